/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.runtime.export;

import com.cgekernel.api.exceptions.ConfigurationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Explicit wire-name to constant table, checked for duplicates when built.
 */
final class EnumNameTable<E extends Enum<E>> {

    private final String typeName;
    private final Map<String, E> byName;

    private EnumNameTable(String typeName, Map<String, E> byName) {
        this.typeName = typeName;
        this.byName = Collections.unmodifiableMap(byName);
    }

    /**
     * @throws IllegalStateException if two constants share a wire name
     */
    static <E extends Enum<E>> EnumNameTable<E> of(Class<E> type, Function<E, String> wireName) {
        Map<String, E> byName = new LinkedHashMap<>();
        for (E constant : type.getEnumConstants()) {
            E previous = byName.put(wireName.apply(constant), constant);
            if (previous != null) {
                throw new IllegalStateException("Duplicate wire name '" + wireName.apply(constant) + "' in "
                        + type.getSimpleName() + ": " + previous + " and " + constant);
            }
        }
        return new EnumNameTable<>(type.getSimpleName(), byName);
    }

    /**
     * @throws ConfigurationException for an unknown name
     */
    E lookup(String name) {
        E constant = name == null ? null : byName.get(name);
        if (constant == null) {
            throw new ConfigurationException("Unknown " + typeName + " value: " + name + " (known: " + byName.keySet() + ")");
        }
        return constant;
    }
}
