/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.runtime.export;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ComponentType {
    SECTOR("sector"),
    MARKET("market"),
    AGENT("agent"),
    OTHER("other");

    private static final EnumNameTable<ComponentType> NAMES = EnumNameTable.of(ComponentType.class, ComponentType::wireName);

    private final String wireName;

    ComponentType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static ComponentType fromName(String name) {
        return NAMES.lookup(name);
    }
}
