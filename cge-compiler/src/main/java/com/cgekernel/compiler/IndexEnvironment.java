/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.compiler;

import com.cgekernel.api.exceptions.UnboundReferenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Scoped mapping from index names to the index values bound while one
 * equation instance is compiled.
 *
 * <p>The instance indices are bound up front by {@link #of(List, List)}; loop
 * indices of summations and products are bound and released by the
 * {@link ExpressionCompiler} around each domain iteration.
 */
public final class IndexEnvironment {
    private static final Logger logger = LoggerFactory.getLogger(IndexEnvironment.class);

    private final Map<String, String> bindings = new HashMap<>();

    public IndexEnvironment() {
    }

    /**
     * Builds the environment of one equation instance by pairing index names
     * with index values. A missing name list or a length mismatch yields an
     * empty environment.
     */
    public static IndexEnvironment of(List<String> indexNames, List<String> indices) {
        IndexEnvironment env = new IndexEnvironment();
        if (indexNames == null) {
            return env;
        }
        List<String> values = indices == null ? List.of() : indices;
        if (indexNames.size() != values.size()) {
            logger.warn("Index names {} do not match index values {}; no instance indices bound",
                    indexNames, values);
            return env;
        }
        for (int i = 0; i < indexNames.size(); i++) {
            env.bind(indexNames.get(i), values.get(i));
        }
        return env;
    }

    /**
     * Installs or overwrites a binding.
     *
     * @return the value previously bound to {@code name}, or {@code null}
     */
    public String bind(String name, String value) {
        return bindings.put(name, value);
    }

    /**
     * @throws UnboundReferenceException if {@code name} is not bound
     */
    public String resolve(String name) {
        String value = bindings.get(name);
        if (value == null) {
            throw new UnboundReferenceException("Unbound index: " + name, name);
        }
        return value;
    }

    /**
     * Removes a binding. Unknown names are ignored.
     */
    public void unbind(String name) {
        bindings.remove(name);
    }

    public boolean isBound(String name) {
        return bindings.containsKey(name);
    }

    public int size() {
        return bindings.size();
    }

    public Map<String, String> bindings() {
        return Collections.unmodifiableMap(bindings);
    }

    @Override
    public String toString() {
        return "IndexEnvironment" + bindings;
    }
}
