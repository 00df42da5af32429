/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.api.solver;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Objects;

/**
 * Backend selection installed on a {@link SolverModel} before solving.
 *
 * @param backend    backend name understood by the model
 * @param attributes backend-specific settings (iteration limits, tolerances)
 */
public record OptimizerConfig(
        @JsonProperty("backend") String backend,
        @JsonProperty("attributes") Map<String, Object> attributes
) {

    public OptimizerConfig {
        Objects.requireNonNull(backend, "backend");
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static OptimizerConfig of(String backend) {
        return new OptimizerConfig(backend, Map.of());
    }

    public double doubleAttribute(String key, double defaultValue) {
        Object value = attributes.get(key);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        return value == null ? defaultValue : Double.parseDouble(value.toString());
    }

    public int intAttribute(String key, int defaultValue) {
        Object value = attributes.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        return value == null ? defaultValue : Integer.parseInt(value.toString());
    }
}
