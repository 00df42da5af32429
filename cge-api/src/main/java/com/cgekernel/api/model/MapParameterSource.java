/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.api.model;

import com.cgekernel.api.VariableNames;
import com.cgekernel.api.exceptions.UnboundReferenceException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link ParameterSource} over an in-memory table keyed by qualified name
 * ({@code p} or {@code p_a_b}, see {@link VariableNames#qualify}).
 */
public final class MapParameterSource implements ParameterSource {

    private final Map<String, Double> values;

    private MapParameterSource(Map<String, Double> values) {
        this.values = Map.copyOf(values);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public double getParam(String name, List<String> indices) {
        String key = VariableNames.qualify(name, indices);
        Double value = values.get(key);
        if (value == null) {
            throw new UnboundReferenceException("Missing parameter: " + key, key);
        }
        return value;
    }

    public int size() {
        return values.size();
    }

    public static final class Builder {
        private final Map<String, Double> values = new HashMap<>();

        private Builder() {
        }

        public Builder put(String name, double value) {
            values.put(name, value);
            return this;
        }

        public Builder put(String name, List<String> indices, double value) {
            values.put(VariableNames.qualify(name, indices), value);
            return this;
        }

        /**
         * Adds one entry per label of a one-dimensional parameter.
         */
        public Builder putAll(String name, Map<String, Double> byLabel) {
            byLabel.forEach((label, value) -> put(name, List.of(label), value));
            return this;
        }

        public MapParameterSource build() {
            return new MapParameterSource(values);
        }
    }
}
