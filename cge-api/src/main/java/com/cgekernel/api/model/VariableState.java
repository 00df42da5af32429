/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Start, bound and fixed values of the registered variables, keyed by name.
 * Only finite values and active bounds or fixings appear.
 */
public record VariableState(
        @JsonProperty("start") Map<String, Double> start,
        @JsonProperty("lower") Map<String, Double> lower,
        @JsonProperty("upper") Map<String, Double> upper,
        @JsonProperty("fixed") Map<String, Double> fixed
) {

    public VariableState {
        start = Map.copyOf(start);
        lower = Map.copyOf(lower);
        upper = Map.copyOf(upper);
        fixed = Map.copyOf(fixed);
    }
}
