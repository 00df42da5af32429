/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Residual of one solved equation instance.
 */
public record ResidualRecord(
        @JsonProperty("tag") String tag,
        @JsonProperty("block") String block,
        @JsonProperty("indices") List<String> indices,
        @JsonProperty("residual") double residual
) {

    public ResidualRecord {
        indices = indices == null ? List.of() : List.copyOf(indices);
    }

    public double absResidual() {
        return Math.abs(residual);
    }
}
