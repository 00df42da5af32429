/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Aggregate residual statistics.
 *
 * @param count    number of residuals
 * @param maxAbs   largest absolute residual, 0.0 when there are none
 * @param worst    first record reaching {@code maxAbs}, or {@code null}
 * @param aboveTol number of residuals whose absolute value exceeds the tolerance
 */
public record ResidualSummary(
        @JsonProperty("count") int count,
        @JsonProperty("max_abs") double maxAbs,
        @JsonProperty("worst") ResidualRecord worst,
        @JsonProperty("above_tol") int aboveTol
) {

    public static final ResidualSummary EMPTY = new ResidualSummary(0, 0.0, null, 0);

    public boolean hasWorst() {
        return worst != null;
    }

    public boolean withinTolerance() {
        return aboveTol == 0;
    }
}
