/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.api.model;

import com.cgekernel.api.solver.ConstraintHandle;

import java.util.Objects;

/**
 * One registered equation instance.
 *
 * @param tag     equation role, e.g. the economic condition it expresses
 * @param block   name of the owning model block
 * @param payload structured payload
 */
public record EquationRecord(String tag, String block, EquationPayload payload) {

    public EquationRecord {
        Objects.requireNonNull(tag, "tag");
        Objects.requireNonNull(block, "block");
        payload = payload == null ? EquationPayload.empty() : payload;
    }

    public EquationRecord withConstraint(ConstraintHandle handle) {
        return new EquationRecord(tag, block, payload.withConstraint(handle));
    }

    public EquationRecord withResidual(double residual) {
        return new EquationRecord(tag, block, payload.withResidual(residual));
    }
}
