/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.api;

import com.cgekernel.api.model.ParameterSource;
import com.cgekernel.runtime.model.KernelContext;

import io.opentelemetry.api.trace.Tracer;

/**
 * Contract for lowering the equations registered in a context into solver
 * constraints and an objective.
 */
public interface IEquationCompiler {

    /**
     * Compiles every registered equation that is not compiled yet.
     *
     * @param context          context holding the registry and the solver model
     * @param params           parameter source overriding each payload's own, or {@code null}
     * @param compileObjective whether to install the registered objective
     * @throws com.cgekernel.api.exceptions.KernelException if any equation fails to compile
     */
    void compileEquations(KernelContext context, ParameterSource params, boolean compileObjective);

    default void compileEquations(KernelContext context) {
        compileEquations(context, null, true);
    }

    /**
     * Sets the tracer for observability.
     *
     * @param tracer the OpenTelemetry tracer
     */
    default void setTracer(Tracer tracer) {
    }
}
