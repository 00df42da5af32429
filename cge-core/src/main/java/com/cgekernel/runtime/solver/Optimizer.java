/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.runtime.solver;

/**
 * A backend that computes variable values for an {@link ExpressionModel}.
 */
public interface Optimizer {

    String name();

    /**
     * Assigns a value to every variable of {@code model}.
     *
     * @return how the run ended
     * @throws com.cgekernel.api.exceptions.SolverException if the backend cannot run
     */
    SolveStatus optimize(ExpressionModel model);
}
