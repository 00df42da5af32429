/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.runtime.solver;

public enum SolveStatus {
    /** optimize() has not run yet */
    NOT_SOLVED,
    /** Values were assigned from fixed and start values without iterating */
    EVALUATED,
    /** Every residual is within the backend tolerance */
    CONVERGED,
    /** The iteration budget ran out before convergence */
    ITERATION_LIMIT
}
