/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.api.solver;

import com.cgekernel.api.exceptions.ValueUnavailableException;
import com.cgekernel.api.numeric.NumericExpr;

import java.util.Optional;

/**
 * A compiled constraint installed in a {@link SolverModel}.
 */
public interface ConstraintHandle {

    enum Kind {
        /** {@code lhs == rhs} */
        EQUALITY,
        /** {@code lhs - rhs} complementary to a bounded variable */
        COMPLEMENTARITY
    }

    Kind kind();

    /**
     * The residual function {@code lhs - rhs}.
     */
    NumericExpr function();

    /**
     * The paired variable of a complementarity constraint; empty for equalities.
     */
    Optional<VariableHandle> complementVariable();

    /**
     * Evaluates {@link #function()} at the current solution.
     *
     * @throws ValueUnavailableException if a referenced variable has no value
     */
    double residual();
}
