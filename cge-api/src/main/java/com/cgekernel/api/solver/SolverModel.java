/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.api.solver;

import com.cgekernel.api.exceptions.SolverException;
import com.cgekernel.api.model.ObjectiveSense;
import com.cgekernel.api.numeric.NumericExpr;

import java.util.List;
import java.util.Optional;

/**
 * Contract of the numerical engine the compiled equations are handed to.
 *
 * <p>The kernel only builds constraints and an objective, installs an optional
 * backend configuration and calls {@link #optimize()} once per solve; how the
 * engine converges is its own concern.
 */
public interface SolverModel {

    /**
     * Creates a new free variable with start value 0 and no bounds.
     */
    VariableHandle addVariable(String name);

    List<VariableHandle> variables();

    ConstraintHandle addEquality(NumericExpr lhs, NumericExpr rhs);

    /**
     * Adds the complementarity pair {@code function ⟂ variable}: at a solution
     * either a bound of {@code variable} is active or {@code function} is zero.
     */
    ConstraintHandle addComplementarity(NumericExpr function, VariableHandle variable);

    List<ConstraintHandle> constraints();

    /**
     * Installs the single objective, replacing any previous one.
     */
    void setObjective(ObjectiveSense sense, NumericExpr objective);

    Optional<NumericExpr> objective();

    Optional<ObjectiveSense> objectiveSense();

    /**
     * Selects the backend used by the next {@link #optimize()} call.
     *
     * @throws com.cgekernel.api.exceptions.ConfigurationException if the backend is unknown
     */
    void setOptimizer(OptimizerConfig config);

    /**
     * Runs the backend. Solved values are queryable through the variable
     * handles once this returns.
     *
     * @throws SolverException if the backend cannot run
     */
    void optimize();
}
