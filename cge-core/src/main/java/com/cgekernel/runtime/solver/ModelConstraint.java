/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.runtime.solver;

import com.cgekernel.api.numeric.NumericExpr;
import com.cgekernel.api.solver.ConstraintHandle;
import com.cgekernel.api.solver.VariableHandle;

import java.util.Optional;

/**
 * Row of an {@link ExpressionModel}.
 */
public final class ModelConstraint implements ConstraintHandle {

    private final int row;
    private final Kind kind;
    private final NumericExpr function;
    private final ModelVariable complement;

    ModelConstraint(int row, Kind kind, NumericExpr function, ModelVariable complement) {
        this.row = row;
        this.kind = kind;
        this.function = function;
        this.complement = complement;
    }

    public int row() {
        return row;
    }

    @Override
    public Kind kind() {
        return kind;
    }

    @Override
    public NumericExpr function() {
        return function;
    }

    @Override
    public Optional<VariableHandle> complementVariable() {
        return Optional.ofNullable(complement);
    }

    @Override
    public double residual() {
        return function.evaluate(VariableHandle::value);
    }

    /**
     * Row value a root finder drives to zero. For a complementarity row this is
     * the natural residual {@code x - mid(lower, x - f, upper)}, which vanishes
     * iff either {@code f} is zero or {@code x} sits at the bound {@code f} pushes against.
     */
    double systemResidual() {
        double f = residual();
        if (complement == null) {
            return f;
        }
        double x = complement.value();
        return x - complement.project(x - f);
    }

    @Override
    public String toString() {
        return "ModelConstraint[" + row + ", " + kind + (complement == null ? "" : " ⟂ " + complement.name()) + "]";
    }
}
