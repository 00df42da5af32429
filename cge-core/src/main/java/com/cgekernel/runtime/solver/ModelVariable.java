/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.runtime.solver;

import com.cgekernel.api.exceptions.ValueUnavailableException;
import com.cgekernel.api.solver.VariableHandle;

/**
 * Column of an {@link ExpressionModel}.
 */
public final class ModelVariable implements VariableHandle {

    private final ExpressionModel owner;
    private final int column;
    private final String name;

    private double start = 0.0;
    private boolean hasLower;
    private double lower = Double.NEGATIVE_INFINITY;
    private boolean hasUpper;
    private double upper = Double.POSITIVE_INFINITY;
    private boolean fixed;
    private double fixedValue = Double.NaN;

    private boolean solved;
    private double solution = Double.NaN;

    ModelVariable(ExpressionModel owner, int column, String name) {
        this.owner = owner;
        this.column = column;
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    public int column() {
        return column;
    }

    ExpressionModel owner() {
        return owner;
    }

    @Override
    public double value() {
        if (!solved) {
            throw new ValueUnavailableException("Variable " + name + " has no solved value; optimize the model first");
        }
        return solution;
    }

    /**
     * Installs the backend's current value for this column.
     */
    void assign(double value) {
        this.solution = value;
        this.solved = true;
    }

    @Override
    public double startValue() {
        return start;
    }

    @Override
    public void setStartValue(double value) {
        this.start = value;
    }

    @Override
    public boolean hasLowerBound() {
        return hasLower;
    }

    @Override
    public double lowerBound() {
        return lower;
    }

    @Override
    public void setLowerBound(double bound) {
        this.hasLower = true;
        this.lower = bound;
    }

    @Override
    public boolean hasUpperBound() {
        return hasUpper;
    }

    @Override
    public double upperBound() {
        return upper;
    }

    @Override
    public void setUpperBound(double bound) {
        this.hasUpper = true;
        this.upper = bound;
    }

    @Override
    public boolean isFixed() {
        return fixed;
    }

    @Override
    public double fixedValue() {
        return fixedValue;
    }

    @Override
    public void fix(double value) {
        this.fixed = true;
        this.fixedValue = value;
        this.hasLower = false;
        this.lower = Double.NEGATIVE_INFINITY;
        this.hasUpper = false;
        this.upper = Double.POSITIVE_INFINITY;
    }

    @Override
    public void unfix() {
        this.fixed = false;
        this.fixedValue = Double.NaN;
    }

    /**
     * Clamps {@code value} into the active bounds.
     */
    double project(double value) {
        double projected = value;
        if (hasLower && projected < lower) {
            projected = lower;
        }
        if (hasUpper && projected > upper) {
            projected = upper;
        }
        return projected;
    }

    @Override
    public String toString() {
        return name;
    }
}
