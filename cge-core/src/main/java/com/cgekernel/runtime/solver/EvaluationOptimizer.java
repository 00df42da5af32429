/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.runtime.solver;

/**
 * Assigns each variable its fixed value, or its start value when free, so
 * that residuals describe how well the given point satisfies the equations.
 * Useful to check a calibrated benchmark replicates itself.
 */
public final class EvaluationOptimizer implements Optimizer {

    public static final String NAME = "evaluate";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public SolveStatus optimize(ExpressionModel model) {
        for (ModelVariable variable : model.modelVariables()) {
            variable.assign(variable.isFixed() ? variable.fixedValue() : variable.startValue());
        }
        return SolveStatus.EVALUATED;
    }
}
