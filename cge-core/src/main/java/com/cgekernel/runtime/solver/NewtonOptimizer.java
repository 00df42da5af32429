/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.runtime.solver;

import com.cgekernel.api.exceptions.ConfigurationException;
import com.cgekernel.api.exceptions.SolverException;
import com.cgekernel.api.solver.OptimizerConfig;
import com.cgekernel.infra.config.KernelConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Damped Newton-Raphson root finder for square systems.
 *
 * <p>Unknowns are the free (non-fixed) variables, equations are all model
 * constraints. Equalities contribute {@code lhs - rhs}; complementarity rows
 * contribute their natural residual, so a pair whose variable sits at a bound
 * counts as solved. The Jacobian is built by forward differences and every
 * iterate is projected onto the variable bounds. The objective is ignored.
 */
public final class NewtonOptimizer implements Optimizer {
    private static final Logger logger = LoggerFactory.getLogger(NewtonOptimizer.class);

    public static final String NAME = "newton";

    public static final String ATTR_MAX_ITERATIONS = "max_iterations";
    public static final String ATTR_TOLERANCE = "tolerance";

    private static final double FD_STEP = 1e-7;
    private static final double PIVOT_EPSILON = 1e-14;
    private static final int MAX_BACKTRACKS = 20;

    private final int maxIterations;
    private final double tolerance;

    public NewtonOptimizer(int maxIterations, double tolerance) {
        if (maxIterations <= 0) {
            throw new ConfigurationException("Newton max_iterations must be positive, got: " + maxIterations);
        }
        if (!(tolerance > 0.0)) {
            throw new ConfigurationException("Newton tolerance must be positive, got: " + tolerance);
        }
        this.maxIterations = maxIterations;
        this.tolerance = tolerance;
    }

    /**
     * Reads {@value #ATTR_MAX_ITERATIONS} and {@value #ATTR_TOLERANCE} from the
     * optimizer attributes, falling back to the kernel configuration.
     */
    public static NewtonOptimizer fromConfig(OptimizerConfig optimizer, KernelConfig config) {
        return new NewtonOptimizer(
                optimizer.intAttribute(ATTR_MAX_ITERATIONS, config.getNewtonMaxIterations()),
                optimizer.doubleAttribute(ATTR_TOLERANCE, config.getNewtonTolerance()));
    }

    @Override
    public String name() {
        return NAME;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public double getTolerance() {
        return tolerance;
    }

    @Override
    public SolveStatus optimize(ExpressionModel model) {
        List<ModelVariable> free = new ArrayList<>();
        for (ModelVariable variable : model.modelVariables()) {
            if (variable.isFixed()) {
                variable.assign(variable.fixedValue());
            } else {
                free.add(variable);
            }
        }
        List<ModelConstraint> rows = model.modelConstraints();
        if (free.size() != rows.size()) {
            throw new SolverException("Newton backend requires a square system: "
                    + free.size() + " free variables, " + rows.size() + " constraints");
        }

        int n = free.size();
        double[] x = new double[n];
        for (int j = 0; j < n; j++) {
            x[j] = free.get(j).project(free.get(j).startValue());
        }
        assign(free, x);
        if (n == 0) {
            return SolveStatus.CONVERGED;
        }

        double[] f = evaluate(rows);
        double norm = maxAbs(f);
        for (int iteration = 0; iteration < maxIterations; iteration++) {
            if (!Double.isFinite(norm)) {
                throw new SolverException("Non-finite residual at Newton iteration " + iteration);
            }
            if (norm <= tolerance) {
                logger.debug("Newton converged after {} iterations, max residual {}", iteration, norm);
                return SolveStatus.CONVERGED;
            }
            double[] step = solveLinear(jacobian(free, rows, x, f), negate(f));

            double alpha = 1.0;
            double[] trial = x;
            double[] trialF = f;
            double trialNorm = norm;
            for (int k = 0; k < MAX_BACKTRACKS; k++) {
                trial = new double[n];
                for (int j = 0; j < n; j++) {
                    trial[j] = free.get(j).project(x[j] + alpha * step[j]);
                }
                assign(free, trial);
                trialF = evaluate(rows);
                trialNorm = maxAbs(trialF);
                if (Double.isFinite(trialNorm) && trialNorm < norm) {
                    break;
                }
                alpha *= 0.5;
            }
            x = trial;
            f = trialF;
            norm = trialNorm;
        }
        if (norm <= tolerance) {
            return SolveStatus.CONVERGED;
        }
        logger.warn("Newton stopped after {} iterations with max residual {} (tolerance {})",
                maxIterations, norm, tolerance);
        return SolveStatus.ITERATION_LIMIT;
    }

    private static void assign(List<ModelVariable> free, double[] x) {
        for (int j = 0; j < x.length; j++) {
            free.get(j).assign(x[j]);
        }
    }

    private static double[] evaluate(List<ModelConstraint> rows) {
        double[] f = new double[rows.size()];
        for (int i = 0; i < f.length; i++) {
            f[i] = rows.get(i).systemResidual();
        }
        return f;
    }

    private static double[][] jacobian(List<ModelVariable> free, List<ModelConstraint> rows, double[] x, double[] f) {
        int n = x.length;
        double[][] jac = new double[rows.size()][n];
        for (int j = 0; j < n; j++) {
            double h = FD_STEP * Math.max(1.0, Math.abs(x[j]));
            free.get(j).assign(x[j] + h);
            double[] shifted = evaluate(rows);
            free.get(j).assign(x[j]);
            for (int i = 0; i < rows.size(); i++) {
                jac[i][j] = (shifted[i] - f[i]) / h;
            }
        }
        return jac;
    }

    /**
     * Gaussian elimination with partial pivoting. Destroys {@code a} and {@code b}.
     */
    static double[] solveLinear(double[][] a, double[] b) {
        int n = b.length;
        for (int col = 0; col < n; col++) {
            int pivot = col;
            for (int row = col + 1; row < n; row++) {
                if (Math.abs(a[row][col]) > Math.abs(a[pivot][col])) {
                    pivot = row;
                }
            }
            if (Math.abs(a[pivot][col]) < PIVOT_EPSILON) {
                throw new SolverException("Singular Jacobian at column " + col);
            }
            double[] rowSwap = a[col];
            a[col] = a[pivot];
            a[pivot] = rowSwap;
            double bSwap = b[col];
            b[col] = b[pivot];
            b[pivot] = bSwap;

            for (int row = col + 1; row < n; row++) {
                double factor = a[row][col] / a[col][col];
                b[row] -= factor * b[col];
                for (int k = col; k < n; k++) {
                    a[row][k] -= factor * a[col][k];
                }
            }
        }
        double[] x = new double[n];
        for (int row = n - 1; row >= 0; row--) {
            double acc = b[row];
            for (int k = row + 1; k < n; k++) {
                acc -= a[row][k] * x[k];
            }
            x[row] = acc / a[row][row];
        }
        return x;
    }

    private static double[] negate(double[] v) {
        double[] out = new double[v.length];
        for (int i = 0; i < v.length; i++) {
            out[i] = -v[i];
        }
        return out;
    }

    private static double maxAbs(double[] v) {
        double max = 0.0;
        for (double value : v) {
            if (Double.isNaN(value)) {
                return Double.NaN;
            }
            max = Math.max(max, Math.abs(value));
        }
        return max;
    }
}
