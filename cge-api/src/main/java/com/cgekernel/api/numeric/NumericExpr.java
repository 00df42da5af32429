/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.api.numeric;

import com.cgekernel.api.exceptions.CompilationException;
import com.cgekernel.api.exceptions.KernelException;
import com.cgekernel.api.solver.VariableHandle;

import java.util.List;
import java.util.Objects;
import java.util.function.ToDoubleFunction;

/**
 * Backend-neutral numeric expression produced by the compiler.
 *
 * <p>Nodes are immutable records, so two compilations of the same AST against
 * the same registry are structurally equal. Evaluation walks the tree against a
 * variable-value function supplied by the backend; the order of {@link Sum}
 * terms is the order the compiler produced them in, which fixes the
 * floating-point summation order.
 */
public sealed interface NumericExpr
        permits NumericExpr.Literal, NumericExpr.VariableTerm, NumericExpr.IndexValue,
        NumericExpr.Sum, NumericExpr.Product, NumericExpr.Power, NumericExpr.Quotient,
        NumericExpr.Negation {

    double evaluate(ToDoubleFunction<VariableHandle> valueOf);

    // ════════════════════════════════════════════════════════════════════════
    // FACTORIES
    // ════════════════════════════════════════════════════════════════════════

    static Literal literal(double value) {
        return new Literal(value);
    }

    static VariableTerm variable(VariableHandle handle) {
        return new VariableTerm(handle);
    }

    static IndexValue indexValue(String label) {
        return new IndexValue(label);
    }

    /**
     * Folds terms with addition. Zero is the identity, so an empty list yields
     * a zero literal.
     */
    static NumericExpr sum(List<NumericExpr> terms) {
        if (terms.isEmpty()) {
            return new Literal(0.0);
        }
        return new Sum(terms);
    }

    /**
     * Folds factors with multiplication. There is no identity element: an
     * empty list is rejected and a single factor is returned unchanged.
     */
    static NumericExpr product(List<NumericExpr> factors) {
        if (factors.isEmpty()) {
            throw new CompilationException("Product requires at least one factor");
        }
        if (factors.size() == 1) {
            return factors.get(0);
        }
        return new Product(factors);
    }

    static NumericExpr power(NumericExpr base, NumericExpr exponent) {
        return new Power(base, exponent);
    }

    static NumericExpr quotient(NumericExpr numerator, NumericExpr denominator) {
        return new Quotient(numerator, denominator);
    }

    static NumericExpr negate(NumericExpr operand) {
        return new Negation(operand);
    }

    /**
     * {@code lhs - rhs}, the residual form of an equality.
     */
    static NumericExpr difference(NumericExpr lhs, NumericExpr rhs) {
        return new Sum(List.of(lhs, new Negation(rhs)));
    }

    // ════════════════════════════════════════════════════════════════════════
    // NODES
    // ════════════════════════════════════════════════════════════════════════

    record Literal(double value) implements NumericExpr {
        @Override
        public double evaluate(ToDoubleFunction<VariableHandle> valueOf) {
            return value;
        }
    }

    record VariableTerm(VariableHandle handle) implements NumericExpr {
        public VariableTerm {
            Objects.requireNonNull(handle, "handle");
        }

        @Override
        public double evaluate(ToDoubleFunction<VariableHandle> valueOf) {
            return valueOf.applyAsDouble(handle);
        }
    }

    /**
     * A resolved index label used as a value. Numeric labels (years, sizes)
     * evaluate to their number; any other label has no numeric meaning.
     */
    record IndexValue(String label) implements NumericExpr {
        public IndexValue {
            Objects.requireNonNull(label, "label");
        }

        @Override
        public double evaluate(ToDoubleFunction<VariableHandle> valueOf) {
            try {
                return Double.parseDouble(label);
            } catch (NumberFormatException e) {
                throw new KernelException("Index value '" + label + "' has no numeric interpretation", e);
            }
        }
    }

    record Sum(List<NumericExpr> terms) implements NumericExpr {
        public Sum {
            terms = List.copyOf(terms);
        }

        @Override
        public double evaluate(ToDoubleFunction<VariableHandle> valueOf) {
            double total = 0.0;
            for (NumericExpr term : terms) {
                total += term.evaluate(valueOf);
            }
            return total;
        }
    }

    record Product(List<NumericExpr> factors) implements NumericExpr {
        public Product {
            factors = List.copyOf(factors);
        }

        @Override
        public double evaluate(ToDoubleFunction<VariableHandle> valueOf) {
            double result = factors.get(0).evaluate(valueOf);
            for (int i = 1; i < factors.size(); i++) {
                result *= factors.get(i).evaluate(valueOf);
            }
            return result;
        }
    }

    record Power(NumericExpr base, NumericExpr exponent) implements NumericExpr {
        @Override
        public double evaluate(ToDoubleFunction<VariableHandle> valueOf) {
            return Math.pow(base.evaluate(valueOf), exponent.evaluate(valueOf));
        }
    }

    /**
     * Division by zero is not checked here; it yields an IEEE infinity or NaN
     * that the backend reports as a residual.
     */
    record Quotient(NumericExpr numerator, NumericExpr denominator) implements NumericExpr {
        @Override
        public double evaluate(ToDoubleFunction<VariableHandle> valueOf) {
            return numerator.evaluate(valueOf) / denominator.evaluate(valueOf);
        }
    }

    record Negation(NumericExpr operand) implements NumericExpr {
        @Override
        public double evaluate(ToDoubleFunction<VariableHandle> valueOf) {
            return -operand.evaluate(valueOf);
        }
    }
}
