/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.api.expr;

import java.util.Arrays;
import java.util.List;

/**
 * Symbolic equation expression tree, produced by the block layer and lowered
 * into solver expressions by the compiler.
 *
 * <p>The set of node variants is closed. Index lists on {@link VarRef} and
 * {@link ParamRef} follow one convention: {@code null} inherits the default
 * indices of the enclosing equation instance, an empty list means "no indices".
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // sum(i in {a,b,c}, p[i] * x[i]) == 0
 * Expr eq = Expr.eq(
 *     Expr.sum("i", List.of("a", "b", "c"),
 *         Expr.mul(Expr.param("p", Expr.index("i")), Expr.var("x", Expr.index("i")))),
 *     Expr.constant(0));
 * }</pre>
 */
public sealed interface Expr
        permits VarRef, ParamRef, Constant, RawExpr, IndexRef, Add, Multiply, Power, Divide,
        Negate, SumOver, ProductOver, Equality {

    /**
     * Short variant name used in diagnostics.
     */
    default String variant() {
        return getClass().getSimpleName();
    }

    static VarRef var(String name) {
        return new VarRef(name, null);
    }

    static VarRef var(String name, IndexTerm... indices) {
        return new VarRef(name, Arrays.asList(indices));
    }

    static ParamRef param(String name) {
        return new ParamRef(name, null);
    }

    static ParamRef param(String name, IndexTerm... indices) {
        return new ParamRef(name, Arrays.asList(indices));
    }

    static Constant constant(double value) {
        return new Constant(value);
    }

    static IndexRef index(String name) {
        return new IndexRef(name);
    }

    static IndexLabel label(String value) {
        return new IndexLabel(value);
    }

    static Add add(Expr... terms) {
        return new Add(Arrays.asList(terms));
    }

    static Multiply mul(Expr... factors) {
        return new Multiply(Arrays.asList(factors));
    }

    static Power pow(Expr base, Expr exponent) {
        return new Power(base, exponent);
    }

    static Divide div(Expr numerator, Expr denominator) {
        return new Divide(numerator, denominator);
    }

    static Negate neg(Expr operand) {
        return new Negate(operand);
    }

    static SumOver sum(String index, List<String> domain, Expr body) {
        return new SumOver(index, domain, body);
    }

    static ProductOver prod(String index, List<String> domain, Expr body) {
        return new ProductOver(index, domain, body);
    }

    static Equality eq(Expr lhs, Expr rhs) {
        return new Equality(lhs, rhs);
    }
}
