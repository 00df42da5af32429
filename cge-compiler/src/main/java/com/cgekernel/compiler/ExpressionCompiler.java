/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.compiler;

import com.cgekernel.api.VariableNames;
import com.cgekernel.api.exceptions.CompilationException;
import com.cgekernel.api.exceptions.ConfigurationException;
import com.cgekernel.api.exceptions.UnboundReferenceException;
import com.cgekernel.api.expr.Add;
import com.cgekernel.api.expr.Constant;
import com.cgekernel.api.expr.Divide;
import com.cgekernel.api.expr.Expr;
import com.cgekernel.api.expr.IndexLabel;
import com.cgekernel.api.expr.IndexRef;
import com.cgekernel.api.expr.IndexTerm;
import com.cgekernel.api.expr.Multiply;
import com.cgekernel.api.expr.Negate;
import com.cgekernel.api.expr.ParamRef;
import com.cgekernel.api.expr.Power;
import com.cgekernel.api.expr.ProductOver;
import com.cgekernel.api.expr.RawExpr;
import com.cgekernel.api.expr.SumOver;
import com.cgekernel.api.expr.VarRef;
import com.cgekernel.api.model.ParameterSource;
import com.cgekernel.api.numeric.NumericExpr;
import com.cgekernel.api.solver.VariableHandle;
import com.cgekernel.runtime.model.KernelContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Lowers one AST node into a {@link NumericExpr}.
 *
 * <h2>Name resolution</h2>
 * <p>
 * Variable and parameter references use their explicit index list when they
 * have one, otherwise the default indices of the equation instance being
 * compiled. Free index references inside a list resolve through the
 * {@link IndexEnvironment}; literal labels are used as-is. Variables are then
 * looked up in the context under their qualified name
 * ({@link VariableNames#qualify}); parameters are read from the parameter source.
 *
 * <h2>Domain operators</h2>
 * <p>
 * {@link SumOver} and {@link ProductOver} bind their loop index to each domain
 * value in domain order and compile the body once per value. The binding is
 * released when the loop ends, also when the body fails to compile; a loop
 * index that shadows an outer binding gets the outer value back.
 *
 * <p>This class is stateless and can be shared.
 */
public final class ExpressionCompiler {

    /**
     * Compiles {@code node}.
     *
     * @param node           AST node
     * @param context        registry used for variable lookups
     * @param params         parameter source, may be {@code null} if the node has no parameters
     * @param defaultIndices index tuple of the enclosing equation instance
     * @param env            index environment of the enclosing equation instance
     * @return the numeric expression
     * @throws CompilationException       for raw nodes, empty domains, unsupported variants and
     *                                    non-numeric index labels used as values
     * @throws UnboundReferenceException  for unbound indices and missing variables or parameters
     * @throws ConfigurationException     for a parameter reference without a parameter source
     */
    public NumericExpr compile(Expr node, KernelContext context, ParameterSource params,
                               List<String> defaultIndices, IndexEnvironment env) {
        if (node instanceof VarRef ref) {
            return NumericExpr.variable(resolveVariable(ref, context, defaultIndices, env));
        } else if (node instanceof ParamRef ref) {
            List<String> resolved = resolveIndices(ref.indices(), defaultIndices, env);
            return NumericExpr.literal(resolveParam(params, ref.name(), resolved));
        } else if (node instanceof Constant constant) {
            return NumericExpr.literal(constant.value());
        } else if (node instanceof RawExpr raw) {
            throw new CompilationException("Cannot compile raw expression: " + raw.text());
        } else if (node instanceof IndexRef index) {
            return numericIndex(index.name(), env.resolve(index.name()));
        } else if (node instanceof Add add) {
            return NumericExpr.sum(compileAll(add.terms(), context, params, defaultIndices, env));
        } else if (node instanceof Multiply multiply) {
            if (multiply.factors().isEmpty()) {
                throw new CompilationException("Multiply requires at least one factor");
            }
            return NumericExpr.product(compileAll(multiply.factors(), context, params, defaultIndices, env));
        } else if (node instanceof Power power) {
            NumericExpr base = compile(power.base(), context, params, defaultIndices, env);
            NumericExpr exponent = compile(power.exponent(), context, params, defaultIndices, env);
            return NumericExpr.power(base, exponent);
        } else if (node instanceof Divide divide) {
            NumericExpr numerator = compile(divide.numerator(), context, params, defaultIndices, env);
            NumericExpr denominator = compile(divide.denominator(), context, params, defaultIndices, env);
            return NumericExpr.quotient(numerator, denominator);
        } else if (node instanceof Negate negate) {
            return NumericExpr.negate(compile(negate.operand(), context, params, defaultIndices, env));
        } else if (node instanceof SumOver sum) {
            List<NumericExpr> parts = compileOverDomain("SumOver", sum.index(), sum.domain(), sum.body(),
                    context, params, defaultIndices, env);
            return NumericExpr.sum(parts);
        } else if (node instanceof ProductOver product) {
            // A singleton domain yields its only factor unchanged
            List<NumericExpr> parts = compileOverDomain("ProductOver", product.index(), product.domain(),
                    product.body(), context, params, defaultIndices, env);
            return NumericExpr.product(parts);
        }
        throw new CompilationException("Unsupported expression type: " + node.variant());
    }

    /**
     * Resolves a variable reference to its registered handle.
     *
     * @throws UnboundReferenceException if the qualified name is not registered
     */
    public VariableHandle resolveVariable(VarRef ref, KernelContext context, List<String> defaultIndices,
                                          IndexEnvironment env) {
        String qualified = VariableNames.qualify(ref.name(), resolveIndices(ref.indices(), defaultIndices, env));
        return context.variable(qualified)
                .orElseThrow(() -> new UnboundReferenceException("Missing variable: " + qualified, qualified));
    }

    /**
     * Resolves an index list: {@code null} inherits {@code defaultIndices},
     * free indices resolve through {@code env}, labels are kept verbatim.
     */
    public List<String> resolveIndices(List<IndexTerm> explicit, List<String> defaultIndices, IndexEnvironment env) {
        if (explicit == null) {
            return defaultIndices == null ? List.of() : defaultIndices;
        }
        List<String> resolved = new ArrayList<>(explicit.size());
        for (IndexTerm term : explicit) {
            if (term instanceof IndexRef ref) {
                resolved.add(env.resolve(ref.name()));
            } else {
                resolved.add(((IndexLabel) term).value());
            }
        }
        return resolved;
    }

    private NumericExpr numericIndex(String name, String label) {
        try {
            Double.parseDouble(label);
        } catch (NumberFormatException e) {
            throw new CompilationException("Index " + name + " is bound to non-numeric label '" + label
                    + "' and cannot be used as a value", e);
        }
        return NumericExpr.indexValue(label);
    }

    private double resolveParam(ParameterSource params, String name, List<String> indices) {
        if (params == null) {
            throw new ConfigurationException("No params provided for parameter " + name);
        }
        return params.getParam(name, indices);
    }

    private List<NumericExpr> compileAll(List<Expr> nodes, KernelContext context, ParameterSource params,
                                         List<String> defaultIndices, IndexEnvironment env) {
        List<NumericExpr> parts = new ArrayList<>(nodes.size());
        for (Expr node : nodes) {
            parts.add(compile(node, context, params, defaultIndices, env));
        }
        return parts;
    }

    private List<NumericExpr> compileOverDomain(String operator, String index, List<String> domain, Expr body,
                                                KernelContext context, ParameterSource params,
                                                List<String> defaultIndices, IndexEnvironment env) {
        if (domain.isEmpty()) {
            throw new CompilationException(operator + " domain is empty for index " + index);
        }
        List<NumericExpr> parts = new ArrayList<>(domain.size());
        String shadowed = env.bindings().get(index);
        try {
            for (String value : domain) {
                env.bind(index, value);
                parts.add(compile(body, context, params, defaultIndices, env));
            }
        } finally {
            if (shadowed == null) {
                env.unbind(index);
            } else {
                env.bind(index, shadowed);
            }
        }
        return parts;
    }
}
