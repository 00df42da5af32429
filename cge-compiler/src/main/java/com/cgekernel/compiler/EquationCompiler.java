/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.compiler;

import com.cgekernel.api.IEquationCompiler;
import com.cgekernel.api.exceptions.CompilationException;
import com.cgekernel.api.exceptions.KernelException;
import com.cgekernel.api.expr.Equality;
import com.cgekernel.api.expr.Expr;
import com.cgekernel.api.expr.RawExpr;
import com.cgekernel.api.expr.VarRef;
import com.cgekernel.api.model.EquationPayload;
import com.cgekernel.api.model.EquationRecord;
import com.cgekernel.api.model.ObjectiveSense;
import com.cgekernel.api.model.ParameterSource;
import com.cgekernel.api.numeric.NumericExpr;
import com.cgekernel.api.solver.ConstraintHandle;
import com.cgekernel.api.solver.SolverModel;
import com.cgekernel.api.solver.VariableHandle;
import com.cgekernel.runtime.model.KernelContext;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Compiles registered equations into solver constraints and the registered
 * objective into the solver objective.
 *
 * <p>The compile pass walks the registry once, in registration order:
 * <ol>
 * <li>An objective-bearing record is set aside; a second one aborts the pass.</li>
 * <li>Records that already hold a constraint handle are left untouched.</li>
 * <li>Records with an equation AST (other than a {@link RawExpr}) are compiled
 * with their own index environment; the handle is written back into the
 * record's payload.</li>
 * </ol>
 * The objective, if any, is compiled after the pass.
 *
 * <p>An equation paired with a complementarity variable compiles to
 * {@code lhs - rhs ⟂ variable}; every other equation compiles to
 * {@code lhs == rhs}.
 */
public class EquationCompiler implements IEquationCompiler {
    private static final Logger logger = LoggerFactory.getLogger(EquationCompiler.class);

    private final ExpressionCompiler expressions;
    private Tracer tracer;

    public EquationCompiler() {
        this(OpenTelemetry.noop().getTracer("cge-kernel"));
    }

    public EquationCompiler(Tracer tracer) {
        this(tracer, new ExpressionCompiler());
    }

    public EquationCompiler(Tracer tracer, ExpressionCompiler expressions) {
        this.tracer = tracer;
        this.expressions = expressions;
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = tracer;
    }

    /**
     * Objective set aside during the compile pass.
     */
    public record ObjectiveRecord(Expr expr, List<String> indexNames, List<String> indices,
                                  ParameterSource params, ObjectiveSense sense) {

        static ObjectiveRecord from(EquationPayload payload) {
            return new ObjectiveRecord(payload.objectiveExpr(), payload.indexNames(), payload.indices(),
                    payload.params(), payload.objectiveSense());
        }
    }

    @Override
    public void compileEquations(KernelContext context, ParameterSource params, boolean compileObjective) {
        SolverModel model = context.requireModel();
        Span span = tracer.spanBuilder("compile-equations").startSpan();
        try (Scope scope = span.makeCurrent()) {
            long startTime = System.nanoTime();
            span.setAttribute("equationCount", context.listEquations().size());

            ObjectiveRecord objective = null;
            int compiled = 0;
            int alreadyCompiled = 0;
            List<EquationRecord> equations = context.listEquations();
            for (int i = 0; i < equations.size(); i++) {
                EquationRecord record = equations.get(i);
                EquationPayload payload = record.payload();

                if (payload.hasObjective()) {
                    if (objective != null) {
                        throw new CompilationException(
                                "Multiple objectives registered; only one objective is supported (second in "
                                        + record.block() + "." + record.tag() + ")");
                    }
                    objective = ObjectiveRecord.from(payload);
                }
                if (payload.isCompiled()) {
                    alreadyCompiled++;
                    continue;
                }
                Expr expr = payload.expr();
                if (expr == null || expr instanceof RawExpr) {
                    continue;
                }

                IndexEnvironment env = IndexEnvironment.of(payload.indexNames(), payload.indices());
                ParameterSource effectiveParams = params != null ? params : payload.params();
                ConstraintHandle constraint = compileEquation(expr, context, effectiveParams,
                        payload.indices(), env, payload.mcpVar());
                context.updateEquation(i, r -> r.withConstraint(constraint));
                compiled++;
            }

            boolean objectiveInstalled = false;
            if (objective != null && compileObjective) {
                compileObjective(objective, context, params, objective.sense());
                objectiveInstalled = true;
            }

            long elapsed = System.nanoTime() - startTime;
            span.setAttribute("compiledCount", compiled);
            span.setAttribute("alreadyCompiledCount", alreadyCompiled);
            span.setAttribute("objectiveInstalled", objectiveInstalled);
            span.setAttribute("compilationTimeMs", TimeUnit.NANOSECONDS.toMillis(elapsed));
            logger.info("Compiled {} equations ({} already compiled) into {} in {} ms; objective installed: {}",
                    compiled, alreadyCompiled, model.getClass().getSimpleName(),
                    TimeUnit.NANOSECONDS.toMillis(elapsed), objectiveInstalled);
        } catch (KernelException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Compiles one equation instance.
     *
     * @param equation equation AST, must be an {@link Equality}
     * @param context  registry and solver model
     * @param params   parameter source of the instance
     * @param indices  default indices of the instance
     * @param env      index environment of the instance
     * @param mcpVar   complementarity variable ({@link VarRef}), or {@code null} for a plain equality
     * @return the installed constraint
     */
    public ConstraintHandle compileEquation(Expr equation, KernelContext context, ParameterSource params,
                                            List<String> indices, IndexEnvironment env, Expr mcpVar) {
        if (!(equation instanceof Equality eq)) {
            throw new CompilationException(
                    "Unsupported equation expression: expected Equality, got " + equation.variant());
        }
        SolverModel model = context.requireModel();
        NumericExpr lhs = expressions.compile(eq.lhs(), context, params, indices, env);
        NumericExpr rhs = expressions.compile(eq.rhs(), context, params, indices, env);
        if (mcpVar != null) {
            VariableHandle variable = resolveMcpVariable(mcpVar, context, indices, env);
            return model.addComplementarity(NumericExpr.difference(lhs, rhs), variable);
        }
        return model.addEquality(lhs, rhs);
    }

    /**
     * Compiles the objective expression and installs it on the model.
     *
     * @param sense objective direction; {@code null} selects {@link ObjectiveSense#DEFAULT}
     */
    public void compileObjective(ObjectiveRecord objective, KernelContext context, ParameterSource params,
                                 ObjectiveSense sense) {
        SolverModel model = context.requireModel();
        IndexEnvironment env = IndexEnvironment.of(objective.indexNames(), objective.indices());
        ParameterSource effectiveParams = params != null ? params : objective.params();
        NumericExpr value = expressions.compile(objective.expr(), context, effectiveParams, objective.indices(), env);
        ObjectiveSense effectiveSense = sense == null ? ObjectiveSense.DEFAULT : sense;
        model.setObjective(effectiveSense, value);
        logger.debug("Installed {} objective", effectiveSense);
    }

    /**
     * Variant taking the sense by name ({@code max}, {@code minimize}, ...).
     *
     * @throws com.cgekernel.api.exceptions.ConfigurationException for an unknown sense
     */
    public void compileObjective(ObjectiveRecord objective, KernelContext context, ParameterSource params,
                                 String sense) {
        compileObjective(objective, context, params, ObjectiveSense.parse(sense));
    }

    private VariableHandle resolveMcpVariable(Expr mcpVar, KernelContext context, List<String> indices,
                                              IndexEnvironment env) {
        if (mcpVar instanceof VarRef ref) {
            return expressions.resolveVariable(ref, context, indices, env);
        }
        throw new CompilationException("Unsupported MCP variable expression: " + mcpVar.variant());
    }
}
