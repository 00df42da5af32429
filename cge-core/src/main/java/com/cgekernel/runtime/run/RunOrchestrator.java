/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.runtime.run;

import com.cgekernel.api.IEquationCompiler;
import com.cgekernel.api.ModelBlock;
import com.cgekernel.api.RunSpec;
import com.cgekernel.api.exceptions.ConfigurationException;
import com.cgekernel.api.exceptions.KernelException;
import com.cgekernel.api.model.ResidualSummary;
import com.cgekernel.api.solver.SolverModel;
import com.cgekernel.api.solver.VariableHandle;
import com.cgekernel.compiler.EquationCompiler;
import com.cgekernel.infra.config.KernelConfig;
import com.cgekernel.runtime.export.DualSignalsDataset;
import com.cgekernel.runtime.export.DualSignalsExporter;
import com.cgekernel.runtime.model.KernelContext;
import com.cgekernel.runtime.residual.ResidualAnalyzer;
import com.cgekernel.runtime.solver.ExpressionModel;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Builds, compiles, solves and summarizes a {@link RunSpec} in one call.
 *
 * <p>Each run gets a fresh context and a fresh solver model. Steps run once,
 * in order, and any failure propagates unchanged:
 * <ol>
 * <li>build every block in {@link RunSpec} order</li>
 * <li>fix the variables named in {@link RunOptions#getMcpFix()}</li>
 * <li>compile equations (unless disabled)</li>
 * <li>solve</li>
 * <li>summarize residuals and export the dataset</li>
 * </ol>
 */
public class RunOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(RunOrchestrator.class);

    private final Tracer tracer;
    private final IEquationCompiler compiler;
    private final Supplier<SolverModel> modelFactory;
    private final DualSignalsExporter exporter;
    private final KernelConfig config;

    public RunOrchestrator(Tracer tracer) {
        this(tracer, KernelConfig.builder().build());
    }

    public RunOrchestrator(Tracer tracer, KernelConfig config) {
        this(tracer, new EquationCompiler(tracer), () -> new ExpressionModel(config), new DualSignalsExporter(), config);
    }

    public RunOrchestrator(Tracer tracer, IEquationCompiler compiler, Supplier<SolverModel> modelFactory,
                           DualSignalsExporter exporter, KernelConfig config) {
        this.tracer = tracer;
        this.compiler = compiler;
        this.modelFactory = modelFactory;
        this.exporter = exporter;
        this.config = config;
        this.compiler.setTracer(tracer);
    }

    public RunResult run(RunSpec spec) {
        return run(spec, RunOptions.builder(config).build());
    }

    public RunResult run(RunSpec spec, RunOptions options) {
        Span span = tracer.spanBuilder("run-model").startSpan();
        try (Scope scope = span.makeCurrent()) {
            long startTime = System.nanoTime();
            span.setAttribute("model", spec.name());
            span.setAttribute("blockCount", spec.blocks().size());

            KernelContext context = new KernelContext(modelFactory.get());
            for (ModelBlock block : spec.blocks()) {
                block.build(context, spec);
                logger.debug("Built block {}", block.name());
            }
            span.setAttribute("equationCount", context.listEquations().size());
            span.setAttribute("variableCount", context.variables().size());

            if (options.getMcpFix() != null) {
                applyFixes(context, options.getMcpFix());
            }
            if (options.isCompileAst()) {
                compiler.compileEquations(context, options.getParams(), options.isCompileObjective());
            }
            context.solve(options.getOptimizer());

            ResidualSummary summary = ResidualAnalyzer.summarize(context, options.getTolerance());
            DualSignalsDataset dataset = exporter.export(context, options.getDatasetId(), options.getDescription(),
                    options.getTolerance());

            long elapsed = System.nanoTime() - startTime;
            span.setAttribute("residualCount", summary.count());
            span.setAttribute("aboveTolerance", summary.aboveTol());
            span.setAttribute("runTimeMs", TimeUnit.NANOSECONDS.toMillis(elapsed));
            logger.info("Run '{}' finished in {} ms: {} residuals, max_abs={}, above_tol={}",
                    spec.name(), TimeUnit.NANOSECONDS.toMillis(elapsed), summary.count(), summary.maxAbs(),
                    summary.aboveTol());
            return new RunResult(context, summary, dataset);
        } catch (KernelException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private void applyFixes(KernelContext context, Map<String, Double> fixes) {
        for (Map.Entry<String, Double> fix : fixes.entrySet()) {
            VariableHandle variable = context.variable(fix.getKey())
                    .orElseThrow(() -> new ConfigurationException(
                            "mcp_fix expects a variable registered in context: " + fix.getKey()));
            variable.fix(fix.getValue());
        }
        logger.debug("Fixed {} variables before compilation", fixes.size());
    }
}
