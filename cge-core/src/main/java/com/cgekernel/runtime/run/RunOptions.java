/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.runtime.run;

import com.cgekernel.api.model.ParameterSource;
import com.cgekernel.api.solver.OptimizerConfig;
import com.cgekernel.infra.config.KernelConfig;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Options of a {@link RunOrchestrator} run.
 *
 * <p>Defaults: compile equations and objective, use the model's default
 * backend, tolerance and dataset id from {@link KernelConfig}.
 */
public final class RunOptions {

    private final OptimizerConfig optimizer;
    private final String datasetId;
    private final double tolerance;
    private final String description;
    private final boolean compileAst;
    private final ParameterSource params;
    private final boolean compileObjective;
    private final Map<String, Double> mcpFix;

    private RunOptions(Builder builder) {
        this.optimizer = builder.optimizer;
        this.datasetId = builder.datasetId;
        this.tolerance = builder.tolerance;
        this.description = builder.description;
        this.compileAst = builder.compileAst;
        this.params = builder.params;
        this.compileObjective = builder.compileObjective;
        this.mcpFix = builder.mcpFix == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(builder.mcpFix));
    }

    public static Builder builder() {
        return builder(KernelConfig.builder().build());
    }

    public static Builder builder(KernelConfig config) {
        return new Builder(config);
    }

    public OptimizerConfig getOptimizer() {
        return optimizer;
    }

    public String getDatasetId() {
        return datasetId;
    }

    public double getTolerance() {
        return tolerance;
    }

    public String getDescription() {
        return description;
    }

    public boolean isCompileAst() {
        return compileAst;
    }

    public ParameterSource getParams() {
        return params;
    }

    public boolean isCompileObjective() {
        return compileObjective;
    }

    /**
     * Variables to fix before compiling, by registered name; {@code null} for none.
     */
    public Map<String, Double> getMcpFix() {
        return mcpFix;
    }

    public static final class Builder {
        private OptimizerConfig optimizer;
        private String datasetId;
        private double tolerance;
        private String description;
        private boolean compileAst = true;
        private ParameterSource params;
        private boolean compileObjective = true;
        private Map<String, Double> mcpFix;

        private Builder(KernelConfig config) {
            this.datasetId = config.getDatasetId();
            this.tolerance = config.getTolerance();
        }

        public Builder optimizer(OptimizerConfig optimizer) {
            this.optimizer = optimizer;
            return this;
        }

        public Builder datasetId(String datasetId) {
            this.datasetId = datasetId;
            return this;
        }

        public Builder tolerance(double tolerance) {
            this.tolerance = tolerance;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder compileAst(boolean compileAst) {
            this.compileAst = compileAst;
            return this;
        }

        public Builder params(ParameterSource params) {
            this.params = params;
            return this;
        }

        public Builder compileObjective(boolean compileObjective) {
            this.compileObjective = compileObjective;
            return this;
        }

        public Builder mcpFix(Map<String, Double> mcpFix) {
            this.mcpFix = mcpFix;
            return this;
        }

        public RunOptions build() {
            return new RunOptions(this);
        }
    }
}
