/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.runtime.solver;

import com.cgekernel.api.exceptions.ConfigurationException;
import com.cgekernel.api.model.ObjectiveSense;
import com.cgekernel.api.numeric.NumericExpr;
import com.cgekernel.api.solver.ConstraintHandle;
import com.cgekernel.api.solver.OptimizerConfig;
import com.cgekernel.api.solver.SolverModel;
import com.cgekernel.api.solver.VariableHandle;
import com.cgekernel.infra.config.KernelConfig;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * In-process {@link SolverModel} that keeps compiled constraints as
 * {@link NumericExpr} trees and evaluates them directly.
 *
 * <p>Backends are selected by name through {@link #setOptimizer(OptimizerConfig)}:
 * <ul>
 * <li>{@value EvaluationOptimizer#NAME}: evaluate at fixed/start values (default)</li>
 * <li>{@value NewtonOptimizer#NAME}: damped Newton-Raphson on square systems</li>
 * </ul>
 */
public final class ExpressionModel implements SolverModel {
    private static final Logger logger = LoggerFactory.getLogger(ExpressionModel.class);

    private static final Map<String, BiFunction<OptimizerConfig, KernelConfig, Optimizer>> BACKENDS = backendTable();

    private final KernelConfig config;
    private final VariableDictionary dictionary = new VariableDictionary();
    private final List<ModelVariable> variables = new ObjectArrayList<>();
    private final List<ModelConstraint> constraints = new ObjectArrayList<>();

    private NumericExpr objective;
    private ObjectiveSense objectiveSense;
    private Optimizer optimizer;
    private SolveStatus status = SolveStatus.NOT_SOLVED;

    public ExpressionModel() {
        this(KernelConfig.builder().build());
    }

    public ExpressionModel(KernelConfig config) {
        this.config = config;
        this.optimizer = createOptimizer(OptimizerConfig.of(config.getDefaultBackend()));
    }

    private static Map<String, BiFunction<OptimizerConfig, KernelConfig, Optimizer>> backendTable() {
        Map<String, BiFunction<OptimizerConfig, KernelConfig, Optimizer>> table = new LinkedHashMap<>();
        table.put(EvaluationOptimizer.NAME, (optimizer, config) -> new EvaluationOptimizer());
        table.put(NewtonOptimizer.NAME, NewtonOptimizer::fromConfig);
        return Collections.unmodifiableMap(table);
    }

    /**
     * Names accepted by {@link #setOptimizer(OptimizerConfig)}.
     */
    public static List<String> backendNames() {
        return List.copyOf(BACKENDS.keySet());
    }

    // ════════════════════════════════════════════════════════════════════════
    // VARIABLES
    // ════════════════════════════════════════════════════════════════════════

    /**
     * @throws IllegalArgumentException if a variable with this name exists
     */
    @Override
    public ModelVariable addVariable(String name) {
        int column = dictionary.add(name);
        ModelVariable variable = new ModelVariable(this, column, name);
        variables.add(variable);
        return variable;
    }

    public Optional<ModelVariable> variable(String name) {
        int column = dictionary.column(name);
        return column < 0 ? Optional.empty() : Optional.of(variables.get(column));
    }

    @Override
    public List<VariableHandle> variables() {
        return Collections.unmodifiableList(variables);
    }

    List<ModelVariable> modelVariables() {
        return Collections.unmodifiableList(variables);
    }

    // ════════════════════════════════════════════════════════════════════════
    // CONSTRAINTS & OBJECTIVE
    // ════════════════════════════════════════════════════════════════════════

    @Override
    public ModelConstraint addEquality(NumericExpr lhs, NumericExpr rhs) {
        ModelConstraint constraint = new ModelConstraint(constraints.size(), ConstraintHandle.Kind.EQUALITY,
                NumericExpr.difference(lhs, rhs), null);
        constraints.add(constraint);
        return constraint;
    }

    /**
     * @throws IllegalArgumentException if {@code variable} belongs to another model
     */
    @Override
    public ModelConstraint addComplementarity(NumericExpr function, VariableHandle variable) {
        if (!(variable instanceof ModelVariable own) || own.owner() != this) {
            throw new IllegalArgumentException("Complementarity variable " + variable.name()
                    + " does not belong to this model");
        }
        ModelConstraint constraint = new ModelConstraint(constraints.size(), ConstraintHandle.Kind.COMPLEMENTARITY,
                function, own);
        constraints.add(constraint);
        return constraint;
    }

    @Override
    public List<ConstraintHandle> constraints() {
        return Collections.unmodifiableList(constraints);
    }

    List<ModelConstraint> modelConstraints() {
        return Collections.unmodifiableList(constraints);
    }

    @Override
    public void setObjective(ObjectiveSense sense, NumericExpr objective) {
        this.objectiveSense = sense;
        this.objective = objective;
    }

    @Override
    public Optional<NumericExpr> objective() {
        return Optional.ofNullable(objective);
    }

    @Override
    public Optional<ObjectiveSense> objectiveSense() {
        return Optional.ofNullable(objectiveSense);
    }

    /**
     * Objective value at the current solution.
     *
     * @throws com.cgekernel.api.exceptions.ValueUnavailableException if unsolved
     * @throws IllegalStateException if no objective is installed
     */
    public double objectiveValue() {
        if (objective == null) {
            throw new IllegalStateException("No objective installed");
        }
        return objective.evaluate(VariableHandle::value);
    }

    // ════════════════════════════════════════════════════════════════════════
    // SOLVING
    // ════════════════════════════════════════════════════════════════════════

    @Override
    public void setOptimizer(OptimizerConfig config) {
        this.optimizer = createOptimizer(config);
    }

    public Optimizer getOptimizer() {
        return optimizer;
    }

    @Override
    public void optimize() {
        long start = System.nanoTime();
        status = optimizer.optimize(this);
        logger.info("Backend '{}' finished with status {} ({} variables, {} constraints) in {} us",
                optimizer.name(), status, variables.size(), constraints.size(), (System.nanoTime() - start) / 1_000);
    }

    public SolveStatus getStatus() {
        return status;
    }

    private Optimizer createOptimizer(OptimizerConfig optimizerConfig) {
        String key = optimizerConfig.backend().toLowerCase(Locale.ROOT);
        BiFunction<OptimizerConfig, KernelConfig, Optimizer> factory = BACKENDS.get(key);
        if (factory == null) {
            throw new ConfigurationException("Unknown optimizer backend: " + optimizerConfig.backend()
                    + " (known: " + BACKENDS.keySet() + ")");
        }
        return factory.apply(optimizerConfig, config);
    }
}
