/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.runtime.snapshot;

import com.cgekernel.api.exceptions.ValueUnavailableException;
import com.cgekernel.api.model.VariableState;
import com.cgekernel.api.solver.VariableHandle;
import com.cgekernel.runtime.model.KernelContext;
import com.cgekernel.runtime.run.RunResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Captures solved variable values and bound states, and replays them into a
 * fresh context as a warm start.
 *
 * <p>Variables without a solved value are skipped; only finite numbers are recorded.
 */
public final class SnapshotService {
    private static final Logger logger = LoggerFactory.getLogger(SnapshotService.class);

    private SnapshotService() {
    }

    /**
     * Solved values by variable name, sorted by name.
     */
    public static Map<String, Double> snapshot(KernelContext context) {
        Map<String, Double> out = new TreeMap<>();
        context.variables().forEach((name, variable) ->
                solvedValue(variable).ifPresent(value -> out.put(name, value)));
        return out;
    }

    public static Map<String, Double> snapshot(RunResult result) {
        return snapshot(result.context());
    }

    /**
     * Solved values as start values, plus active finite bounds and fixed values.
     * Variables without a solved value contribute neither.
     */
    public static VariableState snapshotState(KernelContext context) {
        Map<String, Double> start = new TreeMap<>();
        Map<String, Double> lower = new TreeMap<>();
        Map<String, Double> upper = new TreeMap<>();
        Map<String, Double> fixed = new TreeMap<>();
        context.variables().forEach((name, variable) -> {
            Optional<Double> value = solvedValue(variable);
            if (value.isEmpty()) {
                return;
            }
            start.put(name, value.get());
            if (variable.hasLowerBound() && Double.isFinite(variable.lowerBound())) {
                lower.put(name, variable.lowerBound());
            }
            if (variable.hasUpperBound() && Double.isFinite(variable.upperBound())) {
                upper.put(name, variable.upperBound());
            }
            if (variable.isFixed()) {
                fixed.put(name, variable.fixedValue());
            }
        });
        return new VariableState(start, lower, upper, fixed);
    }

    public static VariableState snapshotState(RunResult result) {
        return snapshotState(result.context());
    }

    /**
     * Installs start values, bounds and fixed values from {@code state} on the
     * variables of {@code context}. Fixings are applied last, so they win over
     * bounds. Names not registered in the context are skipped.
     *
     * @return the number of entries applied
     */
    public static int applyState(KernelContext context, VariableState state) {
        int applied = 0;
        int skipped = 0;
        for (Map.Entry<String, Double> e : state.start().entrySet()) {
            Optional<VariableHandle> variable = context.variable(e.getKey());
            if (variable.isPresent()) {
                variable.get().setStartValue(e.getValue());
                applied++;
            } else {
                skipped++;
            }
        }
        for (Map.Entry<String, Double> e : state.lower().entrySet()) {
            Optional<VariableHandle> variable = context.variable(e.getKey());
            if (variable.isPresent()) {
                variable.get().setLowerBound(e.getValue());
                applied++;
            } else {
                skipped++;
            }
        }
        for (Map.Entry<String, Double> e : state.upper().entrySet()) {
            Optional<VariableHandle> variable = context.variable(e.getKey());
            if (variable.isPresent()) {
                variable.get().setUpperBound(e.getValue());
                applied++;
            } else {
                skipped++;
            }
        }
        for (Map.Entry<String, Double> e : state.fixed().entrySet()) {
            Optional<VariableHandle> variable = context.variable(e.getKey());
            if (variable.isPresent()) {
                variable.get().fix(e.getValue());
                applied++;
            } else {
                skipped++;
            }
        }
        if (skipped > 0) {
            logger.debug("Warm start skipped {} entries for unregistered variables", skipped);
        }
        return applied;
    }

    private static Optional<Double> solvedValue(VariableHandle variable) {
        double value;
        try {
            value = variable.value();
        } catch (ValueUnavailableException e) {
            return Optional.empty();
        }
        return Double.isFinite(value) ? Optional.of(value) : Optional.empty();
    }
}
