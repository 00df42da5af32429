/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.runtime.model;

import com.cgekernel.api.exceptions.ConfigurationException;
import com.cgekernel.api.exceptions.ValueUnavailableException;
import com.cgekernel.api.model.EquationPayload;
import com.cgekernel.api.model.EquationRecord;
import com.cgekernel.api.solver.OptimizerConfig;
import com.cgekernel.api.solver.SolverModel;
import com.cgekernel.api.solver.VariableHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Registry of variables and equations for one model run, with an optional
 * handle to the solver model they are compiled into.
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Not thread-safe. A context is owned by the single call sequence that builds,
 * compiles and solves it.
 */
public final class KernelContext {
    private static final Logger logger = LoggerFactory.getLogger(KernelContext.class);

    private final Map<String, VariableHandle> variables = new LinkedHashMap<>();
    private final List<EquationRecord> equations = new ArrayList<>();
    private final SolverModel model;

    public KernelContext() {
        this(null);
    }

    public KernelContext(SolverModel model) {
        this.model = model;
    }

    // ════════════════════════════════════════════════════════════════════════
    // REGISTRATION
    // ════════════════════════════════════════════════════════════════════════

    /**
     * Registers a variable handle under a qualified name. A later registration
     * under the same name replaces the earlier one.
     */
    public VariableHandle registerVariable(String name, VariableHandle handle) {
        VariableHandle previous = variables.put(name, handle);
        if (previous != null && previous != handle) {
            logger.debug("Variable {} re-registered; last registration wins", name);
        }
        return handle;
    }

    /**
     * Appends an equation record. Duplicates are not detected.
     */
    public void registerEquation(String tag, String block, EquationPayload payload) {
        equations.add(new EquationRecord(tag, block, payload));
    }

    /**
     * Read-only view of the equations in registration order.
     */
    public List<EquationRecord> listEquations() {
        return Collections.unmodifiableList(equations);
    }

    /**
     * Replaces the record at {@code position} with {@code update(record)}.
     */
    public EquationRecord updateEquation(int position, UnaryOperator<EquationRecord> update) {
        EquationRecord updated = update.apply(equations.get(position));
        equations.set(position, updated);
        return updated;
    }

    public Map<String, VariableHandle> variables() {
        return Collections.unmodifiableMap(variables);
    }

    public Optional<VariableHandle> variable(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    // ════════════════════════════════════════════════════════════════════════
    // MODEL
    // ════════════════════════════════════════════════════════════════════════

    public boolean hasModel() {
        return model != null;
    }

    public Optional<SolverModel> model() {
        return Optional.ofNullable(model);
    }

    /**
     * @throws ConfigurationException if no solver model is attached
     */
    public SolverModel requireModel() {
        if (model == null) {
            throw new ConfigurationException("KernelContext has no solver model; attach one to compile or solve");
        }
        return model;
    }

    public SolverModel solve() {
        return solve(null);
    }

    /**
     * Solves the attached model once and records the residual of every
     * compiled equation.
     *
     * @param optimizer backend configuration installed before solving, or {@code null}
     * @return the solved model
     * @throws ConfigurationException if no solver model is attached
     */
    public SolverModel solve(OptimizerConfig optimizer) {
        SolverModel solverModel = requireModel();
        if (optimizer != null) {
            solverModel.setOptimizer(optimizer);
        }
        solverModel.optimize();
        int recorded = recordResiduals();
        logger.debug("Solve finished; {} residuals recorded over {} equations", recorded, equations.size());
        return solverModel;
    }

    private int recordResiduals() {
        int recorded = 0;
        for (int i = 0; i < equations.size(); i++) {
            EquationRecord record = equations.get(i);
            if (!record.payload().isCompiled()) {
                continue;
            }
            double residual;
            try {
                residual = record.payload().constraint().residual();
            } catch (ValueUnavailableException e) {
                logger.debug("No residual for {}.{} {}: {}", record.block(), record.tag(),
                        record.payload().indices(), e.getMessage());
                continue;
            }
            equations.set(i, record.withResidual(residual));
            recorded++;
        }
        return recorded;
    }
}
