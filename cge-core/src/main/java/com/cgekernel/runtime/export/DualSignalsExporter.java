/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.runtime.export;

import com.cgekernel.api.model.ResidualRecord;
import com.cgekernel.runtime.model.KernelContext;
import com.cgekernel.runtime.residual.ResidualAnalyzer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps the solved residuals of a context onto a {@link DualSignalsDataset}.
 *
 * <p>Constraint ids are {@code block:tag:i1,i2}. Duals are not computed by
 * the kernel and are reported as 0.0; slack is the absolute residual and a
 * constraint is binding when its slack is within tolerance.
 */
public class DualSignalsExporter {

    private final ComponentType componentType;
    private final ConstraintKind constraintKind;
    private final ConstraintSense constraintSense;

    public DualSignalsExporter() {
        this("other", "other", "eq");
    }

    /**
     * @param componentType   wire name of the type given to every block
     * @param constraintKind  wire name of the kind given to every equation
     * @param constraintSense wire name of the sense given to every equation
     * @throws com.cgekernel.api.exceptions.ConfigurationException for unknown names
     */
    public DualSignalsExporter(String componentType, String constraintKind, String constraintSense) {
        this.componentType = ComponentType.fromName(componentType);
        this.constraintKind = ConstraintKind.fromName(constraintKind);
        this.constraintSense = ConstraintSense.fromName(constraintSense);
    }

    public DualSignalsDataset export(KernelContext context, String datasetId, String description, double tol) {
        Map<String, DualSignalsDataset.Component> components = new LinkedHashMap<>();
        List<DualSignalsDataset.Constraint> constraints = new ArrayList<>();
        List<DualSignalsDataset.ConstraintSolution> solutions = new ArrayList<>();

        for (ResidualRecord r : ResidualAnalyzer.residuals(context)) {
            String componentId = r.block();
            components.computeIfAbsent(componentId,
                    id -> new DualSignalsDataset.Component(id, componentType, id));

            String constraintId = constraintId(r);
            constraints.add(new DualSignalsDataset.Constraint(constraintId, constraintKind, constraintSense,
                    List.of(componentId)));
            double slack = r.absResidual();
            solutions.add(new DualSignalsDataset.ConstraintSolution(constraintId, 0.0, slack, slack <= tol));
        }

        return new DualSignalsDataset(datasetId, new DualSignalsDataset.Metadata(description),
                new ArrayList<>(components.values()), constraints, solutions);
    }

    static String constraintId(ResidualRecord r) {
        return r.block() + ":" + r.tag() + ":" + String.join(",", r.indices());
    }
}
