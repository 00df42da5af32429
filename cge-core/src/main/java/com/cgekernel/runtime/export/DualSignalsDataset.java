/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.runtime.export;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Constraint-level view of a solved model: the blocks as components, each
 * equation instance as a constraint, and its residual as a solution record.
 *
 * <h2>Usage</h2>
 * <pre>
 * DualSignalsDataset dataset = new DualSignalsExporter().export(context, "base-run", null, 1e-6);
 * new DatasetWriter().write(dataset, Path.of("base-run.json"));
 * </pre>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DualSignalsDataset(
        @JsonProperty("dataset_id") String datasetId,
        @JsonProperty("metadata") Metadata metadata,
        @JsonProperty("components") List<Component> components,
        @JsonProperty("constraints") List<Constraint> constraints,
        @JsonProperty("constraint_solutions") List<ConstraintSolution> constraintSolutions
) implements Serializable {

    public DualSignalsDataset {
        components = List.copyOf(components);
        constraints = List.copyOf(constraints);
        constraintSolutions = List.copyOf(constraintSolutions);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Metadata(
            @JsonProperty("description") String description
    ) implements Serializable {
    }

    public record Component(
            @JsonProperty("component_id") String componentId,
            @JsonProperty("component_type") ComponentType componentType,
            @JsonProperty("name") String name
    ) implements Serializable {
    }

    public record Constraint(
            @JsonProperty("constraint_id") String constraintId,
            @JsonProperty("kind") ConstraintKind kind,
            @JsonProperty("sense") ConstraintSense sense,
            @JsonProperty("component_ids") List<String> componentIds
    ) implements Serializable {
        public Constraint {
            componentIds = List.copyOf(componentIds);
        }
    }

    public record ConstraintSolution(
            @JsonProperty("constraint_id") String constraintId,
            @JsonProperty("dual") double dual,
            @JsonProperty("slack") double slack,
            @JsonProperty("is_binding") boolean binding
    ) implements Serializable {
    }
}
