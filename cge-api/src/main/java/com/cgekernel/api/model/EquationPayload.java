/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.api.model;

import com.cgekernel.api.expr.Expr;
import com.cgekernel.api.expr.VarRef;
import com.cgekernel.api.solver.ConstraintHandle;

import java.util.List;

/**
 * Structured payload of an {@link EquationRecord}.
 *
 * <p>Every field is optional. The block layer fills the symbolic part
 * ({@code expr}, objective, indices, params, {@code mcpVar}); the compiler adds
 * {@code constraint}; the solve step adds {@code residual}. The {@code with*}
 * methods are the only way those later stages extend a payload.
 *
 * @param expr           equation AST, normally an {@link com.cgekernel.api.expr.Equality}
 * @param objectiveExpr  objective AST, at most one per context
 * @param objectiveSense objective direction; {@code null} means {@link ObjectiveSense#DEFAULT}
 * @param indexNames     names of the instance indices, aligned with {@code indices}
 * @param indices        concrete index tuple of this instance
 * @param params         parameter source of this instance
 * @param mcpVar         complementarity variable, a {@link VarRef} or a bare name
 * @param constraint     compiled constraint handle
 * @param residual       residual from the last solve
 * @param attachment     opaque block-layer data, never read by the kernel
 */
public record EquationPayload(
        Expr expr,
        Expr objectiveExpr,
        ObjectiveSense objectiveSense,
        List<String> indexNames,
        List<String> indices,
        ParameterSource params,
        Expr mcpVar,
        ConstraintHandle constraint,
        Double residual,
        Object attachment
) {

    public EquationPayload {
        indexNames = indexNames == null ? null : List.copyOf(indexNames);
        indices = indices == null ? List.of() : List.copyOf(indices);
    }

    public static EquationPayload empty() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean hasObjective() {
        return objectiveExpr != null;
    }

    public boolean hasMcpVar() {
        return mcpVar != null;
    }

    public boolean isCompiled() {
        return constraint != null;
    }

    public boolean hasResidual() {
        return residual != null;
    }

    public EquationPayload withConstraint(ConstraintHandle handle) {
        return new EquationPayload(expr, objectiveExpr, objectiveSense, indexNames, indices, params,
                mcpVar, handle, residual, attachment);
    }

    public EquationPayload withResidual(double value) {
        return new EquationPayload(expr, objectiveExpr, objectiveSense, indexNames, indices, params,
                mcpVar, constraint, value, attachment);
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.expr = expr;
        builder.objectiveExpr = objectiveExpr;
        builder.objectiveSense = objectiveSense;
        builder.indexNames = indexNames;
        builder.indices = indices;
        builder.params = params;
        builder.mcpVar = mcpVar;
        builder.constraint = constraint;
        builder.residual = residual;
        builder.attachment = attachment;
        return builder;
    }

    public static final class Builder {
        private Expr expr;
        private Expr objectiveExpr;
        private ObjectiveSense objectiveSense;
        private List<String> indexNames;
        private List<String> indices;
        private ParameterSource params;
        private Expr mcpVar;
        private ConstraintHandle constraint;
        private Double residual;
        private Object attachment;

        private Builder() {
        }

        public Builder expr(Expr expr) {
            this.expr = expr;
            return this;
        }

        public Builder objective(Expr objectiveExpr, ObjectiveSense sense) {
            this.objectiveExpr = objectiveExpr;
            this.objectiveSense = sense;
            return this;
        }

        public Builder objective(Expr objectiveExpr) {
            return objective(objectiveExpr, null);
        }

        /**
         * Sets the instance index names and their concrete values.
         */
        public Builder indices(List<String> indexNames, List<String> indices) {
            this.indexNames = indexNames;
            this.indices = indices;
            return this;
        }

        public Builder params(ParameterSource params) {
            this.params = params;
            return this;
        }

        public Builder mcpVar(Expr mcpVar) {
            this.mcpVar = mcpVar;
            return this;
        }

        /**
         * Pairs the equation with a variable by bare name, without index resolution.
         */
        public Builder mcpVar(String name) {
            this.mcpVar = VarRef.named(name);
            return this;
        }

        public Builder constraint(ConstraintHandle constraint) {
            this.constraint = constraint;
            return this;
        }

        public Builder residual(Double residual) {
            this.residual = residual;
            return this;
        }

        public Builder attachment(Object attachment) {
            this.attachment = attachment;
            return this;
        }

        public EquationPayload build() {
            return new EquationPayload(expr, objectiveExpr, objectiveSense, indexNames, indices, params,
                    mcpVar, constraint, residual, attachment);
        }
    }
}
