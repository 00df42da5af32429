/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.runtime.validation;

import com.cgekernel.api.exceptions.ValueUnavailableException;
import com.cgekernel.api.expr.Expr;
import com.cgekernel.api.expr.RawExpr;
import com.cgekernel.api.model.EquationPayload;
import com.cgekernel.api.model.EquationRecord;
import com.cgekernel.api.model.ResidualRecord;
import com.cgekernel.api.model.ResidualSummary;
import com.cgekernel.api.model.ValidationCategory;
import com.cgekernel.api.model.ValidationLevel;
import com.cgekernel.api.model.ValidationReport;
import com.cgekernel.api.solver.VariableHandle;
import com.cgekernel.infra.config.KernelConfig;
import com.cgekernel.runtime.model.KernelContext;
import com.cgekernel.runtime.residual.ResidualAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

/**
 * Inspects a built (and optionally solved) context and reports problems
 * without throwing.
 *
 * <h2>Checks</h2>
 * <ul>
 * <li><b>structural</b>: equations and variables are registered</li>
 * <li><b>residuals</b>: residual summary, tolerance breaches, and at
 * {@link ValidationLevel#FULL} the worst residuals</li>
 * <li><b>mcp</b>: once any equation has a complementarity variable, every
 * other non-exempt equation must have one too</li>
 * <li><b>scaling</b> ({@link ValidationLevel#FULL} only): variable magnitudes
 * outside the configured thresholds</li>
 * </ul>
 * Findings are warnings and notes; none of these checks records an error.
 */
public final class ModelValidator {
    private static final Logger logger = LoggerFactory.getLogger(ModelValidator.class);

    /**
     * Equation tags that never need a complementarity pairing.
     */
    public static final Set<String> MCP_EXEMPT_TAGS = Set.of("objective", "numeraire", "start", "lower", "upper", "fixed");

    private final KernelConfig config;

    public ModelValidator() {
        this(KernelConfig.builder().build());
    }

    public ModelValidator(KernelConfig config) {
        this.config = config;
    }

    public ValidationReport validate(KernelContext context) {
        return validate(context, null, ValidationLevel.BASIC, config.getTolerance());
    }

    /**
     * @param context context to inspect
     * @param data    calibration data; accepted for future cross-checks, currently only noted
     * @param level   validation depth
     * @param tol     residual tolerance
     */
    public ValidationReport validate(KernelContext context, Object data, ValidationLevel level, double tol) {
        ValidationReport.Builder report = ValidationReport.builder();
        checkStructure(context, report.category(ValidationCategory.STRUCTURAL));
        checkResiduals(context, level, tol, report.category(ValidationCategory.RESIDUALS));
        checkComplementarity(context, report.category(ValidationCategory.MCP));
        ValidationReport.CategoryBuilder scaling = report.category(ValidationCategory.SCALING);
        if (level == ValidationLevel.FULL) {
            checkScaling(context, scaling);
        }
        if (data != null) {
            report.category(ValidationCategory.STRUCTURAL).note("data provided but not used by validation yet");
        }

        ValidationReport result = report.build();
        logger.debug("Validation at {} level finished: ok={}, errors={}, warnings={}",
                level, result.ok(), result.errors(), result.warnings());
        return result;
    }

    private void checkStructure(KernelContext context, ValidationReport.CategoryBuilder structural) {
        if (context.listEquations().isEmpty()) {
            structural.warning("No equations registered in context");
        }
        if (context.variables().isEmpty()) {
            structural.warning("No variables registered in context");
        }
    }

    private void checkResiduals(KernelContext context, ValidationLevel level, double tol,
                                ValidationReport.CategoryBuilder residuals) {
        List<ResidualRecord> records = ResidualAnalyzer.residuals(context);
        if (records.isEmpty()) {
            residuals.warning("No residuals recorded; compile equations and solve before validation");
            return;
        }
        ResidualSummary summary = ResidualAnalyzer.summarize(records, tol);
        residuals.note("max_abs=" + summary.maxAbs() + ", above_tol=" + summary.aboveTol());
        if (summary.aboveTol() > 0) {
            residuals.warning("Residuals above tolerance: " + summary.aboveTol());
        }
        if (level == ValidationLevel.FULL) {
            List<ResidualRecord> worst = ResidualAnalyzer.topResiduals(context, config.getTopResidualCount());
            for (int i = 0; i < worst.size(); i++) {
                ResidualRecord r = worst.get(i);
                residuals.note("worst " + (i + 1) + ": " + r.block() + "." + r.tag() + " " + r.indices()
                        + " residual=" + r.residual());
            }
        }
    }

    private void checkComplementarity(KernelContext context, ValidationReport.CategoryBuilder mcp) {
        boolean hasMcp = context.listEquations().stream().anyMatch(eq -> eq.payload().hasMcpVar());
        if (!hasMcp) {
            mcp.note("No MCP equations detected");
            return;
        }
        for (EquationRecord eq : context.listEquations()) {
            EquationPayload payload = eq.payload();
            Expr expr = payload.expr();
            boolean compilable = expr != null && !(expr instanceof RawExpr);
            if (compilable && !MCP_EXEMPT_TAGS.contains(eq.tag()) && !payload.hasMcpVar()) {
                mcp.warning("Missing mcp_var for " + eq.block() + "." + eq.tag() + " " + payload.indices());
            }
        }
    }

    private void checkScaling(KernelContext context, ValidationReport.CategoryBuilder scaling) {
        double max = Double.NEGATIVE_INFINITY;
        double min = Double.POSITIVE_INFINITY;
        int count = 0;
        for (VariableHandle variable : context.variables().values()) {
            double value;
            try {
                value = variable.value();
            } catch (ValueUnavailableException e) {
                continue;
            }
            if (!Double.isFinite(value)) {
                continue;
            }
            double magnitude = Math.abs(value);
            max = Math.max(max, magnitude);
            min = Math.min(min, magnitude);
            count++;
        }
        if (count == 0) {
            return;
        }
        if (max > config.getScalingLargeThreshold()) {
            scaling.warning("Large variable magnitude detected: max=" + max);
        }
        if (min < config.getScalingSmallThreshold()) {
            scaling.warning("Very small variable magnitude detected: min=" + min);
        }
    }
}
