/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.runtime.residual;

import com.cgekernel.api.model.EquationPayload;
import com.cgekernel.api.model.EquationRecord;
import com.cgekernel.api.model.ResidualRecord;
import com.cgekernel.api.model.ResidualSummary;
import com.cgekernel.runtime.model.KernelContext;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Reads solved residuals back out of a context and aggregates them.
 *
 * <p>All results follow registration order. Ties on the absolute residual
 * resolve to the earlier record. A NaN residual ranks above every number in
 * both {@link #summarize} and {@link #topResiduals}.
 */
public final class ResidualAnalyzer {

    private ResidualAnalyzer() {
    }

    /**
     * Residuals of every equation whose payload carries one, in registration order.
     */
    public static List<ResidualRecord> residuals(KernelContext context) {
        List<ResidualRecord> out = new ArrayList<>();
        for (EquationRecord record : context.listEquations()) {
            EquationPayload payload = record.payload();
            if (payload.hasResidual()) {
                out.add(new ResidualRecord(record.tag(), record.block(), payload.indices(), payload.residual()));
            }
        }
        return out;
    }

    /**
     * Count, largest absolute residual with its first holder, and the number of
     * residuals strictly above {@code tol}.
     */
    public static ResidualSummary summarize(KernelContext context, double tol) {
        return summarize(residuals(context), tol);
    }

    public static ResidualSummary summarize(List<ResidualRecord> residuals, double tol) {
        if (residuals.isEmpty()) {
            return ResidualSummary.EMPTY;
        }
        ResidualRecord worst = residuals.get(0);
        int aboveTol = 0;
        for (ResidualRecord r : residuals) {
            // Double.compare ranks NaN above every number; strict keeps the first maximum
            if (Double.compare(r.absResidual(), worst.absResidual()) > 0) {
                worst = r;
            }
            if (r.absResidual() > tol) {
                aboveTol++;
            }
        }
        return new ResidualSummary(residuals.size(), worst.absResidual(), worst, aboveTol);
    }

    /**
     * The {@code k} largest residuals by absolute value, largest first.
     */
    public static List<ResidualRecord> topResiduals(KernelContext context, int k) {
        List<ResidualRecord> sorted = new ArrayList<>(residuals(context));
        // List.sort is stable, so equal magnitudes keep registration order
        sorted.sort(Comparator.comparingDouble(ResidualRecord::absResidual).reversed());
        return sorted.subList(0, Math.min(k, sorted.size()));
    }
}
