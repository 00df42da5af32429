/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.runtime.run;

import com.cgekernel.api.model.ResidualSummary;
import com.cgekernel.runtime.export.DualSignalsDataset;
import com.cgekernel.runtime.model.KernelContext;

/**
 * Outcome of one {@link RunOrchestrator#run} call.
 *
 * @param context the built, compiled and solved context
 * @param summary residual summary at the run tolerance
 * @param dataset exported constraint dataset
 */
public record RunResult(KernelContext context, ResidualSummary summary, DualSignalsDataset dataset) {
}
