/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.api;

import com.cgekernel.runtime.model.KernelContext;

/**
 * A model component that registers its variables and equations into a context.
 *
 * <p>Blocks are built once each, in the order the {@link RunSpec} lists them,
 * before any compilation happens.
 */
public interface ModelBlock {

    String name();

    void build(KernelContext context, RunSpec spec);
}
