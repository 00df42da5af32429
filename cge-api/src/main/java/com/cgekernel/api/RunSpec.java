/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.api;

import java.util.List;
import java.util.Objects;

/**
 * A model to run: an ordered list of blocks.
 *
 * @param name   model name, used in logs and traces
 * @param blocks blocks in build order
 */
public record RunSpec(String name, List<ModelBlock> blocks) {

    public RunSpec {
        Objects.requireNonNull(name, "name");
        blocks = List.copyOf(blocks);
    }

    public static RunSpec of(String name, ModelBlock... blocks) {
        return new RunSpec(name, List.of(blocks));
    }
}
