/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.api.expr;

import java.util.List;
import java.util.Objects;

/**
 * Reference to a parameter served by the parameter source.
 *
 * @param name    parameter name
 * @param indices explicit index list, or {@code null} to inherit the equation's indices
 */
public record ParamRef(String name, List<IndexTerm> indices) implements Expr {

    public ParamRef {
        Objects.requireNonNull(name, "name");
        indices = indices == null ? null : List.copyOf(indices);
    }
}
