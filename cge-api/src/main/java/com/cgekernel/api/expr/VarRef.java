/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.api.expr;

import java.util.List;
import java.util.Objects;

/**
 * Reference to a registered variable.
 *
 * @param name    base variable name
 * @param indices explicit index list, or {@code null} to inherit the equation's indices
 */
public record VarRef(String name, List<IndexTerm> indices) implements Expr {

    public VarRef {
        Objects.requireNonNull(name, "name");
        indices = indices == null ? null : List.copyOf(indices);
    }

    /**
     * A reference by bare name: no index list and no inheritance.
     */
    public static VarRef named(String name) {
        return new VarRef(name, List.of());
    }
}
