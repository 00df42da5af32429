/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.api.expr;

import java.util.Objects;

/**
 * Equation-level node {@code lhs == rhs}. The only equation shape the
 * compiler accepts.
 */
public record Equality(Expr lhs, Expr rhs) implements Expr {

    public Equality {
        Objects.requireNonNull(lhs, "lhs");
        Objects.requireNonNull(rhs, "rhs");
    }
}
