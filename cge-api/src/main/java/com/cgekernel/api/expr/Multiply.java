/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.api.expr;

import java.util.List;

/**
 * Fixed-arity product. Has no identity element, so at least one factor is required.
 */
public record Multiply(List<Expr> factors) implements Expr {

    public Multiply {
        factors = List.copyOf(factors);
    }
}
