/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.api.expr;

import java.util.List;

/**
 * Fixed-arity sum. An empty term list compiles to zero.
 */
public record Add(List<Expr> terms) implements Expr {

    public Add {
        terms = List.copyOf(terms);
    }
}
