/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.api.expr;

import java.util.Objects;

/**
 * Free index reference. Resolves through the index environment, either as an
 * expression on its own or as an element of an index list.
 */
public record IndexRef(String name) implements Expr, IndexTerm {

    public IndexRef {
        Objects.requireNonNull(name, "name");
    }
}
