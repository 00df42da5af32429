/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.api.expr;

import java.util.List;
import java.util.Objects;

/**
 * Product of {@code body} over {@code domain}, binding {@code index} to each
 * domain value in order. The domain must not be empty; this is checked when
 * the node is compiled.
 */
public record ProductOver(String index, List<String> domain, Expr body) implements Expr {

    public ProductOver {
        Objects.requireNonNull(index, "index");
        Objects.requireNonNull(body, "body");
        domain = List.copyOf(domain);
    }
}
