/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.api.expr;

import java.util.Objects;

public record Negate(Expr operand) implements Expr {

    public Negate {
        Objects.requireNonNull(operand, "operand");
    }
}
