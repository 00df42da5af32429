/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.api.expr;

import java.util.Objects;

public record Divide(Expr numerator, Expr denominator) implements Expr {

    public Divide {
        Objects.requireNonNull(numerator, "numerator");
        Objects.requireNonNull(denominator, "denominator");
    }
}
