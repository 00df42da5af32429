/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.api.expr;

import java.util.Objects;

public record Power(Expr base, Expr exponent) implements Expr {

    public Power {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(exponent, "exponent");
    }
}
