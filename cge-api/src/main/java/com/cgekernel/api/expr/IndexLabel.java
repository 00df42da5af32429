/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.api.expr;

import java.util.Objects;

/**
 * Literal index value inside an index list, e.g. the {@code agr} in {@code x[agr]}.
 */
public record IndexLabel(String value) implements IndexTerm {

    public IndexLabel {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String toString() {
        return value;
    }
}
