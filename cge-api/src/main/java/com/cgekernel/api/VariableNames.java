/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.api;

import java.util.List;

/**
 * Fully-qualified naming of indexed variables and parameters.
 *
 * <p>The block layer registers variables under these names and the compiler
 * looks them up the same way, so the format is a contract between the two:
 * the base name alone when there are no indices, otherwise the base name and
 * every index joined by {@value #SEPARATOR} ({@code x}, {@code x_agr},
 * {@code trade_agr_usa}).
 */
public final class VariableNames {

    public static final String SEPARATOR = "_";

    private VariableNames() {
    }

    public static String qualify(String base, List<String> indices) {
        if (indices == null || indices.isEmpty()) {
            return base;
        }
        return base + SEPARATOR + String.join(SEPARATOR, indices);
    }

    public static String qualify(String base, String... indices) {
        return qualify(base, List.of(indices));
    }
}
