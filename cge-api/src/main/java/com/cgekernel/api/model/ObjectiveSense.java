/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.api.model;

import com.cgekernel.api.exceptions.ConfigurationException;

import java.util.Locale;

/**
 * Optimization direction of the model objective.
 */
public enum ObjectiveSense {
    MAXIMIZE,
    MINIMIZE;

    /**
     * Sense applied when an objective is registered without one.
     */
    public static final ObjectiveSense DEFAULT = MAXIMIZE;

    /**
     * Parses {@code max}/{@code maximize}/{@code min}/{@code minimize}, case-insensitively.
     *
     * @throws ConfigurationException for any other value
     */
    public static ObjectiveSense parse(String value) {
        if (value == null) {
            return DEFAULT;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "max":
            case "maximize":
                return MAXIMIZE;
            case "min":
            case "minimize":
                return MINIMIZE;
            default:
                throw new ConfigurationException("Unsupported objective sense: " + value);
        }
    }
}
