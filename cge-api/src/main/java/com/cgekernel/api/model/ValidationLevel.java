/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.api.model;

import com.cgekernel.api.exceptions.ConfigurationException;

import java.util.Locale;

/**
 * Depth of a validation run.
 */
public enum ValidationLevel {
    /** Structural, residual summary and complementarity checks. */
    BASIC,
    /** Adds the worst-residual ranking and variable scaling checks. */
    FULL;

    public static ValidationLevel parse(String value) {
        if (value == null) {
            return BASIC;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "basic":
                return BASIC;
            case "full":
            case "extended":
                return FULL;
            default:
                throw new ConfigurationException("Unknown validation level: " + value);
        }
    }
}
