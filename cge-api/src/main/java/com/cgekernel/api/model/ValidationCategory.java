/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.api.model;

import com.cgekernel.api.exceptions.ConfigurationException;

import java.util.Locale;

public enum ValidationCategory {
    STRUCTURAL,
    RESIDUALS,
    MCP,
    SCALING;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ValidationCategory parse(String value) {
        for (ValidationCategory category : values()) {
            if (category.key().equalsIgnoreCase(value)) {
                return category;
            }
        }
        throw new ConfigurationException("Unknown validation category: " + value);
    }
}
