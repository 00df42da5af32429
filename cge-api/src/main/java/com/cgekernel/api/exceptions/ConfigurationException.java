/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.api.exceptions;

/**
 * Invalid inputs supplied by the caller: a missing solver model, a missing
 * parameter source, or an unknown enumerated value.
 */
public class ConfigurationException extends KernelException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
