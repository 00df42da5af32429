/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.api.exceptions;

/**
 * A variable value was requested that the backend cannot provide, typically
 * because the model has not been solved yet. Callers that scan variables
 * treat this as "no value" rather than as a failure.
 */
public class ValueUnavailableException extends KernelException {

    public ValueUnavailableException(String message) {
        super(message);
    }
}
