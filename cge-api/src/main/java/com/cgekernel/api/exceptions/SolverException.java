/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.api.exceptions;

/**
 * Raised by a solver backend when it cannot run the optimize step.
 */
public class SolverException extends KernelException {

    public SolverException(String message) {
        super(message);
    }

    public SolverException(String message, Throwable cause) {
        super(message, cause);
    }
}
