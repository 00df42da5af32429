/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.api.exceptions;

/**
 * Exception thrown when an equation or expression violates a structural rule
 * at compile time: multiple objectives, an empty iteration domain, or an
 * unsupported AST variant.
 */
public class CompilationException extends KernelException {

    public CompilationException(String message) {
        super(message);
    }

    public CompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
