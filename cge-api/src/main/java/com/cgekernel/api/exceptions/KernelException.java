/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.api.exceptions;

/**
 * Base class of every failure raised by the kernel.
 *
 * This is a RuntimeException to avoid forcing checked exception handling
 * through the compile and solve call chains, while still letting callers
 * catch kernel failures as one family.
 */
public class KernelException extends RuntimeException {

    public KernelException(String message) {
        super(message);
    }

    public KernelException(String message, Throwable cause) {
        super(message, cause);
    }
}
