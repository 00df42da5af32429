/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.api.exceptions;

/**
 * An AST reference that the registry or the index environment cannot resolve.
 */
public class UnboundReferenceException extends KernelException {

    private final String reference;

    public UnboundReferenceException(String message, String reference) {
        super(message);
        this.reference = reference;
    }

    /**
     * @return the unresolved name (index, variable or parameter)
     */
    public String getReference() {
        return reference;
    }
}
