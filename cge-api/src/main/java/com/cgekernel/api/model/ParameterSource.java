/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.api.model;

import java.util.List;

/**
 * Calibrated parameter lookup consumed by the compiler. The compiler never
 * inspects the source beyond this call.
 */
@FunctionalInterface
public interface ParameterSource {

    /**
     * @param name    parameter name
     * @param indices resolved index labels, possibly empty
     * @return the parameter value
     * @throws com.cgekernel.api.exceptions.UnboundReferenceException if the parameter does not exist
     */
    double getParam(String name, List<String> indices);
}
