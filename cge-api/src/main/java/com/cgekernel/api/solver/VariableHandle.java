/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.api.solver;

import com.cgekernel.api.exceptions.ValueUnavailableException;

/**
 * A decision variable owned by a {@link SolverModel}.
 *
 * <p>Bound and fixed state can be queried at any time. The solved value is
 * only available after the owning model has been optimized.
 */
public interface VariableHandle {

    String name();

    /**
     * Returns the value from the last solve.
     *
     * @throws ValueUnavailableException if no solved value exists
     */
    double value();

    double startValue();

    void setStartValue(double value);

    boolean hasLowerBound();

    double lowerBound();

    void setLowerBound(double bound);

    boolean hasUpperBound();

    double upperBound();

    void setUpperBound(double bound);

    boolean isFixed();

    double fixedValue();

    /**
     * Fixes the variable at {@code value}. Any active bounds are dropped.
     */
    void fix(double value);

    void unfix();
}
