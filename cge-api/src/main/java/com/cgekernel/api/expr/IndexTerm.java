/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.api.expr;

/**
 * One element of an explicit index list: either a free index resolved through
 * the index environment, or a literal label used verbatim.
 */
public sealed interface IndexTerm permits IndexRef, IndexLabel {
}
