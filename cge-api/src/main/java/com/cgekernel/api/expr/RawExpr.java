/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.api.expr;

/**
 * Expression kept for documentation or rendering only. It is never compiled;
 * attempting to do so fails.
 */
public record RawExpr(String text) implements Expr {
}
