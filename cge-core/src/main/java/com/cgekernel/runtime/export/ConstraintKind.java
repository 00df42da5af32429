/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.runtime.export;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ConstraintKind {
    BALANCE("balance"),
    CAPACITY("capacity"),
    POLICY("policy"),
    OTHER("other");

    private static final EnumNameTable<ConstraintKind> NAMES = EnumNameTable.of(ConstraintKind.class, ConstraintKind::wireName);

    private final String wireName;

    ConstraintKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static ConstraintKind fromName(String name) {
        return NAMES.lookup(name);
    }
}
