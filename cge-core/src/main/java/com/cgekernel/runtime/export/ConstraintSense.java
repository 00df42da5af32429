/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.runtime.export;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ConstraintSense {
    EQ("eq"),
    LE("le"),
    GE("ge");

    private static final EnumNameTable<ConstraintSense> NAMES = EnumNameTable.of(ConstraintSense.class, ConstraintSense::wireName);

    private final String wireName;

    ConstraintSense(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static ConstraintSense fromName(String name) {
        return NAMES.lookup(name);
    }
}
