/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Categorized validation findings.
 *
 * <p>A report is filled through {@link Builder#category(ValidationCategory)} and
 * frozen by {@link Builder#build()}. Warnings never fail a report; only errors do.
 *
 * @param ok         true iff no category recorded an error
 * @param errors     total errors across categories
 * @param warnings   total warnings across categories
 * @param categories findings per category, in category declaration order
 */
public record ValidationReport(
        @JsonProperty("ok") boolean ok,
        @JsonProperty("errors") int errors,
        @JsonProperty("warnings") int warnings,
        @JsonProperty("categories") Map<ValidationCategory, Findings> categories
) {

    public ValidationReport {
        categories = Collections.unmodifiableMap(new LinkedHashMap<>(categories));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Findings category(ValidationCategory category) {
        return categories.getOrDefault(category, Findings.EMPTY);
    }

    /**
     * Ordered findings of one category.
     */
    public record Findings(
            @JsonProperty("errors") List<String> errors,
            @JsonProperty("warnings") List<String> warnings,
            @JsonProperty("notes") List<String> notes
    ) {
        static final Findings EMPTY = new Findings(List.of(), List.of(), List.of());

        public Findings {
            errors = List.copyOf(errors);
            warnings = List.copyOf(warnings);
            notes = List.copyOf(notes);
        }
    }

    /**
     * Mutable accumulator for one category.
     */
    public static final class CategoryBuilder {
        private final List<String> errors = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();
        private final List<String> notes = new ArrayList<>();

        private CategoryBuilder() {
        }

        public CategoryBuilder error(String message) {
            errors.add(message);
            return this;
        }

        public CategoryBuilder warning(String message) {
            warnings.add(message);
            return this;
        }

        public CategoryBuilder note(String message) {
            notes.add(message);
            return this;
        }

        private Findings freeze() {
            return new Findings(errors, warnings, notes);
        }
    }

    public static final class Builder {
        private final Map<ValidationCategory, CategoryBuilder> categories = new EnumMap<>(ValidationCategory.class);

        private Builder() {
        }

        /**
         * Returns the accumulator of {@code category}, creating it on first use.
         */
        public CategoryBuilder category(ValidationCategory category) {
            return categories.computeIfAbsent(category, c -> new CategoryBuilder());
        }

        public ValidationReport build() {
            Map<ValidationCategory, Findings> frozen = new EnumMap<>(ValidationCategory.class);
            int errorCount = 0;
            int warningCount = 0;
            for (Map.Entry<ValidationCategory, CategoryBuilder> entry : categories.entrySet()) {
                Findings findings = entry.getValue().freeze();
                errorCount += findings.errors().size();
                warningCount += findings.warnings().size();
                frozen.put(entry.getKey(), findings);
            }
            return new ValidationReport(errorCount == 0, errorCount, warningCount, frozen);
        }
    }
}
