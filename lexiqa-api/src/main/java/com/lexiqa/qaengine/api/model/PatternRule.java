/*
 * Copyright (c) 2025 Lexiqa QA Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.lexiqa.qaengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single configured check: a pattern to look for, an optional replacement
 * and an optional exclusion pattern.
 *
 * <h2>Field semantics</h2>
 * <ul>
 *   <li><b>order</b>: execution and report sequence inside a {@link Profile}; ties keep declaration order</li>
 *   <li><b>enabled</b>: disabled rules contribute no matches and no mutation</li>
 *   <li><b>pattern</b>: regular expression source; empty means the rule is a no-op</li>
 *   <li><b>replacement</b>: template with back-references ({@code $1}, {@code \1}, {@code ${name}}, {@code \g<name>})</li>
 *   <li><b>caseSensitive</b>: when false, matching ignores case but the text is never case folded</li>
 *   <li><b>excludePattern</b>: matches intersecting any of its spans are discarded; empty means no exclusion</li>
 * </ul>
 *
 * <p>Rules are replaced wholesale, never patched. Use {@link #toBuilder()} to derive a changed copy.
 */
public record PatternRule(
        @JsonProperty("order") int order,
        @JsonProperty("enabled") boolean enabled,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("category") String category,
        @JsonProperty("pattern") String pattern,
        @JsonProperty("replacement") String replacement,
        @JsonProperty("case_sensitive") boolean caseSensitive,
        @JsonProperty("exclude_pattern") String excludePattern) {

    public static final String DEFAULT_CATEGORY = "Custom";

    public PatternRule {
        name = name == null ? "" : name;
        description = description == null ? "" : description;
        category = category == null ? DEFAULT_CATEGORY : category;
        pattern = pattern == null ? "" : pattern;
        replacement = replacement == null ? "" : replacement;
        excludePattern = excludePattern == null ? "" : excludePattern;
    }

    public boolean hasPattern() {
        return !pattern.isEmpty();
    }

    public boolean hasExclusion() {
        return !excludePattern.isEmpty();
    }

    public PatternRule withOrder(int newOrder) {
        return toBuilder().order(newOrder).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .order(order)
                .enabled(enabled)
                .name(name)
                .description(description)
                .category(category)
                .pattern(pattern)
                .replacement(replacement)
                .caseSensitive(caseSensitive)
                .excludePattern(excludePattern);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int order = 0;
        private boolean enabled = true;
        private String name = "";
        private String description = "";
        private String category = DEFAULT_CATEGORY;
        private String pattern = "";
        private String replacement = "";
        private boolean caseSensitive = false;
        private String excludePattern = "";

        private Builder() {
        }

        public Builder order(int order) {
            this.order = order;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder replacement(String replacement) {
            this.replacement = replacement;
            return this;
        }

        public Builder caseSensitive(boolean caseSensitive) {
            this.caseSensitive = caseSensitive;
            return this;
        }

        public Builder excludePattern(String excludePattern) {
            this.excludePattern = excludePattern;
            return this;
        }

        public PatternRule build() {
            return new PatternRule(order, enabled, name, description, category,
                    pattern, replacement, caseSensitive, excludePattern);
        }
    }
}
