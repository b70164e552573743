/*
 * Copyright (c) 2025 Lexiqa QA Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.lexiqa.qaengine.runtime.model;

import com.lexiqa.qaengine.api.model.Diagnostic;
import com.lexiqa.qaengine.api.model.Profile;

import java.util.List;

/**
 * Executable form of a {@link Profile}.
 *
 * <p>{@code rules} holds only the enabled rules with a non-empty pattern that
 * compiled, in ascending order. Rules that failed to compile are absent and each
 * left one entry in {@code diagnostics}. A compiled profile is a read-only
 * snapshot: it is shared by every worker of a batch and never changes afterwards.
 */
public record CompiledProfile(Profile profile, List<CompiledRule> rules, List<Diagnostic> diagnostics) {

    public CompiledProfile {
        rules = List.copyOf(rules);
        diagnostics = List.copyOf(diagnostics);
    }

    public String name() {
        return profile.name();
    }

    public int getNumRules() {
        return rules.size();
    }
}
