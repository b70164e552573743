/*
 * Copyright (c) 2025 Lexiqa QA Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.lexiqa.qaengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * A named, ordered collection of {@link PatternRule}s plus descriptive metadata.
 *
 * <p><b>Ordering invariant:</b> the rule list is always held sorted ascending by
 * {@link PatternRule#order()}. The sort is stable, so rules sharing an order value
 * keep the sequence in which they were declared. Whatever order a document or a
 * caller supplies, the engine only ever sees the sorted list.
 *
 * <p>Timestamps are epoch seconds aligned to the start of a UTC day.
 *
 * @param name        display name
 * @param description free text
 * @param language    target language tag (e.g. {@code nb-NO})
 * @param rules       checks, re-sorted on construction
 * @param created     creation day, epoch seconds
 * @param modified    last modification day, epoch seconds
 */
public record Profile(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("language") String language,
        @JsonProperty("rules") List<PatternRule> rules,
        @JsonProperty("created") long created,
        @JsonProperty("modified") long modified) {

    public static final String DEFAULT_NAME = "Untitled Profile";

    private static final long SECONDS_PER_DAY = 86_400L;

    public Profile {
        name = name == null ? DEFAULT_NAME : name;
        description = description == null ? "" : description;
        language = language == null ? "" : language;
        List<PatternRule> sorted = new ArrayList<>(rules == null ? List.of() : rules);
        sorted.sort(Comparator.comparingInt(PatternRule::order));
        rules = List.copyOf(sorted);
    }

    /**
     * Creates an empty profile stamped with today's date.
     */
    public static Profile create(String name, String description, String language) {
        long today = dayAligned(Instant.now());
        return new Profile(name, description, language, List.of(), today, today);
    }

    public static long dayAligned(Instant instant) {
        return Math.floorDiv(instant.getEpochSecond(), SECONDS_PER_DAY) * SECONDS_PER_DAY;
    }

    public List<PatternRule> enabledRules() {
        return rules.stream().filter(PatternRule::enabled).toList();
    }

    /**
     * Returns the order value a rule appended to this profile should take.
     */
    public int nextOrder() {
        return rules.isEmpty() ? 1 : rules.get(rules.size() - 1).order() + 1;
    }

    public Profile withRules(List<PatternRule> newRules) {
        return new Profile(name, description, language, newRules, created, modified);
    }

    public Profile withRule(PatternRule rule) {
        List<PatternRule> updated = new ArrayList<>(rules);
        updated.add(rule);
        return withRules(updated);
    }

    public Profile touched(Instant now) {
        return new Profile(name, description, language, rules, created, dayAligned(now));
    }
}
