/*
 * Copyright (c) 2025 Lexiqa QA Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.lexiqa.qaengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregated result of a find run.
 *
 * <p>{@code matches} is ordered by record (store order) and, within a record, by
 * rule order, then by match position. {@code totalMatches} always equals
 * {@code matches.size()}; the canonical constructor rejects anything else.
 *
 * @param profileName  name of the profile that ran
 * @param sourceId     identifier of the document the records came from
 * @param totalMatches number of match reports
 * @param matches      match reports
 * @param diagnostics  rules skipped because they failed to compile
 */
public record BatchFindResult(
        @JsonProperty("profile_name") String profileName,
        @JsonProperty("source_id") String sourceId,
        @JsonProperty("total_matches") int totalMatches,
        @JsonProperty("matches") List<MatchReport> matches,
        @JsonProperty("diagnostics") List<Diagnostic> diagnostics) {

    public BatchFindResult {
        matches = List.copyOf(matches);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
        if (totalMatches != matches.size()) {
            throw new IllegalArgumentException(
                    "totalMatches " + totalMatches + " does not equal match count " + matches.size());
        }
    }

    public static BatchFindResult of(String profileName, String sourceId,
                                     List<MatchReport> matches, List<Diagnostic> diagnostics) {
        return new BatchFindResult(profileName, sourceId, matches.size(), matches, diagnostics);
    }

    public boolean hasMatches() {
        return totalMatches > 0;
    }

    public List<MatchReport> matchesFor(String recordId) {
        return matches.stream().filter(m -> m.recordId().equals(recordId)).toList();
    }

    /**
     * Computes per-rule and per-category counts over the match list.
     */
    public FindStatistics statistics() {
        Map<String, Integer> byRule = new LinkedHashMap<>();
        Map<String, Integer> byCategory = new LinkedHashMap<>();
        Map<String, Boolean> records = new LinkedHashMap<>();
        matches.stream()
                .sorted((a, b) -> Integer.compare(a.ruleOrder(), b.ruleOrder()))
                .forEach(m -> byRule.merge(m.ruleName(), 1, Integer::sum));
        for (MatchReport m : matches) {
            byCategory.merge(m.category(), 1, Integer::sum);
            records.put(m.recordId(), Boolean.TRUE);
        }
        return new FindStatistics(totalMatches, records.size(), byRule, byCategory);
    }

    /**
     * Summary counts of a find run.
     *
     * @param totalMatches       number of match reports
     * @param recordsWithMatches distinct records with at least one match
     * @param matchesByRule      counts keyed by rule name, in rule order
     * @param matchesByCategory  counts keyed by category, in first-seen order
     */
    public record FindStatistics(
            int totalMatches,
            int recordsWithMatches,
            Map<String, Integer> matchesByRule,
            Map<String, Integer> matchesByCategory) {

        public FindStatistics {
            matchesByRule = Collections.unmodifiableMap(new LinkedHashMap<>(matchesByRule));
            matchesByCategory = Collections.unmodifiableMap(new LinkedHashMap<>(matchesByCategory));
        }
    }
}
