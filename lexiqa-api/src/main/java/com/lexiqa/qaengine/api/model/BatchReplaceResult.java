package com.lexiqa.qaengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Tally of a replace run.
 *
 * <p>{@code totalReplacements} counts replaced spans across all rules and records,
 * so it is never smaller than {@code modifiedRecords}. {@code success} is true when
 * at least one span was replaced. {@code outputLocation} is empty until the caller
 * has persisted the records.
 */
public record BatchReplaceResult(
        @JsonProperty("success") boolean success,
        @JsonProperty("modified_records") int modifiedRecords,
        @JsonProperty("total_replacements") int totalReplacements,
        @JsonProperty("output_location") String outputLocation,
        @JsonProperty("rule_tallies") List<RuleTally> ruleTallies,
        @JsonProperty("diagnostics") List<Diagnostic> diagnostics) {

    public BatchReplaceResult {
        outputLocation = outputLocation == null ? "" : outputLocation;
        ruleTallies = ruleTallies == null ? List.of() : List.copyOf(ruleTallies);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public static BatchReplaceResult of(int modifiedRecords, int totalReplacements,
                                        List<RuleTally> ruleTallies, List<Diagnostic> diagnostics) {
        return new BatchReplaceResult(totalReplacements > 0, modifiedRecords, totalReplacements,
                "", ruleTallies, diagnostics);
    }

    public BatchReplaceResult withOutputLocation(String location) {
        return new BatchReplaceResult(success, modifiedRecords, totalReplacements, location,
                ruleTallies, diagnostics);
    }
}
