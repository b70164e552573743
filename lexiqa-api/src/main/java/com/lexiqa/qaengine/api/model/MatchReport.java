package com.lexiqa.qaengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One located, non-excluded occurrence of a rule's pattern in one record.
 *
 * <p>{@code start} and {@code end} are code point offsets into the record's target text
 * as it was before any rule touched it; find mode never mutates, so that is the text the
 * rule ran on. A character outside the Basic Multilingual Plane counts once, so offsets
 * differ from {@link String} indices when the text holds emoji or similar characters.
 * Use {@link String#offsetByCodePoints(int, int)} to get back to a {@code String} index.
 */
public record MatchReport(
        @JsonProperty("record_id") String recordId,
        @JsonProperty("rule_name") String ruleName,
        @JsonProperty("rule_order") int ruleOrder,
        @JsonProperty("category") String category,
        @JsonProperty("description") String description,
        @JsonProperty("source") String source,
        @JsonProperty("target") String target,
        @JsonProperty("match") String match,
        @JsonProperty("start") int start,
        @JsonProperty("end") int end,
        @JsonProperty("pattern") String pattern,
        @JsonProperty("replacement") String replacement,
        @JsonProperty("replacement_preview") String replacementPreview) {

    public int length() {
        return end - start;
    }
}
