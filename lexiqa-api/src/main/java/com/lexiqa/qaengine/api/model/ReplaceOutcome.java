package com.lexiqa.qaengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Mutated records and the tally of a replace run. Persisting the records is the caller's job.
 */
public record ReplaceOutcome(
        @JsonProperty("records") List<TextRecord> records,
        @JsonProperty("result") BatchReplaceResult result) {

    public ReplaceOutcome {
        records = List.copyOf(records);
    }
}
