package com.lexiqa.qaengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Result of applying manual edits: the updated records plus per-edit failures.
 *
 * @param records  every record of the batch, edited ones replaced, in original order
 * @param applied  number of edits that found their record
 * @param failures one {@link ErrorKind#UNKNOWN_RECORD_ID} diagnostic per unmatched edit
 */
public record EditOutcome(
        @JsonProperty("records") List<TextRecord> records,
        @JsonProperty("applied") int applied,
        @JsonProperty("failures") List<Diagnostic> failures) {

    public EditOutcome {
        records = List.copyOf(records);
        failures = List.copyOf(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
