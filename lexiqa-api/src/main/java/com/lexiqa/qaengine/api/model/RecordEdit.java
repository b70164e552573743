package com.lexiqa.qaengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A manual correction: replace the target text of record {@code id} with {@code target}.
 */
public record RecordEdit(
        @JsonProperty("id") String id,
        @JsonProperty("target") String target) {

    public RecordEdit {
        Objects.requireNonNull(id, "Edit id cannot be null");
        target = target == null ? "" : target;
    }
}
