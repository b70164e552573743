package com.lexiqa.qaengine.infra.server;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.lexiqa.qaengine.api.model.RecordEdit;
import com.lexiqa.qaengine.api.model.TextRecord;

import java.util.List;

/**
 * Body of the POST endpoints.
 *
 * <p>Records come either inline ({@code records}) or from a JSON file ({@code records_path}).
 * The profile is read from {@code profile_path}; without one the monitored profile is used.
 * Replace and edit runs on a file write back to {@code output_path}, or to the input file.
 */
public record QaRequest(
        @JsonProperty("profile_path") String profilePath,
        @JsonProperty("records_path") String recordsPath,
        @JsonProperty("output_path") String outputPath,
        @JsonProperty("records") List<TextRecord> records,
        @JsonProperty("edits") List<RecordEdit> edits) {

    public boolean hasInlineRecords() {
        return records != null;
    }
}
