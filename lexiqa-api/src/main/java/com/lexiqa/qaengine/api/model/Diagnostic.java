package com.lexiqa.qaengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A per-item failure collected during a batch that otherwise went ahead.
 *
 * @param kind    failure category
 * @param subject what failed: a rule name or a record id
 * @param message human readable detail
 */
public record Diagnostic(
        @JsonProperty("kind") ErrorKind kind,
        @JsonProperty("subject") String subject,
        @JsonProperty("message") String message) {

    public Diagnostic {
        Objects.requireNonNull(kind, "Diagnostic kind cannot be null");
        subject = subject == null ? "" : subject;
        message = message == null ? "" : message;
    }

    public static Diagnostic invalidPattern(String ruleName, String message) {
        return new Diagnostic(ErrorKind.INVALID_PATTERN, ruleName, message);
    }

    public static Diagnostic unknownRecord(String recordId) {
        return new Diagnostic(ErrorKind.UNKNOWN_RECORD_ID, recordId, "No record with id '" + recordId + "'");
    }

    public String describe() {
        return String.format("[%s] %s: %s", kind, subject, message);
    }
}
