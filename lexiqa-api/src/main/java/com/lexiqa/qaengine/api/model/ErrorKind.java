package com.lexiqa.qaengine.api.model;

/**
 * Failure categories surfaced to callers, either as exceptions or as {@link Diagnostic}s.
 */
public enum ErrorKind {
    /** Malformed profile, library or record document. */
    PARSE_ERROR,
    /** A rule's pattern, exclusion or replacement template does not compile. */
    INVALID_PATTERN,
    /** An edit names a record id that is not in the batch. */
    UNKNOWN_RECORD_ID,
    /** Reading or writing a document failed. */
    IO_ERROR,
    /** A required profile, library or record file is absent. */
    MISSING_RESOURCE
}
