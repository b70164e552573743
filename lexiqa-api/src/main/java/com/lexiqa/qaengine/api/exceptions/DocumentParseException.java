package com.lexiqa.qaengine.api.exceptions;

import com.lexiqa.qaengine.api.model.ErrorKind;

/**
 * Thrown when a profile, library or record document is malformed.
 * Carries the line and column of the offending input when the parser reported one.
 */
public class DocumentParseException extends QaEngineException {

    private final String document;
    private final int line;
    private final int column;

    public DocumentParseException(String document, String message, int line, int column, Throwable cause) {
        super(ErrorKind.PARSE_ERROR, format(document, message, line, column), cause);
        this.document = document;
        this.line = line;
        this.column = column;
    }

    public DocumentParseException(String document, String message, int line, int column) {
        this(document, message, line, column, null);
    }

    public DocumentParseException(String document, String message) {
        this(document, message, -1, -1, null);
    }

    private static String format(String document, String message, int line, int column) {
        if (line < 0) {
            return document + ": " + message;
        }
        return String.format("%s:%d:%d: %s", document, line, column, message);
    }

    public String getDocument() {
        return document;
    }

    /** 1-based line, or -1 when unknown. */
    public int getLine() {
        return line;
    }

    /** 1-based column, or -1 when unknown. */
    public int getColumn() {
        return column;
    }
}
