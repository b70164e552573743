package com.lexiqa.qaengine.api.exceptions;

import com.lexiqa.qaengine.api.model.ErrorKind;

/**
 * Thrown when a single rule's pattern, exclusion pattern or replacement template
 * cannot be compiled. Profile compilation turns this into a diagnostic and skips the rule.
 */
public class InvalidPatternException extends QaEngineException {

    private final String ruleName;
    private final String pattern;

    public InvalidPatternException(String ruleName, String pattern, String message, Throwable cause) {
        super(ErrorKind.INVALID_PATTERN, message, cause);
        this.ruleName = ruleName;
        this.pattern = pattern;
    }

    public InvalidPatternException(String ruleName, String pattern, String message) {
        this(ruleName, pattern, message, null);
    }

    public String getRuleName() {
        return ruleName;
    }

    public String getPattern() {
        return pattern;
    }
}
