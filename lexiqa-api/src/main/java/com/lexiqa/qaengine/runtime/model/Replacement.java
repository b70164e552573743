package com.lexiqa.qaengine.runtime.model;

import java.util.regex.MatchResult;

/**
 * A compiled replacement template.
 */
public interface Replacement {

    /**
     * Expands the template against the groups captured by {@code match}.
     * Groups that did not participate in the match expand to the empty string.
     */
    String expand(MatchResult match);

    /**
     * The template text as authored.
     */
    String source();
}
