package com.lexiqa.qaengine.runtime.model;

import com.lexiqa.qaengine.api.model.PatternRule;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A rule whose pattern, exclusion and replacement have been compiled.
 *
 * <p>Instances are immutable and safe to share between worker threads.
 *
 * @param rule        the authored rule
 * @param pattern     compiled match pattern
 * @param exclusion   compiled exclusion pattern, or {@code null} when the rule has none
 * @param replacement compiled replacement template
 */
public record CompiledRule(PatternRule rule, Pattern pattern, Pattern exclusion, Replacement replacement) {

    public CompiledRule {
        Objects.requireNonNull(rule, "rule");
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(replacement, "replacement");
    }

    public boolean hasExclusion() {
        return exclusion != null;
    }

    public String name() {
        return rule.name();
    }

    public int order() {
        return rule.order();
    }
}
