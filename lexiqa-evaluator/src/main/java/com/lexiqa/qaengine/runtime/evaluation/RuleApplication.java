package com.lexiqa.qaengine.runtime.evaluation;

/**
 * Text produced by applying one rule in replace mode, and how many spans it replaced.
 */
public record RuleApplication(String text, int replacements) {
}
