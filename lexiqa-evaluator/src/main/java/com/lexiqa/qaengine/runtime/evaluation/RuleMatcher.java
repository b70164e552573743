/*
 * Copyright (c) 2025 Lexiqa QA Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.lexiqa.qaengine.runtime.evaluation;

import com.lexiqa.qaengine.runtime.model.CompiledRule;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;

/**
 * Evaluates a single compiled rule against a single text.
 *
 * <h2>Matching</h2>
 * <p>Matches are found by standard global scanning ({@link Matcher#find()}):
 * leftmost-first and non-overlapping, each starting at or after the end of the
 * previous one.
 *
 * <h2>Exclusion</h2>
 * <p>The exclusion pattern is scanned once over the same full text the rule runs
 * on. A match is discarded when its span {@code [start, end)} intersects any
 * exclusion span. Exclusion spans of zero width cover nothing. A zero-width
 * match at position {@code p} is discarded when an exclusion span satisfies
 * {@code start <= p < end}. Only overlap counts: an exclusion match elsewhere in
 * the text does not suppress anything.
 */
public final class RuleMatcher {

    private RuleMatcher() {
    }

    /**
     * Returns the accepted matches of {@code rule} in {@code text}, in text order.
     * Each result is a detached snapshot safe to keep after the call.
     */
    public static List<MatchResult> findAll(CompiledRule rule, String text) {
        List<Span> exclusions = rule.hasExclusion() ? exclusionSpans(rule, text) : List.of();
        List<MatchResult> accepted = new ArrayList<>();
        Matcher matcher = rule.pattern().matcher(text);
        while (matcher.find()) {
            if (!isExcluded(matcher.start(), matcher.end(), exclusions)) {
                accepted.add(matcher.toMatchResult());
            }
        }
        return accepted;
    }

    /**
     * Replaces every accepted match with the rule's expanded replacement.
     */
    public static RuleApplication replaceAll(CompiledRule rule, String text) {
        List<MatchResult> matches = findAll(rule, text);
        if (matches.isEmpty()) {
            return new RuleApplication(text, 0);
        }
        StringBuilder out = new StringBuilder(text.length());
        int last = 0;
        for (MatchResult match : matches) {
            out.append(text, last, match.start());
            out.append(rule.replacement().expand(match));
            last = match.end();
        }
        out.append(text, last, text.length());
        return new RuleApplication(out.toString(), matches.size());
    }

    static boolean isExcluded(int start, int end, List<Span> exclusions) {
        for (Span span : exclusions) {
            if (span.isEmpty()) {
                continue;
            }
            if (start == end) {
                if (span.start() <= start && start < span.end()) {
                    return true;
                }
            } else if (start < span.end() && span.start() < end) {
                return true;
            }
        }
        return false;
    }

    private static List<Span> exclusionSpans(CompiledRule rule, String text) {
        List<Span> spans = new ArrayList<>();
        Matcher matcher = rule.exclusion().matcher(text);
        while (matcher.find()) {
            spans.add(new Span(matcher.start(), matcher.end()));
        }
        return spans;
    }

    record Span(int start, int end) {
        boolean isEmpty() {
            return start == end;
        }
    }
}
