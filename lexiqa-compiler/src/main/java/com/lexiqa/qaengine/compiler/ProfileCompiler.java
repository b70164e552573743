/*
 * Copyright (c) 2025 Lexiqa QA Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.lexiqa.qaengine.compiler;

import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.lexiqa.qaengine.api.IProfileCompiler;
import com.lexiqa.qaengine.api.exceptions.InvalidPatternException;
import com.lexiqa.qaengine.api.model.Diagnostic;
import com.lexiqa.qaengine.api.model.PatternRule;
import com.lexiqa.qaengine.api.model.Profile;
import com.lexiqa.qaengine.runtime.model.CompiledProfile;
import com.lexiqa.qaengine.runtime.model.CompiledRule;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiles profiles into {@link CompiledProfile}s.
 *
 * <h2>Compilation Rules</h2>
 * <ul>
 *   <li>Disabled rules are dropped.</li>
 *   <li>Rules with an empty pattern are no-ops and are dropped without a diagnostic.</li>
 *   <li>Case-insensitive rules compile with {@code CASE_INSENSITIVE | UNICODE_CASE};
 *       the exclusion pattern uses the same flags as the rule.</li>
 *   <li>A rule whose pattern, exclusion or replacement template is invalid is logged,
 *       dropped, and reported as an {@code INVALID_PATTERN} diagnostic. Other rules are unaffected.</li>
 * </ul>
 */
public class ProfileCompiler implements IProfileCompiler {
    private static final Logger logger = Logger.getLogger(ProfileCompiler.class.getName());

    private static final AttributeKey<String> RULE_NAME = AttributeKey.stringKey("rule.name");

    private final PatternCache patternCache;
    private Tracer tracer;

    public ProfileCompiler(Tracer tracer) {
        this(tracer, new PatternCache());
    }

    public ProfileCompiler(Tracer tracer, PatternCache patternCache) {
        this.tracer = Objects.requireNonNull(tracer, "Tracer cannot be null");
        this.patternCache = Objects.requireNonNull(patternCache, "PatternCache cannot be null");
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = Objects.requireNonNull(tracer, "Tracer cannot be null");
    }

    @Override
    public CompiledProfile compile(Profile profile) {
        Span span = tracer.spanBuilder("compile-profile").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("profile.name", profile.name());
            span.setAttribute("profile.rules", profile.rules().size());

            List<CompiledRule> compiled = new ArrayList<>();
            List<Diagnostic> diagnostics = new ArrayList<>();
            for (PatternRule rule : profile.rules()) {
                if (!rule.enabled()) {
                    continue;
                }
                if (!rule.hasPattern()) {
                    logger.fine("Rule '" + rule.name() + "' has an empty pattern, treating as no-op");
                    continue;
                }
                try {
                    compiled.add(compileRule(rule));
                } catch (InvalidPatternException e) {
                    logger.warning(String.format("Skipping rule '%s' (order %d): %s",
                            rule.name(), rule.order(), e.getMessage()));
                    span.addEvent("invalid-pattern", Attributes.of(RULE_NAME, rule.name()));
                    diagnostics.add(Diagnostic.invalidPattern(rule.name(), e.getMessage()));
                }
            }

            span.setAttribute("rules.compiled", compiled.size());
            span.setAttribute("rules.invalid", diagnostics.size());
            return new CompiledProfile(profile, compiled, diagnostics);
        } finally {
            span.end();
        }
    }

    @Override
    public CompiledRule compileRule(PatternRule rule) throws InvalidPatternException {
        if (!rule.hasPattern()) {
            throw new IllegalArgumentException("Rule '" + rule.name() + "' has an empty pattern");
        }
        int flags = flagsFor(rule);
        Pattern pattern = compilePattern(rule, rule.pattern(), flags, "pattern");
        Pattern exclusion = rule.hasExclusion()
                ? compilePattern(rule, rule.excludePattern(), flags, "exclude pattern")
                : null;
        ReplacementTemplate replacement;
        try {
            replacement = ReplacementTemplate.parse(rule.replacement(), GroupIndex.of(pattern));
        } catch (IllegalArgumentException e) {
            throw new InvalidPatternException(rule.name(), rule.replacement(),
                    "Invalid replacement '" + rule.replacement() + "': " + e.getMessage(), e);
        }
        return new CompiledRule(rule, pattern, exclusion, replacement);
    }

    /**
     * Checks whether a pattern compiles, without touching the cache.
     */
    public PatternValidation validatePattern(String pattern, boolean caseSensitive) {
        if (pattern == null || pattern.isEmpty()) {
            return PatternValidation.failed("Pattern is empty", -1);
        }
        try {
            Pattern compiled = Pattern.compile(pattern, caseSensitive ? 0 : Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
            return PatternValidation.ok(compiled.matcher("").groupCount());
        } catch (PatternSyntaxException e) {
            return PatternValidation.failed(e.getDescription(), e.getIndex());
        }
    }

    public CacheStats getCacheStats() {
        return patternCache.stats();
    }

    @Override
    public Map<String, Object> getCacheMetrics() {
        CacheStats stats = patternCache.stats();
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("size", patternCache.estimatedSize());
        metrics.put("hits", stats.hitCount());
        metrics.put("misses", stats.missCount());
        metrics.put("hitRate", stats.hitRate());
        metrics.put("evictions", stats.evictionCount());
        return metrics;
    }

    static int flagsFor(PatternRule rule) {
        return rule.caseSensitive() ? 0 : Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
    }

    private Pattern compilePattern(PatternRule rule, String source, int flags, String what)
            throws InvalidPatternException {
        try {
            return patternCache.get(source, flags);
        } catch (PatternSyntaxException e) {
            throw new InvalidPatternException(rule.name(), source,
                    String.format("Invalid %s '%s': %s near index %d", what, source, e.getDescription(), e.getIndex()),
                    e);
        }
    }
}
