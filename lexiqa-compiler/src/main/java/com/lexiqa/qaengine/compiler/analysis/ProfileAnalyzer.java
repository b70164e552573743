/*
 * Copyright (c) 2025 Lexiqa QA Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.lexiqa.qaengine.compiler.analysis;

import com.lexiqa.qaengine.api.model.PatternRule;
import com.lexiqa.qaengine.api.model.Profile;
import com.lexiqa.qaengine.compiler.PatternValidation;
import com.lexiqa.qaengine.compiler.ProfileCompiler;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Static checks run on a profile before it is used or saved.
 *
 * <p>The engine itself tolerates every problem reported here: duplicate order
 * values fall back to declaration order, bad patterns are skipped. The analyzer
 * exists so that authors hear about them up front rather than through missing
 * matches.
 *
 * <h2>Checks</h2>
 * <ul>
 *   <li>{@link IssueType#DUPLICATE_ORDER}: two rules share an order value</li>
 *   <li>{@link IssueType#DUPLICATE_NAME}: two rules share a name, which makes reports ambiguous</li>
 *   <li>{@link IssueType#EMPTY_PATTERN}: an enabled rule that will never match</li>
 *   <li>{@link IssueType#INVALID_PATTERN}: pattern or exclusion does not compile</li>
 *   <li>{@link IssueType#MATCHES_EMPTY}: pattern matches the empty string, so it
 *       reports zero-width matches everywhere</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>
 * ProfileAnalyzer analyzer = new ProfileAnalyzer(compiler);
 * AnalysisReport report = analyzer.analyze(profile);
 * report.issues().forEach(issue -&gt; System.out.println(issue.describe()));
 * </pre>
 */
public class ProfileAnalyzer {

    private final ProfileCompiler compiler;

    public ProfileAnalyzer(ProfileCompiler compiler) {
        this.compiler = compiler;
    }

    public AnalysisReport analyze(Profile profile) {
        List<ProfileIssue> issues = new ArrayList<>();

        Map<Integer, List<PatternRule>> byOrder = new HashMap<>();
        Map<String, List<PatternRule>> byName = new HashMap<>();
        for (PatternRule rule : profile.rules()) {
            byOrder.computeIfAbsent(rule.order(), k -> new ArrayList<>()).add(rule);
            byName.computeIfAbsent(rule.name(), k -> new ArrayList<>()).add(rule);
        }
        byOrder.forEach((order, rules) -> {
            if (rules.size() > 1) {
                issues.add(new ProfileIssue(IssueType.DUPLICATE_ORDER, rules.get(0).name(), order,
                        rules.size() + " rules share order " + order + "; declaration order decides"));
            }
        });
        byName.forEach((name, rules) -> {
            if (rules.size() > 1 && !name.isEmpty()) {
                issues.add(new ProfileIssue(IssueType.DUPLICATE_NAME, name, rules.get(0).order(),
                        rules.size() + " rules are named '" + name + "'"));
            }
        });

        for (PatternRule rule : profile.enabledRules()) {
            if (!rule.hasPattern()) {
                issues.add(new ProfileIssue(IssueType.EMPTY_PATTERN, rule.name(), rule.order(),
                        "Enabled rule has no pattern and will never match"));
                continue;
            }
            PatternValidation pattern = compiler.validatePattern(rule.pattern(), rule.caseSensitive());
            if (!pattern.valid()) {
                issues.add(new ProfileIssue(IssueType.INVALID_PATTERN, rule.name(), rule.order(),
                        "Pattern does not compile: " + pattern.message()));
                continue;
            }
            if (rule.hasExclusion()) {
                PatternValidation exclusion = compiler.validatePattern(rule.excludePattern(), rule.caseSensitive());
                if (!exclusion.valid()) {
                    issues.add(new ProfileIssue(IssueType.INVALID_PATTERN, rule.name(), rule.order(),
                            "Exclude pattern does not compile: " + exclusion.message()));
                }
            }
            if (Pattern.compile(rule.pattern()).matcher("").matches()) {
                issues.add(new ProfileIssue(IssueType.MATCHES_EMPTY, rule.name(), rule.order(),
                        "Pattern matches the empty string"));
            }
        }

        issues.sort(Comparator.comparingInt(ProfileIssue::ruleOrder).thenComparing(ProfileIssue::type));
        return new AnalysisReport(profile.name(), issues);
    }

    public enum IssueType {
        DUPLICATE_ORDER,
        DUPLICATE_NAME,
        EMPTY_PATTERN,
        INVALID_PATTERN,
        MATCHES_EMPTY
    }

    /**
     * Issues found in one profile, sorted by rule order.
     */
    public record AnalysisReport(String profileName, List<ProfileIssue> issues) {

        public AnalysisReport {
            issues = List.copyOf(issues);
        }

        public boolean hasIssues() {
            return !issues.isEmpty();
        }

        public boolean hasErrors() {
            return issues.stream().anyMatch(i -> "ERROR".equals(i.severity()));
        }

        public List<ProfileIssue> ofType(IssueType type) {
            return issues.stream().filter(i -> i.type() == type).toList();
        }
    }

    public record ProfileIssue(IssueType type, String ruleName, int ruleOrder, String message) {

        public String describe() {
            return String.format("[%s] rule '%s' (order %d): %s", severity(), ruleName, ruleOrder, message);
        }

        public String severity() {
            return switch (type) {
                case INVALID_PATTERN -> "ERROR";
                case EMPTY_PATTERN -> "INFO";
                default -> "WARNING";
            };
        }
    }
}
