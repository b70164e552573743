package com.lexiqa.qaengine.compiler.analysis;

import com.lexiqa.qaengine.api.model.PatternRule;
import com.lexiqa.qaengine.api.model.Profile;
import com.lexiqa.qaengine.compiler.ProfileCompiler;
import com.lexiqa.qaengine.compiler.analysis.ProfileAnalyzer.AnalysisReport;
import com.lexiqa.qaengine.compiler.analysis.ProfileAnalyzer.IssueType;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProfileAnalyzerTest {

    private final ProfileAnalyzer analyzer =
            new ProfileAnalyzer(new ProfileCompiler(OpenTelemetry.noop().getTracer("test")));

    @Test
    void cleanProfileShouldHaveNoIssues() {
        Profile profile = new Profile("clean", "", "", List.of(
                PatternRule.builder().order(1).name("a").pattern(" {2,}").build(),
                PatternRule.builder().order(2).name("b").pattern("\\.\\.\\.").build()), 0, 0);

        AnalysisReport report = analyzer.analyze(profile);

        assertThat(report.hasIssues()).isFalse();
        assertThat(report.profileName()).isEqualTo("clean");
    }

    @Test
    void shouldFlagEveryKindOfProblem() {
        Profile profile = new Profile("messy", "", "", List.of(
                PatternRule.builder().order(1).name("dup").pattern("a").build(),
                PatternRule.builder().order(1).name("dup").pattern("b").build(),
                PatternRule.builder().order(2).name("empty").pattern("").build(),
                PatternRule.builder().order(3).name("broken").pattern("(x").build(),
                PatternRule.builder().order(4).name("bad-exclude").pattern("x").excludePattern("[").build(),
                PatternRule.builder().order(5).name("star").pattern(" *").build(),
                PatternRule.builder().order(6).name("disabled").pattern("").enabled(false).build()), 0, 0);

        AnalysisReport report = analyzer.analyze(profile);

        assertThat(report.ofType(IssueType.DUPLICATE_ORDER)).hasSize(1);
        assertThat(report.ofType(IssueType.DUPLICATE_NAME)).hasSize(1);
        assertThat(report.ofType(IssueType.EMPTY_PATTERN)).extracting(ProfileAnalyzer.ProfileIssue::ruleName)
                .containsExactly("empty");
        assertThat(report.ofType(IssueType.INVALID_PATTERN)).extracting(ProfileAnalyzer.ProfileIssue::ruleName)
                .containsExactly("broken", "bad-exclude");
        assertThat(report.ofType(IssueType.MATCHES_EMPTY)).extracting(ProfileAnalyzer.ProfileIssue::ruleName)
                .containsExactly("star");
        assertThat(report.hasErrors()).isTrue();
        assertThat(report.issues().get(0).describe()).contains("order 1");
    }
}
