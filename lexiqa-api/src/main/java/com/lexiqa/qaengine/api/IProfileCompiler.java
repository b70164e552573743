package com.lexiqa.qaengine.api;

import com.lexiqa.qaengine.api.exceptions.InvalidPatternException;
import com.lexiqa.qaengine.api.model.PatternRule;
import com.lexiqa.qaengine.api.model.Profile;
import com.lexiqa.qaengine.runtime.model.CompiledProfile;
import com.lexiqa.qaengine.runtime.model.CompiledRule;
import io.opentelemetry.api.trace.Tracer;

import java.util.Map;

/**
 * Contract for compiling a profile's rules into executable patterns.
 */
public interface IProfileCompiler {

    /**
     * Compiles every enabled rule of the profile.
     *
     * <p>Never fails because of a bad rule: such rules are left out of the
     * result and reported in {@link CompiledProfile#diagnostics()}.
     *
     * @param profile the profile to compile
     * @return compiled profile
     */
    CompiledProfile compile(Profile profile);

    /**
     * Compiles a single rule.
     *
     * @param rule a rule with a non-empty pattern
     * @return the compiled rule
     * @throws InvalidPatternException if the pattern, exclusion or replacement is invalid
     */
    CompiledRule compileRule(PatternRule rule) throws InvalidPatternException;

    /**
     * Sets the tracer for observability.
     *
     * @param tracer the OpenTelemetry tracer
     */
    default void setTracer(Tracer tracer) {
    }

    /**
     * Statistics of the compiled-pattern cache, keyed by metric name. Empty when the
     * compiler does not cache.
     */
    default Map<String, Object> getCacheMetrics() {
        return Map.of();
    }
}
