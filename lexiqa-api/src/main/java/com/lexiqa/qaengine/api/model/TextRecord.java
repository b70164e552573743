package com.lexiqa.qaengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Objects;

/**
 * One unit of translatable text handed to the engine by a record store.
 *
 * <p>Records are immutable. Replace mode and edit application hand back new
 * instances built with {@link #withTarget(String)}, so a caller's original
 * batch is never observed half-rewritten.
 *
 * @param id       identifier, unique within one run
 * @param source   source-language text, reported but never inspected
 * @param target   target-language text the engine reads and rewrites ({@code null} becomes empty)
 * @param metadata opaque key/value bag carried through untouched
 */
public record TextRecord(
        @JsonProperty("id") String id,
        @JsonProperty("source") String source,
        @JsonProperty("target") String target,
        @JsonProperty("metadata") Map<String, String> metadata) {

    public TextRecord {
        Objects.requireNonNull(id, "Record id cannot be null");
        source = source == null ? "" : source;
        target = target == null ? "" : target;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static TextRecord of(String id, String target) {
        return new TextRecord(id, "", target, Map.of());
    }

    public static TextRecord of(String id, String source, String target) {
        return new TextRecord(id, source, target, Map.of());
    }

    public TextRecord withTarget(String newTarget) {
        return new TextRecord(id, source, newTarget, metadata);
    }

    public boolean hasTarget() {
        return !target.isEmpty();
    }
}
