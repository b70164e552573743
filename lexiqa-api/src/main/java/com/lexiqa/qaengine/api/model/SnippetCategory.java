package com.lexiqa.qaengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * A named group of snippet entries.
 */
public record SnippetCategory(
        @JsonProperty("name") String name,
        @JsonProperty("entries") List<SnippetEntry> entries) {

    public SnippetCategory {
        name = name == null ? SnippetLibrary.UNCATEGORIZED : name;
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public static SnippetCategory empty(String name) {
        return new SnippetCategory(name, List.of());
    }

    public SnippetCategory withEntry(SnippetEntry entry) {
        List<SnippetEntry> updated = new ArrayList<>(entries);
        updated.add(entry.inCategory(name));
        return new SnippetCategory(name, updated);
    }

    public SnippetCategory withoutEntry(String entryId) {
        return new SnippetCategory(name,
                entries.stream().filter(e -> !e.id().equals(entryId)).toList());
    }
}
