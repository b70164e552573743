package com.lexiqa.qaengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A reusable pattern/replacement pair stored in the {@link SnippetLibrary}.
 *
 * @param id          unique identifier, assigned at import when the document has none
 * @param name        display name
 * @param description free text
 * @param pattern     regular expression source
 * @param replacement replacement template
 * @param category    name of the owning category
 */
public record SnippetEntry(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("pattern") String pattern,
        @JsonProperty("replacement") String replacement,
        @JsonProperty("category") String category) {

    public SnippetEntry {
        id = id == null ? "" : id;
        name = name == null ? "" : name;
        description = description == null ? "" : description;
        pattern = pattern == null ? "" : pattern;
        replacement = replacement == null ? "" : replacement;
        category = category == null ? SnippetLibrary.UNCATEGORIZED : category;
    }

    public SnippetEntry inCategory(String newCategory) {
        return new SnippetEntry(id, name, description, pattern, replacement, newCategory);
    }

    /**
     * Copies this snippet into a new enabled, case-insensitive rule.
     */
    public PatternRule toRule(int order) {
        return PatternRule.builder()
                .order(order)
                .name(name)
                .description(description)
                .category(category)
                .pattern(pattern)
                .replacement(replacement)
                .build();
    }
}
