/*
 * Copyright (c) 2025 Lexiqa QA Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.lexiqa.qaengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Category-partitioned catalogue of reusable snippets, independent of any profile.
 *
 * <p>Categories are identified by name, but a document may contain the same name
 * more than once. Such duplicates are kept as separate categories, in document
 * order, and are never merged. Lookups by name therefore consider every category
 * carrying that name.
 *
 * <p>The library is immutable; every mutator returns a new instance.
 */
public record SnippetLibrary(@JsonProperty("categories") List<SnippetCategory> categories) {

    public static final String UNCATEGORIZED = "Uncategorized";

    /**
     * Categories a fresh library starts with.
     */
    public static final List<String> DEFAULT_CATEGORY_NAMES = List.of(
            "Tegnsetting",
            "Harde mellomrom",
            "Tall/tallformatering",
            "Spesialtegn");

    public SnippetLibrary {
        categories = categories == null ? List.of() : List.copyOf(categories);
    }

    /**
     * Starter library used when no library document exists yet.
     */
    public static SnippetLibrary defaults() {
        return new SnippetLibrary(DEFAULT_CATEGORY_NAMES.stream().map(SnippetCategory::empty).toList());
    }

    public static SnippetLibrary empty() {
        return new SnippetLibrary(List.of());
    }

    /**
     * Category names in document order, duplicates included.
     */
    public List<String> categoryNames() {
        return categories.stream().map(SnippetCategory::name).toList();
    }

    public List<SnippetEntry> allEntries() {
        return categories.stream().flatMap(c -> c.entries().stream()).toList();
    }

    public int size() {
        return categories.stream().mapToInt(c -> c.entries().size()).sum();
    }

    /**
     * Entries of every category with the given name.
     */
    public List<SnippetEntry> entriesIn(String categoryName) {
        return categories.stream()
                .filter(c -> c.name().equals(categoryName))
                .flatMap(c -> c.entries().stream())
                .toList();
    }

    public Optional<SnippetEntry> findById(String id) {
        return allEntries().stream().filter(e -> e.id().equals(id)).findFirst();
    }

    public Optional<SnippetEntry> findByName(String name) {
        return allEntries().stream().filter(e -> e.name().equals(name)).findFirst();
    }

    /**
     * Case-insensitive search over entry name, description and pattern.
     */
    public List<SnippetEntry> search(String query) {
        if (query == null || query.isBlank()) {
            return allEntries();
        }
        String needle = query.toLowerCase(Locale.ROOT);
        return allEntries().stream()
                .filter(e -> e.name().toLowerCase(Locale.ROOT).contains(needle)
                        || e.description().toLowerCase(Locale.ROOT).contains(needle)
                        || e.pattern().toLowerCase(Locale.ROOT).contains(needle))
                .toList();
    }

    /**
     * Appends a new, empty category. An existing category of the same name is left alone.
     */
    public SnippetLibrary withCategory(String name) {
        List<SnippetCategory> updated = new ArrayList<>(categories);
        updated.add(SnippetCategory.empty(name));
        return new SnippetLibrary(updated);
    }

    /**
     * Removes every category carrying the given name, together with its entries.
     */
    public SnippetLibrary withoutCategory(String name) {
        return new SnippetLibrary(categories.stream().filter(c -> !c.name().equals(name)).toList());
    }

    /**
     * Adds an entry to the first category with the given name, creating the category
     * at the end of the library when none exists.
     */
    public SnippetLibrary withEntry(String categoryName, SnippetEntry entry) {
        List<SnippetCategory> updated = new ArrayList<>(categories);
        for (int i = 0; i < updated.size(); i++) {
            if (updated.get(i).name().equals(categoryName)) {
                updated.set(i, updated.get(i).withEntry(entry));
                return new SnippetLibrary(updated);
            }
        }
        updated.add(SnippetCategory.empty(categoryName).withEntry(entry));
        return new SnippetLibrary(updated);
    }

    public SnippetLibrary withoutEntry(String entryId) {
        return new SnippetLibrary(categories.stream().map(c -> c.withoutEntry(entryId)).toList());
    }

    /**
     * Appends the categories of another library after this one's.
     */
    public SnippetLibrary merge(SnippetLibrary other) {
        List<SnippetCategory> updated = new ArrayList<>(categories);
        updated.addAll(other.categories());
        return new SnippetLibrary(updated);
    }
}
