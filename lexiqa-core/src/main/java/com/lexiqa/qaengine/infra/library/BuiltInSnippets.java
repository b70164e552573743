package com.lexiqa.qaengine.infra.library;

import com.lexiqa.qaengine.api.model.SnippetEntry;
import com.lexiqa.qaengine.api.model.SnippetLibrary;

import java.util.List;
import java.util.Locale;

/**
 * Starter catalogue of common localization checks.
 *
 * <p>Entry ids are derived from category and name, so merging the catalogue into a
 * library twice produces recognizable duplicates rather than fresh UUIDs.
 */
public final class BuiltInSnippets {

    public static final String WHITESPACE = "Whitespace";
    public static final String PUNCTUATION = "Punctuation";
    public static final String NORWEGIAN = "Norwegian";
    public static final String TYPOS = "Typos";
    public static final String NUMBERS = "Numbers";
    public static final String URLS_AND_EMAILS = "URLs & Emails";
    public static final String MARKUP = "Tags & Markup";
    public static final String CONSISTENCY = "Consistency";

    private static final List<SnippetEntry> ENTRIES = List.of(
            entry(WHITESPACE, "Multiple spaces", "\\s{2,}", " ",
                    "Normalize runs of whitespace to a single space"),
            entry(WHITESPACE, "Leading spaces", "^\\s+", "",
                    "Remove whitespace at the start of a segment"),
            entry(WHITESPACE, "Trailing spaces", "\\s+$", "",
                    "Remove whitespace at the end of a segment"),
            entry(WHITESPACE, "Space before punctuation", "\\s+([.,!?;:])", "\\1",
                    "Remove whitespace before punctuation marks"),
            entry(WHITESPACE, "No space after punctuation", "([.,!?;:])([A-ZÆØÅ])", "\\1 \\2",
                    "Add a space after punctuation followed by a capital letter"),

            entry(PUNCTUATION, "Double periods", "\\.\\.", ".",
                    "Replace a double period with a single one"),
            entry(PUNCTUATION, "Double commas", ",,", ",",
                    "Replace a double comma with a single one"),
            entry(PUNCTUATION, "Space before comma", "\\s+,", ",",
                    "Remove whitespace before a comma"),

            entry(NORWEGIAN, "Norwegian quotes (English style)", "\"([^\"]+)\"", "«\\1»",
                    "Convert straight double quotes to guillemets"),
            entry(NORWEGIAN, "Date format US to NO", "(\\d{1,2})/(\\d{1,2})/(\\d{4})", "\\2.\\1.\\3",
                    "Convert MM/DD/YYYY to DD.MM.YYYY"),
            entry(NORWEGIAN, "'å' vs 'aa'", "\\baa\\b", "å",
                    "Replace a standalone 'aa' with 'å'"),
            entry(NORWEGIAN, "Norwegian double negation", "\\bikke\\s+ingen\\b", "ingen",
                    "Fix double negation (ikke ingen -> ingen)"),

            entry(TYPOS, "'teh' typo", "\\bteh\\b", "the", "Fix 'teh' -> 'the'"),
            entry(TYPOS, "'recieve' typo", "\\brecieve\\b", "receive", "Fix 'recieve' -> 'receive'"),
            entry(TYPOS, "'occured' typo", "\\boccured\\b", "occurred", "Fix 'occured' -> 'occurred'"),

            entry(NUMBERS, "Space in large numbers", "(\\d)(\\d{3})\\b", "\\1 \\2",
                    "Insert a space as thousands separator"),
            entry(NUMBERS, "Comma to period in decimals", "(\\d),(\\d)", "\\1.\\2",
                    "Convert a decimal comma to a decimal point"),

            entry(URLS_AND_EMAILS, "Find email addresses",
                    "\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b", "",
                    "Find e-mail addresses"),
            entry(URLS_AND_EMAILS, "Find HTTP URLs", "https?://[^\\s<>\"]+", "",
                    "Find HTTP and HTTPS URLs"),

            entry(MARKUP, "Unmatched brackets", "\\[[^\\]]*$|^[^\\[]*\\]", "",
                    "Find segments with unmatched square brackets"),
            entry(MARKUP, "Unmatched parentheses", "\\([^)]*$|^[^(]*\\)", "",
                    "Find segments with unmatched parentheses"),

            entry(CONSISTENCY, "Capitalize 'Internet'", "\\binternet\\b", "Internet",
                    "Capitalize 'Internet' where the style guide requires it"),
            entry(CONSISTENCY, "Hyphenate 'e-mail'", "\\bemail\\b", "e-mail",
                    "Write 'email' as 'e-mail'"));

    private BuiltInSnippets() {
    }

    public static List<SnippetEntry> entries() {
        return ENTRIES;
    }

    /**
     * The catalogue as a library, one category per group, in catalogue order.
     */
    public static SnippetLibrary asLibrary() {
        SnippetLibrary library = SnippetLibrary.empty();
        for (SnippetEntry entry : ENTRIES) {
            library = library.withEntry(entry.category(), entry);
        }
        return library;
    }

    /**
     * Adds the catalogue entries missing from {@code library}, matched by id.
     */
    public static SnippetLibrary installInto(SnippetLibrary library) {
        SnippetLibrary result = library;
        for (SnippetEntry entry : ENTRIES) {
            if (result.findById(entry.id()).isEmpty()) {
                result = result.withEntry(entry.category(), entry);
            }
        }
        return result;
    }

    private static SnippetEntry entry(String category, String name, String pattern, String replacement,
                                      String description) {
        String id = "builtin-" + slug(category) + "-" + slug(name);
        return new SnippetEntry(id, name, description, pattern, replacement, category);
    }

    private static String slug(String text) {
        String slug = text.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9å]+", "-");
        return slug.replaceAll("^-+|-+$", "");
    }
}
