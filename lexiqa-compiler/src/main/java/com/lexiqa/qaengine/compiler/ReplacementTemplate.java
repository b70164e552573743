package com.lexiqa.qaengine.compiler;

import com.lexiqa.qaengine.runtime.model.Replacement;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.regex.MatchResult;

/**
 * Parsed replacement template.
 *
 * <h2>Syntax</h2>
 * <ul>
 *   <li>{@code $n}, {@code ${n}}: group {@code n}; {@code $0} is the whole match</li>
 *   <li>{@code \n}: group {@code n}, at most two digits</li>
 *   <li>{@code ${name}}, {@code \g<name>}, {@code \g<n>}: named or numbered group</li>
 *   <li>{@code \\}, {@code \$}: literal backslash, literal dollar</li>
 *   <li>{@code \n}, {@code \t}, {@code \r} escapes (letters, not digits)</li>
 *   <li>{@code $$}: literal dollar; a {@code $} followed by anything else is literal</li>
 * </ul>
 *
 * <p>Multi-digit references take the longest prefix that names an existing group,
 * so {@code $12} with one group means group 1 followed by a literal {@code 2}.
 * Any other backslash sequence is kept verbatim. References to groups the pattern
 * does not have are rejected at parse time, never at match time.
 *
 * <p>An empty template deletes the matched span.
 *
 * <p>Profiles written for tools that only understand backslash references may contain
 * a literal {@code $} followed by a digit, for example {@code "$5 off"}. Here that text
 * is a group reference, and it fails to parse if the pattern has no such group. Such
 * templates must write {@code \$5} or {@code $$5} to keep the dollar sign.
 */
public final class ReplacementTemplate implements Replacement {

    private final String source;
    private final List<Part> parts;

    private ReplacementTemplate(String source, List<Part> parts) {
        this.source = source;
        this.parts = List.copyOf(parts);
    }

    /**
     * Parses a template against the group layout of the pattern it will be used with.
     *
     * @throws IllegalArgumentException if the template references a missing group
     *                                  or contains an unterminated reference
     */
    public static ReplacementTemplate parse(String template, GroupIndex groups) {
        List<Part> parts = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int n = template.length();
        int i = 0;
        while (i < n) {
            char c = template.charAt(i);
            char next = i + 1 < n ? template.charAt(i + 1) : 0;
            if (c == '$' && isDigit(next)) {
                i = readNumber(template, i + 1, Integer.MAX_VALUE, groups, literal, parts);
            } else if (c == '$' && next == '{') {
                int close = template.indexOf('}', i + 2);
                if (close < 0) {
                    throw new IllegalArgumentException("Unterminated ${ at index " + i);
                }
                flush(literal, parts);
                parts.add(new GroupPart(resolve(template.substring(i + 2, close), groups)));
                i = close + 1;
            } else if (c == '$' && next == '$') {
                literal.append('$');
                i += 2;
            } else if (c == '\\' && isDigit(next)) {
                i = readNumber(template, i + 1, 2, groups, literal, parts);
            } else if (c == '\\' && next == 'g' && i + 2 < n && template.charAt(i + 2) == '<') {
                int close = template.indexOf('>', i + 3);
                if (close < 0) {
                    throw new IllegalArgumentException("Unterminated \\g< at index " + i);
                }
                flush(literal, parts);
                parts.add(new GroupPart(resolve(template.substring(i + 3, close), groups)));
                i = close + 1;
            } else if (c == '\\' && next != 0) {
                switch (next) {
                    case '\\' -> literal.append('\\');
                    case '$' -> literal.append('$');
                    case 'n' -> literal.append('\n');
                    case 't' -> literal.append('\t');
                    case 'r' -> literal.append('\r');
                    default -> literal.append(c).append(next);
                }
                i += 2;
            } else {
                literal.append(c);
                i++;
            }
        }
        flush(literal, parts);
        return new ReplacementTemplate(template, parts);
    }

    /**
     * Template with no group references at all, for callers that substitute fixed text.
     */
    public static ReplacementTemplate literal(String text) {
        return new ReplacementTemplate(text, text.isEmpty() ? List.of() : List.of(new LiteralPart(text)));
    }

    @Override
    public String expand(MatchResult match) {
        if (parts.isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder();
        for (Part part : parts) {
            part.appendTo(out, match);
        }
        return out.toString();
    }

    @Override
    public String source() {
        return source;
    }

    public boolean referencesGroups() {
        return parts.stream().anyMatch(p -> p instanceof GroupPart);
    }

    @Override
    public String toString() {
        return "ReplacementTemplate[" + source + "]";
    }

    private static int readNumber(String template, int start, int maxDigits, GroupIndex groups,
                                  StringBuilder literal, List<Part> parts) {
        int first = template.charAt(start) - '0';
        if (first > groups.groupCount()) {
            throw new IllegalArgumentException("No group " + first + " (pattern has "
                    + groups.groupCount() + ")");
        }
        int value = first;
        int end = start + 1;
        while (end < template.length() && end - start < maxDigits && isDigit(template.charAt(end))) {
            int candidate = value * 10 + (template.charAt(end) - '0');
            if (candidate > groups.groupCount()) {
                break;
            }
            value = candidate;
            end++;
        }
        flush(literal, parts);
        parts.add(new GroupPart(value));
        return end;
    }

    private static int resolve(String reference, GroupIndex groups) {
        if (reference.isEmpty()) {
            throw new IllegalArgumentException("Empty group reference");
        }
        if (reference.chars().allMatch(ReplacementTemplate::isDigit)) {
            int number = Integer.parseInt(reference);
            if (number > groups.groupCount()) {
                throw new IllegalArgumentException("No group " + number + " (pattern has "
                        + groups.groupCount() + ")");
            }
            return number;
        }
        OptionalInt number = groups.numberOf(reference);
        if (number.isEmpty()) {
            throw new IllegalArgumentException("No group named '" + reference + "'");
        }
        return number.getAsInt();
    }

    private static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    private static void flush(StringBuilder literal, List<Part> parts) {
        if (literal.length() > 0) {
            parts.add(new LiteralPart(literal.toString()));
            literal.setLength(0);
        }
    }

    private interface Part {
        void appendTo(StringBuilder out, MatchResult match);
    }

    private record LiteralPart(String text) implements Part {
        @Override
        public void appendTo(StringBuilder out, MatchResult match) {
            out.append(text);
        }
    }

    private record GroupPart(int group) implements Part {
        @Override
        public void appendTo(StringBuilder out, MatchResult match) {
            String value = match.group(group);
            if (value != null) {
                out.append(value);
            }
        }
    }
}
