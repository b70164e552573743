package com.lexiqa.qaengine.compiler;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * Capturing-group layout of a compiled pattern: the group count and the number
 * assigned to each named group.
 *
 * <p>{@code java.util.regex} on Java 17 does not expose group names, so they are
 * recovered by scanning the pattern source. Escapes, {@code \Q...\E} quotes and
 * character classes are skipped; every unescaped {@code (} that is not followed
 * by {@code ?} opens a numbered group, as does {@code (?<name>}. When the scan
 * disagrees with {@link java.util.regex.Matcher#groupCount()} the names are
 * dropped rather than guessed.
 */
public final class GroupIndex {

    private final int groupCount;
    private final Map<String, Integer> namedGroups;

    private GroupIndex(int groupCount, Map<String, Integer> namedGroups) {
        this.groupCount = groupCount;
        this.namedGroups = Collections.unmodifiableMap(namedGroups);
    }

    public static GroupIndex of(Pattern pattern) {
        int count = pattern.matcher("").groupCount();
        Map<String, Integer> names = new HashMap<>();
        int scanned = scan(pattern.pattern(), names);
        if (scanned != count) {
            names.clear();
        }
        return new GroupIndex(count, names);
    }

    public int groupCount() {
        return groupCount;
    }

    public OptionalInt numberOf(String name) {
        Integer n = namedGroups.get(name);
        return n == null ? OptionalInt.empty() : OptionalInt.of(n);
    }

    private static int scan(String source, Map<String, Integer> names) {
        int count = 0;
        int classDepth = 0;
        int i = 0;
        int n = source.length();
        while (i < n) {
            char c = source.charAt(i);
            if (c == '\\') {
                if (i + 1 < n && source.charAt(i + 1) == 'Q') {
                    int end = source.indexOf("\\E", i + 2);
                    i = end < 0 ? n : end + 2;
                } else {
                    i += 2;
                }
                continue;
            }
            if (classDepth > 0) {
                if (c == '[') {
                    classDepth++;
                } else if (c == ']') {
                    classDepth--;
                }
                i++;
                continue;
            }
            if (c == '[') {
                classDepth = 1;
                // a leading ] or ^] is a literal inside the class
                if (i + 1 < n && source.charAt(i + 1) == '^') {
                    i++;
                }
                if (i + 1 < n && source.charAt(i + 1) == ']') {
                    i++;
                }
            } else if (c == '(') {
                if (i + 1 < n && source.charAt(i + 1) == '?') {
                    if (i + 3 < n && source.charAt(i + 2) == '<' && Character.isLetter(source.charAt(i + 3))) {
                        int close = source.indexOf('>', i + 3);
                        if (close > 0) {
                            count++;
                            names.put(source.substring(i + 3, close), count);
                        }
                    }
                } else {
                    count++;
                }
            }
            i++;
        }
        return count;
    }
}
