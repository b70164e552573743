package com.lexiqa.qaengine;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Arguments of one command: positionals, boolean switches and valued options.
 *
 * <p>A token is an option only if it starts with {@code --} or is {@code -o}, so
 * patterns such as {@code -+} stay positional. Everything after a bare {@code --}
 * is positional.
 */
final class CommandArgs {

    private static final Map<String, String> ALIASES = Map.of("-o", "--output");

    private final List<String> positionals;
    private final Map<String, String> options;
    private final Set<String> switches;

    private CommandArgs(List<String> positionals, Map<String, String> options, Set<String> switches) {
        this.positionals = positionals;
        this.options = options;
        this.switches = switches;
    }

    /**
     * @param valued   options that take the next token as their value
     * @param booleans options that stand alone
     * @throws IllegalArgumentException on an unknown option or a valued option without a value
     */
    static CommandArgs parse(String[] args, Set<String> valued, Set<String> booleans) {
        List<String> positionals = new ArrayList<>();
        Map<String, String> options = new HashMap<>();
        Set<String> switches = new HashSet<>();
        boolean literal = false;
        for (int i = 0; i < args.length; i++) {
            String token = args[i];
            if (literal || !isOption(token)) {
                positionals.add(token);
                continue;
            }
            if ("--".equals(token)) {
                literal = true;
                continue;
            }
            String name = ALIASES.getOrDefault(token, token);
            if (booleans.contains(name)) {
                switches.add(name);
            } else if (valued.contains(name)) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("Option " + token + " needs a value");
                }
                options.put(name, args[++i]);
            } else {
                throw new IllegalArgumentException("Unknown option: " + token);
            }
        }
        return new CommandArgs(positionals, options, switches);
    }

    private static boolean isOption(String token) {
        return token.startsWith("--") || ALIASES.containsKey(token);
    }

    /**
     * @throws IllegalArgumentException with the usage line if fewer than {@code count} positionals were given
     */
    CommandArgs require(int count, String usage) {
        if (positionals.size() < count) {
            throw new IllegalArgumentException("Usage: " + usage);
        }
        return this;
    }

    String positional(int index) {
        return positionals.get(index);
    }

    int positionalCount() {
        return positionals.size();
    }

    Optional<String> option(String name) {
        return Optional.ofNullable(options.get(name));
    }

    OptionalInt intOption(String name) {
        String value = options.get(name);
        if (value == null) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Option " + name + " needs a number: " + value, e);
        }
    }

    boolean has(String name) {
        return switches.contains(name);
    }
}
