package com.lexiqa.qaengine.compiler;

/**
 * Outcome of checking a pattern before it is saved into a rule.
 *
 * @param valid      whether the pattern compiles
 * @param message    compiler description of the problem, empty when valid
 * @param errorIndex index into the pattern near which the problem was found, -1 when valid or unknown
 * @param groupCount capturing groups of a valid pattern, 0 otherwise
 */
public record PatternValidation(boolean valid, String message, int errorIndex, int groupCount) {

    static PatternValidation ok(int groupCount) {
        return new PatternValidation(true, "", -1, groupCount);
    }

    static PatternValidation failed(String message, int errorIndex) {
        return new PatternValidation(false, message, errorIndex, 0);
    }
}
