package com.formative.api;

/**
 * A precondition for the causal interpretation of a method's output.
 *
 * @param name     human readable statement of the assumption
 * @param testable whether the data can provide evidence about it
 */
public record Assumption(String name, boolean testable) {

    public static Assumption testable(String name) {
        return new Assumption(name, true);
    }

    public static Assumption untestable(String name) {
        return new Assumption(name, false);
    }
}
