package com.formative.refute;

/**
 * Outcome of one perturbation test. A failed check is advisory evidence
 * against the estimate, never a program failure.
 */
public record RefutationCheck(String name, boolean passed, String detail) {

    @Override
    public String toString() {
        return "[" + (passed ? "PASS" : "FAIL") + "]  " + name + ": " + detail;
    }
}
