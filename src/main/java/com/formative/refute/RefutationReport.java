package com.formative.refute;

import java.util.List;

/**
 * Ordered, immutable collection of refutation checks run against one fitted
 * result.
 */
public final class RefutationReport {
    private final String title;
    private final List<RefutationCheck> checks;

    public RefutationReport(String title, List<RefutationCheck> checks) {
        this.title = title;
        this.checks = List.copyOf(checks);
    }

    public String title() {
        return title;
    }

    /** All checks, in the order they were run. */
    public List<RefutationCheck> checks() {
        return checks;
    }

    /** True iff every check passed. */
    public boolean passed() {
        return checks.stream().allMatch(RefutationCheck::passed);
    }

    public List<RefutationCheck> failedChecks() {
        return checks.stream().filter(c -> !c.passed()).toList();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(256).append(title).append('\n');
        for (RefutationCheck c : checks)
            sb.append("  ").append(c).append('\n');
        if (passed())
            sb.append("  All checks passed.");
        else
            sb.append("  ").append(failedChecks().size()).append(" check(s) failed.");
        return sb.toString();
    }
}
