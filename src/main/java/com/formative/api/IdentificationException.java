package com.formative.api;

import java.util.List;
import java.util.Set;

/**
 * The graph declares confounders of treatment and outcome that have no column
 * in the supplied dataset, for a method that needs every confounder observed.
 *
 * <p>
 * Only confounders modelled in the graph can be detected. Confounders absent
 * from the graph entirely are invisible here.
 */
public final class IdentificationException extends CausalException {
    private final String treatment;
    private final String outcome;
    private final List<String> missingConfounders;

    public IdentificationException(String treatment, String outcome, Set<String> missingConfounders) {
        super(buildMessage(treatment, outcome, List.copyOf(missingConfounders)));
        this.treatment = treatment;
        this.outcome = outcome;
        this.missingConfounders = List.copyOf(missingConfounders);
    }

    public String treatment() {
        return treatment;
    }

    public String outcome() {
        return outcome;
    }

    /** Sorted names of the declared but unmeasured confounders. */
    public List<String> missingConfounders() {
        return missingConfounders;
    }

    private static String buildMessage(String treatment, String outcome, List<String> missing) {
        return "DAG confounders not found in dataset: " + missing + "\n\n"
                + "The DAG declares these variables as confounders of '" + treatment + "' and\n"
                + "'" + outcome + "', but they are absent from the dataset and cannot be\n"
                + "controlled for. There may also be confounders not modelled in the DAG\n"
                + "at all; those cannot be detected.\n\n"
                + "Consider:\n"
                + "  - Collecting data on " + missing + " and adding it to the dataset\n"
                + "  - Instrumental variables if a valid instrument for '" + treatment + "' exists\n"
                + "  - Difference-in-differences if a natural experiment is available";
    }
}
