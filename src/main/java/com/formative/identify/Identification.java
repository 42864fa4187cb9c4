package com.formative.identify;

import java.util.*;

/**
 * Outcome of applying the backdoor criterion against a dataset's columns.
 *
 * @param adjustmentSet      confounders present in the data; to be used as
 *                           statistical controls
 * @param missingConfounders confounders declared in the graph but absent from
 *                           the data
 */
public record Identification(SortedSet<String> adjustmentSet, SortedSet<String> missingConfounders) {

    public Identification {
        adjustmentSet = Collections.unmodifiableSortedSet(new TreeSet<>(adjustmentSet));
        missingConfounders = Collections.unmodifiableSortedSet(new TreeSet<>(missingConfounders));
    }

    /** True when every declared confounder has a column. */
    public boolean fullyObserved() {
        return missingConfounders.isEmpty();
    }

    /** The adjustment set as a sorted list, ready to hand to a regression. */
    public List<String> controls() {
        return List.copyOf(adjustmentSet);
    }
}
