package com.formative.identify;

import com.formative.graph.CausalGraph;

import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Backdoor-criterion identification.
 *
 * <p>
 * A variable must be controlled for when it is a common cause of treatment
 * and outcome and not itself a consequence of treatment:
 *
 * <pre>
 * confounders = (ancestors(T) ∩ ancestors(Y)) \ descendants(T)
 * </pre>
 *
 * Mediators and other post-treatment variables are descendants of treatment and
 * are never adjusted for: conditioning on them blocks part of the causal path and
 * biases the total effect toward zero.
 *
 * <p>
 * The same computation serves every adjustment-based method. Only the policy
 * differs: observational regression and matching treat missing confounders as
 * fatal, instrumental variables tolerates them.
 */
public final class IdentificationEngine {
    private static final Logger log = LogManager.getLogger(IdentificationEngine.class);

    private IdentificationEngine() {
        // Utility class
    }

    /**
     * Computes the adjustment set for {@code treatment -> outcome} and partitions
     * it by membership in {@code availableColumns}.
     *
     * @param excluded nodes never admitted to the adjustment set even when they
     *                 qualify graph-theoretically (the instrument)
     * @throws IllegalArgumentException if treatment or outcome is not a node, or
     *                                  they are the same node
     */
    public static Identification identify(CausalGraph graph, String treatment, String outcome,
            Set<String> availableColumns, String... excluded) {
        if (!graph.contains(treatment))
            throw new IllegalArgumentException("Unknown node: " + treatment);
        if (!graph.contains(outcome))
            throw new IllegalArgumentException("Unknown node: " + outcome);
        if (treatment.equals(outcome))
            throw new IllegalArgumentException("Treatment and outcome must be different variables.");

        Set<String> confounders = new TreeSet<>(graph.ancestors(treatment));
        confounders.retainAll(graph.ancestors(outcome));
        confounders.removeAll(graph.descendants(treatment));
        for (String x : excluded)
            confounders.remove(x);

        SortedSet<String> observed = new TreeSet<>();
        SortedSet<String> missing = new TreeSet<>();
        for (String c : confounders) {
            if (availableColumns.contains(c))
                observed.add(c);
            else
                missing.add(c);
        }
        log.debug("Identified {} -> {}: adjust for {}, missing {}", treatment, outcome, observed, missing);
        return new Identification(observed, missing);
    }
}
