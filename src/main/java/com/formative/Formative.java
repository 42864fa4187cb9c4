package com.formative;

import com.formative.graph.CausalGraph;

/**
 * Formative: causal effect estimation driven by a declared causal graph.
 *
 * <h2>Philosophy</h2>
 * <p>
 * Identification comes before estimation. The user declares causal assumptions
 * as a DAG; the library then decides, before any fitting happens:
 * <ul>
 * <li><b>What to control for:</b> the backdoor adjustment set
 * ({@link com.formative.identify.IdentificationEngine}).</li>
 * <li><b>Whether an instrument is structurally valid:</b> relevance and
 * exclusion restriction ({@link com.formative.identify.InstrumentValidator}).</li>
 * <li><b>Whether the data permit an estimate at all:</b> declared confounders
 * without a column are reported, never silently ignored.</li>
 * </ul>
 *
 * <h3>Estimators</h3>
 * {@link com.formative.estimate.ObservationalOls},
 * {@link com.formative.estimate.InstrumentalVariables},
 * {@link com.formative.estimate.PropensityScoreMatching},
 * {@link com.formative.estimate.RandomizedTrial} and
 * {@link com.formative.estimate.DifferenceInDifferences}. Every fitted result
 * can be refuted with {@code result.refute(dataset)}.
 */
public final class Formative {

    private Formative() {
        // Prevent instantiation of utility class
    }

    /**
     * Entry point: create a new, empty causal graph.
     *
     * @return A graph to declare assumptions on with
     *         {@code assume(x).causes(y, z)}.
     */
    public static CausalGraph graph() {
        return new CausalGraph();
    }
}
