package com.formative.estimate;

import com.formative.api.Assumption;
import com.formative.data.Dataset;
import com.formative.graph.CausalGraph;

import java.util.List;

/**
 * A causal estimation method bound to a graph and its role variables.
 *
 * <p>
 * Structural validation against the graph happens at construction. {@link #fit}
 * checks the dataset, runs identification and either fails with a classified
 * {@link com.formative.api.CausalException} or returns a complete, immutable
 * result. There is no partially fitted state, and the estimator can be fitted
 * again on other data.
 *
 * @param <R> the result type
 */
public interface Estimator<R extends EstimationResult> {

    R fit(Dataset data);

    /** Preconditions for a causal reading of this method's output. */
    List<Assumption> assumptions();

    CausalGraph graph();
}
