package com.formative.identify;

import com.formative.api.ValidationException;
import com.formative.graph.CausalGraph;

import java.util.*;

/**
 * Structural checks an instrument must pass before any data is touched.
 *
 * <ol>
 * <li><b>Relevance:</b> a directed path exists from instrument to treatment.</li>
 * <li><b>Exclusion restriction:</b> the outcome is not reachable from the
 * instrument once paths entering the treatment are cut.</li>
 * </ol>
 *
 * Independence and monotonicity are not visible in the graph and remain
 * untestable assumptions of the method.
 */
public final class InstrumentValidator {

    private InstrumentValidator() {
        // Utility class
    }

    /** Runs both checks. */
    public static void validate(CausalGraph graph, String treatment, String outcome, String instrument) {
        checkRelevance(graph, treatment, instrument);
        checkExclusion(graph, treatment, outcome, instrument);
    }

    public static void checkRelevance(CausalGraph graph, String treatment, String instrument) {
        if (!graph.descendants(instrument).contains(treatment)) {
            throw new ValidationException(ValidationException.Kind.RELEVANCE,
                    "Instrument '" + instrument + "' does not cause treatment '" + treatment + "' in the DAG "
                            + "(no directed path from '" + instrument + "' to '" + treatment + "'). "
                            + "Add a causal path to assert relevance.");
        }
    }

    public static void checkExclusion(CausalGraph graph, String treatment, String outcome, String instrument) {
        if (descendantsAvoiding(graph, instrument, treatment).contains(outcome)) {
            throw new ValidationException(ValidationException.Kind.EXCLUSION_RESTRICTION,
                    "Exclusion restriction violated: '" + instrument + "' can reach '" + outcome
                            + "' in the DAG without going through '" + treatment + "'. The instrument must "
                            + "affect the outcome only through the treatment.");
        }
    }

    /**
     * Descendants of {@code start} along paths that never enter {@code blocked}.
     * The blocked node is neither visited nor expanded.
     */
    static Set<String> descendantsAvoiding(CausalGraph graph, String start, String blocked) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        for (String c : graph.children(start))
            if (!c.equals(blocked))
                stack.push(c);
        while (!stack.isEmpty()) {
            String node = stack.pop();
            if (!visited.add(node))
                continue;
            for (String c : graph.children(node))
                if (!c.equals(blocked))
                    stack.push(c);
        }
        return visited;
    }
}
