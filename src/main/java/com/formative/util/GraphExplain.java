package com.formative.util;

import com.formative.graph.CausalGraph;
import com.formative.graph.Edge;

import java.util.Collection;
import java.util.List;

/**
 * Diagnostic utility for inspecting a causal graph.
 *
 * <p>
 * Generates human-readable string representations of the graph structure and
 * of the neighbourhood of specific nodes. Intended for debugging sessions and
 * error reports.
 */
public final class GraphExplain {
    private final CausalGraph graph;

    public GraphExplain(CausalGraph graph) {
        this.graph = graph;
    }

    /**
     * Lists every edge in assertion order.
     */
    public String dumpEdges() {
        StringBuilder sb = new StringBuilder(256);
        sb.append("Graph (").append(graph.nodes().size()).append(" nodes, ")
                .append(graph.edges().size()).append(" edges):\n");
        for (Edge e : graph.edges())
            sb.append("  ").append(e.cause()).append(" -> ").append(e.effect()).append('\n');
        return sb.toString();
    }

    /**
     * Dumps the causal neighbourhood of a single node.
     */
    public String explainNode(String nodeName) {
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(nodeName).append('\n')
                .append("  Topo index: ").append(graph.topologicalOrder().indexOf(nodeName)).append('\n')
                .append("  Is root: ").append(graph.parents(nodeName).isEmpty()).append('\n');
        appendSet(sb, "Parents", graph.parents(nodeName));
        appendSet(sb, "Children", graph.children(nodeName));
        appendSet(sb, "Ancestors", graph.ancestors(nodeName));
        appendSet(sb, "Descendants", graph.descendants(nodeName));
        return sb.toString();
    }

    /**
     * Generates a Mermaid JS graph diagram, nodes declared in topological order.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("graph TD;\n");
        List<String> order = graph.topologicalOrder();

        // 1. Declare nodes
        for (String node : order)
            sb.append("  ").append(sanitize(node)).append("[\"").append(node).append("\"];\n");

        // 2. Then edges, grouped by cause
        for (String node : order)
            for (String child : graph.children(node))
                sb.append("  ").append(sanitize(node)).append(" --> ").append(sanitize(child)).append(";\n");
        return sb.toString();
    }

    private static void appendSet(StringBuilder sb, String label, Collection<String> names) {
        sb.append("  ").append(label).append(" (").append(names.size()).append("): ")
                .append(String.join(", ", names)).append('\n');
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}
