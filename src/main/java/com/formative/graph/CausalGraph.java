package com.formative.graph;

import com.formative.api.GraphException;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * A directed acyclic graph of causal assumptions over named variables.
 *
 * <p>
 * Nodes are variable names. An edge {@code cause -> effect} asserts that
 * {@code cause} has a direct causal effect on {@code effect}. Latent variables
 * (declared confounders that were never measured) are ordinary nodes: leave
 * their column out of the dataset and the estimators will notice at fit time.
 *
 * <h3>Invariants</h3>
 * <ul>
 * <li>The edge relation is acyclic at every observable point. Each assertion
 * appends the edge, re-runs Kahn's algorithm over the whole graph and rolls the
 * edge back if a cycle remains.</li>
 * <li>The node set is exactly the set of names appearing in some edge.</li>
 * <li>Edges are append-only. To start over, discard the graph.</li>
 * </ul>
 *
 * <h3>Usage Pattern</h3>
 *
 * <pre>{@code
 * CausalGraph g = new CausalGraph();
 * g.assume("ability").causes("education", "income");
 * g.assume("education").causes("income");
 * }</pre>
 *
 * <p>
 * Not thread-safe. Estimators hold a reference to the graph and never mutate it.
 */
@Log4j2
public final class CausalGraph {
    private final List<Edge> edges = new ArrayList<>();
    private final Set<Edge> edgeSet = new HashSet<>();

    // Adjacency index, kept in sync with the edge list. Insertion ordered.
    private final Map<String, Set<String>> childrenOf = new LinkedHashMap<>();
    private final Map<String, Set<String>> parentsOf = new LinkedHashMap<>();

    // ── Building the graph ──────────────────────────────────────

    /**
     * Asserts that {@code cause} directly causes {@code effect}.
     *
     * @return this graph, for chaining
     * @throws GraphException if the edge is a self loop, already asserted, or
     *                        would close a cycle. The graph is unchanged.
     */
    public CausalGraph assertEdge(String cause, String effect) {
        Objects.requireNonNull(cause, "cause");
        Objects.requireNonNull(effect, "effect");
        Edge edge = new Edge(cause, effect);
        if (cause.equals(effect))
            throw reject(GraphException.Kind.SELF_LOOP, edge, "Self-loops are not allowed: '" + cause + "'");
        if (edgeSet.contains(edge))
            throw reject(GraphException.Kind.DUPLICATE_EDGE, edge,
                    "'" + cause + "' -> '" + effect + "' already asserted");

        append(edge);
        if (hasCycle()) {
            rollback(edge);
            throw reject(GraphException.Kind.CYCLE, edge,
                    "Asserting '" + cause + "' -> '" + effect + "' would create a cycle. "
                            + "Causal graphs must be acyclic (DAGs).");
        }
        log.debug("Asserted {}", edge);
        return this;
    }

    /**
     * Starts a fluent assertion about {@code subject}:
     * {@code graph.assume("ability").causes("education", "income")}.
     */
    public Subject assume(String subject) {
        return new Subject(Objects.requireNonNull(subject, "subject"));
    }

    // ── Graph properties ────────────────────────────────────────

    /** All nodes, in order of first appearance. Read-only. */
    public Set<String> nodes() {
        return Collections.unmodifiableSet(childrenOf.keySet());
    }

    /** All edges in assertion order. Read-only. */
    public List<Edge> edges() {
        return Collections.unmodifiableList(edges);
    }

    public boolean contains(String node) {
        return childrenOf.containsKey(node);
    }

    public boolean isEmpty() {
        return edges.isEmpty();
    }

    /** Direct causes of {@code node}. */
    public Set<String> parents(String node) {
        return Collections.unmodifiableSet(requireNode(parentsOf, node));
    }

    /** Direct effects of {@code node}. */
    public Set<String> children(String node) {
        return Collections.unmodifiableSet(requireNode(childrenOf, node));
    }

    /** All nodes with a directed path into {@code node}, excluding the node itself. */
    public Set<String> ancestors(String node) {
        return reach(node, parentsOf);
    }

    /** All nodes reachable from {@code node} by a directed path, excluding the node itself. */
    public Set<String> descendants(String node) {
        return reach(node, childrenOf);
    }

    /**
     * Nodes in a topological order: every cause precedes its effects. Ties keep
     * the order of first appearance.
     */
    public List<String> topologicalOrder() {
        List<String> names = new ArrayList<>(childrenOf.keySet());
        int[] order = kahn(names);
        List<String> result = new ArrayList<>(order.length);
        for (int idx : order)
            result.add(names.get(idx));
        return result;
    }

    @Override
    public String toString() {
        if (edges.isEmpty())
            return "DAG (empty)";
        StringBuilder sb = new StringBuilder("DAG:");
        for (Edge e : edges)
            sb.append("\n  ").append(e.cause()).append(" -> ").append(e.effect());
        return sb.toString();
    }

    // ── Internals ───────────────────────────────────────────────

    private Set<String> reach(String node, Map<String, Set<String>> step) {
        requireNode(step, node);
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> stack = new ArrayDeque<>(step.get(node));
        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (visited.add(current))
                stack.addAll(step.get(current));
        }
        return visited;
    }

    private static Set<String> requireNode(Map<String, Set<String>> index, String node) {
        Set<String> adjacent = index.get(node);
        if (adjacent == null)
            throw new IllegalArgumentException("Unknown node: " + node);
        return adjacent;
    }

    private void append(Edge edge) {
        edges.add(edge);
        edgeSet.add(edge);
        childrenOf.computeIfAbsent(edge.cause(), k -> new LinkedHashSet<>()).add(edge.effect());
        parentsOf.computeIfAbsent(edge.cause(), k -> new LinkedHashSet<>());
        childrenOf.computeIfAbsent(edge.effect(), k -> new LinkedHashSet<>());
        parentsOf.computeIfAbsent(edge.effect(), k -> new LinkedHashSet<>()).add(edge.cause());
    }

    // Only ever called for the edge appended last.
    private void rollback(Edge edge) {
        edges.remove(edges.size() - 1);
        edgeSet.remove(edge);
        childrenOf.get(edge.cause()).remove(edge.effect());
        parentsOf.get(edge.effect()).remove(edge.cause());
        dropIfIsolated(edge.cause());
        dropIfIsolated(edge.effect());
    }

    private void dropIfIsolated(String node) {
        if (childrenOf.get(node).isEmpty() && parentsOf.get(node).isEmpty()) {
            childrenOf.remove(node);
            parentsOf.remove(node);
        }
    }

    private boolean hasCycle() {
        List<String> names = new ArrayList<>(childrenOf.keySet());
        return kahn(names).length != names.size();
    }

    /**
     * Kahn's algorithm: repeatedly remove nodes with in-degree zero. Returns the
     * processed node indices in order; fewer than {@code names.size()} entries
     * means a cycle exists.
     */
    private int[] kahn(List<String> names) {
        int n = names.size();
        Map<String, Integer> index = new HashMap<>(n * 2);
        for (int i = 0; i < n; i++)
            index.put(names.get(i), i);

        // 1. Calculate in-degrees
        int[] inDegree = new int[n];
        for (int i = 0; i < n; i++)
            inDegree[i] = parentsOf.get(names.get(i)).size();

        // 2. Initialize queue with nodes having in-degree 0
        int[] queue = new int[n];
        int head = 0, tail = 0;
        for (int i = 0; i < n; i++)
            if (inDegree[i] == 0)
                queue[tail++] = i;

        // 3. Process queue
        while (head < tail) {
            int curr = queue[head++];
            for (String child : childrenOf.get(names.get(curr))) {
                int ci = index.get(child);
                if (--inDegree[ci] == 0)
                    queue[tail++] = ci;
            }
        }
        return Arrays.copyOf(queue, tail);
    }

    private static GraphException reject(GraphException.Kind kind, Edge edge, String message) {
        log.warn("Rejected edge {}: {}", edge, kind);
        return new GraphException(kind, edge, message);
    }

    /**
     * Lightweight handle returned by {@link #assume(String)}. References the
     * graph and a subject node and forwards each {@code causes} target to
     * {@link #assertEdge(String, String)}.
     */
    public final class Subject {
        private final String subject;

        private Subject(String subject) {
            this.subject = subject;
        }

        /**
         * Asserts {@code subject -> effect} for each effect, in order. Each
         * assertion is atomic on its own: if the k-th is rejected the earlier ones
         * stay in place.
         */
        public Subject causes(String... effects) {
            if (effects.length == 0)
                throw new IllegalArgumentException("causes() needs at least one effect");
            for (String effect : effects)
                assertEdge(subject, effect);
            return this;
        }

        public String subject() {
            return subject;
        }

        public CausalGraph graph() {
            return CausalGraph.this;
        }
    }
}
