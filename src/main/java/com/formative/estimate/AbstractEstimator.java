package com.formative.estimate;

import com.formative.api.IdentificationException;
import com.formative.api.ValidationException;
import com.formative.data.Dataset;
import com.formative.fit.FittingBackend;
import com.formative.graph.CausalGraph;
import com.formative.identify.Identification;
import com.formative.identify.IdentificationEngine;

import java.util.*;

/**
 * Shared plumbing for the estimators: role validation against the graph,
 * column checks against the dataset, and identification policy.
 */
public abstract class AbstractEstimator<R extends EstimationResult> implements Estimator<R> {
    protected final CausalGraph graph;
    protected final FittingBackend backend;
    private final List<Role> roles;

    /** A variable playing a named part in the method (treatment, outcome, ...). */
    protected record Role(String label, String variable) {
    }

    protected AbstractEstimator(CausalGraph graph, FittingBackend backend, Role... roles) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.backend = Objects.requireNonNull(backend, "backend");
        this.roles = List.of(roles);
        validateRoles();
    }

    @Override
    public CausalGraph graph() {
        return graph;
    }

    private void validateRoles() {
        Set<String> nodes = graph.nodes();
        for (Role r : roles) {
            Objects.requireNonNull(r.variable(), r.label());
            if (!nodes.contains(r.variable()))
                throw new ValidationException(ValidationException.Kind.MISSING_NODE,
                        r.label() + " '" + r.variable() + "' is not a node in the DAG. Known nodes: "
                                + new TreeSet<>(nodes));
        }
        for (int i = 0; i < roles.size(); i++)
            for (int j = i + 1; j < roles.size(); j++)
                if (roles.get(i).variable().equals(roles.get(j).variable()))
                    throw new ValidationException(ValidationException.Kind.DUPLICATE_ROLE,
                            roles.get(i).label() + " and " + roles.get(j).label().toLowerCase()
                                    + " must be different variables.");
    }

    /** Every role variable must have a column. */
    protected void requireColumns(Dataset data) {
        for (Role r : roles)
            if (!data.hasColumn(r.variable()))
                throw new ValidationException(ValidationException.Kind.MISSING_COLUMN,
                        r.label() + " column '" + r.variable() + "' not found in dataset.");
    }

    protected static void requireBinary(Dataset data, String label, String column) {
        if (!data.isBinary(column))
            throw new ValidationException(ValidationException.Kind.NON_BINARY,
                    label + " '" + column + "' must be binary (0/1). Found: " + data.distinctValues(column));
    }

    protected static void requireBothLevels(Dataset data, String label, String column) {
        boolean zero = false, one = false;
        for (double v : data.column(column)) {
            zero |= v == 0.0;
            one |= v == 1.0;
        }
        if (!zero || !one)
            throw new ValidationException(ValidationException.Kind.MISSING_LEVEL,
                    label + " '" + column + "' must contain both 0 and 1. Found only: "
                            + data.distinctValues(column));
    }

    /**
     * Backdoor identification for methods that need every declared confounder
     * measured.
     *
     * @throws IdentificationException if any declared confounder lacks a column
     */
    protected Identification identifyFullyObserved(Dataset data, String treatment, String outcome) {
        Identification id = IdentificationEngine.identify(graph, treatment, outcome, data.columns());
        if (!id.fullyObserved())
            throw new IdentificationException(treatment, outcome, id.missingConfounders());
        return id;
    }

    protected static List<String> concat(String first, List<String> rest) {
        List<String> out = new ArrayList<>(rest.size() + 1);
        out.add(first);
        out.addAll(rest);
        return out;
    }

    protected static List<String> concat(List<String> a, List<String> b) {
        List<String> out = new ArrayList<>(a.size() + b.size());
        out.addAll(a);
        out.addAll(b);
        return out;
    }
}
