package com.formative.graph;

/**
 * A direct causal effect: {@code cause} has a direct effect on {@code effect}.
 */
public record Edge(String cause, String effect) {

    @Override
    public String toString() {
        return cause + " -> " + effect;
    }
}
