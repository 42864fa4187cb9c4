package com.formative.io;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * POJO representation of a causal graph declaration.
 *
 * <pre>{@code
 * {
 *   "name": "returns-to-schooling",
 *   "edges": [ { "cause": "education", "effect": "income" } ],
 *   "assumptions": { "ability": ["education", "income"] }
 * }
 * }</pre>
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class GraphDefinition {
    private String name;
    private List<EdgeDef> edges = new ArrayList<>();
    /** Subject to the list of its direct effects, in document order. */
    private Map<String, List<String>> assumptions = new LinkedHashMap<>();

    /** A single {@code cause -> effect} assertion. */
    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class EdgeDef {
        private String cause, effect;

        public EdgeDef(String cause, String effect) {
            this.cause = cause;
            this.effect = effect;
        }
    }
}
