package com.formative.io;

import com.formative.graph.CausalGraph;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.log4j.Log4j2;

/**
 * Reads a JSON {@link GraphDefinition} and compiles it into a
 * {@link CausalGraph}.
 *
 * <p>
 * Edges are asserted in document order, then each {@code assumptions} entry in
 * document order. Any graph violation (self loop, duplicate, cycle) surfaces as
 * the usual {@link com.formative.api.GraphException}.
 */
@Log4j2
public final class GraphDefinitionReader {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private GraphDefinitionReader() {
        // Utility class
    }

    /** Parses a JSON file into a GraphDefinition. */
    public static GraphDefinition parseFile(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return parse(in);
        }
    }

    public static GraphDefinition parse(InputStream in) throws IOException {
        return MAPPER.readValue(in, GraphDefinition.class);
    }

    /** Parses a JSON string into a GraphDefinition. */
    public static GraphDefinition parse(String json) {
        try {
            return MAPPER.readValue(json, GraphDefinition.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed graph definition: " + e.getOriginalMessage(), e);
        }
    }

    /** Parses and compiles a JSON file in one step. */
    public static CausalGraph read(Path path) throws IOException {
        return compile(parseFile(path));
    }

    /**
     * Compiles the definition into a graph.
     *
     * @throws IllegalArgumentException if an edge lacks a cause or effect
     */
    public static CausalGraph compile(GraphDefinition def) {
        CausalGraph graph = new CausalGraph();
        if (def.getEdges() != null) {
            for (GraphDefinition.EdgeDef e : def.getEdges()) {
                if (e == null || e.getCause() == null || e.getEffect() == null)
                    throw new IllegalArgumentException("Edge needs both 'cause' and 'effect': " + e);
                graph.assertEdge(e.getCause(), e.getEffect());
            }
        }
        if (def.getAssumptions() != null) {
            for (Map.Entry<String, List<String>> entry : def.getAssumptions().entrySet()) {
                List<String> effects = entry.getValue();
                if (effects == null || effects.isEmpty())
                    throw new IllegalArgumentException("Assumption for '" + entry.getKey() + "' lists no effects");
                graph.assume(entry.getKey()).causes(effects.toArray(new String[0]));
            }
        }
        log.info("Compiled graph '{}': {} nodes, {} edges", def.getName(), graph.nodes().size(),
                graph.edges().size());
        return graph;
    }
}
