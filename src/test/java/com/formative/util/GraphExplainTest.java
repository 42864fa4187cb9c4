package com.formative.util;

import com.formative.graph.CausalGraph;
import org.junit.Test;

import static org.junit.Assert.*;

public class GraphExplainTest {

    private static CausalGraph graph() {
        CausalGraph g = new CausalGraph();
        g.assume("ability").causes("education", "income");
        g.assume("education").causes("income");
        return g;
    }

    @Test
    public void testDumpEdges() {
        String dump = new GraphExplain(graph()).dumpEdges();
        assertEquals("Graph (3 nodes, 3 edges):\n"
                + "  ability -> education\n"
                + "  ability -> income\n"
                + "  education -> income\n", dump);
    }

    @Test
    public void testExplainNode() {
        String s = new GraphExplain(graph()).explainNode("education");
        assertTrue(s.startsWith("Node: education\n"));
        assertTrue(s.contains("Topo index: 1"));
        assertTrue(s.contains("Is root: false"));
        assertTrue(s.contains("Parents (1): ability"));
        assertTrue(s.contains("Children (1): income"));
        assertTrue(s.contains("Descendants (1): income"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testExplainUnknownNode() {
        new GraphExplain(graph()).explainNode("wealth");
    }

    @Test
    public void testToMermaid() {
        CausalGraph g = graph();
        g.assertEdge("my-var", "income");
        String m = new GraphExplain(g).toMermaid();
        assertTrue(m.startsWith("graph TD;\n"));
        assertTrue(m.contains("  ability[\"ability\"];\n"));
        assertTrue(m.contains("  my_var[\"my-var\"];\n"));
        assertTrue(m.contains("  ability --> education;\n"));
        assertTrue(m.contains("  my_var --> income;\n"));
        assertTrue(m.indexOf("ability -->") < m.indexOf("education -->"));
    }
}
