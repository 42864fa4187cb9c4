package com.formative.estimate;

import com.formative.api.ValidationException;
import com.formative.data.Dataset;
import com.formative.graph.CausalGraph;
import com.formative.refute.RefutationReport;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class DifferenceInDifferencesTest {

    private static CausalGraph panelGraph() {
        CausalGraph g = new CausalGraph();
        g.assume("group").causes("sales");
        g.assume("post").causes("sales");
        return g;
    }

    @Test
    public void testInteractionIsTheEffect() {
        DifferenceInDifferences.Result r = new DifferenceInDifferences(panelGraph(), "group", "post", "sales")
                .fit(Scenarios.panel(9));

        assertEquals("DiD", r.method());
        assertEquals("group", r.group());
        assertEquals("post", r.time());
        assertEquals(3.0, r.effect(), 0.5);
        // baseline gap plus effect
        assertEquals(5.0, r.naiveDiff(), 0.5);
        assertEquals(r.naiveDiff(), r.unadjustedEffect().getAsDouble(), 0.0);
        assertTrue(r.adjustmentSet().isEmpty());
        assertEquals(4, r.assumptions().size());
        assertEquals("group:post", r.interactionTerm());
        assertEquals(r.effect(), r.regression().estimate("group:post"), 0.0);
        assertEquals(2.0, r.regression().estimate("group"), 0.5);
        assertEquals(1.0, r.regression().estimate("post"), 0.5);
    }

    @Test
    public void testInteractionColumnNameClash() {
        Dataset d = Scenarios.panel(9);
        d = d.withColumn("group:post", new double[d.rowCount()]);
        DifferenceInDifferences.Result r = new DifferenceInDifferences(panelGraph(), "group", "post", "sales")
                .fit(d);
        assertEquals(3.0, r.effect(), 0.5);
        assertEquals("_group:post", r.interactionTerm());
    }

    @Test
    public void testRefuteRequiresTimeColumn() {
        Dataset d = Scenarios.panel(9);
        DifferenceInDifferences.Result r = new DifferenceInDifferences(panelGraph(), "group", "post", "sales")
                .fit(d);
        try {
            r.refute(d.select(List.of("group", "sales")));
            fail("Expected validation failure");
        } catch (ValidationException e) {
            assertEquals(ValidationException.Kind.MISSING_COLUMN, e.kind());
            assertTrue(e.getMessage().startsWith("Time column 'post'"));
        }
    }

    @Test
    public void testTimeMustBeBinary() {
        Dataset d = Scenarios.panel(9);
        double[] post = d.column("post");
        post[3] = 2.0;
        try {
            new DifferenceInDifferences(panelGraph(), "group", "post", "sales").fit(d.withColumn("post", post));
            fail("Expected validation failure");
        } catch (ValidationException e) {
            assertEquals(ValidationException.Kind.NON_BINARY, e.kind());
            assertTrue(e.getMessage().startsWith("Time 'post'"));
        }
    }

    @Test
    public void testRolesMustBeDistinct() {
        try {
            new DifferenceInDifferences(panelGraph(), "group", "group", "sales");
            fail("Expected validation failure");
        } catch (ValidationException e) {
            assertEquals(ValidationException.Kind.DUPLICATE_ROLE, e.kind());
        }
    }

    @Test
    public void testRefutationChecks() {
        Dataset d = Scenarios.panel(9);
        RefutationReport report = new DifferenceInDifferences(panelGraph(), "group", "post", "sales").fit(d)
                .refute(d);

        assertEquals("DiD Refutation Report: group x post -> sales", report.title());
        assertEquals(3, report.checks().size());
        assertEquals("Placebo group", report.checks().get(0).name());
        assertEquals("Placebo time", report.checks().get(1).name());
        assertEquals("Random common cause", report.checks().get(2).name());
        assertTrue(report.checks().get(2).passed());
    }
}
