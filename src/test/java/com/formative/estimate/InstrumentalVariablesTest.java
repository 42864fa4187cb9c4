package com.formative.estimate;

import com.formative.api.ValidationException;
import com.formative.data.Dataset;
import com.formative.graph.CausalGraph;
import com.formative.refute.RefutationReport;
import org.junit.Test;

import java.util.List;
import java.util.Set;

import static org.junit.Assert.*;

public class InstrumentalVariablesTest {

    @Test
    public void testToleratesUnobservedConfounder() {
        InstrumentalVariables est = new InstrumentalVariables(Scenarios.schoolingGraph(), "education", "income",
                "distance");
        InstrumentalVariables.Result r = est.fit(Scenarios.schooling(5, false));

        assertEquals("IV", r.method());
        assertEquals("distance", r.instrument());
        assertTrue(r.adjustmentSet().isEmpty());
        assertEquals(Set.of("ability"), r.unobservedConfounders());
        assertEquals(2.0, r.effect(), 0.3);
        assertTrue(r.unadjustedEffect().getAsDouble() > r.effect());
        assertEquals(4, r.assumptions().size());
        assertEquals(r.effect(), r.regression().estimate("education"), 0.0);
        assertEquals(r.unadjustedEffect().getAsDouble(), r.unadjustedRegression().estimate("education"), 0.0);
    }

    @Test
    public void testObservedConfounderEntersBothStages() {
        InstrumentalVariables.Result r = new InstrumentalVariables(Scenarios.schoolingGraph(), "education",
                "income", "distance").fit(Scenarios.schooling(5, true));
        assertEquals(Set.of("ability"), r.adjustmentSet());
        assertTrue(r.unobservedConfounders().isEmpty());
        assertFalse(r.adjustmentSet().contains("distance"));
        assertEquals(2.0, r.effect(), 0.15);
        assertEquals(3.0, r.regression().estimate("ability"), 0.3);
    }

    @Test
    public void testRefuteRequiresInstrumentColumn() {
        Dataset d = Scenarios.schooling(5, false);
        InstrumentalVariables.Result r = new InstrumentalVariables(Scenarios.schoolingGraph(), "education",
                "income", "distance").fit(d);
        try {
            r.refute(d.select(List.of("education", "income")));
            fail("Expected validation failure");
        } catch (ValidationException e) {
            assertEquals(ValidationException.Kind.MISSING_COLUMN, e.kind());
            assertTrue(e.getMessage().startsWith("Instrument column 'distance'"));
        }
    }

    @Test
    public void testIrrelevantInstrumentRejectedAtConstruction() {
        CausalGraph g = Scenarios.schoolingGraph();
        g.assertEdge("weather", "income");
        try {
            new InstrumentalVariables(g, "education", "income", "weather");
            fail("Expected relevance failure");
        } catch (ValidationException e) {
            assertEquals(ValidationException.Kind.RELEVANCE, e.kind());
        }
    }

    @Test
    public void testDirectEffectViolatesExclusion() {
        CausalGraph g = Scenarios.schoolingGraph();
        g.assertEdge("distance", "income");
        try {
            new InstrumentalVariables(g, "education", "income", "distance");
            fail("Expected exclusion failure");
        } catch (ValidationException e) {
            assertEquals(ValidationException.Kind.EXCLUSION_RESTRICTION, e.kind());
        }
    }

    @Test
    public void testMissingInstrumentColumn() {
        Dataset d = Scenarios.schooling(5, false).select(List.of("education", "income"));
        try {
            new InstrumentalVariables(Scenarios.schoolingGraph(), "education", "income", "distance").fit(d);
            fail("Expected validation failure");
        } catch (ValidationException e) {
            assertEquals(ValidationException.Kind.MISSING_COLUMN, e.kind());
            assertTrue(e.getMessage().startsWith("Instrument column"));
        }
    }

    @Test
    public void testRefutationRunsFirstStageThenRandomCommonCause() {
        Dataset d = Scenarios.schooling(5, false);
        InstrumentalVariables.Result r = new InstrumentalVariables(Scenarios.schoolingGraph(), "education",
                "income", "distance").fit(d);
        RefutationReport report = r.refute(d);

        assertEquals(2, report.checks().size());
        assertEquals("First-stage F-statistic", report.checks().get(0).name());
        assertEquals("Random common cause", report.checks().get(1).name());
        assertTrue(report.title().contains("(instrument: distance)"));
        assertTrue(report.toString(), report.passed());
    }
}
