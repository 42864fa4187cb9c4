package com.formative.estimate;

import com.formative.api.IdentificationException;
import com.formative.api.ValidationException;
import com.formative.data.Dataset;
import com.formative.fit.CommonsMathBackend;
import com.formative.refute.RefutationReport;
import org.junit.Test;

import java.util.List;
import java.util.Set;

import static org.junit.Assert.*;

public class PropensityScoreMatchingTest {

    private static PropensityScoreMatching estimator(int replicates) {
        return new PropensityScoreMatching(Scenarios.matchingGraph(), "t", "y", CommonsMathBackend.INSTANCE,
                replicates, PropensityScoreMatching.DEFAULT_BOOTSTRAP_SEED);
    }

    @Test
    public void testMatchedAttRemovesSelection() {
        PropensityScoreMatching.Result r = estimator(200).fit(Scenarios.matching(17, Scenarios.N));

        assertEquals("Matching", r.method());
        assertEquals(Set.of("x"), r.adjustmentSet());
        assertEquals(2.0, r.effect(), 0.5);
        // treated units have higher x, so the raw difference is inflated
        assertTrue(r.unadjustedEffect().getAsDouble() > 3.0);
        assertTrue(r.stdErr() > 0);
        assertTrue(r.confInt().lower() < r.effect() && r.effect() < r.confInt().upper());
        assertTrue(r.pValue() < 0.001);
        assertEquals(200, r.bootstrapEffects().length);
        assertEquals(4, r.assumptions().size());
    }

    @Test
    public void testDefaultBootstrap() {
        PropensityScoreMatching.Result r = new PropensityScoreMatching(Scenarios.matchingGraph(), "t", "y")
                .fit(Scenarios.matching(17, 400));
        assertEquals(PropensityScoreMatching.DEFAULT_BOOTSTRAP_REPLICATES, r.bootstrapEffects().length);
    }

    @Test
    public void testBootstrapIsDeterministicForSeed() {
        Dataset d = Scenarios.matching(23, 300);
        double[] first = estimator(50).fit(d).bootstrapEffects();
        double[] second = estimator(50).fit(d).bootstrapEffects();
        assertArrayEquals(first, second, 0.0);
    }

    @Test
    public void testStdErrIsSampleStdDevOfReplicates() {
        PropensityScoreMatching.Result r = estimator(60).fit(Scenarios.matching(29, 300));
        double[] b = r.bootstrapEffects();
        double mean = 0;
        for (double v : b)
            mean += v;
        mean /= b.length;
        double ss = 0;
        for (double v : b)
            ss += (v - mean) * (v - mean);
        assertEquals(Math.sqrt(ss / (b.length - 1)), r.stdErr(), 1e-12);
    }

    @Test
    public void testNonBinaryTreatment() {
        Dataset d = Scenarios.matching(17, 50);
        double[] t = d.column("t");
        t[0] = 2.0;
        try {
            estimator(10).fit(d.withColumn("t", t));
            fail("Expected validation failure");
        } catch (ValidationException e) {
            assertEquals(ValidationException.Kind.NON_BINARY, e.kind());
        }
    }

    @Test
    public void testSingleTreatmentLevel() {
        Dataset d = Scenarios.matching(17, 50);
        try {
            estimator(10).fit(d.withColumn("t", new double[50]));
            fail("Expected validation failure");
        } catch (ValidationException e) {
            assertEquals(ValidationException.Kind.MISSING_LEVEL, e.kind());
        }
    }

    @Test
    public void testMissingConfounderIsFatal() {
        Dataset d = Scenarios.matching(17, 100).select(List.of("t", "y"));
        try {
            estimator(10).fit(d);
            fail("Expected identification failure");
        } catch (IdentificationException e) {
            assertEquals(List.of("x"), e.missingConfounders());
        }
    }

    @Test
    public void testNegativeZeroCountsAsControl() {
        Dataset d = Scenarios.matching(17, 300);
        double[] t = d.column("t");
        for (int i = 0; i < t.length; i++)
            if (t[i] == 0.0)
                t[i] = -0.0;
        PropensityScoreMatching.Result plain = estimator(20).fit(d);
        PropensityScoreMatching.Result signed = estimator(20).fit(d.withColumn("t", t));
        assertEquals(plain.effect(), signed.effect(), 1e-12);
        assertEquals(plain.unadjustedEffect().getAsDouble(), signed.unadjustedEffect().getAsDouble(), 1e-12);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNeedsTwoReplicates() {
        estimator(1);
    }

    @Test
    public void testRefutationChecks() {
        Dataset d = Scenarios.matching(17, 400);
        RefutationReport report = estimator(50).fit(d).refute(d);

        assertEquals("Matching Refutation Report: t -> y", report.title());
        assertEquals(2, report.checks().size());
        assertEquals("Placebo treatment", report.checks().get(0).name());
        assertEquals("Random common cause", report.checks().get(1).name());
    }
}
