package com.formative.refute;

import com.formative.api.FittingException;
import com.formative.data.Dataset;
import com.formative.fit.CommonsMathBackend;
import com.formative.fit.ConfidenceInterval;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.Assert.*;

public class RefutationEngineTest {

    private static Dataset data() {
        RandomGenerator rng = new Well19937c(5);
        int n = 500;
        double[] z = new double[n], t = new double[n], y = new double[n];
        for (int i = 0; i < n; i++) {
            z[i] = rng.nextGaussian();
            t[i] = z[i] + rng.nextGaussian();
            y[i] = 2.0 * t[i] + rng.nextGaussian();
        }
        return Dataset.builder().column("z", z).column("t", t).column("y", y).build();
    }

    private static RefutationCheck check(Refutation r) {
        return r.run(data());
    }

    @Test
    public void testRandomCommonCausePassesWithinOneSe() {
        RefutationCheck c = check(RefutationEngine.randomCommonCause(1.0, 0.1, (d, extra) -> 1.05));
        assertEquals("Random common cause", c.name());
        assertTrue(c.passed());
        assertTrue(c.detail().contains("<="));
    }

    @Test
    public void testRandomCommonCauseFailsBeyondOneSe() {
        RefutationCheck c = check(RefutationEngine.randomCommonCause(1.0, 0.1, (d, extra) -> 1.5));
        assertFalse(c.passed());
        assertTrue(c.detail().contains("destabilised"));
    }

    @Test
    public void testRandomCommonCauseAddsFreshNoiseColumn() {
        List<String> seen = new ArrayList<>();
        AtomicReference<double[]> noise = new AtomicReference<>();
        Dataset d = data().withColumn(RefutationEngine.NOISE_COLUMN, new double[500]);
        RefutationEngine.randomCommonCause(0, 1, (p, extra) -> {
            seen.addAll(extra);
            noise.set(p.column(extra.get(0)));
            return 0;
        }).run(d);

        assertEquals(List.of("__rcc"), seen);
        assertFalse(d.hasColumn("__rcc"));
        double mean = 0;
        for (double v : noise.get())
            mean += v / 500;
        assertEquals(0.0, mean, 0.2);
    }

    @Test
    public void testSameSeedSameNoise() {
        List<double[]> draws = new ArrayList<>();
        Reestimator capture = (p, extra) -> {
            draws.add(p.column(extra.get(0)));
            return 0;
        };
        RefutationEngine.randomCommonCause(0, 1, capture).run(data());
        RefutationEngine.randomCommonCause(0, 1, capture).run(data());
        RefutationEngine.randomCommonCause(0, 1, 7L, capture).run(data());
        assertArrayEquals(draws.get(0), draws.get(1), 0.0);
        assertFalse(draws.get(0)[0] == draws.get(2)[0]);
    }

    @Test
    public void testRandomCommonCauseStableAcrossSeeds() {
        Dataset d = data();
        var fit = CommonsMathBackend.INSTANCE.ols(d, "y", List.of("t")).coefficient("t");
        Reestimator ols = (p, extra) -> {
            List<String> regressors = new ArrayList<>(List.of("t"));
            regressors.addAll(extra);
            return CommonsMathBackend.INSTANCE.ols(p, "y", regressors).estimate("t");
        };
        int passed = 0;
        for (long seed = 1; seed <= 100; seed++)
            if (RefutationEngine.randomCommonCause(fit.estimate(), fit.stdErr(), seed, ols).run(d).passed())
                passed++;
        assertTrue("passed " + passed + " of 100", passed >= 95);
    }

    @Test
    public void testDetailUsesDotDecimalsInAnyLocale() {
        Locale saved = Locale.getDefault();
        Locale.setDefault(Locale.GERMANY);
        try {
            RefutationCheck c = check(RefutationEngine.randomCommonCause(1.0, 0.25, (d, extra) -> 1.125));
            assertTrue(c.detail(), c.detail().contains("0.1250"));
            assertTrue(c.detail(), c.detail().contains("0.2500"));
            assertEquals("[0.1000, 0.2000]", new ConfidenceInterval(0.1, 0.2).toString());
        } finally {
            Locale.setDefault(saved);
        }
    }

    @Test
    public void testFailedReestimateBecomesFailedCheck() {
        RefutationCheck c = check(RefutationEngine.randomCommonCause(1.0, 0.1, (d, extra) -> {
            throw new FittingException("singular");
        }));
        assertFalse(c.passed());
        assertTrue(c.detail().contains("singular"));
    }

    @Test
    public void testPlaceboPermutesColumn() {
        Dataset d = data();
        AtomicReference<double[]> permuted = new AtomicReference<>();
        RefutationCheck c = RefutationEngine.placebo("Placebo treatment", "t", 0.1, RefutationEngine.PLACEBO_SEED,
                (p, extra) -> {
                    assertTrue(extra.isEmpty());
                    permuted.set(p.column("t"));
                    return 0.05;
                }).run(d);

        assertTrue(c.passed());
        assertEquals("Placebo treatment", c.name());
        double[] original = d.column("t");
        double[] sortedOriginal = original.clone(), sortedPermuted = permuted.get().clone();
        Arrays.sort(sortedOriginal);
        Arrays.sort(sortedPermuted);
        assertArrayEquals(sortedOriginal, sortedPermuted, 0.0);
        assertFalse(Arrays.equals(original, permuted.get()));
    }

    @Test
    public void testPlaceboFailsOnLargeEffect() {
        RefutationCheck c = check(RefutationEngine.placebo("Placebo group", "t", 0.1, RefutationEngine.PLACEBO_SEED,
                (d, extra) -> -0.5));
        assertFalse(c.passed());
        assertTrue(c.detail().contains("spurious"));
    }

    @Test
    public void testPermutedTreatmentHasNoEffect() {
        Dataset d = data();
        double se = CommonsMathBackend.INSTANCE.ols(d, "y", List.of("t")).coefficient("t").stdErr();
        RefutationCheck c = RefutationEngine.placebo("Placebo treatment", "t", 10 * se,
                RefutationEngine.PLACEBO_SEED,
                (p, extra) -> CommonsMathBackend.INSTANCE.ols(p, "y", List.of("t")).estimate("t")).run(d);
        assertTrue(c.detail(), c.passed());
    }

    @Test
    public void testFirstStageStrength() {
        RefutationCheck strong = check(RefutationEngine.firstStageStrength(CommonsMathBackend.INSTANCE, "t", "z",
                List.of()));
        assertEquals("First-stage F-statistic", strong.name());
        assertTrue(strong.detail(), strong.passed());

        RefutationCheck weak = check(RefutationEngine.firstStageStrength(CommonsMathBackend.INSTANCE, "t", "z",
                List.of(), Double.MAX_VALUE));
        assertFalse(weak.passed());
        assertTrue(weak.detail().contains("Weak instrument"));
    }

    @Test
    public void testRunKeepsOrder() {
        RefutationReport report = RefutationEngine.run("Report", data(), List.of(
                RefutationEngine.randomCommonCause(1.0, 0.1, (d, extra) -> 1.0),
                RefutationEngine.placebo("Placebo treatment", "t", 0.1, 1L, (d, extra) -> 3.0)));
        assertEquals(2, report.checks().size());
        assertEquals("Random common cause", report.checks().get(0).name());
        assertEquals("Placebo treatment", report.checks().get(1).name());
        assertFalse(report.passed());
        assertEquals(1, report.failedChecks().size());
    }
}
