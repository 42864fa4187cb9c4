package com.formative.estimate;

import com.formative.api.FittingException;
import com.formative.data.Dataset;
import com.formative.fit.ConfidenceInterval;

import java.util.Arrays;
import java.util.function.ToDoubleFunction;
import java.util.stream.IntStream;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import lombok.extern.log4j.Log4j2;

/**
 * Nonparametric bootstrap over dataset rows.
 *
 * <p>
 * All resample indices are drawn up front from a single generator seeded with
 * the given seed, so the result does not depend on how replicates are
 * scheduled. Replicates are then fitted on a parallel stream, each writing only
 * its own slot.
 */
@Log4j2
final class Bootstrap {
    private final int replicates;
    private final long seed;

    Bootstrap(int replicates, long seed) {
        this.replicates = replicates;
        this.seed = seed;
    }

    /**
     * @return the statistic of each replicate whose fit succeeded, in draw order
     * @throws FittingException if fewer than two replicates succeeded
     */
    double[] run(Dataset data, ToDoubleFunction<Dataset> statistic) {
        int n = data.rowCount();
        RandomGenerator rng = new Well19937c(seed);
        int[][] draws = new int[replicates][n];
        for (int b = 0; b < replicates; b++)
            for (int i = 0; i < n; i++)
                draws[b][i] = rng.nextInt(n);

        double[] slots = new double[replicates];
        IntStream.range(0, replicates).parallel().forEach(b -> {
            try {
                slots[b] = statistic.applyAsDouble(data.withRows(draws[b]));
            } catch (FittingException e) {
                log.warn("Bootstrap replicate {} skipped: {}", b, e.getMessage());
                slots[b] = Double.NaN;
            }
        });

        double[] effects = Arrays.stream(slots).filter(v -> !Double.isNaN(v)).toArray();
        if (effects.length < 2)
            throw new FittingException("Only " + effects.length + " of " + replicates
                    + " bootstrap replicates could be fitted");
        if (effects.length < replicates)
            log.warn("{} of {} bootstrap replicates skipped", replicates - effects.length, replicates);
        return effects;
    }

    /** Sample standard deviation (n - 1 denominator). */
    static double stdErr(double[] effects) {
        return new StandardDeviation(true).evaluate(effects);
    }

    /** 2.5th and 97.5th percentiles, linearly interpolated. */
    static ConfidenceInterval percentileInterval(double[] effects) {
        Percentile p = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        p.setData(effects);
        return new ConfidenceInterval(p.evaluate(2.5), p.evaluate(97.5));
    }
}
