package com.formative.estimate;

import com.formative.api.Assumption;
import com.formative.data.Dataset;
import com.formative.fit.CommonsMathBackend;
import com.formative.fit.FittingBackend;
import com.formative.graph.CausalGraph;
import com.formative.identify.Identification;
import com.formative.refute.RefutationEngine;
import com.formative.refute.RefutationReport;

import java.util.*;

import org.apache.commons.math3.distribution.NormalDistribution;

import lombok.extern.log4j.Log4j2;

/**
 * Propensity-score matching for the average treatment effect on the treated
 * (ATT).
 *
 * <ol>
 * <li>Finds confounders with the backdoor criterion; every one of them must be
 * measured.</li>
 * <li>Fits {@code P(treatment = 1 | controls)} by logistic regression.</li>
 * <li>Matches each treated unit to its nearest control on the score, with
 * replacement, and averages the outcome differences.</li>
 * <li>Bootstraps the whole procedure for standard error, percentile interval
 * and normal-approximation p-value.</li>
 * </ol>
 * Treatment must be coded 0/1 with both levels present.
 */
@Log4j2
public final class PropensityScoreMatching extends AbstractEstimator<PropensityScoreMatching.Result> {
    public static final int DEFAULT_BOOTSTRAP_REPLICATES = 500;
    public static final long DEFAULT_BOOTSTRAP_SEED = 42L;

    public static final List<Assumption> ASSUMPTIONS = List.of(
            Assumption.untestable("Conditional independence: no unobserved confounders given the propensity score"),
            Assumption.testable("Common support: overlap in propensity scores between treated and control"),
            Assumption.untestable("Correct specification: the logistic propensity model is correctly specified"),
            Assumption.untestable("Stable Unit Treatment Value Assumption (SUTVA)"));

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution();

    private final String treatment;
    private final String outcome;
    private final int replicates;
    private final long seed;

    public PropensityScoreMatching(CausalGraph graph, String treatment, String outcome) {
        this(graph, treatment, outcome, CommonsMathBackend.INSTANCE);
    }

    public PropensityScoreMatching(CausalGraph graph, String treatment, String outcome, FittingBackend backend) {
        this(graph, treatment, outcome, backend, DEFAULT_BOOTSTRAP_REPLICATES, DEFAULT_BOOTSTRAP_SEED);
    }

    public PropensityScoreMatching(CausalGraph graph, String treatment, String outcome, FittingBackend backend,
            int replicates, long seed) {
        super(graph, backend, new Role("Treatment", treatment), new Role("Outcome", outcome));
        if (replicates < 2)
            throw new IllegalArgumentException("Need at least 2 bootstrap replicates, got " + replicates);
        this.treatment = treatment;
        this.outcome = outcome;
        this.replicates = replicates;
        this.seed = seed;
    }

    @Override
    public Result fit(Dataset data) {
        requireColumns(data);
        requireBinary(data, "Treatment", treatment);
        requireBothLevels(data, "Treatment", treatment);
        Identification id = identifyFullyObserved(data, treatment, outcome);
        List<String> controls = id.controls();

        double unadjusted = data.meanWhere(outcome, treatment, 1.0) - data.meanWhere(outcome, treatment, 0.0);
        double att = att(backend, data, treatment, outcome, controls);

        Dataset sample = data.select(concat(List.of(treatment, outcome), controls));
        double[] effects = new Bootstrap(replicates, seed)
                .run(sample, d -> att(backend, d, treatment, outcome, controls));

        Result result = new Result(this, att, unadjusted, effects, id.adjustmentSet());
        log.info("Fitted {} from {} bootstrap replicates", result, effects.length);
        return result;
    }

    @Override
    public List<Assumption> assumptions() {
        return ASSUMPTIONS;
    }

    static double att(FittingBackend backend, Dataset data, String treatment, String outcome,
            List<String> covariates) {
        double[] scores = backend.logit(data, treatment, covariates);
        return backend.nearestNeighbourAtt(data.column(treatment), data.column(outcome), scores);
    }

    /** Matched ATT with bootstrap inference, next to the raw mean difference. */
    public static final class Result extends EstimationResult {
        private final FittingBackend backend;
        private final double[] bootstrapEffects;

        private Result(PropensityScoreMatching est, double att, double unadjusted, double[] effects,
                Set<String> adjustmentSet) {
            this(est, att, unadjusted, effects, Bootstrap.stdErr(effects), adjustmentSet);
        }

        private Result(PropensityScoreMatching est, double att, double unadjusted, double[] effects, double se,
                Set<String> adjustmentSet) {
            super(est.treatment, est.outcome, att, OptionalDouble.of(unadjusted), se,
                    Bootstrap.percentileInterval(effects), pValue(att, se), adjustmentSet, ASSUMPTIONS);
            this.backend = est.backend;
            this.bootstrapEffects = effects;
        }

        private static double pValue(double att, double se) {
            if (se == 0.0)
                return att == 0.0 ? 1.0 : 0.0;
            return 2.0 * STANDARD_NORMAL.cumulativeProbability(-Math.abs(att / se));
        }

        @Override
        public String method() {
            return "Matching";
        }

        /** ATT of each surviving bootstrap replicate. A copy. */
        public double[] bootstrapEffects() {
            return bootstrapEffects.clone();
        }

        /**
         * Runs placebo treatment (permuted treatment labels, matching redone) and
         * random common cause (noise added to the propensity model).
         */
        @Override
        public RefutationReport refute(Dataset data) {
            requireColumns(data);
            String t = treatment(), y = outcome();
            List<String> controls = List.copyOf(adjustmentSet());
            return RefutationEngine.run(title(), data, List.of(
                    RefutationEngine.placebo("Placebo treatment", t, stdErr(), RefutationEngine.PLACEBO_SEED,
                            (d, extra) -> att(backend, d, t, y, concat(controls, extra))),
                    RefutationEngine.randomCommonCause(effect(), stdErr(),
                            (d, extra) -> att(backend, d, t, y, concat(controls, extra)))));
        }
    }
}
