package com.formative.estimate;

import com.formative.api.Assumption;
import com.formative.api.ValidationException;
import com.formative.data.Dataset;
import com.formative.fit.CommonsMathBackend;
import com.formative.fit.FittingBackend;
import com.formative.fit.RegressionResult;
import com.formative.graph.CausalGraph;
import com.formative.refute.RefutationEngine;
import com.formative.refute.RefutationReport;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Randomized controlled trial: the ATE by OLS of outcome on treatment.
 *
 * <p>
 * Random assignment means treatment has no causes, so the treatment node must
 * have no parents in the DAG. That is checked at construction. No confounder
 * adjustment is done.
 */
@Log4j2
public final class RandomizedTrial extends AbstractEstimator<RandomizedTrial.Result> {
    public static final List<Assumption> ASSUMPTIONS = List.of(
            Assumption.untestable("Random assignment of treatment"),
            Assumption.untestable("Excludability: assignment affects outcome only through treatment received"),
            Assumption.untestable("Stable Unit Treatment Value Assumption (SUTVA)"));

    private final String treatment;
    private final String outcome;

    public RandomizedTrial(CausalGraph graph, String treatment, String outcome) {
        this(graph, treatment, outcome, CommonsMathBackend.INSTANCE);
    }

    public RandomizedTrial(CausalGraph graph, String treatment, String outcome, FittingBackend backend) {
        super(graph, backend, new Role("Treatment", treatment), new Role("Outcome", outcome));
        this.treatment = treatment;
        this.outcome = outcome;

        Set<String> parents = graph.parents(treatment);
        if (!parents.isEmpty())
            throw new ValidationException(ValidationException.Kind.NOT_RANDOMIZED,
                    "In an RCT, treatment is randomly assigned and must have no causes in the DAG. '"
                            + treatment + "' has declared causes: " + new TreeSet<>(parents)
                            + ". Remove these edges, or use ObservationalOls / PropensityScoreMatching "
                            + "if treatment is not randomised.");
    }

    /** Treatment may be binary or continuous. */
    @Override
    public Result fit(Dataset data) {
        requireColumns(data);
        RegressionResult r = backend.ols(data, outcome, List.of(treatment));
        Result result = new Result(this, r);
        log.info("Fitted {}", result);
        return result;
    }

    @Override
    public List<Assumption> assumptions() {
        return ASSUMPTIONS;
    }

    /** ATE estimate. Has no unadjusted counterpart. */
    public static final class Result extends EstimationResult {
        private final FittingBackend backend;
        private final RegressionResult regression;

        private Result(RandomizedTrial est, RegressionResult r) {
            super(est.treatment, est.outcome, r.coefficient(est.treatment), OptionalDouble.empty(), Set.of(),
                    ASSUMPTIONS);
            this.backend = est.backend;
            this.regression = r;
        }

        @Override
        public String method() {
            return "RCT";
        }

        /** Full fit of {@code outcome ~ treatment}; the intercept is the control-arm mean. */
        public RegressionResult regression() {
            return regression;
        }

        /**
         * Under randomisation the ATE does not depend on any extra covariate, so
         * a random common cause must not move it.
         */
        @Override
        public RefutationReport refute(Dataset data) {
            requireColumns(data);
            return RefutationEngine.run(title(), data, List.of(
                    RefutationEngine.randomCommonCause(effect(), stdErr(),
                            (d, extra) -> backend.ols(d, outcome(), concat(treatment(), extra))
                                    .estimate(treatment()))));
        }
    }
}
