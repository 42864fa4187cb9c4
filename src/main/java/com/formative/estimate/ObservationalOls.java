package com.formative.estimate;

import com.formative.api.Assumption;
import com.formative.data.Dataset;
import com.formative.fit.CommonsMathBackend;
import com.formative.fit.FittingBackend;
import com.formative.fit.RegressionResult;
import com.formative.graph.CausalGraph;
import com.formative.identify.Identification;
import com.formative.refute.RefutationEngine;
import com.formative.refute.RefutationReport;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Observational OLS with DAG-based confounder identification.
 *
 * <ol>
 * <li>Finds the adjustment set with the backdoor criterion.</li>
 * <li>Refuses to run when a declared confounder is unmeasured: proceeding
 * would silently produce a biased estimate.</li>
 * <li>Fits {@code outcome ~ treatment + controls} for the causal estimate and
 * {@code outcome ~ treatment} for the naive one.</li>
 * </ol>
 *
 * <pre>{@code
 * CausalGraph g = Formative.graph();
 * g.assume("ability").causes("education", "income");
 * g.assume("education").causes("income");
 * ObservationalOls.Result r = new ObservationalOls(g, "education", "income").fit(data);
 * }</pre>
 */
@Log4j2
public final class ObservationalOls extends AbstractEstimator<ObservationalOls.Result> {
    public static final List<Assumption> ASSUMPTIONS = List.of(
            Assumption.untestable("Conditional ignorability: the DAG captures every confounder of treatment and outcome"),
            Assumption.testable("Linearity: the outcome is linear in treatment and controls"),
            Assumption.untestable("Stable Unit Treatment Value Assumption (SUTVA)"));

    private final String treatment;
    private final String outcome;

    public ObservationalOls(CausalGraph graph, String treatment, String outcome) {
        this(graph, treatment, outcome, CommonsMathBackend.INSTANCE);
    }

    public ObservationalOls(CausalGraph graph, String treatment, String outcome, FittingBackend backend) {
        super(graph, backend, new Role("Treatment", treatment), new Role("Outcome", outcome));
        this.treatment = treatment;
        this.outcome = outcome;
    }

    @Override
    public Result fit(Dataset data) {
        requireColumns(data);
        Identification id = identifyFullyObserved(data, treatment, outcome);
        List<String> controls = id.controls();

        RegressionResult adjusted = backend.ols(data, outcome, concat(treatment, controls));
        RegressionResult unadjusted = backend.ols(data, outcome, List.of(treatment));

        Result result = new Result(this, adjusted, unadjusted, id.adjustmentSet());
        log.info("Fitted {}", result);
        return result;
    }

    @Override
    public List<Assumption> assumptions() {
        return ASSUMPTIONS;
    }

    /** OLS estimate adjusted for the backdoor set, next to the naive estimate. */
    public static final class Result extends EstimationResult {
        private final FittingBackend backend;
        private final RegressionResult regression;
        private final RegressionResult unadjustedRegression;

        private Result(ObservationalOls est, RegressionResult adjusted, RegressionResult unadjusted,
                Set<String> adjustmentSet) {
            super(est.treatment, est.outcome, adjusted.coefficient(est.treatment),
                    OptionalDouble.of(unadjusted.estimate(est.treatment)), adjustmentSet, ASSUMPTIONS);
            this.backend = est.backend;
            this.regression = adjusted;
            this.unadjustedRegression = unadjusted;
        }

        @Override
        public String method() {
            return "OLS";
        }

        /** Full fit of {@code outcome ~ treatment + controls}, intercept and controls included. */
        public RegressionResult regression() {
            return regression;
        }

        /** Full fit of {@code outcome ~ treatment}. */
        public RegressionResult unadjustedRegression() {
            return unadjustedRegression;
        }

        /** Runs the random common cause check. */
        @Override
        public RefutationReport refute(Dataset data) {
            requireColumns(data);
            List<String> controls = List.copyOf(adjustmentSet());
            return RefutationEngine.run(title(), data, List.of(
                    RefutationEngine.randomCommonCause(effect(), stdErr(),
                            (d, extra) -> backend.ols(d, outcome(), concat(treatment(), concat(controls, extra)))
                                    .estimate(treatment()))));
        }
    }
}
