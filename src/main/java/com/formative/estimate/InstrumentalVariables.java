package com.formative.estimate;

import com.formative.api.Assumption;
import com.formative.data.Dataset;
import com.formative.fit.CommonsMathBackend;
import com.formative.fit.FittingBackend;
import com.formative.fit.RegressionResult;
import com.formative.graph.CausalGraph;
import com.formative.identify.Identification;
import com.formative.identify.IdentificationEngine;
import com.formative.identify.InstrumentValidator;
import com.formative.refute.RefutationEngine;
import com.formative.refute.RefutationReport;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Instrumental variables by two-stage least squares.
 *
 * <p>
 * The DAG is used to:
 * <ol>
 * <li>check relevance and the exclusion restriction of the instrument, at
 * construction and before any data is touched;</li>
 * <li>find observed confounders to include as controls in both stages.
 * Unobserved confounders are expected here and tolerated: handling them is
 * what the instrument is for.</li>
 * </ol>
 * The instrument is never part of the adjustment set.
 */
@Log4j2
public final class InstrumentalVariables extends AbstractEstimator<InstrumentalVariables.Result> {
    public static final List<Assumption> ASSUMPTIONS = List.of(
            Assumption.testable("Relevance: the instrument strongly affects treatment"),
            Assumption.untestable("Exclusion restriction: instrument only affects outcome through treatment"),
            Assumption.untestable("Independence: instrument is uncorrelated with unobserved confounders"),
            Assumption.untestable("Monotonicity: instrument affects treatment in same direction for everyone"));

    private final String treatment;
    private final String outcome;
    private final String instrument;

    public InstrumentalVariables(CausalGraph graph, String treatment, String outcome, String instrument) {
        this(graph, treatment, outcome, instrument, CommonsMathBackend.INSTANCE);
    }

    public InstrumentalVariables(CausalGraph graph, String treatment, String outcome, String instrument,
            FittingBackend backend) {
        super(graph, backend, new Role("Treatment", treatment), new Role("Outcome", outcome),
                new Role("Instrument", instrument));
        this.treatment = treatment;
        this.outcome = outcome;
        this.instrument = instrument;
        InstrumentValidator.validate(graph, treatment, outcome, instrument);
    }

    @Override
    public Result fit(Dataset data) {
        requireColumns(data);
        Identification id = IdentificationEngine.identify(graph, treatment, outcome, data.columns(), instrument);
        if (!id.fullyObserved())
            log.info("Unobserved confounders {} of {} -> {} left to instrument '{}'",
                    id.missingConfounders(), treatment, outcome, instrument);
        List<String> controls = id.controls();

        RegressionResult iv = backend.twoStageLeastSquares(data, outcome, treatment, instrument, controls);
        RegressionResult unadjusted = backend.ols(data, outcome, List.of(treatment));

        Result result = new Result(this, iv, unadjusted, id);
        log.info("Fitted {}", result);
        return result;
    }

    @Override
    public List<Assumption> assumptions() {
        return ASSUMPTIONS;
    }

    public String instrument() {
        return instrument;
    }

    /** 2SLS estimate (a LATE), next to the naive OLS estimate. */
    public static final class Result extends EstimationResult {
        private final FittingBackend backend;
        private final String instrument;
        private final SortedSet<String> unobservedConfounders;
        private final RegressionResult regression;
        private final RegressionResult unadjustedRegression;

        private Result(InstrumentalVariables est, RegressionResult iv, RegressionResult unadjusted,
                Identification id) {
            super(est.treatment, est.outcome, iv.coefficient(est.treatment),
                    OptionalDouble.of(unadjusted.estimate(est.treatment)), id.adjustmentSet(), ASSUMPTIONS);
            this.backend = est.backend;
            this.regression = iv;
            this.unadjustedRegression = unadjusted;
            this.instrument = est.instrument;
            this.unobservedConfounders = id.missingConfounders();
        }

        @Override
        public String method() {
            return "IV";
        }

        public String instrument() {
            return instrument;
        }

        /** Second-stage coefficients of the 2SLS fit, keyed by exogenous name. */
        public RegressionResult regression() {
            return regression;
        }

        /** Naive OLS fit of {@code outcome ~ treatment}. */
        public RegressionResult unadjustedRegression() {
            return unadjustedRegression;
        }

        @Override
        protected Map<String, String> roleColumns() {
            Map<String, String> roles = super.roleColumns();
            roles.put("Instrument", instrument);
            return roles;
        }

        /** Declared confounders without a column, handled by the instrument. */
        public SortedSet<String> unobservedConfounders() {
            return unobservedConfounders;
        }

        /**
         * Runs the first-stage F-statistic (instrument strength) and the random
         * common cause check, the noise column entering both stages.
         */
        @Override
        public RefutationReport refute(Dataset data) {
            requireColumns(data);
            List<String> controls = List.copyOf(adjustmentSet());
            return RefutationEngine.run(title() + " (instrument: " + instrument + ")", data, List.of(
                    RefutationEngine.firstStageStrength(backend, treatment(), instrument, controls),
                    RefutationEngine.randomCommonCause(effect(), stdErr(),
                            (d, extra) -> backend.twoStageLeastSquares(d, outcome(), treatment(), instrument,
                                    concat(controls, extra)).estimate(treatment()))));
        }
    }
}
