package com.formative.estimate;

import com.formative.api.Assumption;
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
 * Difference-in-differences: the ATT from a two-by-two group × period design.
 *
 * <p>
 * Fitted as {@code outcome ~ group + time + group:time}; the interaction
 * coefficient is the estimate. Any trend common to both groups cancels out.
 * The DAG only validates that group, time and outcome are declared nodes: the
 * design supplies identification, so the backdoor criterion is not applied.
 *
 * <p>
 * Group (0 = control, 1 = treated) and time (0 = pre, 1 = post) must be coded
 * 0/1.
 */
@Log4j2
public final class DifferenceInDifferences extends AbstractEstimator<DifferenceInDifferences.Result> {
    public static final List<Assumption> ASSUMPTIONS = List.of(
            Assumption.untestable("Parallel trends: treated and control groups would have followed "
                    + "the same trend absent treatment"),
            Assumption.untestable("No anticipation: treatment does not affect outcomes before it begins"),
            Assumption.untestable("Stable group composition: group membership does not change due to treatment"),
            Assumption.untestable("Stable Unit Treatment Value Assumption (SUTVA)"));

    private final String group;
    private final String time;
    private final String outcome;

    public DifferenceInDifferences(CausalGraph graph, String group, String time, String outcome) {
        this(graph, group, time, outcome, CommonsMathBackend.INSTANCE);
    }

    public DifferenceInDifferences(CausalGraph graph, String group, String time, String outcome,
            FittingBackend backend) {
        super(graph, backend, new Role("Group", group), new Role("Time", time), new Role("Outcome", outcome));
        this.group = group;
        this.time = time;
        this.outcome = outcome;
    }

    @Override
    public Result fit(Dataset data) {
        requireColumns(data);
        requireBinary(data, "Group", group);
        requireBinary(data, "Time", time);

        double[] g = data.column(group), t = data.column(time), y = data.column(outcome);
        double treatedPost = 0, controlPost = 0;
        int nTreatedPost = 0, nControlPost = 0;
        for (int i = 0; i < y.length; i++) {
            if (t[i] != 1.0)
                continue;
            if (g[i] == 1.0) {
                treatedPost += y[i];
                nTreatedPost++;
            } else {
                controlPost += y[i];
                nControlPost++;
            }
        }
        double naiveDiff = treatedPost / nTreatedPost - controlPost / nControlPost;

        Interaction fit = interaction(backend, data, group, time, outcome, List.of());
        Result result = new Result(this, fit, naiveDiff);
        log.info("Fitted {}", result);
        return result;
    }

    @Override
    public List<Assumption> assumptions() {
        return ASSUMPTIONS;
    }

    private record Interaction(RegressionResult regression, String term) {
        double estimate() {
            return regression.estimate(term);
        }
    }

    private static Interaction interaction(FittingBackend backend, Dataset data, String group, String time,
            String outcome, List<String> extra) {
        double[] g = data.column(group), t = data.column(time);
        double[] gt = new double[g.length];
        for (int i = 0; i < gt.length; i++)
            gt[i] = g[i] * t[i];
        String term = data.freshColumnName(group + ":" + time);
        List<String> regressors = new ArrayList<>(List.of(group, time, term));
        regressors.addAll(extra);
        return new Interaction(backend.ols(data.withColumn(term, gt), outcome, regressors), term);
    }

    /** ATT under parallel trends, next to the naive post-period difference. */
    public static final class Result extends EstimationResult {
        private final FittingBackend backend;
        private final String time;
        private final RegressionResult regression;
        private final String interactionTerm;

        private Result(DifferenceInDifferences est, Interaction fit, double naiveDiff) {
            super(est.group, est.outcome, fit.regression().coefficient(fit.term()), OptionalDouble.of(naiveDiff),
                    Set.of(), ASSUMPTIONS);
            this.backend = est.backend;
            this.time = est.time;
            this.regression = fit.regression();
            this.interactionTerm = fit.term();
        }

        @Override
        public String method() {
            return "DiD";
        }

        public String group() {
            return treatment();
        }

        public String time() {
            return time;
        }

        /**
         * Full fit of {@code outcome ~ group + time + group:time}. The
         * interaction is keyed by {@link #interactionTerm()}.
         */
        public RegressionResult regression() {
            return regression;
        }

        /** Name of the interaction regressor, normally {@code group:time}. */
        public String interactionTerm() {
            return interactionTerm;
        }

        @Override
        protected Map<String, String> roleColumns() {
            Map<String, String> roles = new LinkedHashMap<>();
            roles.put("Group", group());
            roles.put("Time", time);
            roles.put("Outcome", outcome());
            return roles;
        }

        /** Treated post-period mean minus control post-period mean. */
        public double naiveDiff() {
            return unadjustedEffect().getAsDouble();
        }

        /**
         * Runs placebo group, placebo time and random common cause. The
         * interaction is rebuilt from the perturbed columns each time.
         */
        @Override
        public RefutationReport refute(Dataset data) {
            requireColumns(data);
            String g = group(), y = outcome();
            return RefutationEngine.run(method() + " Refutation Report: " + g + " x " + time + " -> " + y, data,
                    List.of(
                            RefutationEngine.placebo("Placebo group", g, stdErr(), RefutationEngine.PLACEBO_SEED,
                                    (d, extra) -> interaction(backend, d, g, time, y, extra).estimate()),
                            RefutationEngine.placebo("Placebo time", time, stdErr(),
                                    RefutationEngine.PLACEBO_TIME_SEED,
                                    (d, extra) -> interaction(backend, d, g, time, y, extra).estimate()),
                            RefutationEngine.randomCommonCause(effect(), stdErr(),
                                    (d, extra) -> interaction(backend, d, g, time, y, extra).estimate())));
        }
    }
}
