package com.formative.fit;

import com.formative.data.Dataset;

import java.util.List;

/**
 * The numeric fitting collaborator.
 *
 * <p>
 * Estimators decide what to fit from the causal graph and delegate how to fit
 * it here. Implementations follow standard linear, logistic and 2SLS semantics
 * and signal numeric failure (singular design, non-convergence, no residual
 * degrees of freedom) with {@link com.formative.api.FittingException}.
 */
public interface FittingBackend {

    /** Name under which the intercept is reported. */
    String INTERCEPT = "Intercept";

    /** Ordinary least squares of {@code outcome ~ 1 + regressors}. */
    RegressionResult ols(Dataset data, String outcome, List<String> regressors);

    /**
     * Logistic regression of binary {@code treatment ~ 1 + covariates}.
     *
     * @return fitted probabilities, one per row (propensity scores)
     */
    double[] logit(Dataset data, String treatment, List<String> covariates);

    /**
     * Two-stage least squares. Exogenous regressors are
     * {@code [1, endogenous] + controls}, instruments {@code [1, instrument] + controls}.
     * Statistics are keyed by the exogenous names, so the causal effect is
     * {@code coefficient(endogenous)}.
     */
    RegressionResult twoStageLeastSquares(Dataset data, String outcome, String endogenous, String instrument,
            List<String> controls);

    /**
     * Partial F-statistic for {@code H0: instrument coefficient = 0} in the
     * first-stage regression {@code treatment ~ 1 + instrument + controls}.
     */
    double firstStageF(Dataset data, String treatment, String instrument, List<String> controls);

    /**
     * 1-to-1 nearest-neighbour matching on propensity score, with replacement.
     *
     * @return the ATT: mean outcome difference across matched pairs
     */
    double nearestNeighbourAtt(double[] treatment, double[] outcome, double[] propensity);
}
