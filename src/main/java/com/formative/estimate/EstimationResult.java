package com.formative.estimate;

import com.formative.api.Assumption;
import com.formative.api.ValidationException;
import com.formative.data.Dataset;
import com.formative.fit.Coefficient;
import com.formative.fit.ConfidenceInterval;
import com.formative.refute.RefutationReport;

import java.util.*;

/**
 * Immutable outcome of a successful {@link Estimator#fit}.
 *
 * <p>
 * Carries the causal estimate, the naive estimate where the method has one, so
 * the bias removed by adjustment is visible as their difference, and the
 * adjustment set that was actually used.
 */
public abstract class EstimationResult {
    private final String treatment;
    private final String outcome;
    private final double effect;
    private final OptionalDouble unadjustedEffect;
    private final double stdErr;
    private final ConfidenceInterval confInt;
    private final double pValue;
    private final SortedSet<String> adjustmentSet;
    private final List<Assumption> assumptions;

    protected EstimationResult(String treatment, String outcome, double effect, OptionalDouble unadjustedEffect,
            double stdErr, ConfidenceInterval confInt, double pValue, Set<String> adjustmentSet,
            List<Assumption> assumptions) {
        this.treatment = treatment;
        this.outcome = outcome;
        this.effect = effect;
        this.unadjustedEffect = unadjustedEffect;
        this.stdErr = stdErr;
        this.confInt = confInt;
        this.pValue = pValue;
        this.adjustmentSet = Collections.unmodifiableSortedSet(new TreeSet<>(adjustmentSet));
        this.assumptions = List.copyOf(assumptions);
    }

    protected EstimationResult(String treatment, String outcome, Coefficient c, OptionalDouble unadjustedEffect,
            Set<String> adjustmentSet, List<Assumption> assumptions) {
        this(treatment, outcome, c.estimate(), unadjustedEffect, c.stdErr(), c.confInt(), c.pValue(),
                adjustmentSet, assumptions);
    }

    /** Short method label, e.g. {@code "OLS"}. */
    public abstract String method();

    /**
     * Runs this method's refutation checks against {@code data}, normally the
     * dataset passed to {@code fit}. Failed checks are reported, never thrown.
     */
    public abstract RefutationReport refute(Dataset data);

    public String treatment() {
        return treatment;
    }

    public String outcome() {
        return outcome;
    }

    /** Point estimate of the causal effect. */
    public double effect() {
        return effect;
    }

    /** Naive estimate without controls or instrumenting; empty where the method has none. */
    public OptionalDouble unadjustedEffect() {
        return unadjustedEffect;
    }

    public double stdErr() {
        return stdErr;
    }

    /** 95% two-sided confidence interval. */
    public ConfidenceInterval confInt() {
        return confInt;
    }

    /** Two-sided p-value for {@code H0: effect = 0}. */
    public double pValue() {
        return pValue;
    }

    /** Variables controlled for; empty for methods that do not adjust. */
    public SortedSet<String> adjustmentSet() {
        return adjustmentSet;
    }

    public List<Assumption> assumptions() {
        return assumptions;
    }

    /** Role label to column name, in role order. */
    protected Map<String, String> roleColumns() {
        Map<String, String> roles = new LinkedHashMap<>();
        roles.put("Treatment", treatment);
        roles.put("Outcome", outcome);
        return roles;
    }

    /**
     * Checks that {@code data} has every role and adjustment-set column, so
     * refutation re-fits run on the same variables as the original fit.
     */
    protected void requireColumns(Dataset data) {
        for (Map.Entry<String, String> role : roleColumns().entrySet())
            if (!data.hasColumn(role.getValue()))
                throw new ValidationException(ValidationException.Kind.MISSING_COLUMN,
                        role.getKey() + " column '" + role.getValue() + "' not found in dataset.");
        for (String control : adjustmentSet)
            if (!data.hasColumn(control))
                throw new ValidationException(ValidationException.Kind.MISSING_COLUMN,
                        "Control column '" + control + "' not found in dataset.");
    }

    protected String title() {
        return method() + " Refutation Report: " + treatment + " -> " + outcome;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%s[%s -> %s: effect=%.4f, se=%.4f, ci=%s, p=%.4f, adjust=%s]",
                method(), treatment, outcome, effect, stdErr, confInt, pValue, adjustmentSet);
    }
}
