package com.formative.fit;

/**
 * The four statistics reported for one regressor.
 *
 * @param estimate point estimate
 * @param stdErr   standard error
 * @param confInt  95% two-sided confidence interval
 * @param pValue   two-sided p-value for {@code H0: coefficient = 0}
 */
public record Coefficient(double estimate, double stdErr, ConfidenceInterval confInt, double pValue) {
}
