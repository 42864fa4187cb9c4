package com.formative.fit;

import java.util.*;

/**
 * Coefficient statistics keyed by variable name, as returned by the fitting
 * collaborator. The intercept is keyed {@value FittingBackend#INTERCEPT}.
 *
 * @param coefficients per-variable statistics, in design-matrix column order
 * @param residualDof  residual degrees of freedom ({@code n - k})
 * @param rss          residual sum of squares
 */
public record RegressionResult(Map<String, Coefficient> coefficients, int residualDof, double rss) {

    public RegressionResult {
        coefficients = Collections.unmodifiableMap(new LinkedHashMap<>(coefficients));
    }

    /**
     * @throws IllegalArgumentException if the variable was not a regressor
     */
    public Coefficient coefficient(String name) {
        Coefficient c = coefficients.get(name);
        if (c == null)
            throw new IllegalArgumentException("No coefficient for '" + name + "'. Regressors: "
                    + coefficients.keySet());
        return c;
    }

    public double estimate(String name) {
        return coefficient(name).estimate();
    }
}
