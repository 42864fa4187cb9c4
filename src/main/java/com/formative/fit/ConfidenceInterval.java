package com.formative.fit;

import java.util.Locale;

/** Two-sided confidence interval. */
public record ConfidenceInterval(double lower, double upper) {

    public boolean contains(double value) {
        return value >= lower && value <= upper;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "[%.4f, %.4f]", lower, upper);
    }
}
