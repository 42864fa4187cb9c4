package com.formative.data;

import java.util.*;

/**
 * Immutable, column-major table of numeric observations keyed by column name.
 *
 * <p>
 * Column names match node names in the causal graph. A graph node with no
 * column here is treated as unobserved. All columns share one length and hold
 * finite values only; drop incomplete rows before building a dataset.
 *
 * <p>
 * Perturbing operations ({@link #withColumn}, {@link #withRows}) return a new
 * dataset and leave this one untouched.
 */
public final class Dataset {
    private final Map<String, double[]> columns;
    private final int rowCount;

    private Dataset(Map<String, double[]> columns, int rowCount) {
        this.columns = columns;
        this.rowCount = rowCount;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Column names in insertion order. Read-only. */
    public Set<String> columns() {
        return Collections.unmodifiableSet(columns.keySet());
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    public int rowCount() {
        return rowCount;
    }

    /** A copy of the named column. */
    public double[] column(String name) {
        return require(name).clone();
    }

    public double value(String name, int row) {
        return require(name)[row];
    }

    /** Mean of the column over the rows where {@code filter} equals {@code level}. */
    public double meanWhere(String name, String filter, double level) {
        double[] values = require(name);
        double[] f = require(filter);
        double sum = 0;
        int n = 0;
        for (int i = 0; i < rowCount; i++) {
            if (f[i] == level) {
                sum += values[i];
                n++;
            }
        }
        return n == 0 ? Double.NaN : sum / n;
    }

    /** Distinct values of the column, ascending. */
    public SortedSet<Double> distinctValues(String name) {
        SortedSet<Double> out = new TreeSet<>();
        for (double v : require(name))
            out.add(v);
        return out;
    }

    /** True if every value of the column is 0 or 1. */
    public boolean isBinary(String name) {
        for (double v : require(name))
            if (v != 0.0 && v != 1.0)
                return false;
        return true;
    }

    /** A new dataset with {@code name} added, or replaced if already present. */
    public Dataset withColumn(String name, double[] values) {
        checkColumn(name, values, rowCount);
        Map<String, double[]> copy = new LinkedHashMap<>(columns);
        copy.put(name, values.clone());
        return new Dataset(copy, rowCount);
    }

    /**
     * A new dataset made of the given rows, in the given order. Rows may repeat,
     * which is how bootstrap resamples are drawn.
     */
    public Dataset withRows(int[] rows) {
        Map<String, double[]> copy = new LinkedHashMap<>(columns.size() * 2);
        for (var entry : columns.entrySet()) {
            double[] src = entry.getValue();
            double[] dst = new double[rows.length];
            for (int i = 0; i < rows.length; i++)
                dst[i] = src[rows[i]];
            copy.put(entry.getKey(), dst);
        }
        return new Dataset(copy, rows.length);
    }

    /** A new dataset holding only the named columns. */
    public Dataset select(Collection<String> names) {
        Map<String, double[]> copy = new LinkedHashMap<>(names.size() * 2);
        for (String name : names)
            copy.put(name, require(name));
        return new Dataset(copy, rowCount);
    }

    /** Returns a column name starting from {@code base} that is not in use. */
    public String freshColumnName(String base) {
        String name = base;
        while (columns.containsKey(name))
            name = "_" + name;
        return name;
    }

    @Override
    public String toString() {
        return "Dataset[" + rowCount + " rows, columns=" + columns.keySet() + "]";
    }

    private double[] require(String name) {
        double[] values = columns.get(name);
        if (values == null)
            throw new IllegalArgumentException("Unknown column: " + name + ". Known columns: " + columns.keySet());
        return values;
    }

    private static void checkColumn(String name, double[] values, int expectedRows) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(values, "values");
        if (expectedRows >= 0 && values.length != expectedRows)
            throw new IllegalArgumentException("Column '" + name + "' has " + values.length
                    + " rows, expected " + expectedRows);
        for (int i = 0; i < values.length; i++)
            if (!Double.isFinite(values[i]))
                throw new IllegalArgumentException("Column '" + name + "' has a missing or non-finite value at row "
                        + i + "; drop incomplete rows first");
    }

    /** Accumulates columns before freezing them into a {@link Dataset}. */
    public static final class Builder {
        private final Map<String, double[]> columns = new LinkedHashMap<>();
        private int rowCount = -1;

        private Builder() {
        }

        public Builder column(String name, double[] values) {
            if (columns.containsKey(name))
                throw new IllegalArgumentException("Duplicate column name: " + name);
            checkColumn(name, values, rowCount);
            columns.put(name, values.clone());
            rowCount = values.length;
            return this;
        }

        public Dataset build() {
            return new Dataset(new LinkedHashMap<>(columns), Math.max(rowCount, 0));
        }
    }
}
