package com.formative.api;

/**
 * A structural precondition of an estimation method is violated, either
 * against the graph (raised at construction) or against the dataset (raised at
 * fit time).
 */
public final class ValidationException extends CausalException {

    public enum Kind {
        /** A role variable is not a node of the graph. */
        MISSING_NODE,
        /** Two roles (treatment, outcome, instrument, ...) name the same variable. */
        DUPLICATE_ROLE,
        /** A role variable has no column in the dataset. */
        MISSING_COLUMN,
        /** A column that must be coded 0/1 holds other values. */
        NON_BINARY,
        /** A binary column lacks one of its two levels. */
        MISSING_LEVEL,
        /** A randomized treatment has declared causes. */
        NOT_RANDOMIZED,
        /** The instrument has no directed path to the treatment. */
        RELEVANCE,
        /** The instrument reaches the outcome without passing through the treatment. */
        EXCLUSION_RESTRICTION
    }

    private final Kind kind;

    public ValidationException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }
}
