package com.formative.api;

/**
 * The numeric fitting collaborator could not produce an estimate, e.g. a
 * singular design matrix, a logit that does not converge, or no residual
 * degrees of freedom.
 */
public final class FittingException extends CausalException {

    public FittingException(String message) {
        super(message);
    }

    public FittingException(String message, Throwable cause) {
        super(message, cause);
    }
}
