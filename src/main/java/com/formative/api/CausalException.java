package com.formative.api;

/**
 * Base type for every failure the library classifies.
 *
 * <p>
 * All subclasses are fatal to the call that raised them: there is no partial
 * result and no automatic retry. The caller fixes the graph, the dataset or the
 * method choice and re-invokes.
 */
public abstract class CausalException extends RuntimeException {

    protected CausalException(String message) {
        super(message);
    }

    protected CausalException(String message, Throwable cause) {
        super(message, cause);
    }
}
