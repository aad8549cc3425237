package com.fluxwatch.core.exception;

/**
 * Base class for failures that abort a detection run.
 *
 * <p>
 * All engine errors are unchecked and propagate to the caller of the stage
 * that raised them. Numeric degeneracies in the tail model are handled by
 * fallback formulas and never surface as exceptions.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyEngineException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public AnomalyEngineException(String message) {
        super(message);
    }

    public AnomalyEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
