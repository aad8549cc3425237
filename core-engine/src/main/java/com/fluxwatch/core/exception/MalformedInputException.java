package com.fluxwatch.core.exception;

/**
 * Thrown by the preprocessor for a record it cannot accept under the
 * configured policies: a non-finite value, a timestamp going backwards, or
 * a duplicate timestamp.
 *
 * @since 1.0.0
 */
public class MalformedInputException extends AnomalyEngineException {

    private static final long serialVersionUID = 1L;

    private final long timestamp;

    public MalformedInputException(long timestamp, String reason) {
        super("Malformed observation at timestamp " + timestamp + ": " + reason);
        this.timestamp = timestamp;
    }

    /**
     * @return timestamp of the offending record
     */
    public long getTimestamp() {
        return timestamp;
    }
}
