package com.fluxwatch.core.exception;

/**
 * Thrown when the calibration batch is smaller than the configured minimum.
 *
 * @since 1.0.0
 */
public class InsufficientDataException extends AnomalyEngineException {

    private static final long serialVersionUID = 1L;

    private final int batchSize;
    private final int requiredSize;

    public InsufficientDataException(int batchSize, int requiredSize) {
        super("Calibration batch has " + batchSize + " observation(s), at least "
                + requiredSize + " required");
        this.batchSize = batchSize;
        this.requiredSize = requiredSize;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public int getRequiredSize() {
        return requiredSize;
    }
}
