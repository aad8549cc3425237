package com.fluxwatch.core.exception;

/**
 * Thrown when no calibration value exceeds the initial threshold, i.e. the
 * configured low quantile is too high for the data. Callers should lower the
 * quantile or supply a larger batch.
 *
 * @since 1.0.0
 */
public class InsufficientExcessesException extends AnomalyEngineException {

    private static final long serialVersionUID = 1L;

    private final double lowQuantile;
    private final double initialThreshold;

    public InsufficientExcessesException(double lowQuantile, double initialThreshold, int batchSize) {
        super(String.format("No value of the %d-point calibration batch exceeds the %s-quantile (%s); "
                + "lower 'lowQuantile' or supply more data", batchSize, lowQuantile, initialThreshold));
        this.lowQuantile = lowQuantile;
        this.initialThreshold = initialThreshold;
    }

    public double getLowQuantile() {
        return lowQuantile;
    }

    public double getInitialThreshold() {
        return initialThreshold;
    }
}
