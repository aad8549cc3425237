package com.fluxwatch.core.preprocess;

/**
 * First difference {@code x[i] - x[i-1]}; the first value maps to 0.
 *
 * @since 1.0.0
 */
public class DifferenceTransform implements ValueTransform {

    private static final long serialVersionUID = 1L;

    private boolean primed;
    private double previous;

    @Override
    public double apply(double value) {
        double out = primed ? value - previous : 0.0;
        previous = value;
        primed = true;
        return out;
    }

    @Override
    public TransformType getType() {
        return TransformType.DIFFERENCE;
    }
}
