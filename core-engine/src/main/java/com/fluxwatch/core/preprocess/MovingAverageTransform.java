package com.fluxwatch.core.preprocess;

/**
 * Mean of the last {@code window} values, over a partial window while the
 * stream warms up.
 *
 * @since 1.0.0
 */
public class MovingAverageTransform implements ValueTransform {

    private static final long serialVersionUID = 1L;

    private final double[] ring;
    private int next;
    private int size;
    private double sum;

    public MovingAverageTransform(int window) {
        if (window < 1) {
            throw new IllegalArgumentException("Moving average window must be >= 1, got: " + window);
        }
        this.ring = new double[window];
    }

    @Override
    public double apply(double value) {
        if (size == ring.length) {
            sum -= ring[next];
        } else {
            size++;
        }
        ring[next] = value;
        sum += value;
        next = (next + 1) % ring.length;
        return sum / size;
    }

    @Override
    public TransformType getType() {
        return TransformType.MOVING_AVERAGE;
    }
}
