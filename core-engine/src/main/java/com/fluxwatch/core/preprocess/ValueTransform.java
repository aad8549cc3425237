package com.fluxwatch.core.preprocess;

import java.io.Serializable;

/**
 * Stateful per-stream value transform applied after cleaning.
 *
 * <p>
 * Implementations see every value of one stream in order, imputed fills
 * included, and return exactly one output per input. They must be
 * {@link Serializable} because they live inside checkpointed keyed state.
 * </p>
 *
 * @since 1.0.0
 */
public interface ValueTransform extends Serializable {

    /**
     * Transform the next value of the stream.
     *
     * @param value cleaned input value (finite)
     * @return transformed value (finite)
     */
    double apply(double value);

    /**
     * Called when the value last passed to {@link #apply(double)} was
     * flagged anomalous, so a transform that keeps feature history can
     * leave it out of later outputs. The default does nothing.
     */
    default void discardLast() {
    }

    /**
     * @return the transform type implemented
     */
    TransformType getType();
}
