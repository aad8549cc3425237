package com.fluxwatch.core.preprocess;

/**
 * Passes values through unchanged.
 */
final class IdentityTransform implements ValueTransform {

    private static final long serialVersionUID = 1L;

    @Override
    public double apply(double value) {
        return value;
    }

    @Override
    public TransformType getType() {
        return TransformType.NONE;
    }
}
