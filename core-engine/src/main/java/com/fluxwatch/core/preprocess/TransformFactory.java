package com.fluxwatch.core.preprocess;

import com.fluxwatch.core.config.PreprocessingSettings;

import java.util.Objects;

/**
 * Creates the {@link ValueTransform} configured for a stream.
 *
 * <p>
 * Each call returns a fresh instance; transforms are stateful and must not be
 * shared between streams.
 * </p>
 *
 * @since 1.0.0
 */
public final class TransformFactory {

    private TransformFactory() {
        // utility class
    }

    /**
     * @param settings preprocessing settings; must not be {@code null}
     * @return a new transform for one stream
     */
    public static ValueTransform create(PreprocessingSettings settings) {
        Objects.requireNonNull(settings, "PreprocessingSettings must not be null");
        return switch (settings.resolveTransform()) {
            case NONE -> new IdentityTransform();
            case MOVING_AVERAGE -> new MovingAverageTransform(settings.getSmoothingWindow());
            case DIFFERENCE -> new DifferenceTransform();
            case FLUCTUATION -> new FluctuationTransform(settings.getSmoothingWindow(), settings.getEwmaAlpha());
            case PERIODIC_FLUCTUATION -> new PeriodicFluctuationTransform(settings.getSmoothingWindow(),
                    settings.getEwmaAlpha(), settings.getPeriod(), settings.getPeriodWindow(),
                    settings.getHalfDriftWindow());
        };
    }
}
