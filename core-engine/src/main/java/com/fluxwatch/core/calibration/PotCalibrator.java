package com.fluxwatch.core.calibration;

import com.fluxwatch.core.config.DetectorSettings;
import com.fluxwatch.core.exception.InsufficientDataException;
import com.fluxwatch.core.exception.InsufficientExcessesException;
import com.fluxwatch.core.model.CalibrationState;
import com.fluxwatch.core.model.Observation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Peaks-Over-Threshold calibration of a stream's initial batch.
 *
 * <h3>Algorithm</h3>
 * <ol>
 * <li>{@code t} = empirical {@code lowQuantile} of the batch</li>
 * <li>excesses = {@code {x - t : x > t}}</li>
 * <li>fit a {@link TailModel} to the excesses by the method of moments</li>
 * <li>extreme threshold from the tail quantile formula at {@code riskLevel}</li>
 * <li>seed the {@link DriftWindow} with the tail of the batch and derive the
 * anomaly threshold</li>
 * </ol>
 *
 * <p>
 * Calibration is a pure function of the batch and the settings: running it
 * twice on the same input yields equal states.
 * </p>
 *
 * @since 1.0.0
 */
public class PotCalibrator {

    private static final Logger LOG = LoggerFactory.getLogger(PotCalibrator.class);

    private final DetectorSettings settings;

    /**
     * @param settings detector settings; validated here
     * @throws IllegalStateException if the settings are invalid
     */
    public PotCalibrator(DetectorSettings settings) {
        this.settings = Objects.requireNonNull(settings, "DetectorSettings must not be null");
        settings.validate();
    }

    /**
     * Calibrate from cleaned observations, in order.
     *
     * @see #calibrate(double[])
     */
    public CalibrationState calibrate(List<Observation> batch) {
        Objects.requireNonNull(batch, "Calibration batch must not be null");
        return calibrate(batch.stream().mapToDouble(Observation::getValue).toArray());
    }

    /**
     * Calibrate from an ordered batch of values.
     *
     * @param batch initial observations, oldest first
     * @return the initial state of a streaming detector
     * @throws InsufficientDataException     if the batch is smaller than
     *                                       {@code minCalibrationSize}
     * @throws InsufficientExcessesException if no value exceeds the initial
     *                                       threshold
     * @throws IllegalArgumentException      if the batch contains a non-finite
     *                                       value
     */
    public CalibrationState calibrate(double[] batch) {
        Objects.requireNonNull(batch, "Calibration batch must not be null");
        int required = Math.max(1, settings.getMinCalibrationSize());
        if (batch.length < required) {
            throw new InsufficientDataException(batch.length, required);
        }
        for (int i = 0; i < batch.length; i++) {
            if (!Double.isFinite(batch[i])) {
                throw new IllegalArgumentException(
                        "Calibration batch contains a non-finite value at index " + i + ": " + batch[i]);
            }
        }

        double lowQuantile = settings.getLowQuantile();
        double initialThreshold = EmpiricalQuantile.of(batch, lowQuantile);

        ExcessStatistics excesses = new ExcessStatistics();
        for (double value : batch) {
            if (value > initialThreshold) {
                excesses.add(value - initialThreshold);
            }
        }
        if (excesses.isEmpty()) {
            throw new InsufficientExcessesException(lowQuantile, initialThreshold, batch.length);
        }

        TailModel tail = TailModel.fit(excesses);
        double threshold = tail.threshold(initialThreshold, settings.getRiskLevel(),
                batch.length, excesses.getCount());

        DriftWindow window = DriftWindow.of(settings.getDriftWindow(), settings.getDriftQuantile(), batch);
        double anomalyThreshold = window.anomalyThreshold(initialThreshold, threshold);

        if (threshold < initialThreshold) {
            LOG.warn("Extreme threshold {} is below the initial threshold {}: riskLevel {} exceeds the "
                    + "excess rate {}/{}", threshold, initialThreshold, settings.getRiskLevel(),
                    excesses.getCount(), batch.length);
        }
        if (tail.isExponential()) {
            LOG.debug("Excess variance degenerate for {} excess(es), using exponential tail", excesses.getCount());
        }
        LOG.info("Calibrated on {} observation(s): t={} ξ={} σ={} excesses={} threshold={} anomalyThreshold={}",
                batch.length, initialThreshold, tail.getShape(), tail.getScale(), excesses.getCount(),
                threshold, anomalyThreshold);

        return CalibrationState.builder()
                .initialThreshold(initialThreshold)
                .tailShape(tail.getShape())
                .tailScale(tail.getScale())
                .excessCount(excesses.getCount())
                .threshold(threshold)
                .anomalyThreshold(anomalyThreshold)
                .lowQuantile(lowQuantile)
                .riskLevel(settings.getRiskLevel())
                .observationCount(batch.length)
                .excessSum(excesses.getSum())
                .excessSumOfSquares(excesses.getSumOfSquares())
                .driftWindow(window.getCapacity())
                .driftQuantile(window.getQuantile())
                .recentValues(window.toArray())
                .build();
    }

    public DetectorSettings getSettings() {
        return settings;
    }
}
