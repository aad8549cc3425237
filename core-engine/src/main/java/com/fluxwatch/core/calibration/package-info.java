/**
 * Peaks-Over-Threshold calibration.
 *
 * <p>
 * {@link com.fluxwatch.core.calibration.PotCalibrator} turns an initial batch
 * into a {@link com.fluxwatch.core.model.CalibrationState}. The building
 * blocks are shared with the streaming detector, which keeps re-estimating
 * the same model online:
 * </p>
 * <ul>
 * <li>{@link com.fluxwatch.core.calibration.ExcessStatistics}: running
 * moments of the excesses</li>
 * <li>{@link com.fluxwatch.core.calibration.TailModel}: method-of-moments
 * GPD fit and tail quantile</li>
 * <li>{@link com.fluxwatch.core.calibration.DriftWindow}: recent-level
 * window behind the anomaly threshold</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.fluxwatch.core.calibration;
