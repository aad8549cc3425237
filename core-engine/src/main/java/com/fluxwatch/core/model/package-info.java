/**
 * Domain model classes for FluxWatch.
 *
 * <p>
 * Value types shared between the engine stages and the Flink job layer:
 * </p>
 * <ul>
 * <li>{@link com.fluxwatch.core.model.Observation}: one timestamped scalar
 * sample</li>
 * <li>{@link com.fluxwatch.core.model.CalibrationState}: resumable per-stream
 * detector state</li>
 * <li>{@link com.fluxwatch.core.model.DetectionResult}: per-observation
 * decision plus threshold trace</li>
 * <li>{@link com.fluxwatch.core.model.LabeledInterval} and
 * {@link com.fluxwatch.core.model.EvaluationScore}: offline scoring</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.fluxwatch.core.model;
