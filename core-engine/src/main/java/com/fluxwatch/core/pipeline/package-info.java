/**
 * Per-stream orchestration: preprocessing, calibration and detection wired
 * together for live use ({@link com.fluxwatch.core.pipeline.MetricMonitor}),
 * for finite streams ({@link com.fluxwatch.core.pipeline.StreamRunner}), and
 * checkpoint encoding ({@link com.fluxwatch.core.pipeline.CheckpointCodec}).
 *
 * @since 1.0.0
 */
package com.fluxwatch.core.pipeline;
