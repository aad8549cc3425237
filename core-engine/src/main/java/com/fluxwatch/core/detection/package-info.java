/**
 * Streaming anomaly detection.
 *
 * <p>
 * {@link com.fluxwatch.core.detection.StreamingDetector} classifies a
 * calibrated stream one observation at a time. The
 * {@link com.fluxwatch.core.detection.DecisionRule} chosen for a run decides
 * whether alarms key off the long-term extreme threshold or the
 * drift-adjusted anomaly threshold; the two are never mixed within a run.
 * </p>
 *
 * @since 1.0.0
 */
package com.fluxwatch.core.detection;
