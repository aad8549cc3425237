/**
 * Offline scoring of detections against labelled anomaly intervals.
 *
 * @since 1.0.0
 */
package com.fluxwatch.core.evaluation;
