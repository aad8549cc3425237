/**
 * Apache Flink job for live monitoring: Kafka observations in, one
 * isolated streaming detector per metric in keyed state, detection events
 * out to Kafka.
 *
 * @since 1.0.0
 */
package com.fluxwatch.flink;
