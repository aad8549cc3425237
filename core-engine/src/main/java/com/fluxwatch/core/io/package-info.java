/**
 * Offline datasets: reading labelled KPI CSV files and evaluating them
 * concurrently.
 *
 * @since 1.0.0
 */
package com.fluxwatch.core.io;
