/**
 * Configuration loading and validation for the FluxWatch engine.
 *
 * <p>
 * Settings are defined in YAML and loaded by
 * {@link com.fluxwatch.core.config.EngineConfigLoader} into an
 * {@link com.fluxwatch.core.config.EngineConfig} made of three sections:
 * detector, preprocessing and evaluation. Validation runs automatically
 * after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.fluxwatch.core.config;
