/**
 * Input cleaning and feature transforms.
 *
 * <p>
 * {@link com.fluxwatch.core.preprocess.Preprocessor} enforces validity,
 * ordering and duplicate policies, fills short gaps and applies a
 * {@link com.fluxwatch.core.preprocess.ValueTransform} created by
 * {@link com.fluxwatch.core.preprocess.TransformFactory}.
 * </p>
 *
 * @since 1.0.0
 */
package com.fluxwatch.core.preprocess;
