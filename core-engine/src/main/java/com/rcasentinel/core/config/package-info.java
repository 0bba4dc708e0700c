/**
 * YAML configuration of the detector, the analyzer and the pipeline.
 *
 * <p>
 * {@link com.rcasentinel.core.config.ConfigLoader} resolves the file,
 * SnakeYAML binds it onto {@link com.rcasentinel.core.config.RcaConfig} and
 * validation runs before the configuration is returned.
 * </p>
 *
 * @since 1.0.0
 */
package com.rcasentinel.core.config;
