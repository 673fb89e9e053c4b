/**
 * Detector configuration: the immutable
 * {@link com.driftsentinel.core.config.DetectorConfig}, its YAML binding
 * {@link com.driftsentinel.core.config.DetectorSettings}, and
 * {@link com.driftsentinel.core.config.DetectorConfigLoader}, which parses
 * and validates in one step so startup fails fast.
 *
 * @since 1.0.0
 */
package com.driftsentinel.core.config;
