/**
 * Configuration loading and validation for Mesh Sentinel.
 *
 * <p>
 * Settings are defined in YAML and loaded by
 * {@link com.meshsentinel.core.config.ConfigLoader} into a
 * {@link com.meshsentinel.core.config.SentinelConfig} instance. Validation
 * runs right after parsing and reports every invalid value at once.
 * </p>
 *
 * @since 1.0.0
 */
package com.meshsentinel.core.config;
