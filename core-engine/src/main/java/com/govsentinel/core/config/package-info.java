/**
 * YAML configuration for watched sources and policy tables.
 *
 * <p>
 * {@link com.govsentinel.core.config.MonitorsLoader} and
 * {@link com.govsentinel.core.config.PoliciesLoader} load from an
 * environment-supplied path or the classpath and fail fast on invalid input.
 * </p>
 *
 * @since 1.0.0
 */
package com.govsentinel.core.config;
