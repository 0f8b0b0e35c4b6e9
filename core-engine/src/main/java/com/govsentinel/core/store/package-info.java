/**
 * Durable per-source state: entity records and the admin-alert registry.
 *
 * @since 1.0.0
 */
package com.govsentinel.core.store;
