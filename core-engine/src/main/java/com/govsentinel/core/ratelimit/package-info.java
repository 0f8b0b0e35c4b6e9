/**
 * Guards around fragile upstream calls: a single-slot spacing throttle with
 * exponential backoff and a deadline wrapper.
 *
 * @since 1.0.0
 */
package com.govsentinel.core.ratelimit;
