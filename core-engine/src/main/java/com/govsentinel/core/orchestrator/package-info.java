/**
 * Per-source poll / diff / dispatch loop.
 *
 * <p>
 * A {@link com.govsentinel.core.orchestrator.SourceOrchestrator} owns one
 * source's store, rate limiter and fetcher; orchestrators share nothing
 * mutable and run concurrently under the service supervisor.
 * </p>
 *
 * @since 1.0.0
 */
package com.govsentinel.core.orchestrator;
