package com.govsentinel.core.orchestrator;

/**
 * Lifecycle of a {@link SourceOrchestrator}:
 * {@code IDLE -> FETCHING -> RECONCILING -> SLEEPING -> FETCHING ...},
 * ending in {@code STOPPED}.
 *
 * @since 1.0.0
 */
public enum OrchestratorState {
    IDLE,
    FETCHING,
    RECONCILING,
    SLEEPING,
    STOPPED
}
