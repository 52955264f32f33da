package com.kg.core.service.lifecycle;

/**
 * Lifecycle states of the knowledge graph coordinator.
 */
public enum CoordinatorState {
    STOPPED,
    STARTING,
    RUNNING,
    /**
     * Dependencies failed; reads continue but publishing is refused until recovery.
     */
    DEGRADED
}
