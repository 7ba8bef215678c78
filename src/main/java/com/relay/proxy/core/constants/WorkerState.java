package com.relay.proxy.core.constants;

/**
 * Liveness of a worker handle. Transitions only move forward:
 * {@code STARTING -> READY -> DEAD} or {@code STARTING -> DEAD}.
 */
public enum WorkerState {
    /** Thread created, not yet taking requests. */
    STARTING,

    /** Taking requests. Only ready workers are selectable. */
    READY,

    /** Terminated. Never resurrected; the pool may replace the slot. */
    DEAD
}
