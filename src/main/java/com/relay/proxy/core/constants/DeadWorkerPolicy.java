package com.relay.proxy.core.constants;

/**
 * What the worker pool does with a slot whose worker has died.
 */
public enum DeadWorkerPolicy {
    /**
     * Leave the slot dead. The pool keeps serving with the remaining workers.
     * Default.
     */
    DEGRADE,

    /**
     * Replace the dead worker with a fresh one over the same routing table.
     */
    RESPAWN
}
