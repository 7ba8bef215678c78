package com.relay.proxy.core.exceptions;

/**
 * Thrown when no worker can take a request: the pool has no ready worker, the
 * selected worker is dead, or it died while the request was pending.
 */
public class WorkerUnavailableException extends ProxyException {

    private final int workerId;

    /**
     * Constructs a new WorkerUnavailableException not tied to a specific worker.
     * 
     * @param message the detail message.
     */
    public WorkerUnavailableException(String message) {
        this(-1, message);
    }

    /**
     * Constructs a new WorkerUnavailableException for the given worker.
     * 
     * @param workerId the id of the worker that is unavailable.
     * @param message  the detail message.
     */
    public WorkerUnavailableException(int workerId, String message) {
        super(message);
        this.workerId = workerId;
    }

    /**
     * Retrieves the id of the unavailable worker.
     * 
     * @return The worker id, or -1 if the pool itself had nothing to offer.
     */
    public int getWorkerId() {
        return workerId;
    }
}
