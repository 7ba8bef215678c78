package com.relay.proxy.spi;

import com.relay.proxy.core.worker.WorkerHandle;
import java.util.List;

/**
 * Strategy interface for choosing the worker that receives a request.
 * Implementations must be thread-safe; the dispatcher calls them concurrently.
 */
public interface WorkerSelector {
    /**
     * Selects one worker from the currently ready ones.
     * @param readyWorkers Non-empty list of workers in the READY state.
     * @return The selected worker.
     */
    WorkerHandle select(List<WorkerHandle> readyWorkers);
}
