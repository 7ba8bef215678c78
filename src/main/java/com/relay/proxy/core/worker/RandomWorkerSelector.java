package com.relay.proxy.core.worker;

import com.relay.proxy.spi.WorkerSelector;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Uniform random selection among ready workers.
 */
public class RandomWorkerSelector implements WorkerSelector {
    @Override
    public WorkerHandle select(List<WorkerHandle> readyWorkers) {
        return readyWorkers.get(ThreadLocalRandom.current().nextInt(readyWorkers.size()));
    }
}
