package com.relay.proxy.core.worker;

import com.relay.proxy.config.ServerConfig;
import com.relay.proxy.core.constants.DeadWorkerPolicy;
import com.relay.proxy.core.exceptions.WorkerUnavailableException;
import com.relay.proxy.core.forward.UpstreamForwarder;
import com.relay.proxy.core.routing.RoutingTable;
import com.relay.proxy.entity.ReplyDescriptor;
import com.relay.proxy.entity.RequestDescriptor;
import com.relay.proxy.spi.WorkerSelector;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the fixed set of workers created at startup.
 * <p>
 * The pool size never changes at runtime. A dead worker either leaves its slot
 * dead ({@link DeadWorkerPolicy#DEGRADE}) or is replaced in place by a fresh
 * worker over the same routing table ({@link DeadWorkerPolicy#RESPAWN}).
 * </p>
 */
public class WorkerPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final RoutingTable routingTable;
    private final UpstreamForwarder forwarder;
    private final WorkerSelector selector;
    private final DeadWorkerPolicy deadWorkerPolicy;
    private final long replyTimeoutMillis;
    private final int queueCapacity;
    private final AtomicReferenceArray<WorkerHandle> slots;
    private final AtomicInteger nextWorkerId = new AtomicInteger();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Creates and starts a pool with uniform random selection.
     *
     * @param config       The server configuration.
     * @param routingTable The routing snapshot every worker observes.
     * @param forwarder    The upstream forwarder shared by the workers.
     */
    public WorkerPool(ServerConfig config, RoutingTable routingTable, UpstreamForwarder forwarder) {
        this(config, routingTable, forwarder, new RandomWorkerSelector());
    }

    /**
     * Creates and starts a pool.
     *
     * @param config       The server configuration.
     * @param routingTable The routing snapshot every worker observes.
     * @param forwarder    The upstream forwarder shared by the workers.
     * @param selector     The worker selection strategy.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public WorkerPool(ServerConfig config, RoutingTable routingTable, UpstreamForwarder forwarder,
            WorkerSelector selector) {
        this.routingTable = routingTable;
        this.forwarder = forwarder;
        this.selector = selector;
        this.deadWorkerPolicy = config.getDeadWorkerPolicy() != null
                ? config.getDeadWorkerPolicy()
                : DeadWorkerPolicy.DEGRADE;
        this.replyTimeoutMillis = config.getReplyTimeout();
        this.queueCapacity = config.getWorkerQueueCapacity();

        int size = config.effectiveWorkerCount();
        this.slots = new AtomicReferenceArray<>(size);
        for (int slot = 0; slot < size; slot++) {
            slots.set(slot, create(slot));
        }
        for (int slot = 0; slot < size; slot++) {
            slots.get(slot).start();
        }
        log.info("Worker pool started with {} workers (dead worker policy: {})", size, deadWorkerPolicy);
    }

    private WorkerHandle create(int slot) {
        return new WorkerHandle(nextWorkerId.getAndIncrement(), slot, routingTable, forwarder, queueCapacity,
                this::onWorkerDeath);
    }

    /**
     * Replaces a dead handle when the policy is RESPAWN. Only the handle that
     * currently occupies its slot is replaced, and the replacement is started
     * after it has been placed.
     *
     * @param dead The handle that became DEAD.
     */
    void onWorkerDeath(WorkerHandle dead) {
        if (closed.get() || deadWorkerPolicy != DeadWorkerPolicy.RESPAWN) {
            return;
        }
        int slot = dead.getSlot();
        if (slots.get(slot) != dead) {
            log.debug("Worker {} no longer occupies slot {}, not respawning", dead.getId(), slot);
            return;
        }
        WorkerHandle replacement = create(slot);
        if (!slots.compareAndSet(slot, dead, replacement)) {
            log.debug("Slot {} was already replaced, discarding worker {}", slot, replacement.getId());
            return;
        }
        replacement.start();
        log.info("Respawned worker {} as worker {} in slot {}", dead.getId(), replacement.getId(), slot);
    }

    /**
     * Selects a ready worker.
     *
     * @return The selected worker.
     * @throws WorkerUnavailableException if no worker is ready.
     */
    public WorkerHandle select() {
        if (closed.get()) {
            throw new WorkerUnavailableException("Worker pool is shut down");
        }
        List<WorkerHandle> ready = new ArrayList<>(slots.length());
        for (int i = 0; i < slots.length(); i++) {
            WorkerHandle handle = slots.get(i);
            if (handle.isReady()) {
                ready.add(handle);
            }
        }
        if (ready.isEmpty()) {
            throw new WorkerUnavailableException("No ready worker in pool");
        }
        return selector.select(ready);
    }

    /**
     * Sends a descriptor to a worker and waits asynchronously for its reply.
     *
     * @param handle     The worker to use.
     * @param descriptor The request.
     * @return A future completed with the matching reply. It fails with
     *         {@link WorkerUnavailableException} if the worker is or becomes
     *         dead, or with a {@link java.util.concurrent.TimeoutException} if no
     *         reply arrives within the configured reply timeout.
     */
    public CompletableFuture<ReplyDescriptor> send(WorkerHandle handle, RequestDescriptor descriptor) {
        if (handle == null) {
            return CompletableFuture.failedFuture(new WorkerUnavailableException("No worker selected"));
        }
        if (closed.get()) {
            return CompletableFuture.failedFuture(
                    new WorkerUnavailableException(handle.getId(), "Worker pool is shut down"));
        }
        return handle.send(descriptor, replyTimeoutMillis);
    }

    /**
     * Selects a worker and sends the descriptor to it.
     *
     * @param descriptor The request.
     * @return A future completed with the reply; see {@link #send}.
     */
    public CompletableFuture<ReplyDescriptor> dispatch(RequestDescriptor descriptor) {
        WorkerHandle handle;
        try {
            handle = select();
        } catch (WorkerUnavailableException e) {
            return CompletableFuture.failedFuture(e);
        }
        return send(handle, descriptor);
    }

    /**
     * Snapshot of the handles currently occupying the pool's slots.
     *
     * @return The handles, in slot order.
     */
    public List<WorkerHandle> handles() {
        List<WorkerHandle> handles = new ArrayList<>(slots.length());
        for (int i = 0; i < slots.length(); i++) {
            handles.add(slots.get(i));
        }
        return handles;
    }

    public int size() {
        return slots.length();
    }

    /**
     * Counts the workers currently in the READY state.
     *
     * @return The number of selectable workers.
     */
    public int readyCount() {
        int ready = 0;
        for (int i = 0; i < slots.length(); i++) {
            if (slots.get(i).isReady()) {
                ready++;
            }
        }
        return ready;
    }

    /**
     * Counts the requests awaiting a reply across the pool.
     *
     * @return The number of pending operations.
     */
    public int pendingCount() {
        int total = 0;
        for (int i = 0; i < slots.length(); i++) {
            total += slots.get(i).pendingCount();
        }
        return total;
    }

    public DeadWorkerPolicy getDeadWorkerPolicy() {
        return deadWorkerPolicy;
    }

    /**
     * Terminates every worker. Pending requests fail with
     * {@link WorkerUnavailableException}. Respawning stops.
     */
    public void shutdown() {
        if (closed.compareAndSet(false, true)) {
            log.info("Shutting down worker pool...");
            for (int i = 0; i < slots.length(); i++) {
                slots.get(i).terminate();
            }
        }
    }

    @Override
    public void close() {
        shutdown();
    }
}
