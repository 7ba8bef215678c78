package com.relay.proxy.core.worker;

import com.relay.proxy.core.constants.WorkerState;
import com.relay.proxy.core.exceptions.WorkerUnavailableException;
import com.relay.proxy.core.forward.UpstreamForwarder;
import com.relay.proxy.core.routing.RoutingTable;
import com.relay.proxy.entity.ReplyDescriptor;
import com.relay.proxy.entity.RequestDescriptor;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The pool's view of one worker: its request and reply channels, its liveness
 * state and the pending operations awaiting a reply.
 * <p>
 * Every request sent through a handle registers a future under its correlation
 * id. The reply pump completes that future when the matching reply arrives, so
 * any number of requests may be in flight on the same worker and complete in
 * any order. If the worker dies, every pending future fails with
 * {@link WorkerUnavailableException}.
 * </p>
 */
public class WorkerHandle {

    private static final Logger log = LoggerFactory.getLogger(WorkerHandle.class);

    private final int id;
    private final int slot;
    private final BlockingQueue<RequestDescriptor> requests;
    private final BlockingQueue<ReplyDescriptor> replies = new LinkedBlockingQueue<>();
    private final Worker worker;
    private final AtomicReference<WorkerState> state = new AtomicReference<>(WorkerState.STARTING);
    private final Map<String, CompletableFuture<ReplyDescriptor>> pending = new ConcurrentHashMap<>();
    private final AtomicLong dispatched = new AtomicLong();
    private final Consumer<WorkerHandle> deathListener;

    private volatile Thread workerThread;
    private volatile Thread replyPump;

    /**
     * Creates a handle and its worker. Nothing runs until {@link #start()}.
     *
     * @param id            Unique worker id.
     * @param slot          Position of this handle in the pool.
     * @param routingTable  The shared routing snapshot.
     * @param forwarder     The upstream forwarder.
     * @param queueCapacity Capacity of the request channel.
     * @param deathListener Called once when the handle transitions to DEAD.
     */
    public WorkerHandle(int id, int slot, RoutingTable routingTable, UpstreamForwarder forwarder, int queueCapacity,
            Consumer<WorkerHandle> deathListener) {
        this.id = id;
        this.slot = slot;
        this.requests = new ArrayBlockingQueue<>(Math.max(1, queueCapacity));
        this.worker = new Worker(id, routingTable, forwarder, requests, replies::add);
        this.deathListener = deathListener;
    }

    /**
     * Starts the worker loop and the reply pump, then marks the handle READY.
     */
    public synchronized void start() {
        if (workerThread != null || state.get() == WorkerState.DEAD) {
            return;
        }
        workerThread = new Thread(() -> {
            try {
                worker.run();
            } finally {
                markDead("worker loop exited");
            }
        }, "worker-" + id);
        workerThread.setDaemon(true);

        replyPump = new Thread(this::pumpReplies, "worker-" + id + "-replies");
        replyPump.setDaemon(true);

        workerThread.start();
        replyPump.start();
        if (state.compareAndSet(WorkerState.STARTING, WorkerState.READY)) {
            log.debug("Worker {} ready in slot {}", id, slot);
        } else {
            // terminated while starting
            workerThread.interrupt();
            replyPump.interrupt();
        }
    }

    /**
     * Sends a descriptor to the worker.
     *
     * @param descriptor         The request.
     * @param replyTimeoutMillis Upper bound on the wait for the reply; 0 or less
     *                           for none.
     * @return A future completed with the matching reply, or failed with
     *         {@link WorkerUnavailableException}, a timeout, or cancellation.
     */
    public CompletableFuture<ReplyDescriptor> send(RequestDescriptor descriptor, long replyTimeoutMillis) {
        CompletableFuture<ReplyDescriptor> future = new CompletableFuture<>();
        String correlationId = descriptor.getCorrelationId();

        if (state.get() != WorkerState.READY) {
            future.completeExceptionally(new WorkerUnavailableException(id, "Worker " + id + " is " + state.get()));
            return future;
        }
        if (pending.putIfAbsent(correlationId, future) != null) {
            future.completeExceptionally(
                    new IllegalStateException("Duplicate correlation id " + correlationId + " on worker " + id));
            return future;
        }
        future.whenComplete((reply, error) -> pending.remove(correlationId, future));

        // markDead may have drained the arena between the first check and put
        if (state.get() != WorkerState.READY) {
            future.completeExceptionally(new WorkerUnavailableException(id, "Worker " + id + " died"));
            return future;
        }
        if (!requests.offer(descriptor)) {
            future.completeExceptionally(new WorkerUnavailableException(id, "Worker " + id + " request queue full"));
            return future;
        }
        dispatched.incrementAndGet();
        if (replyTimeoutMillis > 0) {
            future.orTimeout(replyTimeoutMillis, TimeUnit.MILLISECONDS);
        }
        return future;
    }

    private void pumpReplies() {
        try {
            while (!Thread.currentThread().isInterrupted()) {
                deliver(replies.take());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Completes the pending operation a reply belongs to.
     *
     * @param reply The reply received from the worker.
     */
    void deliver(ReplyDescriptor reply) {
        CompletableFuture<ReplyDescriptor> future = pending.remove(reply.getCorrelationId());
        if (future == null) {
            log.debug("Worker {}: dropping reply for unknown or abandoned request {}", id,
                    reply.getCorrelationId());
            return;
        }
        future.complete(reply);
    }

    /**
     * Stops the worker. The handle becomes DEAD and pending requests fail.
     */
    public void terminate() {
        markDead("terminated");
    }

    /**
     * Transitions the handle to DEAD. Only the first call has any effect.
     *
     * @param reason Reason recorded in the log.
     */
    void markDead(String reason) {
        WorkerState previous = state.getAndSet(WorkerState.DEAD);
        if (previous == WorkerState.DEAD) {
            return;
        }
        log.warn("Worker {} in slot {} is dead: {}", id, slot, reason);

        interruptIfOther(workerThread);
        interruptIfOther(replyPump);

        for (String correlationId : pending.keySet()) {
            CompletableFuture<ReplyDescriptor> future = pending.remove(correlationId);
            if (future != null) {
                future.completeExceptionally(
                        new WorkerUnavailableException(id, "Worker " + id + " died while request was pending"));
            }
        }

        if (deathListener != null) {
            try {
                deathListener.accept(this);
            } catch (RuntimeException e) {
                log.error("Death listener failed for worker {}: {}", id, e.getMessage(), e);
            }
        }
    }

    private static void interruptIfOther(Thread thread) {
        if (thread != null && thread != Thread.currentThread()) {
            thread.interrupt();
        }
    }

    public int getId() {
        return id;
    }

    public int getSlot() {
        return slot;
    }

    public WorkerState getState() {
        return state.get();
    }

    public boolean isReady() {
        return state.get() == WorkerState.READY;
    }

    /**
     * Number of requests awaiting a reply on this worker.
     *
     * @return The size of the pending arena.
     */
    public int pendingCount() {
        return pending.size();
    }

    /**
     * Number of requests accepted by this worker since it started.
     *
     * @return The dispatch count.
     */
    public long dispatchedCount() {
        return dispatched.get();
    }

    @Override
    public String toString() {
        return "WorkerHandle{id=" + id + ", slot=" + slot + ", state=" + state.get() + "}";
    }
}
