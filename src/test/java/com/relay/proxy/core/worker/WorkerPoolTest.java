package com.relay.proxy.core.worker;

import com.relay.proxy.config.ServerConfig;
import com.relay.proxy.core.constants.DeadWorkerPolicy;
import com.relay.proxy.core.constants.WorkerState;
import com.relay.proxy.core.exceptions.WorkerUnavailableException;
import com.relay.proxy.core.routing.RoutingTable;
import com.relay.proxy.entity.ReplyDescriptor;
import com.relay.proxy.entity.RequestDescriptor;
import com.relay.proxy.entity.Rule;
import com.relay.proxy.entity.Upstream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class WorkerPoolTest {

    private final RoutingTable table = new RoutingTable(
            List.of(new Upstream("backend", "localhost:1")),
            List.of(new Rule("/", List.of("backend"))),
            List.of());

    private final StubForwarder forwarder = new StubForwarder();
    private WorkerPool pool;

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdown();
        }
    }

    private WorkerPool newPool(int workers, DeadWorkerPolicy policy, int replyTimeout) {
        ServerConfig config = new ServerConfig();
        config.setWorkerCount(workers);
        config.setDeadWorkerPolicy(policy);
        config.setReplyTimeout(replyTimeout);
        pool = new WorkerPool(config, table, forwarder);
        return pool;
    }

    private static RequestDescriptor request(String path) {
        return RequestDescriptor.http("GET", path, Map.of(), null, "127.0.0.1");
    }

    @Test
    void startsFixedNumberOfReadyWorkers() {
        newPool(3, DeadWorkerPolicy.DEGRADE, 30000);

        assertThat(pool.size()).isEqualTo(3);
        assertThat(pool.readyCount()).isEqualTo(3);
        assertThat(pool.handles()).extracting(WorkerHandle::getState).containsOnly(WorkerState.READY);
        assertThat(pool.handles()).extracting(WorkerHandle::getSlot).containsExactly(0, 1, 2);
    }

    @Test
    void hundredConcurrentRequestsOnOneWorkerEachGetTheirOwnReply() {
        newPool(1, DeadWorkerPolicy.DEGRADE, 30000);
        WorkerHandle handle = pool.select();

        List<RequestDescriptor> requests = new ArrayList<>();
        List<CompletableFuture<ReplyDescriptor>> futures = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            RequestDescriptor descriptor = request("/r/" + i);
            requests.add(descriptor);
            futures.add(pool.send(handle, descriptor));
        }
        await().atMost(Duration.ofSeconds(10)).until(() -> forwarder.calls.size() == 100);
        assertThat(handle.pendingCount()).isEqualTo(100);

        for (int i = 99; i >= 0; i--) {
            forwarder.succeed("/r/" + i, "body-" + i);
        }

        for (int i = 0; i < 100; i++) {
            ReplyDescriptor reply = futures.get(i).join();
            assertThat(reply.getCorrelationId()).isEqualTo(requests.get(i).getCorrelationId());
            assertThat(new String(reply.body(), StandardCharsets.UTF_8)).isEqualTo("body-" + i);
        }
        await().atMost(Duration.ofSeconds(10)).until(() -> pool.pendingCount() == 0);
        assertThat(handle.dispatchedCount()).isEqualTo(100);
    }

    @Test
    void selectSpreadsRequestsAcrossAllReadyWorkers() {
        newPool(4, DeadWorkerPolicy.DEGRADE, 30000);

        Map<Integer, Integer> counts = new HashMap<>();
        for (int i = 0; i < 400; i++) {
            counts.merge(pool.select().getId(), 1, Integer::sum);
        }

        assertThat(counts).hasSize(4);
        assertThat(counts.values()).allMatch(c -> c > 0);
    }

    @Test
    void workerDeathFailsPendingRequestsWithWorkerUnavailable() {
        newPool(1, DeadWorkerPolicy.DEGRADE, 30000);
        WorkerHandle handle = pool.select();
        CompletableFuture<ReplyDescriptor> pending = pool.send(handle, request("/slow"));
        await().atMost(Duration.ofSeconds(10)).until(() -> forwarder.calls.containsKey("/slow"));

        handle.terminate();

        assertThatThrownBy(pending::join).hasCauseInstanceOf(WorkerUnavailableException.class);
        assertThat(handle.getState()).isEqualTo(WorkerState.DEAD);
        assertThat(handle.pendingCount()).isZero();
    }

    @Test
    void degradePolicyLeavesDeadSlotEmpty() {
        newPool(1, DeadWorkerPolicy.DEGRADE, 30000);
        WorkerHandle handle = pool.select();

        handle.terminate();

        assertThat(pool.readyCount()).isZero();
        assertThatThrownBy(pool::select).isInstanceOf(WorkerUnavailableException.class);
        assertThatThrownBy(() -> pool.dispatch(request("/x")).join())
                .hasCauseInstanceOf(WorkerUnavailableException.class);
        assertThatThrownBy(() -> pool.send(handle, request("/x")).join())
                .hasCauseInstanceOf(WorkerUnavailableException.class);
    }

    @Test
    void respawnPolicyReplacesDeadWorkerInSameSlot() {
        newPool(2, DeadWorkerPolicy.RESPAWN, 30000);
        WorkerHandle dead = pool.handles().get(1);

        dead.terminate();

        await().atMost(Duration.ofSeconds(10)).until(() -> pool.readyCount() == 2);
        WorkerHandle replacement = pool.handles().get(1);
        assertThat(replacement).isNotSameAs(dead);
        assertThat(replacement.getSlot()).isEqualTo(1);
        assertThat(replacement.getId()).isNotEqualTo(dead.getId());
        assertThat(pool.getDeadWorkerPolicy()).isEqualTo(DeadWorkerPolicy.RESPAWN);
    }

    @Test
    void deathOfReplacedWorkerDoesNotSpawnAgain() {
        newPool(1, DeadWorkerPolicy.RESPAWN, 30000);
        WorkerHandle first = pool.handles().get(0);
        first.terminate();
        await().atMost(Duration.ofSeconds(10)).until(() -> pool.readyCount() == 1);
        WorkerHandle second = pool.handles().get(0);

        pool.onWorkerDeath(first);

        assertThat(pool.handles()).containsExactly(second);
        assertThat(second.isReady()).isTrue();
        assertThat(pool.select()).isSameAs(second);
    }

    @Test
    void terminatedHandleNeverStarts() {
        WorkerHandle handle = new WorkerHandle(99, 0, table, forwarder, 8, null);
        handle.terminate();

        handle.start();

        assertThat(handle.getState()).isEqualTo(WorkerState.DEAD);
        assertThat(Thread.getAllStackTraces().keySet())
                .noneMatch(t -> t.getName().equals("worker-99") && t.isAlive());
    }

    @Test
    void replyTimeoutFailsPendingRequestAndFreesSlot() {
        newPool(1, DeadWorkerPolicy.DEGRADE, 200);
        WorkerHandle handle = pool.select();

        CompletableFuture<ReplyDescriptor> pending = pool.send(handle, request("/never"));

        assertThatThrownBy(pending::join).hasCauseInstanceOf(TimeoutException.class);
        assertThat(handle.pendingCount()).isZero();
        assertThat(handle.isReady()).isTrue();
    }

    @Test
    void cancelledRequestFreesSlotAndLateReplyIsDropped() {
        newPool(1, DeadWorkerPolicy.DEGRADE, 30000);
        WorkerHandle handle = pool.select();
        CompletableFuture<ReplyDescriptor> pending = pool.send(handle, request("/abandoned"));
        await().atMost(Duration.ofSeconds(10)).until(() -> forwarder.calls.containsKey("/abandoned"));

        pending.cancel(true);
        assertThat(handle.pendingCount()).isZero();

        forwarder.succeed("/abandoned", "late");
        CompletableFuture<ReplyDescriptor> next = pool.send(handle, request("/next"));
        await().atMost(Duration.ofSeconds(10)).until(() -> forwarder.calls.containsKey("/next"));
        forwarder.succeed("/next", "fresh");

        assertThat(new String(next.join().body(), StandardCharsets.UTF_8)).isEqualTo("fresh");
        assertThat(handle.isReady()).isTrue();
    }

    @Test
    void upstreamFailureIsAReplyNotAFailedFuture() {
        newPool(1, DeadWorkerPolicy.DEGRADE, 30000);
        CompletableFuture<ReplyDescriptor> pending = pool.dispatch(request("/down"));
        await().atMost(Duration.ofSeconds(10)).until(() -> forwarder.calls.containsKey("/down"));

        forwarder.fail("/down");

        ReplyDescriptor reply = pending.join();
        assertThat(reply.isOk()).isFalse();
        assertThat(reply.getStatus()).isEqualTo(502);
    }

    @Test
    void shutdownFailsPendingAndStopsRespawning() {
        newPool(2, DeadWorkerPolicy.RESPAWN, 30000);
        CompletableFuture<ReplyDescriptor> pending = pool.dispatch(request("/hang"));
        await().atMost(Duration.ofSeconds(10)).until(() -> forwarder.calls.containsKey("/hang"));

        pool.shutdown();

        assertThatThrownBy(pending::join).hasCauseInstanceOf(WorkerUnavailableException.class);
        assertThat(pool.readyCount()).isZero();
        assertThatThrownBy(pool::select).isInstanceOf(WorkerUnavailableException.class);
    }
}
