package com.relay.proxy.core.worker;

import com.relay.proxy.core.constants.ErrorKind;
import com.relay.proxy.core.exceptions.ForwardException;
import com.relay.proxy.core.forward.ForwardResponse;
import com.relay.proxy.core.forward.UpstreamForwarder;
import com.relay.proxy.core.routing.RoutingTable;
import com.relay.proxy.entity.PassThroughHeader;
import com.relay.proxy.entity.ReplyDescriptor;
import com.relay.proxy.entity.RequestDescriptor;
import com.relay.proxy.entity.Rule;
import com.relay.proxy.entity.Upstream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WorkerTest {

    private static final Upstream BACKEND = new Upstream("backend", "localhost:1");

    private final RoutingTable table = new RoutingTable(
            List.of(BACKEND),
            List.of(new Rule("/missing", List.of("dummy")), new Rule("/api", List.of("backend"))),
            List.of(new PassThroughHeader("x-forward", "$ip"), new PassThroughHeader("x-static", "yes")));

    private Thread workerThread;

    @AfterEach
    void tearDown() {
        if (workerThread != null) {
            workerThread.interrupt();
        }
    }

    private static RequestDescriptor request(String path) {
        return RequestDescriptor.http("GET", path, Map.of("Accept", "application/json"), null, "10.1.2.3");
    }

    @Test
    void process_unmatchedPathRepliesRuleNotFound() {
        Worker worker = new Worker(0, table, mock(UpstreamForwarder.class), new LinkedBlockingQueue<>(), r -> {
        });
        RequestDescriptor descriptor = request("/unmatched");

        ReplyDescriptor reply = worker.process(descriptor).join();

        assertThat(reply.getCorrelationId()).isEqualTo(descriptor.getCorrelationId());
        assertThat(reply.getError()).isEqualTo(ErrorKind.RULE_NOT_FOUND);
        assertThat(reply.getStatus()).isEqualTo(404);
        assertThat(reply.getErrorCode()).isEqualTo("404");
        assertThat(new String(reply.body(), StandardCharsets.UTF_8)).isEqualTo("Rule not found");
    }

    @Test
    void process_unknownUpstreamRepliesUpstreamNotFound() {
        Worker worker = new Worker(0, table, mock(UpstreamForwarder.class), new LinkedBlockingQueue<>(), r -> {
        });

        ReplyDescriptor reply = worker.process(request("/missing/x")).join();

        assertThat(reply.getError()).isEqualTo(ErrorKind.UPSTREAM_NOT_FOUND);
        assertThat(reply.getStatus()).isEqualTo(500);
        assertThat(new String(reply.body(), StandardCharsets.UTF_8)).isEqualTo("Upstream server not found");
    }

    @Test
    void process_forwardFailureRepliesBadGateway() {
        UpstreamForwarder forwarder = mock(UpstreamForwarder.class);
        when(forwarder.forward(any(), anyString(), anyString(), anyMap(), any()))
                .thenReturn(CompletableFuture.failedFuture(new ForwardException("refused")));
        Worker worker = new Worker(0, table, forwarder, new LinkedBlockingQueue<>(), r -> {
        });

        ReplyDescriptor reply = worker.process(request("/api/users")).join();

        assertThat(reply.getError()).isEqualTo(ErrorKind.UPSTREAM_UNREACHABLE);
        assertThat(reply.getStatus()).isEqualTo(502);
    }

    @Test
    void process_synchronousForwarderExceptionRepliesInternalError() {
        UpstreamForwarder forwarder = mock(UpstreamForwarder.class);
        when(forwarder.forward(any(), anyString(), anyString(), anyMap(), any()))
                .thenThrow(new IllegalStateException("boom"));
        Worker worker = new Worker(0, table, forwarder, new LinkedBlockingQueue<>(), r -> {
        });

        ReplyDescriptor reply = worker.process(request("/api/users")).join();

        assertThat(reply.getError()).isEqualTo(ErrorKind.INTERNAL_ERROR);
        assertThat(reply.getStatus()).isEqualTo(500);
    }

    @Test
    void process_successRelaysBodyWhateverTheUpstreamStatus() {
        UpstreamForwarder forwarder = mock(UpstreamForwarder.class);
        when(forwarder.forward(any(), anyString(), anyString(), anyMap(), any()))
                .thenReturn(CompletableFuture.completedFuture(
                        new ForwardResponse(404, "application/json", "{}".getBytes(StandardCharsets.UTF_8))));
        Worker worker = new Worker(0, table, forwarder, new LinkedBlockingQueue<>(), r -> {
        });

        ReplyDescriptor reply = worker.process(request("/api/users?page=2")).join();

        assertThat(reply.isOk()).isTrue();
        assertThat(reply.getStatus()).isEqualTo(200);
        assertThat(reply.getErrorCode()).isNull();
        assertThat(reply.getUpstreamStatus()).isEqualTo(404);
        assertThat(reply.getContentType()).isEqualTo("application/json");
        assertThat(new String(reply.body(), StandardCharsets.UTF_8)).isEqualTo("{}");
        verify(forwarder).forward(eq(BACKEND), eq("GET"), eq("/api/users?page=2"), anyMap(), any());
    }

    @Test
    @SuppressWarnings("unchecked")
    void process_addsForwardingAndPassThroughHeaders() {
        UpstreamForwarder forwarder = mock(UpstreamForwarder.class);
        when(forwarder.forward(any(), anyString(), anyString(), anyMap(), any()))
                .thenReturn(CompletableFuture.completedFuture(new ForwardResponse(200, null, new byte[0])));
        Worker worker = new Worker(0, table, forwarder, new LinkedBlockingQueue<>(), r -> {
        });
        RequestDescriptor descriptor = RequestDescriptor.http("GET", "/api",
                Map.of("X-Forwarded-For", "192.168.0.9", "Accept", "*/*"), null, "10.1.2.3");

        worker.process(descriptor).join();

        ArgumentCaptor<Map<String, String>> headers = ArgumentCaptor.forClass(Map.class);
        verify(forwarder).forward(any(), anyString(), anyString(), headers.capture(), any());
        assertThat(headers.getValue())
                .containsEntry("Accept", "*/*")
                .containsEntry("X-Forwarded-For", "192.168.0.9, 10.1.2.3")
                .containsEntry("X-Request-Id", descriptor.getCorrelationId())
                .containsEntry("x-forward", "10.1.2.3")
                .containsEntry("x-static", "yes");
    }

    @Test
    void run_emitsRepliesInCompletionOrder() throws Exception {
        StubForwarder forwarder = new StubForwarder();
        BlockingQueue<RequestDescriptor> requests = new LinkedBlockingQueue<>();
        BlockingQueue<ReplyDescriptor> replies = new LinkedBlockingQueue<>();
        Worker worker = new Worker(7, table, forwarder, requests, replies::add);
        workerThread = new Thread(worker, "worker-test");
        workerThread.setDaemon(true);
        workerThread.start();

        RequestDescriptor first = request("/api/first");
        RequestDescriptor second = request("/api/second");
        requests.put(first);
        requests.put(second);
        await().atMost(Duration.ofSeconds(10)).until(() -> forwarder.calls.size() == 2);

        forwarder.succeed("/api/second", "two");
        forwarder.succeed("/api/first", "one");

        ReplyDescriptor r1 = replies.poll(5, TimeUnit.SECONDS);
        ReplyDescriptor r2 = replies.poll(5, TimeUnit.SECONDS);
        assertThat(r1).isNotNull();
        assertThat(r2).isNotNull();
        assertThat(r1.getCorrelationId()).isEqualTo(second.getCorrelationId());
        assertThat(new String(r1.body(), StandardCharsets.UTF_8)).isEqualTo("two");
        assertThat(r2.getCorrelationId()).isEqualTo(first.getCorrelationId());
        assertThat(new String(r2.body(), StandardCharsets.UTF_8)).isEqualTo("one");
        assertThat(worker.getId()).isEqualTo(7);
    }

    @Test
    void run_stopsWhenInterrupted() {
        Worker worker = new Worker(1, table, new StubForwarder(), new LinkedBlockingQueue<>(), r -> {
        });
        workerThread = new Thread(worker, "worker-test");
        workerThread.setDaemon(true);
        workerThread.start();

        workerThread.interrupt();

        await().atMost(Duration.ofSeconds(10)).until(() -> !workerThread.isAlive());
    }
}
