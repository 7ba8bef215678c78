package com.relay.proxy.core.worker;

import com.relay.proxy.core.constants.ErrorKind;
import com.relay.proxy.core.constants.HeaderConstants;
import com.relay.proxy.core.forward.UpstreamForwarder;
import com.relay.proxy.core.routing.RoutingTable;
import com.relay.proxy.entity.PassThroughHeader;
import com.relay.proxy.entity.ReplyDescriptor;
import com.relay.proxy.entity.RequestDescriptor;
import com.relay.proxy.entity.Rule;
import com.relay.proxy.entity.Upstream;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Isolated execution unit bound to one {@link RoutingTable} snapshot.
 * <p>
 * The processing loop runs on a single thread and takes descriptors from its
 * request channel. Forwarding is asynchronous, so the loop moves on to the next
 * descriptor while earlier ones are still waiting on their upstream. Replies are
 * emitted in completion order, each tagged with its request's correlation id.
 * </p>
 */
public class Worker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(Worker.class);

    private final int id;
    private final RoutingTable routingTable;
    private final UpstreamForwarder forwarder;
    private final BlockingQueue<RequestDescriptor> requests;
    private final Consumer<ReplyDescriptor> replies;

    /**
     * Creates a worker.
     *
     * @param id           Worker id, used in logs and thread names.
     * @param routingTable The routing snapshot shared by every worker.
     * @param forwarder    The forwarder used for upstream calls.
     * @param requests     Inbound channel of dispatch messages.
     * @param replies      Outbound channel for reply messages.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public Worker(int id, RoutingTable routingTable, UpstreamForwarder forwarder,
            BlockingQueue<RequestDescriptor> requests, Consumer<ReplyDescriptor> replies) {
        this.id = id;
        this.routingTable = routingTable;
        this.forwarder = forwarder;
        this.requests = requests;
        this.replies = replies;
    }

    public int getId() {
        return id;
    }

    /**
     * Processing loop. Returns when the thread is interrupted.
     */
    @Override
    public void run() {
        log.debug("Worker {} started", id);
        try {
            while (!Thread.currentThread().isInterrupted()) {
                RequestDescriptor descriptor = requests.take();
                process(descriptor).thenAccept(replies);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.debug("Worker {} stopped", id);
    }

    /**
     * Turns a request descriptor into its reply.
     * Never completes exceptionally: every failure becomes an error reply.
     *
     * @param descriptor The request to handle.
     * @return A future completed with the reply for this descriptor.
     */
    public CompletableFuture<ReplyDescriptor> process(RequestDescriptor descriptor) {
        String correlationId = descriptor.getCorrelationId();
        try {
            Rule rule = routingTable.matchRule(descriptor.getPathOnly());
            if (rule == null) {
                log.debug("Worker {}: no rule for {} [{}]", id, descriptor.getPath(), correlationId);
                return CompletableFuture.completedFuture(
                        ReplyDescriptor.error(correlationId, ErrorKind.RULE_NOT_FOUND));
            }

            Optional<Upstream> upstream = routingTable.upstream(rule.primaryUpstreamId());
            if (upstream.isEmpty()) {
                log.error("Worker {}: rule {} references unknown upstream {}", id, rule.getPathPrefix(),
                        rule.primaryUpstreamId());
                return CompletableFuture.completedFuture(
                        ReplyDescriptor.error(correlationId, ErrorKind.UPSTREAM_NOT_FOUND));
            }

            Upstream target = upstream.get();
            return forwarder.forward(target, descriptor.getMethod(), descriptor.getPath(),
                    outboundHeaders(descriptor), descriptor.getBody())
                    .handle((response, error) -> {
                        if (error != null) {
                            log.warn("Worker {}: upstream {} failed for {} [{}]: {}", id, target.getId(),
                                    descriptor.getPath(), correlationId, error.getMessage());
                            return ReplyDescriptor.error(correlationId, ErrorKind.UPSTREAM_UNREACHABLE);
                        }
                        return ReplyDescriptor.ok(correlationId, response.body(), response.contentType(),
                                response.statusCode());
                    });
        } catch (RuntimeException e) {
            log.error("Worker {}: unexpected error handling {}", id, descriptor, e);
            return CompletableFuture.completedFuture(
                    ReplyDescriptor.error(correlationId, ErrorKind.INTERNAL_ERROR));
        }
    }

    /**
     * Builds the headers sent upstream: inbound headers, forwarding headers and
     * the routing table's pass-through headers, in that order of precedence.
     */
    private Map<String, String> outboundHeaders(RequestDescriptor descriptor) {
        Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headers.putAll(descriptor.getHeaders());

        String clientIp = descriptor.getClientAddress();
        if (clientIp != null) {
            String existingXff = headers.get(HeaderConstants.X_FORWARDED_FOR.getValue());
            headers.put(HeaderConstants.X_FORWARDED_FOR.getValue(),
                    (existingXff != null ? existingXff + ", " : "") + clientIp);
        }
        headers.put(HeaderConstants.X_REQUEST_ID.getValue(), descriptor.getCorrelationId());

        for (PassThroughHeader header : routingTable.getHeaders()) {
            headers.put(header.getKey(), header.resolve(clientIp, descriptor.getCorrelationId()));
        }
        return headers;
    }
}
