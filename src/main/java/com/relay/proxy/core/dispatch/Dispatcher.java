package com.relay.proxy.core.dispatch;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.relay.proxy.config.ServerConfig;
import com.relay.proxy.core.constants.ErrorKind;
import com.relay.proxy.core.constants.HeaderConstants;
import com.relay.proxy.core.exceptions.ProtocolException;
import com.relay.proxy.core.exceptions.WorkerUnavailableException;
import com.relay.proxy.core.services.LoggingService;
import com.relay.proxy.core.utils.IoUtils;
import com.relay.proxy.core.utils.NamedThreadFactory;
import com.relay.proxy.core.worker.WorkerHandle;
import com.relay.proxy.core.worker.WorkerPool;
import com.relay.proxy.entity.ReplyDescriptor;
import com.relay.proxy.entity.RequestDescriptor;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Network-facing entry point of the proxy.
 * <p>
 * Accepts inbound HTTP/1.1 connections, turns each request into a
 * {@link RequestDescriptor}, hands it to a worker selected from the
 * {@link WorkerPool} and writes the worker's reply back on the originating
 * connection. One request is served per connection.
 * </p>
 */
public class Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private static final int MAX_HTTP_HEADERS = 100;

    /** Interval at which a waiting connection checks whether its client is still there. */
    private static final long WAIT_SLICE_MILLIS = 100;

    private static final String TEXT_PLAIN = "text/plain; charset=utf-8";

    /** Standard HTTP reason phrases. */
    private static final Map<Integer, String> REASON_PHRASES = Map.ofEntries(
            Map.entry(200, "OK"), Map.entry(400, "Bad Request"),
            Map.entry(404, "Not Found"), Map.entry(411, "Length Required"),
            Map.entry(413, "Payload Too Large"), Map.entry(500, "Internal Server Error"),
            Map.entry(501, "Not Implemented"), Map.entry(502, "Bad Gateway"),
            Map.entry(503, "Service Unavailable"), Map.entry(504, "Gateway Timeout"));

    private final ServerConfig config;
    private final WorkerPool pool;
    private final LoggingService loggingService;
    private final MeterRegistry registry;

    /** Executor for handling client connections. */
    private final ExecutorService executor;

    /** Semaphore to enforce the maximum number of concurrent connections. */
    private final Semaphore connectionSemaphore;

    /** Set of active client sockets for graceful shutdown. */
    private final Set<Socket> activeSockets = ConcurrentHashMap.newKeySet();

    private final Counter dispatchTotal;
    private final Meter activeGauge;
    private final Meter readyGauge;
    private final Meter pendingGauge;
    private final Map<String, Counter> taggedCounters = new ConcurrentHashMap<>();

    /** Released once the bind attempt has completed, successfully or not. */
    private final CountDownLatch bindLatch = new CountDownLatch(1);
    private volatile boolean bindSuccess = false;

    private volatile ServerSocket serverSocket;

    /**
     * Creates a dispatcher. Nothing is bound until {@link #start()}.
     *
     * @param config         The listener configuration.
     * @param pool           The worker pool requests are dispatched to.
     * @param loggingService The access log.
     * @param registry       The Micrometer meter registry.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public Dispatcher(ServerConfig config, WorkerPool pool, LoggingService loggingService,
            MeterRegistry registry) {
        this.config = config;
        this.pool = pool;
        this.loggingService = loggingService;
        this.registry = registry;
        this.executor = Executors.newCachedThreadPool(new NamedThreadFactory("dispatch-"));
        this.connectionSemaphore = new Semaphore(config.getMaxConnections());

        this.dispatchTotal = Counter.builder("relay.dispatch.total")
                .description("Total number of requests dispatched to workers")
                .register(registry);
        this.activeGauge = Gauge.builder("relay.connections.active", activeSockets, Set::size)
                .description("Current number of inbound connections")
                .register(registry);
        this.readyGauge = Gauge.builder("relay.workers.ready", pool, WorkerPool::readyCount)
                .description("Number of workers able to take requests")
                .register(registry);
        this.pendingGauge = Gauge.builder("relay.replies.pending", pool, WorkerPool::pendingCount)
                .description("Number of requests awaiting a worker reply")
                .register(registry);
    }

    /**
     * Binds the listener and runs the accept loop on the calling thread until
     * {@link #stop()} is called.
     */
    public void start() {
        try {
            serverSocket = new ServerSocket();
            serverSocket.setReuseAddress(true);
            InetSocketAddress bindAddr = config.getBindAddress() != null
                    ? new InetSocketAddress(config.getBindAddress(), config.getListenPort())
                    : new InetSocketAddress(config.getListenPort());
            serverSocket.bind(bindAddr);
            bindSuccess = true;
            bindLatch.countDown();
            log.info("Relay proxy listening on {}:{} with {} workers",
                    config.getBindAddress() != null ? config.getBindAddress() : "0.0.0.0",
                    serverSocket.getLocalPort(), pool.size());

            while (!serverSocket.isClosed()) {
                if (!acceptAndProcessNextClient()) {
                    break;
                }
            }
        } catch (IOException e) {
            bindLatch.countDown();
            log.error("Listener error on port {}: {}", config.getListenPort(), e.getMessage(), e);
        }
    }

    private boolean acceptAndProcessNextClient() {
        try {
            Socket client = serverSocket.accept();
            processClient(client);
            return true;
        } catch (SocketException e) {
            if (serverSocket.isClosed()) {
                return false;
            }
            log.error("Accept error on port {}: {}", config.getListenPort(), e.getMessage());
            return true;
        } catch (IOException e) {
            log.error("I/O error during accept on port {}: {}", config.getListenPort(), e.getMessage());
            return true;
        }
    }

    /**
     * Waits for the listener to finish binding to its port.
     *
     * @param timeout Maximum time to wait.
     * @param unit    Unit for the timeout.
     * @return {@code true} if the bind completed successfully within the timeout.
     */
    public boolean awaitBind(long timeout, TimeUnit unit) {
        try {
            return bindLatch.await(timeout, unit) && bindSuccess;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Retrieves the port the listener is bound to.
     *
     * @return The local port, or -1 if not bound.
     */
    public int getLocalPort() {
        ServerSocket socket = serverSocket;
        return socket != null ? socket.getLocalPort() : -1;
    }

    private void processClient(Socket client) {
        String remoteAddr = client.getInetAddress().getHostAddress();
        try {
            client.setTcpNoDelay(true);
            client.setSoTimeout(config.getRequestTimeout() > 0 ? config.getRequestTimeout() : 60000);
        } catch (SocketException e) {
            log.debug("Failed to configure client socket: {}", e.getMessage());
        }

        if (connectionSemaphore.tryAcquire()) {
            activeSockets.add(client);
            executor.submit(() -> {
                try {
                    handleClient(client, remoteAddr);
                } catch (Exception e) {
                    log.error("Unexpected error handling client {}: {}", remoteAddr, e.getMessage(), e);
                } finally {
                    activeSockets.remove(client);
                    connectionSemaphore.release();
                    IoUtils.closeQuietly(client, "client socket");
                }
            });
        } else {
            log.warn("Connection limit reached ({})", config.getMaxConnections());
            IoUtils.closeQuietly(client, "limit reached client socket");
        }
    }

    private void handleClient(Socket client, String remoteAddr) {
        try (client) {
            InputStream in = new BufferedInputStream(client.getInputStream());
            OutputStream out = client.getOutputStream();

            RequestDescriptor descriptor;
            try {
                descriptor = readRequest(in, out, remoteAddr);
            } catch (ProtocolException e) {
                log.warn("HTTP protocol error from {}: {}", remoteAddr, e.getMessage());
                writeResponse(out, e.getStatus(), TEXT_PLAIN, reasonPhrase(e.getStatus())
                        .getBytes(StandardCharsets.UTF_8), null);
                return;
            }
            if (descriptor == null) {
                return;
            }
            dispatch(client, in, out, descriptor);
        } catch (SocketTimeoutException e) {
            log.debug("Client {} timed out: {}", remoteAddr, e.getMessage());
        } catch (IOException e) {
            log.debug("I/O error with client {}: {}", remoteAddr, e.getMessage());
        }
    }

    private void dispatch(Socket client, InputStream in, OutputStream out, RequestDescriptor descriptor)
            throws IOException {
        String correlationId = descriptor.getCorrelationId();
        int workerId = -1;
        ReplyDescriptor reply;
        try {
            WorkerHandle handle = pool.select();
            workerId = handle.getId();
            dispatchTotal.increment();
            taggedCounter("relay.worker.dispatched", "worker", String.valueOf(workerId)).increment();

            CompletableFuture<ReplyDescriptor> pending = pool.send(handle, descriptor);
            reply = awaitReply(client, in, pending, descriptor);
            if (reply == null) {
                return;
            }
        } catch (WorkerUnavailableException e) {
            log.error("No worker for {} {} [{}]: {}", descriptor.getMethod(), descriptor.getPath(), correlationId,
                    e.getMessage());
            reply = ReplyDescriptor.error(correlationId, ErrorKind.WORKER_UNAVAILABLE);
        }

        if (reply.isOk()) {
            taggedCounter("relay.upstream.responses", "status", String.valueOf(reply.getUpstreamStatus()))
                    .increment();
        } else {
            taggedCounter("relay.dispatch.errors", "kind", reply.getError().name().toLowerCase(Locale.ROOT))
                    .increment();
        }
        byte[] body = reply.body();
        String contentType = reply.isOk() ? reply.getContentType() : TEXT_PLAIN;
        writeResponse(out, reply.getStatus(), contentType, body, correlationId);
        loggingService.logRequest(descriptor.getClientAddress(), descriptor.getMethod(), descriptor.getPath(),
                reply.getStatus(), body.length, workerId, correlationId);
    }

    /**
     * Waits for a worker reply while watching the client connection.
     *
     * @return The reply to send, or null if the client went away and the request
     *         was abandoned.
     */
    private ReplyDescriptor awaitReply(Socket client, InputStream in, CompletableFuture<ReplyDescriptor> pending,
            RequestDescriptor descriptor) throws IOException {
        String correlationId = descriptor.getCorrelationId();
        boolean probing = true;
        while (true) {
            try {
                return pending.get(WAIT_SLICE_MILLIS, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                if (!probing) {
                    continue;
                }
                ClientState clientState = probeClient(client, in);
                if (clientState == ClientState.GONE) {
                    pending.cancel(true);
                    log.info("Client {} disconnected, abandoning request {}", descriptor.getClientAddress(),
                            correlationId);
                    return null;
                }
                if (clientState == ClientState.HALF_CLOSED) {
                    // reading side is done; the reply is still owed
                    log.debug("Client {} half-closed while waiting for {}", descriptor.getClientAddress(),
                            correlationId);
                    probing = false;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                pending.cancel(true);
                return null;
            } catch (CancellationException e) {
                return null;
            } catch (ExecutionException e) {
                return failureReply(correlationId, e.getCause());
            }
        }
    }

    private ReplyDescriptor failureReply(String correlationId, Throwable cause) {
        if (cause instanceof WorkerUnavailableException) {
            log.error("Worker lost while handling {}: {}", correlationId, cause.getMessage());
            return ReplyDescriptor.error(correlationId, ErrorKind.WORKER_UNAVAILABLE);
        }
        if (cause instanceof TimeoutException) {
            log.warn("No reply for {} within {} ms", correlationId, config.getReplyTimeout());
            return ReplyDescriptor.error(correlationId, ErrorKind.REPLY_TIMEOUT);
        }
        log.error("Dispatch of {} failed", correlationId, cause);
        return ReplyDescriptor.error(correlationId, ErrorKind.INTERNAL_ERROR);
    }

    /**
     * Probes the client connection without consuming data. End of stream only
     * means the client finished sending; a reset or a closed socket means it is
     * gone.
     */
    private ClientState probeClient(Socket client, InputStream in) throws IOException {
        if (client.isClosed()) {
            return ClientState.GONE;
        }
        if (in.available() > 0) {
            return ClientState.OPEN;
        }
        int previousTimeout = client.getSoTimeout();
        client.setSoTimeout(1);
        try {
            in.mark(1);
            int b = in.read();
            if (b == -1) {
                return ClientState.HALF_CLOSED;
            }
            in.reset();
            return ClientState.OPEN;
        } catch (SocketTimeoutException e) {
            return ClientState.OPEN;
        } catch (SocketException e) {
            return ClientState.GONE;
        } finally {
            if (!client.isClosed()) {
                client.setSoTimeout(previousTimeout);
            }
        }
    }

    private enum ClientState {
        OPEN, HALF_CLOSED, GONE
    }

    /**
     * Reads one request from the connection.
     *
     * @return The descriptor, or null if the client closed the connection before
     *         sending a request line.
     */
    private RequestDescriptor readRequest(InputStream in, OutputStream out, String remoteAddr) throws IOException {
        String requestLine = readLine(in);
        if (requestLine == null || requestLine.isEmpty()) {
            return null;
        }
        String[] parts = requestLine.split(" ");
        if (parts.length < 2 || parts[0].isEmpty()) {
            throw new ProtocolException("Malformed request line: " + requestLine);
        }
        String method = parts[0].toUpperCase(Locale.ROOT);
        String path = toOriginForm(parts[1]);

        Map<String, String> headers = readHeaders(in);

        if ("100-continue".equalsIgnoreCase(headers.get(HeaderConstants.EXPECT.getValue()))) {
            out.write("HTTP/1.1 100 Continue\r\n\r\n".getBytes(StandardCharsets.US_ASCII));
            out.flush();
        }
        byte[] body = readBody(in, headers);

        return RequestDescriptor.http(method, path, headers, body, remoteAddr);
    }

    /**
     * Reduces an absolute-form request target to its path and query.
     */
    private static String toOriginForm(String target) {
        if (target.startsWith("http://") || target.startsWith("https://")) {
            try {
                URI uri = URI.create(target);
                String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
                return uri.getRawQuery() != null ? path + "?" + uri.getRawQuery() : path;
            } catch (IllegalArgumentException e) {
                throw new ProtocolException("Invalid request target: " + target, e);
            }
        }
        return target;
    }

    private String readLine(InputStream in) throws IOException {
        try {
            return IoUtils.readLine(in);
        } catch (SocketTimeoutException e) {
            throw e;
        } catch (IOException e) {
            throw new ProtocolException(e.getMessage(), e);
        }
    }

    private Map<String, String> readHeaders(InputStream in) throws IOException {
        Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        String line;
        int headerCount = 0;
        while ((line = readLine(in)) != null && !line.isEmpty()) {
            if (++headerCount > MAX_HTTP_HEADERS) {
                throw new ProtocolException("Too many HTTP headers (exceeds limit of " + MAX_HTTP_HEADERS + ")");
            }
            int idx = line.indexOf(':');
            if (idx <= 0) {
                throw new ProtocolException("Malformed header line: " + line);
            }
            headers.put(line.substring(0, idx).trim(), line.substring(idx + 1).trim());
        }
        if (line == null) {
            throw new ProtocolException("Connection closed before end of headers");
        }
        return headers;
    }

    private byte[] readBody(InputStream in, Map<String, String> headers) throws IOException {
        int limit = config.getMaxRequestBodyBytes();
        String transferEncoding = headers.get(HeaderConstants.TRANSFER_ENCODING.getValue());
        if (transferEncoding != null) {
            if (!"chunked".equalsIgnoreCase(transferEncoding)) {
                throw new ProtocolException("Unsupported Transfer-Encoding: " + transferEncoding, 501);
            }
            return readChunked(in, limit);
        }

        String clStr = headers.get(HeaderConstants.CONTENT_LENGTH.getValue());
        if (clStr == null) {
            return new byte[0];
        }
        long length;
        try {
            length = Long.parseLong(clStr);
        } catch (NumberFormatException e) {
            throw new ProtocolException("Invalid Content-Length: " + clStr);
        }
        if (length < 0) {
            throw new ProtocolException("Invalid Content-Length: " + clStr);
        }
        if (length > limit) {
            throw new ProtocolException("Request body of " + length + " bytes exceeds limit of " + limit, 413);
        }
        try {
            return IoUtils.readFully(in, (int) length);
        } catch (SocketTimeoutException e) {
            throw e;
        } catch (IOException e) {
            throw new ProtocolException("Truncated request body: " + e.getMessage(), e);
        }
    }

    private byte[] readChunked(InputStream in, int limit) throws IOException {
        ByteArrayOutputStream body = new ByteArrayOutputStream();
        while (true) {
            String sizeLine = readLine(in);
            if (sizeLine == null) {
                throw new ProtocolException("Connection closed inside chunked body");
            }
            int ext = sizeLine.indexOf(';');
            String hex = (ext == -1 ? sizeLine : sizeLine.substring(0, ext)).trim();
            int size;
            try {
                size = Integer.parseInt(hex, 16);
            } catch (NumberFormatException e) {
                throw new ProtocolException("Invalid chunk size: " + sizeLine);
            }
            if (size < 0) {
                throw new ProtocolException("Invalid chunk size: " + sizeLine);
            }
            if (size == 0) {
                // trailers
                String trailer;
                while ((trailer = readLine(in)) != null && !trailer.isEmpty()) {
                    log.debug("Ignoring chunked trailer: {}", trailer);
                }
                return body.toByteArray();
            }
            if ((long) body.size() + size > limit) {
                throw new ProtocolException("Chunked request body exceeds limit of " + limit, 413);
            }
            body.write(IoUtils.readFully(in, size));
            readLine(in);
        }
    }

    /**
     * Writes a complete response and closes the exchange.
     */
    private void writeResponse(OutputStream out, int status, String contentType, byte[] body, String correlationId)
            throws IOException {
        StringBuilder head = new StringBuilder(128)
                .append("HTTP/1.1 ").append(status).append(' ').append(reasonPhrase(status)).append("\r\n");
        if (contentType != null) {
            head.append(HeaderConstants.CONTENT_TYPE.getValue()).append(": ").append(contentType).append("\r\n");
        }
        if (correlationId != null) {
            head.append(HeaderConstants.X_REQUEST_ID.getValue()).append(": ").append(correlationId).append("\r\n");
        }
        head.append(HeaderConstants.CONTENT_LENGTH.getValue()).append(": ").append(body.length).append("\r\n")
                .append(HeaderConstants.CONNECTION.getValue()).append(": close\r\n\r\n");
        out.write(head.toString().getBytes(StandardCharsets.US_ASCII));
        out.write(body);
        out.flush();
    }

    private static String reasonPhrase(int status) {
        return REASON_PHRASES.getOrDefault(status, "Unknown");
    }

    private Counter taggedCounter(String name, String tagKey, String tagValue) {
        return taggedCounters.computeIfAbsent(name + "|" + tagValue, k -> Counter.builder(name)
                .tag(tagKey, tagValue)
                .register(registry));
    }

    /**
     * Stops the listener. Closes the server socket and all active client
     * connections.
     */
    public void stop() {
        log.info("Stopping listener on port {}...", getLocalPort());
        try {
            if (serverSocket != null) {
                serverSocket.close();
            }
        } catch (IOException e) {
            log.error("Failed to close server socket: {}", e.getMessage(), e);
        }

        for (Socket s : activeSockets) {
            IoUtils.closeQuietly(s);
        }
        activeSockets.clear();

        registry.remove(dispatchTotal);
        registry.remove(activeGauge);
        registry.remove(readyGauge);
        registry.remove(pendingGauge);
        taggedCounters.values().forEach(registry::remove);
        taggedCounters.clear();

        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Dispatcher executor did not terminate cleanly after 5 s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
