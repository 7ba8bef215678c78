package com.relay.proxy.core.forward;

import com.relay.proxy.core.constants.HeaderConstants;
import com.relay.proxy.core.exceptions.ForwardException;
import com.relay.proxy.core.utils.NamedThreadFactory;
import com.relay.proxy.entity.Upstream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link UpstreamForwarder} backed by the JDK {@link HttpClient}.
 * <p>
 * Requests are sent with {@code sendAsync}; completion runs on the client's own
 * executor, never on the worker thread. Response bodies are buffered entirely in
 * memory, which bounds the payload size this proxy can relay.
 * </p>
 */
public class HttpUpstreamForwarder implements UpstreamForwarder {

    private static final Logger log = LoggerFactory.getLogger(HttpUpstreamForwarder.class);

    /**
     * Headers that are hop-by-hop or that the JDK client refuses to set.
     */
    private static final Set<String> DISALLOWED_HEADERS;

    static {
        Set<String> disallowed = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        disallowed.addAll(List.of(
                HeaderConstants.HOST.getValue(),
                HeaderConstants.CONNECTION.getValue(),
                HeaderConstants.CONTENT_LENGTH.getValue(),
                HeaderConstants.EXPECT.getValue(),
                HeaderConstants.KEEP_ALIVE.getValue(),
                HeaderConstants.PROXY_AUTHORIZATION.getValue(),
                HeaderConstants.PROXY_AUTHENTICATE.getValue(),
                HeaderConstants.TE.getValue(),
                HeaderConstants.TRAILERS.getValue(),
                HeaderConstants.TRANSFER_ENCODING.getValue(),
                HeaderConstants.UPGRADE.getValue()));
        DISALLOWED_HEADERS = Collections.unmodifiableSet(disallowed);
    }

    private final HttpClient httpClient;
    private final ExecutorService executor;
    private final Duration requestTimeout;

    /**
     * Creates a forwarder with its own HTTP client.
     *
     * @param connectTimeoutMillis Connect timeout, 0 or less for the JDK default.
     * @param requestTimeoutMillis Per-request timeout, 0 or less for none.
     */
    public HttpUpstreamForwarder(int connectTimeoutMillis, int requestTimeoutMillis) {
        this.executor = Executors.newCachedThreadPool(new NamedThreadFactory("upstream-io-"));
        HttpClient.Builder builder = HttpClient.newBuilder()
                .executor(executor)
                .followRedirects(HttpClient.Redirect.NEVER)
                .version(HttpClient.Version.HTTP_1_1);
        if (connectTimeoutMillis > 0) {
            builder.connectTimeout(Duration.ofMillis(connectTimeoutMillis));
        }
        this.httpClient = builder.build();
        this.requestTimeout = requestTimeoutMillis > 0 ? Duration.ofMillis(requestTimeoutMillis) : null;
    }

    @Override
    public CompletableFuture<ForwardResponse> forward(Upstream upstream, String method, String pathAndQuery,
            Map<String, String> headers, byte[] body) {
        HttpRequest request;
        try {
            request = buildRequest(upstream, method, pathAndQuery, headers, body);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(
                    new ForwardException("Invalid request for upstream " + upstream.getId() + ": " + e.getMessage(),
                            e));
        }

        CompletableFuture<ForwardResponse> result = new CompletableFuture<>();
        httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray()).whenComplete((response, error) -> {
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause()
                        : error;
                log.debug("Upstream {} failed for {} {}: {}", upstream.getId(), method, pathAndQuery,
                        cause.toString());
                result.completeExceptionally(new ForwardException(
                        "Upstream " + upstream.getId() + " unreachable: " + cause.getMessage(), cause));
            } else {
                String contentType = response.headers()
                        .firstValue(HeaderConstants.CONTENT_TYPE.getValue())
                        .orElse(null);
                result.complete(new ForwardResponse(response.statusCode(), contentType, response.body()));
            }
        });
        return result;
    }

    private HttpRequest buildRequest(Upstream upstream, String method, String pathAndQuery,
            Map<String, String> headers, byte[] body) {
        String path = pathAndQuery == null || pathAndQuery.isEmpty() ? "/" : pathAndQuery;
        if (!path.startsWith("/")) {
            path = "/" + path;
        }
        HttpRequest.BodyPublisher publisher = body == null || body.length == 0
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofByteArray(body);

        HttpRequest.Builder rb = HttpRequest.newBuilder()
                .uri(URI.create(upstream.baseUrl() + path))
                .version(HttpClient.Version.HTTP_1_1)
                .method(method, publisher);
        if (requestTimeout != null) {
            rb.timeout(requestTimeout);
        }
        if (headers != null) {
            headers.forEach((k, v) -> {
                if (isAllowedHeader(k) && v != null) {
                    rb.setHeader(k, v);
                }
            });
        }
        return rb.build();
    }

    /**
     * Checks if a header may be forwarded to the upstream.
     *
     * @param name The header name.
     * @return True unless it is hop-by-hop or restricted.
     */
    static boolean isAllowedHeader(String name) {
        return !DISALLOWED_HEADERS.contains(name);
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Upstream executor did not terminate cleanly after 5 s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
