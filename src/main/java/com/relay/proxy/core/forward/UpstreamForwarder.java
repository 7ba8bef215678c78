package com.relay.proxy.core.forward;

import com.relay.proxy.entity.Upstream;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Performs the outbound request of a routed call and aggregates the upstream
 * response.
 * <p>
 * Implementations must not block the calling worker thread on network I/O.
 * Failures complete the returned future exceptionally with a
 * {@link com.relay.proxy.core.exceptions.ForwardException}.
 * </p>
 */
public interface UpstreamForwarder extends AutoCloseable {

    /**
     * Forwards a request to an upstream.
     *
     * @param upstream     The target upstream.
     * @param method       The HTTP method of the inbound request.
     * @param pathAndQuery The inbound path including any query string.
     * @param headers      Headers to send; hop-by-hop headers are dropped.
     * @param body         The request body, possibly empty.
     * @return A future completed with the fully buffered response.
     */
    CompletableFuture<ForwardResponse> forward(Upstream upstream, String method, String pathAndQuery,
            Map<String, String> headers, byte[] body);

    /**
     * Releases the resources held by this forwarder.
     */
    @Override
    default void close() {
    }
}
