package com.relay.proxy.core.worker;

import com.relay.proxy.core.exceptions.ForwardException;
import com.relay.proxy.core.forward.ForwardResponse;
import com.relay.proxy.core.forward.UpstreamForwarder;
import com.relay.proxy.entity.Upstream;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Forwarder whose responses are completed by the test, keyed by request path.
 */
class StubForwarder implements UpstreamForwarder {

    final Map<String, CompletableFuture<ForwardResponse>> calls = new ConcurrentHashMap<>();

    @Override
    public CompletableFuture<ForwardResponse> forward(Upstream upstream, String method, String pathAndQuery,
            Map<String, String> headers, byte[] body) {
        return calls.computeIfAbsent(pathAndQuery, k -> new CompletableFuture<>());
    }

    void succeed(String path, String body) {
        calls.get(path).complete(new ForwardResponse(200, "text/plain",
                body.getBytes(StandardCharsets.UTF_8)));
    }

    void fail(String path) {
        calls.get(path).completeExceptionally(new ForwardException("connection refused"));
    }
}
