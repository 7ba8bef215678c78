package com.relay.proxy.entity;

import com.relay.proxy.core.constants.RequestType;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Dispatch message handed from the dispatcher to a worker.
 * Immutable; headers are case-insensitive and keep the last value seen for a
 * repeated name.
 */
public final class RequestDescriptor {
    private static final byte[] EMPTY_BODY = new byte[0];

    private final String correlationId;
    private final RequestType requestType;
    private final String method;
    /** Path including the query string, as received on the request line. */
    private final String path;
    private final Map<String, String> headers;
    private final byte[] body;
    private final String clientAddress;

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public RequestDescriptor(String correlationId, RequestType requestType, String method, String path,
            Map<String, String> headers, byte[] body, String clientAddress) {
        this.correlationId = Objects.requireNonNull(correlationId, "correlationId");
        this.requestType = Objects.requireNonNull(requestType, "requestType");
        this.method = Objects.requireNonNull(method, "method");
        this.path = path == null ? "" : path;
        Map<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            copy.putAll(headers);
        }
        this.headers = Collections.unmodifiableMap(copy);
        this.body = body == null ? EMPTY_BODY : body;
        this.clientAddress = clientAddress;
    }

    /**
     * Creates an HTTP descriptor with a fresh correlation id.
     * 
     * @param method        The HTTP method.
     * @param path          The request path including any query string.
     * @param headers       The request headers.
     * @param body          The request body, may be null.
     * @param clientAddress The client's IP address, may be null.
     * @return A new descriptor.
     */
    public static RequestDescriptor http(String method, String path, Map<String, String> headers, byte[] body,
            String clientAddress) {
        return new RequestDescriptor(UUID.randomUUID().toString(), RequestType.HTTP, method, path, headers, body,
                clientAddress);
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public RequestType getRequestType() {
        return requestType;
    }

    public String getMethod() {
        return method;
    }

    public String getPath() {
        return path;
    }

    /**
     * Retrieves the path without its query string, used for rule matching.
     * 
     * @return The path component.
     */
    public String getPathOnly() {
        int q = path.indexOf('?');
        return q == -1 ? path : path.substring(0, q);
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public byte[] getBody() {
        return body;
    }

    public String getClientAddress() {
        return clientAddress;
    }

    @Override
    public String toString() {
        return "RequestDescriptor{" + correlationId + " " + method + " " + path + "}";
    }
}
