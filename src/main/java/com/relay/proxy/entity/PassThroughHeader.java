package com.relay.proxy.entity;

import java.util.Objects;

/**
 * A configured header added to every forwarded request.
 * The values {@code $ip} and {@code $id} are expanded per request to the client
 * address and the correlation id.
 */
public final class PassThroughHeader {
    public static final String CLIENT_IP = "$ip";
    public static final String CORRELATION_ID = "$id";

    private final String key;
    private final String value;

    public PassThroughHeader(String key, String value) {
        this.key = Objects.requireNonNull(key, "key");
        this.value = value == null ? "" : value;
    }

    public String getKey() {
        return key;
    }

    public String getValue() {
        return value;
    }

    /**
     * Resolves the header value for a concrete request.
     * 
     * @param clientIp      The client address, may be null.
     * @param correlationId The correlation id of the request.
     * @return The value to send upstream.
     */
    public String resolve(String clientIp, String correlationId) {
        if (CLIENT_IP.equals(value)) {
            return clientIp != null ? clientIp : "";
        }
        if (CORRELATION_ID.equals(value)) {
            return correlationId;
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PassThroughHeader that = (PassThroughHeader) o;
        return key.equals(that.key) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, value);
    }
}
