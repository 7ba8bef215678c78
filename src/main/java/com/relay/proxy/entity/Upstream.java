package com.relay.proxy.entity;

import java.util.Objects;

/**
 * A named backend server that can receive forwarded requests.
 */
public final class Upstream {
    /** Unique identifier referenced by rules. */
    private final String id;

    /** Host, host:port, or a full http(s) base URL. */
    private final String address;

    public Upstream(String id, String address) {
        this.id = Objects.requireNonNull(id, "id");
        this.address = Objects.requireNonNull(address, "address");
    }

    public String getId() {
        return id;
    }

    public String getAddress() {
        return address;
    }

    /**
     * Builds the base URL requests to this upstream are sent to.
     * A bare host (or host:port) is addressed over plain HTTP.
     * 
     * @return The base URL without a trailing slash.
     */
    public String baseUrl() {
        String base = address.contains("://") ? address : "http://" + address;
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Upstream that = (Upstream) o;
        return id.equals(that.id) && address.equals(that.address);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, address);
    }

    @Override
    public String toString() {
        return id + "(" + address + ")";
    }
}
