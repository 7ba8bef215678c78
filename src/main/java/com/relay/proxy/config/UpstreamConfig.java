package com.relay.proxy.config;

/**
 * Configuration of a single named upstream.
 */
public class UpstreamConfig {
    /** Unique id referenced by rules. */
    private String id;

    /** Host, host:port or http(s) base URL of the backend. */
    private String url;

    public UpstreamConfig() {
    }

    public UpstreamConfig(String id, String url) {
        this.id = id;
        this.url = url;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }
}
