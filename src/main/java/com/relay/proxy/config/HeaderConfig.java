package com.relay.proxy.config;

/**
 * A header added to every forwarded request.
 */
public class HeaderConfig {
    private String key;
    private String value;

    public HeaderConfig() {
    }

    public HeaderConfig(String key, String value) {
        this.key = key;
        this.value = value;
    }

    public String getKey() {
        return key;
    }

    public void setKey(String key) {
        this.key = key;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }
}
