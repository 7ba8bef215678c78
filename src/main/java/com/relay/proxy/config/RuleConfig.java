package com.relay.proxy.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Configuration of a path-prefix routing rule.
 */
public class RuleConfig {
    /** The path prefix to match (e.g., /api). */
    private String path;

    /** Upstream ids in preference order. */
    private List<String> upstreams = new ArrayList<>();

    public RuleConfig() {
    }

    public RuleConfig(String path, List<String> upstreams) {
        this.path = path;
        setUpstreams(upstreams);
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public List<String> getUpstreams() {
        return upstreams == null ? null : Collections.unmodifiableList(upstreams);
    }

    public void setUpstreams(List<String> upstreams) {
        this.upstreams = upstreams == null ? null : new ArrayList<>(upstreams);
    }
}
