package com.relay.proxy.entity;

import java.util.List;
import java.util.Objects;

/**
 * Defines a path-prefix routing rule. Rules are evaluated in declaration order
 * and the first match wins.
 */
public final class Rule {
    /** The path prefix to match (e.g., /api). "/" matches every path. */
    private final String pathPrefix;

    /**
     * Upstream ids in preference order. Only the head is used for selection;
     * the rest is kept for failover.
     */
    private final List<String> upstreamIds;

    public Rule(String pathPrefix, List<String> upstreamIds) {
        this.pathPrefix = Objects.requireNonNull(pathPrefix, "pathPrefix");
        this.upstreamIds = List.copyOf(upstreamIds);
        if (this.upstreamIds.isEmpty()) {
            throw new IllegalArgumentException("Rule " + pathPrefix + " must reference at least one upstream");
        }
    }

    public String getPathPrefix() {
        return pathPrefix;
    }

    public List<String> getUpstreamIds() {
        return upstreamIds;
    }

    /**
     * Retrieves the upstream id used for selection.
     * 
     * @return The first configured upstream id.
     */
    public String primaryUpstreamId() {
        return upstreamIds.get(0);
    }

    /**
     * Checks whether this rule covers the given path.
     * 
     * @param path The request path, already normalized.
     * @return True if the path starts with this rule's prefix.
     */
    public boolean matches(String path) {
        return path.startsWith(pathPrefix);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Rule rule = (Rule) o;
        return pathPrefix.equals(rule.pathPrefix) && upstreamIds.equals(rule.upstreamIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pathPrefix, upstreamIds);
    }

    @Override
    public String toString() {
        return pathPrefix + " -> " + upstreamIds;
    }
}
