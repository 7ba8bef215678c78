package com.relay.proxy.core.routing;

import com.relay.proxy.entity.Rule;
import java.util.List;

/**
 * Utility class for finding the routing rule that covers a request path.
 */
public final class RuleMatcher {

    private static final String ROOT = "/";

    private RuleMatcher() {
        // Private constructor for utility class
    }

    /**
     * Finds the first rule, in declaration order, whose prefix the path starts
     * with. A catch-all "/" rule therefore has to be declared last.
     * <p>
     * An empty or null path is treated as "/".
     * </p>
     *
     * @param rules The ordered list of rules.
     * @param path  The request path, without query string.
     * @return The matching rule, or null if no match is found.
     */
    public static Rule match(List<Rule> rules, String path) {
        if (rules == null) {
            return null;
        }
        String normalized = normalize(path);
        for (Rule rule : rules) {
            if (rule.matches(normalized)) {
                return rule;
            }
        }
        return null;
    }

    /**
     * Normalizes a request path for matching.
     *
     * @param path The raw path.
     * @return "/" for an empty or null path, the path unchanged otherwise.
     */
    static String normalize(String path) {
        return path == null || path.isEmpty() ? ROOT : path;
    }
}
