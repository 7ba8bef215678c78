package com.relay.proxy.core.routing;

import com.relay.proxy.config.HeaderConfig;
import com.relay.proxy.config.RuleConfig;
import com.relay.proxy.config.ServerConfig;
import com.relay.proxy.config.UpstreamConfig;
import com.relay.proxy.core.exceptions.ConfigException;
import com.relay.proxy.entity.PassThroughHeader;
import com.relay.proxy.entity.Rule;
import com.relay.proxy.entity.Upstream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable view of the upstreams, rules and pass-through headers.
 * Built once at startup and shared read-only by every worker.
 */
public final class RoutingTable {

    private final Map<String, Upstream> upstreams;
    private final List<Rule> rules;
    private final List<PassThroughHeader> headers;

    /**
     * Creates a routing table without validating rule references.
     * A rule pointing at an unknown upstream resolves to nothing at request
     * time; use {@link #from(ServerConfig)} to reject such tables up front.
     *
     * @param upstreams The upstreams; later duplicates of an id replace earlier ones.
     * @param rules     The rules in evaluation order.
     * @param headers   Headers added to forwarded requests.
     */
    public RoutingTable(Collection<Upstream> upstreams, List<Rule> rules, List<PassThroughHeader> headers) {
        Map<String, Upstream> byId = new LinkedHashMap<>();
        for (Upstream upstream : upstreams) {
            byId.put(upstream.getId(), upstream);
        }
        this.upstreams = Collections.unmodifiableMap(byId);
        this.rules = List.copyOf(rules);
        this.headers = headers == null ? List.of() : List.copyOf(headers);
    }

    /**
     * Builds a validated routing table from configuration.
     *
     * @param config The server configuration.
     * @return The routing table.
     * @throws ConfigException if an upstream or rule is malformed, an upstream id
     *                         is duplicated, or a rule references an unknown
     *                         upstream.
     */
    public static RoutingTable from(ServerConfig config) {
        List<UpstreamConfig> upstreamConfigs = config.getUpstreams() == null ? List.of() : config.getUpstreams();
        List<RuleConfig> ruleConfigs = config.getRules() == null ? List.of() : config.getRules();

        Map<String, Upstream> upstreams = new LinkedHashMap<>();
        for (UpstreamConfig uc : upstreamConfigs) {
            if (uc == null || isBlank(uc.getId())) {
                throw new ConfigException("Upstream without an id");
            }
            if (isBlank(uc.getUrl())) {
                throw new ConfigException("Upstream " + uc.getId() + " has no url");
            }
            if (upstreams.put(uc.getId(), new Upstream(uc.getId(), uc.getUrl().trim())) != null) {
                throw new ConfigException("Duplicate upstream id: " + uc.getId());
            }
        }

        if (ruleConfigs.isEmpty()) {
            throw new ConfigException("At least one rule must be configured");
        }
        List<Rule> rules = new ArrayList<>();
        for (RuleConfig rc : ruleConfigs) {
            if (rc == null || rc.getPath() == null) {
                throw new ConfigException("Rule without a path");
            }
            if (rc.getUpstreams() == null || rc.getUpstreams().isEmpty()) {
                throw new ConfigException("Rule " + rc.getPath() + " references no upstream");
            }
            for (String id : rc.getUpstreams()) {
                if (!upstreams.containsKey(id)) {
                    throw new ConfigException("Rule " + rc.getPath() + " references unknown upstream: " + id);
                }
            }
            rules.add(new Rule(rc.getPath(), rc.getUpstreams()));
        }

        List<PassThroughHeader> headers = new ArrayList<>();
        if (config.getHeaders() != null) {
            for (HeaderConfig hc : config.getHeaders()) {
                if (hc == null || isBlank(hc.getKey())) {
                    throw new ConfigException("Header without a key");
                }
                headers.add(new PassThroughHeader(hc.getKey().trim(), hc.getValue()));
            }
        }
        return new RoutingTable(upstreams.values(), rules, headers);
    }

    /**
     * Finds the first rule covering the path.
     *
     * @param path The request path, without query string.
     * @return The matching rule, or null.
     */
    public Rule matchRule(String path) {
        return RuleMatcher.match(rules, path);
    }

    /**
     * Looks up an upstream by id.
     *
     * @param id The upstream id.
     * @return The upstream, if configured.
     */
    public Optional<Upstream> upstream(String id) {
        return Optional.ofNullable(upstreams.get(id));
    }

    /**
     * Resolves the upstream a request path is routed to.
     *
     * @param path The request path, without query string.
     * @return The upstream, or empty if no rule matches or the matched rule
     *         references an unknown upstream.
     */
    public Optional<Upstream> resolve(String path) {
        Rule rule = matchRule(path);
        if (rule == null) {
            return Optional.empty();
        }
        return upstream(rule.primaryUpstreamId());
    }

    public List<Rule> getRules() {
        return rules;
    }

    public Collection<Upstream> getUpstreams() {
        return upstreams.values();
    }

    public List<PassThroughHeader> getHeaders() {
        return headers;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
