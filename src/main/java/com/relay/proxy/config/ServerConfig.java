package com.relay.proxy.config;

import com.relay.proxy.core.constants.DeadWorkerPolicy;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Configuration of the reverse proxy listener, its worker pool and its routing
 * table.
 */
public class ServerConfig {
    /** Port to listen on. */
    private int listenPort = 8000;

    /** Local IP address to bind to. Null means all interfaces. */
    private String bindAddress;

    /** Number of workers. 0 means one per available processor. */
    private int workerCount = 0;

    /** Maximum time in milliseconds to wait for a worker reply. Default is 30s. */
    private int replyTimeout = 30000;

    /** Upstream connect timeout in milliseconds. Default is 5s. */
    private int connectTimeout = 5000;

    /** Upstream request timeout in milliseconds. Default is 30s. */
    private int requestTimeout = 30000;

    /** Maximum concurrent inbound connections. Default is 10,000. */
    private int maxConnections = 10000;

    /** Largest inbound request body accepted, in bytes. Default is 1 MiB. */
    private int maxRequestBodyBytes = 1024 * 1024;

    /** Capacity of each worker's request channel. */
    private int workerQueueCapacity = 1024;

    /** What to do when a worker dies. */
    private DeadWorkerPolicy deadWorkerPolicy = DeadWorkerPolicy.DEGRADE;

    /** Named backends. */
    private List<UpstreamConfig> upstreams = new ArrayList<>();

    /** Headers added to every forwarded request. */
    private List<HeaderConfig> headers = new ArrayList<>();

    /** Routing rules, evaluated in order. */
    private List<RuleConfig> rules = new ArrayList<>();

    public int getListenPort() {
        return listenPort;
    }

    public void setListenPort(int listenPort) {
        this.listenPort = listenPort;
    }

    public String getBindAddress() {
        return bindAddress;
    }

    public void setBindAddress(String bindAddress) {
        this.bindAddress = bindAddress;
    }

    public int getWorkerCount() {
        return workerCount;
    }

    public void setWorkerCount(int workerCount) {
        this.workerCount = workerCount;
    }

    /**
     * Resolves the number of workers to start.
     * 
     * @return The configured count, or the number of available processors when
     *         unset.
     */
    public int effectiveWorkerCount() {
        return workerCount > 0 ? workerCount : Runtime.getRuntime().availableProcessors();
    }

    public int getReplyTimeout() {
        return replyTimeout;
    }

    public void setReplyTimeout(int replyTimeout) {
        this.replyTimeout = replyTimeout;
    }

    public int getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(int connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public int getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(int requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public int getMaxConnections() {
        return maxConnections;
    }

    public void setMaxConnections(int maxConnections) {
        this.maxConnections = maxConnections;
    }

    public int getMaxRequestBodyBytes() {
        return maxRequestBodyBytes;
    }

    public void setMaxRequestBodyBytes(int maxRequestBodyBytes) {
        this.maxRequestBodyBytes = maxRequestBodyBytes;
    }

    public int getWorkerQueueCapacity() {
        return workerQueueCapacity;
    }

    public void setWorkerQueueCapacity(int workerQueueCapacity) {
        this.workerQueueCapacity = workerQueueCapacity;
    }

    public DeadWorkerPolicy getDeadWorkerPolicy() {
        return deadWorkerPolicy;
    }

    public void setDeadWorkerPolicy(DeadWorkerPolicy deadWorkerPolicy) {
        this.deadWorkerPolicy = deadWorkerPolicy;
    }

    public List<UpstreamConfig> getUpstreams() {
        return upstreams == null ? null : Collections.unmodifiableList(upstreams);
    }

    public void setUpstreams(List<UpstreamConfig> upstreams) {
        this.upstreams = upstreams == null ? null : new ArrayList<>(upstreams);
    }

    public List<HeaderConfig> getHeaders() {
        return headers == null ? null : Collections.unmodifiableList(headers);
    }

    public void setHeaders(List<HeaderConfig> headers) {
        this.headers = headers == null ? null : new ArrayList<>(headers);
    }

    public List<RuleConfig> getRules() {
        return rules == null ? null : Collections.unmodifiableList(rules);
    }

    public void setRules(List<RuleConfig> rules) {
        this.rules = rules == null ? null : new ArrayList<>(rules);
    }
}
