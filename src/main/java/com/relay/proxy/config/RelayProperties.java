package com.relay.proxy.config;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * Root configuration object for the Relay Proxy.
 * Maps to the top-level structure of relay-proxy.yml.
 */
public class RelayProperties {
    /**
     * Listener, worker pool and routing configuration.
     */
    private ServerConfig server = new ServerConfig();

    /**
     * Administration and metrics configuration.
     */
    private AdminConfig admin = new AdminConfig();

    /**
     * Access log configuration.
     */
    private LoggingConfig logging = new LoggingConfig();

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public ServerConfig getServer() {
        return server;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setServer(ServerConfig server) {
        this.server = server;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public AdminConfig getAdmin() {
        return admin;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setAdmin(AdminConfig admin) {
        this.admin = admin;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public LoggingConfig getLogging() {
        return logging;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setLogging(LoggingConfig logging) {
        this.logging = logging;
    }
}
