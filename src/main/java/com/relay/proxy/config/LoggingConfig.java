package com.relay.proxy.config;

/**
 * Configuration for the access log.
 */
public class LoggingConfig {
    /**
     * Access log format. Apache-style placeholders (%h, %t, %r, %>s, %b) plus
     * %w for the worker id and %i for the correlation id.
     */
    private String format = "%h %l %u %t \"%r\" %>s %b";

    /** Whether to log every dispatched request. */
    private boolean accessLogEnabled = true;

    public String getFormat() {
        return format;
    }

    public void setFormat(String format) {
        this.format = format;
    }

    public boolean isAccessLogEnabled() {
        return accessLogEnabled;
    }

    public void setAccessLogEnabled(boolean accessLogEnabled) {
        this.accessLogEnabled = accessLogEnabled;
    }
}
