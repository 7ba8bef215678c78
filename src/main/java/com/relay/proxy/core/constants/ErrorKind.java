package com.relay.proxy.core.constants;

/**
 * Failure taxonomy of a dispatched request. Each kind carries the HTTP status
 * and the short body the client receives.
 */
public enum ErrorKind {
    /** No rule prefix matched the request path. */
    RULE_NOT_FOUND(404, "Rule not found"),

    /** The matched rule references an upstream id that is not configured. */
    UPSTREAM_NOT_FOUND(500, "Upstream server not found"),

    /** The upstream could not be reached or its response could not be read. */
    UPSTREAM_UNREACHABLE(502, "Bad Gateway"),

    /** The pool had no ready worker, or the worker died while the request was pending. */
    WORKER_UNAVAILABLE(500, "Internal Server Error"),

    /** No reply arrived within the configured bound. */
    REPLY_TIMEOUT(504, "Gateway Timeout"),

    /** Unexpected failure inside a worker. */
    INTERNAL_ERROR(500, "Internal Server Error");

    private final int status;
    private final String message;

    ErrorKind(int status, String message) {
        this.status = status;
        this.message = message;
    }

    /**
     * Retrieves the HTTP status code this kind maps to.
     * 
     * @return The HTTP status code.
     */
    public int getStatus() {
        return status;
    }

    /**
     * Retrieves the human-readable body sent to the client.
     * 
     * @return The client-facing message.
     */
    public String getMessage() {
        return message;
    }
}
