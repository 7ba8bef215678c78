package com.relay.proxy.core.exceptions;

/**
 * Thrown when an inbound HTTP request is malformed or cannot be accepted.
 */
public class ProtocolException extends ProxyException {

    private final int status;

    /**
     * Constructs a new ProtocolException with the specified detail message.
     * The client is answered with 400 Bad Request.
     *
     * @param message the detail message.
     */
    public ProtocolException(String message) {
        this(message, 400);
    }

    /**
     * Constructs a new ProtocolException answered with a specific status.
     *
     * @param message the detail message.
     * @param status  the HTTP status sent to the client.
     */
    public ProtocolException(String message, int status) {
        super(message);
        this.status = status;
    }

    /**
     * Constructs a new ProtocolException with the specified detail message and cause.
     *
     * @param message the detail message.
     * @param cause   the cause of the exception.
     */
    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
        this.status = 400;
    }

    /**
     * Retrieves the HTTP status the client receives for this failure.
     *
     * @return The status code.
     */
    public int getStatus() {
        return status;
    }
}
