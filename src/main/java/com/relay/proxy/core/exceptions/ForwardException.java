package com.relay.proxy.core.exceptions;

/**
 * Thrown when a request cannot be delivered to an upstream or its response cannot be read.
 */
public class ForwardException extends ProxyException {
    /**
     * Constructs a new ForwardException with the specified detail message.
     * 
     * @param message the detail message.
     */
    public ForwardException(String message) {
        super(message);
    }

    /**
     * Constructs a new ForwardException with the specified detail message and cause.
     * 
     * @param message the detail message.
     * @param cause   the cause of the exception.
     */
    public ForwardException(String message, Throwable cause) {
        super(message, cause);
    }
}
