package com.tollgate.proxy.core.exceptions;

/**
 * Thrown by a middleware to abort the request pipeline.
 * Carries the HTTP status the client should see (403 unless stated otherwise).
 */
public class MiddlewareException extends ProxyException {

    /** Status used when a middleware does not pick one. */
    public static final int DEFAULT_STATUS = 403;

    private final int status;

    /**
     * Constructs a new MiddlewareException answered with 403.
     * 
     * @param message the detail message.
     */
    public MiddlewareException(String message) {
        this(DEFAULT_STATUS, message);
    }

    /**
     * Constructs a new MiddlewareException with an explicit status.
     * 
     * @param status  HTTP status to answer with.
     * @param message the detail message.
     */
    public MiddlewareException(int status, String message) {
        super(message);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }
}
