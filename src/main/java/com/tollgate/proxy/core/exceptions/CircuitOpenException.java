package com.tollgate.proxy.core.exceptions;

/**
 * Thrown by a circuit breaker that rejects a call without invoking it.
 */
public class CircuitOpenException extends ProxyException {
    public CircuitOpenException(String message) {
        super(message);
    }
}
