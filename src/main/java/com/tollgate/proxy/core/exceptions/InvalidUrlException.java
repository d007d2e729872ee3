package com.tollgate.proxy.core.exceptions;

/**
 * Thrown when a backend server URL cannot be parsed or is not an absolute
 * http(s) URL.
 */
public class InvalidUrlException extends ConfigException {
    public InvalidUrlException(String message) {
        super(message);
    }

    public InvalidUrlException(String message, Throwable cause) {
        super(message, cause);
    }
}
