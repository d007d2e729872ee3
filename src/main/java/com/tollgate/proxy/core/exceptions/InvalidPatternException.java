package com.tollgate.proxy.core.exceptions;

/**
 * Thrown when a route's regular expression does not compile.
 */
public class InvalidPatternException extends ConfigException {
    public InvalidPatternException(String message, Throwable cause) {
        super(message, cause);
    }
}
