package com.tollgate.proxy.core.constants;

/**
 * Common HTTP header names used by the proxy.
 */
public enum HeaderConstants {
    /** The Standard HTTP Host header. */
    HOST("Host"),
    /** Hop-by-hop Connection header. */
    CONNECTION("Connection"),
    /** Length of the entity body in bytes. */
    CONTENT_LENGTH("Content-Length"),
    /** Media type of the entity body. */
    CONTENT_TYPE("Content-Type"),
    /** Type of encoding used to transfer the entity. */
    TRANSFER_ENCODING("Transfer-Encoding"),
    /** Specifies the persistent connection parameters. */
    KEEP_ALIVE("Keep-Alive"),
    /** Specifies the transfer encodings the client is willing to accept. */
    TE("TE"),
    /** Specifies that a set of header fields is present in the trailer. */
    TRAILERS("Trailers"),
    /** Used by the client to request a protocol change. */
    UPGRADE("Upgrade"),
    /** Expectation sent before a request body. */
    EXPECT("Expect"),
    /** Hop-by-hop proxy credentials. */
    PROXY_AUTHORIZATION("Proxy-Authorization"),
    /** Hop-by-hop proxy challenge. */
    PROXY_AUTHENTICATE("Proxy-Authenticate"),
    /** Bearer or other credentials checked by the auth middleware. */
    AUTHORIZATION("Authorization"),
    /** Request cookies. */
    COOKIE("Cookie"),
    /** Cross-origin request origin. */
    ORIGIN("Origin"),
    /** Chain of client addresses seen by proxies. */
    X_FORWARDED_FOR("X-Forwarded-For"),
    /** Scheme the client used to reach the first proxy. */
    X_FORWARDED_PROTO("X-Forwarded-Proto"),
    /** Address of the originating client. */
    X_REAL_IP("X-Real-IP"),
    /** Explicit user identity used for sticky traffic splits. */
    X_USER_ID("X-User-ID"),
    /** Marks whether a response was served from the cache. */
    X_CACHE("X-Cache"),
    /** CORS allowed origin. */
    ACCESS_CONTROL_ALLOW_ORIGIN("Access-Control-Allow-Origin"),
    /** CORS allowed methods. */
    ACCESS_CONTROL_ALLOW_METHODS("Access-Control-Allow-Methods"),
    /** CORS allowed headers. */
    ACCESS_CONTROL_ALLOW_HEADERS("Access-Control-Allow-Headers");

    private final String value;

    HeaderConstants(String value) {
        this.value = value;
    }

    /**
     * Retrieves the standard string value of the header.
     * 
     * @return The standard string value of the header.
     */
    public String getValue() {
        return value;
    }
}
