package com.tollgate.proxy.config;

/**
 * Listener settings of the proxy front end.
 */
public class ServerConfig {
    /** Bind address. */
    private String host = "0.0.0.0";
    /** Listen port. */
    private int port = 8080;
    /** Reserved; TLS termination is not performed. */
    private boolean tls;
    /** Timeout of each forwarded request. */
    private int requestTimeoutMs = 30000;
    /** Timeout for connecting to a backend. */
    private int connectTimeoutMs = 5000;

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public boolean isTls() {
        return tls;
    }

    public void setTls(boolean tls) {
        this.tls = tls;
    }

    public int getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    public void setRequestTimeoutMs(int requestTimeoutMs) {
        this.requestTimeoutMs = requestTimeoutMs;
    }

    public int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(int connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }
}
