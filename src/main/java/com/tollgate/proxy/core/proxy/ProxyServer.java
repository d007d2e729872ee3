package com.tollgate.proxy.core.proxy;

import com.tollgate.proxy.config.ServerConfig;

/**
 * Interface representing a proxy server instance.
 */
public interface ProxyServer {
    /**
     * Starts the proxy server and begins listening for connections.
     */
    void start();

    /**
     * Stops the proxy server and releases all associated resources.
     */
    void stop();

    /**
     * Retrieves the listener configuration.
     * @return The configuration used by this proxy server.
     */
    ServerConfig getConfig();
}
