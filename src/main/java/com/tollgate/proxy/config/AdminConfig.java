package com.tollgate.proxy.config;

/**
 * Configuration for the administration server (health, metrics, stats).
 */
public class AdminConfig {
    private boolean enabled = true;
    private int port = 9090;
    private String bindAddress = "127.0.0.1";

    /**
     * Whether the admin server is started.
     *
     * @return the enabled.
     */
    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Sets the enabled.
     *
     * @param enabled the enabled.
     */
    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    /**
     * Admin listen port.
     *
     * @return the port.
     */
    public int getPort() {
        return port;
    }

    /**
     * Sets the port.
     *
     * @param port the port.
     */
    public void setPort(int port) {
        this.port = port;
    }

    /**
     * Bind address for the admin server. Defaults to loopback.
     *
     * @return the bindAddress.
     */
    public String getBindAddress() {
        return bindAddress;
    }

    /**
     * Sets the bindAddress.
     *
     * @param bindAddress the bindAddress.
     */
    public void setBindAddress(String bindAddress) {
        this.bindAddress = bindAddress;
    }
}
