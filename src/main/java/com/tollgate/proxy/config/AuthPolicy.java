package com.tollgate.proxy.config;

/**
 * Token authentication of inbound requests.
 */
public class AuthPolicy {
    private boolean enabled;
    private String type = "bearer";
    /** Shared secret; blank accepts any non-empty token. */
    private String secret;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getSecret() {
        return secret;
    }

    public void setSecret(String secret) {
        this.secret = secret;
    }
}
