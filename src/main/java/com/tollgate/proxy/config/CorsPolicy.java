package com.tollgate.proxy.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class CorsPolicy {
    private boolean enabled;
    private List<String> allowedOrigins = new ArrayList<>();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public List<String> getAllowedOrigins() {
        return allowedOrigins == null ? null : Collections.unmodifiableList(allowedOrigins);
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
        this.allowedOrigins = allowedOrigins == null ? null : new ArrayList<>(allowedOrigins);
    }
}
