package com.tollgate.proxy.config;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A named pool of backend servers.
 */
public class BackendConfig {
    private String id;
    private List<String> servers = new ArrayList<>();
    private HealthCheckConfig healthCheck = new HealthCheckConfig();

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public List<String> getServers() {
        return servers == null ? null : Collections.unmodifiableList(servers);
    }

    public void setServers(List<String> servers) {
        this.servers = servers == null ? null : new ArrayList<>(servers);
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public HealthCheckConfig getHealthCheck() {
        return healthCheck;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setHealthCheck(HealthCheckConfig healthCheck) {
        this.healthCheck = healthCheck;
    }
}
