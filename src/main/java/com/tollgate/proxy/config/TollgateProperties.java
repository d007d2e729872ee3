package com.tollgate.proxy.config;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Root configuration object for Tollgate.
 * Maps to the top-level structure of application.yml.
 */
public class TollgateProperties {
    /** Front-end listener. */
    private ServerConfig server = new ServerConfig();
    /** Backend pools. */
    private List<BackendConfig> backends = new ArrayList<>();
    /** Routing rules. */
    private List<RouteConfig> routes = new ArrayList<>();
    /** Request policies. */
    private PoliciesConfig policies = new PoliciesConfig();
    /** Administration and metrics configuration. */
    private AdminConfig admin = new AdminConfig();

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public ServerConfig getServer() {
        return server;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setServer(ServerConfig server) {
        this.server = server;
    }

    public List<BackendConfig> getBackends() {
        return backends == null ? null : Collections.unmodifiableList(backends);
    }

    public void setBackends(List<BackendConfig> backends) {
        this.backends = backends == null ? null : new ArrayList<>(backends);
    }

    public List<RouteConfig> getRoutes() {
        return routes == null ? null : Collections.unmodifiableList(routes);
    }

    public void setRoutes(List<RouteConfig> routes) {
        this.routes = routes == null ? null : new ArrayList<>(routes);
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public PoliciesConfig getPolicies() {
        return policies;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setPolicies(PoliciesConfig policies) {
        this.policies = policies;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public AdminConfig getAdmin() {
        return admin;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setAdmin(AdminConfig admin) {
        this.admin = admin;
    }
}
