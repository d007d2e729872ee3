package com.tollgate.proxy.config;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Routing rule binding request predicates to a backend.
 */
public class RouteConfig {
    private String name;
    /** Regular expression searched in the path. */
    private String pattern;
    private String pathPrefix;
    private String subdomain;
    private Map<String, String> headers = new LinkedHashMap<>();
    private List<String> methods = new ArrayList<>();
    private String backendId;
    /** Higher values are matched first. */
    private int priority;
    private CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig();

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getPattern() {
        return pattern;
    }

    public void setPattern(String pattern) {
        this.pattern = pattern;
    }

    public String getPathPrefix() {
        return pathPrefix;
    }

    public void setPathPrefix(String pathPrefix) {
        this.pathPrefix = pathPrefix;
    }

    public String getSubdomain() {
        return subdomain;
    }

    public void setSubdomain(String subdomain) {
        this.subdomain = subdomain;
    }

    public Map<String, String> getHeaders() {
        return headers == null ? null : Collections.unmodifiableMap(headers);
    }

    public void setHeaders(Map<String, String> headers) {
        this.headers = headers == null ? null : new LinkedHashMap<>(headers);
    }

    public List<String> getMethods() {
        return methods == null ? null : Collections.unmodifiableList(methods);
    }

    public void setMethods(List<String> methods) {
        this.methods = methods == null ? null : new ArrayList<>(methods);
    }

    public String getBackendId() {
        return backendId;
    }

    public void setBackendId(String backendId) {
        this.backendId = backendId;
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public CircuitBreakerConfig getCircuitBreaker() {
        return circuitBreaker;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setCircuitBreaker(CircuitBreakerConfig circuitBreaker) {
        this.circuitBreaker = circuitBreaker;
    }
}
