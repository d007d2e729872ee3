package com.tollgate.proxy.core.routing;

import com.tollgate.proxy.core.backend.Pool;
import com.tollgate.proxy.core.proxy.RequestContext;
import com.tollgate.proxy.core.traffic.CircuitBreaker;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A routing rule mapping matching requests to a backend pool.
 * Every configured predicate must hold for the route to match; unset
 * predicates are ignored, so a bare route matches everything.
 */
public class Route {

    private String name;
    private String pattern;
    private String prefix;
    private String subdomain;
    private Map<String, String> headers = new LinkedHashMap<>();
    private Set<String> methods = new LinkedHashSet<>();
    private int priority;
    private Pool pool;
    private PoolSelector selector;
    private CircuitBreaker circuitBreaker;

    // Set by Router.addRoute
    private Pattern compiled;

    public Route() {
    }

    public Route(String name, Pool pool) {
        this.name = name;
        this.pool = pool;
    }

    /**
     * Tests every configured predicate against the request.
     *
     * @param request the request.
     * @return true if all predicates hold.
     */
    public boolean matches(RequestContext request) {
        if (!methods.isEmpty() && !methods.contains(request.getMethod())) {
            return false;
        }
        if (subdomain != null && !subdomain.isEmpty() && !subdomain.equals(extractSubdomain(request.getHost()))) {
            return false;
        }
        for (Map.Entry<String, String> header : headers.entrySet()) {
            if (!header.getValue().equals(request.getHeader(header.getKey()))) {
                return false;
            }
        }
        String path = request.getPath();
        if (prefix != null && !prefix.isEmpty() && !path.startsWith(prefix)) {
            return false;
        }
        return compiled == null || compiled.matcher(path).find();
    }

    /**
     * The pool serving this request: the selector's choice if one is set,
     * otherwise the fixed pool.
     *
     * @param request the request.
     * @return the pool, possibly null.
     */
    public Pool resolvePool(RequestContext request) {
        if (selector != null) {
            return selector.select(request);
        }
        return pool;
    }

    static String extractSubdomain(String host) {
        if (host == null || host.isEmpty()) {
            return "";
        }
        String bare = host;
        int colon = bare.lastIndexOf(':');
        if (colon >= 0 && bare.indexOf(']') < colon) {
            bare = bare.substring(0, colon);
        }
        int dot = bare.indexOf('.');
        return dot >= 0 ? bare.substring(0, dot) : bare;
    }

    void compile(Pattern compiled) {
        this.compiled = compiled;
    }

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

    public String getPrefix() {
        return prefix;
    }

    public void setPrefix(String prefix) {
        this.prefix = prefix;
    }

    public String getSubdomain() {
        return subdomain;
    }

    public void setSubdomain(String subdomain) {
        this.subdomain = subdomain;
    }

    public Map<String, String> getHeaders() {
        return Collections.unmodifiableMap(headers);
    }

    public void setHeaders(Map<String, String> headers) {
        this.headers = headers != null ? new LinkedHashMap<>(headers) : new LinkedHashMap<>();
    }

    public Set<String> getMethods() {
        return Collections.unmodifiableSet(methods);
    }

    public void setMethods(Set<String> methods) {
        this.methods = methods != null ? new LinkedHashSet<>(methods) : new LinkedHashSet<>();
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public Pool getPool() {
        return pool;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setPool(Pool pool) {
        this.pool = pool;
    }

    public PoolSelector getSelector() {
        return selector;
    }

    public void setSelector(PoolSelector selector) {
        this.selector = selector;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setCircuitBreaker(CircuitBreaker circuitBreaker) {
        this.circuitBreaker = circuitBreaker;
    }

    @Override
    public String toString() {
        return "Route{name='" + name + "', priority=" + priority + '}';
    }
}
