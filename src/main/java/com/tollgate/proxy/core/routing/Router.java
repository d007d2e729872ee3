package com.tollgate.proxy.core.routing;

import com.tollgate.proxy.core.exceptions.InvalidPatternException;
import com.tollgate.proxy.core.proxy.RequestContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Ordered route table. Routes are kept sorted by descending priority, ties in
 * insertion order, and the first full match wins.
 */
public class Router {

    private static final Logger log = LoggerFactory.getLogger(Router.class);

    private final List<Route> routes = new ArrayList<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Compiles the route's pattern and inserts it.
     *
     * @param route the route to add.
     * @throws InvalidPatternException if the pattern does not compile.
     */
    public void addRoute(Route route) {
        String pattern = route.getPattern();
        if (pattern != null && !pattern.isEmpty()) {
            try {
                route.compile(Pattern.compile(pattern));
            } catch (PatternSyntaxException e) {
                throw new InvalidPatternException("Invalid pattern for route " + route.getName() + ": " + pattern, e);
            }
        } else {
            route.compile(null);
        }

        lock.writeLock().lock();
        try {
            routes.add(route);
            routes.sort(Comparator.comparingInt(Route::getPriority).reversed());
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Added route {} (priority {})", route.getName(), route.getPriority());
    }

    /**
     * Removes the first route with the given name.
     *
     * @param name route name.
     * @return true if a route was removed.
     */
    public boolean removeRoute(String name) {
        lock.writeLock().lock();
        try {
            Iterator<Route> it = routes.iterator();
            while (it.hasNext()) {
                if (name.equals(it.next().getName())) {
                    it.remove();
                    return true;
                }
            }
            return false;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Finds the first route whose predicates all hold.
     *
     * @param request the request.
     * @return the matching route, or null.
     */
    public Route match(RequestContext request) {
        lock.readLock().lock();
        try {
            for (Route route : routes) {
                if (route.matches(request)) {
                    return route;
                }
            }
            return null;
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Route> listRoutes() {
        lock.readLock().lock();
        try {
            return List.copyOf(routes);
        } finally {
            lock.readLock().unlock();
        }
    }
}
