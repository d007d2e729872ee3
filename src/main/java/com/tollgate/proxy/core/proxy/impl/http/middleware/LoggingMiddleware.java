package com.tollgate.proxy.core.proxy.impl.http.middleware;

import com.tollgate.proxy.core.proxy.ProxyResponse;
import com.tollgate.proxy.core.proxy.RequestContext;

import java.util.function.Consumer;

/**
 * Writes a line to the sink when a request arrives and another when it completes.
 */
public class LoggingMiddleware implements Middleware {

    private final Consumer<String> sink;

    public LoggingMiddleware(Consumer<String> sink) {
        this.sink = sink;
    }

    @Override
    public ProxyResponse preHandle(RequestContext context) {
        context.setStartNanos(System.nanoTime());
        sink.accept(context.getMethod() + " " + context.getPath() + " from " + context.getRemoteAddr());
        return null;
    }

    @Override
    public void postHandle(RequestContext context, int statusCode) {
        long start = context.getStartNanos();
        if (start == 0) {
            return;
        }
        context.setStartNanos(0);
        long millis = (System.nanoTime() - start) / 1_000_000;
        sink.accept(context.getMethod() + " " + context.getPath() + " completed with " + statusCode + " in "
                + millis + " ms");
    }
}
