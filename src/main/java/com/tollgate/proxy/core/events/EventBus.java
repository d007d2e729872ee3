package com.tollgate.proxy.core.events;

import com.tollgate.proxy.core.utils.DaemonThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * Fire-and-forget event fan-out. Each handler subscribed to an event's type
 * runs as its own task; {@link #emit} never waits for handlers.
 */
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Map<String, List<Consumer<ProxyEvent>>> handlers = new ConcurrentHashMap<>();
    private final ExecutorService executor;

    public EventBus() {
        this(Executors.newCachedThreadPool(new DaemonThreadFactory("proxy-events")));
    }

    public EventBus(ExecutorService executor) {
        this.executor = executor;
    }

    /**
     * Subscribes a handler to one event type.
     *
     * @param eventType event type wire name.
     * @param handler   the handler.
     */
    public void on(String eventType, Consumer<ProxyEvent> handler) {
        handlers.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>()).add(handler);
    }

    /**
     * Dispatches an event to every handler of its type.
     *
     * @param event the event.
     */
    public void emit(ProxyEvent event) {
        List<Consumer<ProxyEvent>> subscribers = handlers.get(event.type());
        if (subscribers == null) {
            return;
        }
        for (Consumer<ProxyEvent> handler : subscribers) {
            try {
                executor.execute(() -> dispatch(handler, event));
            } catch (RejectedExecutionException e) {
                log.debug("Dropped {} event: dispatcher is shut down", event.type());
            }
        }
    }

    private static void dispatch(Consumer<ProxyEvent> handler, ProxyEvent event) {
        try {
            handler.accept(event);
        } catch (RuntimeException e) {
            log.warn("Event handler for {} failed: {}", event.type(), e.getMessage(), e);
        }
    }

    public void shutdown() {
        executor.shutdownNow();
    }
}
