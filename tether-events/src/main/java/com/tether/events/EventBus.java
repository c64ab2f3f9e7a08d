package com.tether.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Typed publish/subscribe dispatcher. Handlers are keyed by the exact event class they subscribed
 * with. {@link #publish(Object)} snapshots the handler list under the lock and then calls each
 * handler synchronously, in subscription order, outside the lock. A failing handler is logged and
 * the remaining handlers still run.
 */
public final class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Object lock = new Object();
    /** event class → handlers in subscription order */
    private final Map<Class<?>, List<EventHandler<?>>> handlers = new HashMap<>();

    public <E> void subscribe(Class<E> eventType, EventHandler<? super E> handler) {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(handler, "handler");
        synchronized (lock) {
            handlers.computeIfAbsent(eventType, k -> new ArrayList<>()).add(handler);
        }
        log.debug("Subscribed {} to {}", handler, eventType.getSimpleName());
    }

    /** Removes one registration of {@code handler} for {@code eventType}; no-op when not subscribed. */
    public <E> void unsubscribe(Class<E> eventType, EventHandler<? super E> handler) {
        if (eventType == null || handler == null) return;
        synchronized (lock) {
            List<EventHandler<?>> list = handlers.get(eventType);
            if (list != null) {
                list.remove(handler);
                if (list.isEmpty()) {
                    handlers.remove(eventType);
                }
            }
        }
    }

    /**
     * Delivers {@code event} to every handler subscribed to its class.
     *
     * @param event event to publish; null is ignored
     */
    @SuppressWarnings("unchecked")
    public void publish(Object event) {
        if (event == null) return;
        List<EventHandler<?>> snapshot;
        synchronized (lock) {
            List<EventHandler<?>> list = handlers.get(event.getClass());
            if (list == null || list.isEmpty()) {
                log.debug("No subscribers for {}", event.getClass().getSimpleName());
                return;
            }
            snapshot = List.copyOf(list);
        }
        for (EventHandler<?> h : snapshot) {
            try {
                ((EventHandler<Object>) h).handle(event);
            } catch (Exception e) {
                log.error("Event handler {} failed for {}", h, event.getClass().getSimpleName(), e);
            }
        }
    }

    /** Number of handlers currently subscribed to {@code eventType}. */
    public int subscriberCount(Class<?> eventType) {
        synchronized (lock) {
            List<EventHandler<?>> list = handlers.get(eventType);
            return list != null ? list.size() : 0;
        }
    }
}
