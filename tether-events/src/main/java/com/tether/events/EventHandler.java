package com.tether.events;

/**
 * Receives events of one type from the {@link EventBus}.
 *
 * @param <E> event type
 */
@FunctionalInterface
public interface EventHandler<E> {

    /**
     * Handles one published event. Exceptions thrown here are logged by the bus and do not reach
     * the publisher or other subscribers.
     */
    void handle(E event) throws Exception;
}
