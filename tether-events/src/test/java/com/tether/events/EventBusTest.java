package com.tether.events;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventBusTest {

    record Ping(String value) {
    }

    record Pong(int value) {
    }

    @Test
    void publish_invokesHandlersInSubscriptionOrder() {
        EventBus bus = new EventBus();
        List<String> calls = new ArrayList<>();
        bus.subscribe(Ping.class, e -> calls.add("first:" + e.value()));
        bus.subscribe(Ping.class, e -> calls.add("second:" + e.value()));

        bus.publish(new Ping("a"));

        assertEquals(List.of("first:a", "second:a"), calls);
    }

    @Test
    void publish_failingHandlerDoesNotStopOthers() {
        EventBus bus = new EventBus();
        List<String> calls = new ArrayList<>();
        bus.subscribe(Ping.class, e -> {
            throw new IllegalStateException("boom");
        });
        bus.subscribe(Ping.class, e -> calls.add(e.value()));

        assertDoesNotThrow(() -> bus.publish(new Ping("x")));
        assertEquals(List.of("x"), calls);
    }

    @Test
    void publish_onlyReachesHandlersOfThatType() {
        EventBus bus = new EventBus();
        List<Object> pings = new ArrayList<>();
        List<Object> pongs = new ArrayList<>();
        bus.subscribe(Ping.class, pings::add);
        bus.subscribe(Pong.class, pongs::add);

        bus.publish(new Pong(1));

        assertTrue(pings.isEmpty());
        assertEquals(1, pongs.size());
    }

    @Test
    void unsubscribe_removesHandler() {
        EventBus bus = new EventBus();
        List<String> calls = new ArrayList<>();
        EventHandler<Ping> handler = e -> calls.add(e.value());
        bus.subscribe(Ping.class, handler);

        bus.unsubscribe(Ping.class, handler);
        bus.publish(new Ping("ignored"));

        assertTrue(calls.isEmpty());
        assertEquals(0, bus.subscriberCount(Ping.class));
    }

    @Test
    void publish_handlerSubscribingDuringDispatchDoesNotSeeCurrentEvent() {
        EventBus bus = new EventBus();
        List<String> late = new ArrayList<>();
        bus.subscribe(Ping.class, e -> bus.subscribe(Ping.class, p -> late.add(p.value())));

        bus.publish(new Ping("one"));
        assertTrue(late.isEmpty());

        bus.publish(new Ping("two"));
        assertEquals(List.of("two"), late);
    }

    @Test
    void publish_nullAndUnknownEventsAreIgnored() {
        EventBus bus = new EventBus();

        assertDoesNotThrow(() -> bus.publish(null));
        assertDoesNotThrow(() -> bus.publish("no subscribers"));
    }
}
