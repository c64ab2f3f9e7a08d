package com.tether.plugin;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/** Plugin double that counts calls and returns scripted results. */
final class FakePlugin implements Plugin {

    final String id;
    final PluginDefinition definition;
    final AtomicInteger starts = new AtomicInteger();
    final AtomicInteger stops = new AtomicInteger();
    final AtomicInteger healthChecks = new AtomicInteger();
    final List<PluginContext> startContexts = new ArrayList<>();
    volatile boolean startResult = true;
    volatile boolean healthy = true;
    volatile RuntimeException healthFailure;
    /** When set, checkHealth counts this down on entry. */
    volatile CountDownLatch healthEntered;
    /** When set, checkHealth blocks on this before answering. */
    volatile CountDownLatch healthGate;
    private volatile PluginState state = PluginState.DISABLED;
    private volatile PluginContext startContext;

    FakePlugin(String id, PluginDefinition definition) {
        this.id = id;
        this.definition = definition;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public PluginType getType() {
        return definition.getType();
    }

    @Override
    public PluginState getState() {
        return state;
    }

    @Override
    public PluginDefinition getDefinition() {
        return definition;
    }

    @Override
    public PluginContext getStartContext() {
        return startContext;
    }

    @Override
    public synchronized boolean start(PluginContext context) {
        starts.incrementAndGet();
        startContext = context;
        startContexts.add(context);
        state = startResult ? PluginState.RUNNING : PluginState.ERROR;
        return startResult;
    }

    @Override
    public void stop() {
        stops.incrementAndGet();
        state = PluginState.STOPPED;
    }

    @Override
    public boolean checkHealth() {
        healthChecks.incrementAndGet();
        if (healthEntered != null) {
            healthEntered.countDown();
        }
        if (healthGate != null) {
            try {
                healthGate.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (healthFailure != null) {
            throw healthFailure;
        }
        return healthy;
    }

    @Override
    public void addStateListener(PluginStateListener listener) {
    }
}
