package com.tether.agent;

import com.tether.bootstrap.AgentContext;
import com.tether.bootstrap.TetherBootstrap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tether agent entry point. Configuration comes from {@code TETHER_*} environment variables.
 * <p>
 * The agent's threads are daemons, so the main thread is blocked to keep the JVM alive. The shutdown hook
 * and InterruptedException both run the agent's cleanup (e.g. on Ctrl+C).
 */
public final class TetherAgentApplication {

    private static final Logger log = LoggerFactory.getLogger(TetherAgentApplication.class);

    private TetherAgentApplication() {
    }

    public static void main(String[] args) {
        AgentContext agent = TetherBootstrap.initialize();

        Runtime.getRuntime().addShutdownHook(new Thread(agent::onExit, "tether-shutdown"));

        agent.start();
        log.info("Tether agent running | {}", agent.health());

        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Interrupted, shutting down agent...");
            agent.onExit();
        }
    }
}
