package com.tether.ports;

/**
 * Live check that a TCP port can currently be bound on this host.
 */
@FunctionalInterface
public interface PortProbe {

    /** Returns true if a listener could be bound to {@code port} right now. */
    boolean isFree(int port);
}
