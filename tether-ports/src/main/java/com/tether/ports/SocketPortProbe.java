package com.tether.ports;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;

/**
 * Binds and immediately releases a loopback listener to decide whether a port is free.
 */
public final class SocketPortProbe implements PortProbe {

    private static final Logger log = LoggerFactory.getLogger(SocketPortProbe.class);

    @Override
    public boolean isFree(int port) {
        try (ServerSocket socket = new ServerSocket()) {
            socket.setReuseAddress(false);
            socket.bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), port), 1);
            return true;
        } catch (IOException e) {
            log.trace("Port {} not bindable: {}", port, e.getMessage());
            return false;
        }
    }
}
