package com.tether.ports;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Allocates runs of consecutive TCP ports from an inclusive range. A candidate port must be both
 * unallocated in memory and bindable according to the {@link PortProbe}. Scan and commit happen
 * under one lock so concurrent callers never receive overlapping runs.
 */
public final class PortAllocator {

    private static final Logger log = LoggerFactory.getLogger(PortAllocator.class);

    private final int minPort;
    private final int maxPort;
    private final PortProbe probe;
    private final Object lock = new Object();
    private final Set<Integer> allocated = new HashSet<>();

    public PortAllocator(int minPort, int maxPort) {
        this(minPort, maxPort, new SocketPortProbe());
    }

    public PortAllocator(int minPort, int maxPort, PortProbe probe) {
        if (minPort < 1 || maxPort > 65535 || maxPort < minPort) {
            throw new IllegalArgumentException("Invalid port range: " + minPort + "-" + maxPort);
        }
        this.minPort = minPort;
        this.maxPort = maxPort;
        this.probe = Objects.requireNonNull(probe, "probe");
    }

    /**
     * Finds the lowest run of {@code count} consecutive free ports and marks it allocated.
     *
     * @param count number of ports wanted
     * @return the allocated ports in ascending order, or empty when the range has no such run
     *         (or {@code count} is not positive)
     */
    public Optional<List<Integer>> allocateConsecutive(int count) {
        if (count <= 0) {
            return Optional.empty();
        }
        synchronized (lock) {
            int start = minPort;
            while (start + count - 1 <= maxPort) {
                int blocked = firstBlocked(start, count);
                if (blocked < 0) {
                    List<Integer> ports = new ArrayList<>(count);
                    for (int p = start; p < start + count; p++) {
                        allocated.add(p);
                        ports.add(p);
                    }
                    log.debug("Allocated ports {}", ports);
                    return Optional.of(List.copyOf(ports));
                }
                start = blocked + 1;
            }
        }
        log.warn("No run of {} consecutive free ports in {}-{}", count, minPort, maxPort);
        return Optional.empty();
    }

    /** Marks the given ports free again. Ports that are not allocated are ignored. */
    public void release(Collection<Integer> ports) {
        if (ports == null || ports.isEmpty()) return;
        synchronized (lock) {
            allocated.removeAll(ports);
        }
        log.debug("Released ports {}", ports);
    }

    /**
     * True if the port is allocated here or cannot be bound. Ports outside the range are reported as in use.
     */
    public boolean isInUse(int port) {
        if (port < minPort || port > maxPort) {
            return true;
        }
        synchronized (lock) {
            if (allocated.contains(port)) {
                return true;
            }
        }
        return !probe.isFree(port);
    }

    /** Sorted snapshot of the allocated ports. */
    public List<Integer> allocatedPorts() {
        synchronized (lock) {
            return allocated.stream().sorted().toList();
        }
    }

    public int getMinPort() {
        return minPort;
    }

    public int getMaxPort() {
        return maxPort;
    }

    /** Returns the first port in {@code [start, start+count)} that cannot be used, or -1 if all are usable. */
    private int firstBlocked(int start, int count) {
        for (int p = start; p < start + count; p++) {
            if (allocated.contains(p) || !probe.isFree(p)) {
                return p;
            }
        }
        return -1;
    }
}
