package com.tether.ports;

import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.net.ServerSocket;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PortAllocatorTest {

    private static final PortProbe ALWAYS_FREE = port -> true;

    @Test
    void allocateConsecutive_reusesReleasedRun() {
        PortAllocator allocator = new PortAllocator(4723, 4733, ALWAYS_FREE);

        assertEquals(List.of(4723, 4724, 4725), allocator.allocateConsecutive(3).orElseThrow());
        assertEquals(List.of(4726, 4727), allocator.allocateConsecutive(2).orElseThrow());

        allocator.release(List.of(4723, 4724, 4725));

        assertEquals(List.of(4723, 4724, 4725), allocator.allocateConsecutive(3).orElseThrow());
        assertEquals(List.of(4723, 4724, 4725, 4726, 4727), allocator.allocatedPorts());
    }

    @Test
    void allocateConsecutive_returnsEmptyWhenRangeTooSmall() {
        PortAllocator allocator = new PortAllocator(4723, 4724, ALWAYS_FREE);

        assertTrue(allocator.allocateConsecutive(3).isEmpty());
        assertTrue(allocator.allocatedPorts().isEmpty());
    }

    @Test
    void allocateConsecutive_rejectsNonPositiveCount() {
        PortAllocator allocator = new PortAllocator(4723, 4733, ALWAYS_FREE);

        assertTrue(allocator.allocateConsecutive(0).isEmpty());
        assertTrue(allocator.allocateConsecutive(-1).isEmpty());
    }

    @Test
    void allocateConsecutive_skipsPortsThatFailTheBindProbe() {
        PortAllocator allocator = new PortAllocator(4723, 4733, port -> port != 4724);

        assertEquals(List.of(4725, 4726), allocator.allocateConsecutive(2).orElseThrow());
        assertEquals(List.of(4723), allocator.allocateConsecutive(1).orElseThrow());
    }

    @Test
    void release_isIdempotent() {
        PortAllocator allocator = new PortAllocator(4723, 4733, ALWAYS_FREE);
        List<Integer> ports = allocator.allocateConsecutive(2).orElseThrow();

        allocator.release(ports);
        allocator.release(ports);
        allocator.release(List.of(4999));

        assertTrue(allocator.allocatedPorts().isEmpty());
    }

    @Test
    void isInUse_reportsAllocatedProbeFailedAndOutOfRange() {
        PortAllocator allocator = new PortAllocator(4723, 4733, port -> port != 4730);
        allocator.allocateConsecutive(1);

        assertTrue(allocator.isInUse(4723));
        assertFalse(allocator.isInUse(4724));
        assertTrue(allocator.isInUse(4730));
        assertTrue(allocator.isInUse(80));
    }

    @Test
    void isInUse_detectsRealListener() throws Exception {
        try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            int port = socket.getLocalPort();
            PortAllocator allocator = new PortAllocator(port, port);

            assertTrue(allocator.isInUse(port));
            assertTrue(allocator.allocateConsecutive(1).isEmpty());
        }
    }

    @Test
    void constructor_rejectsInvertedRange() {
        assertThrows(IllegalArgumentException.class, () -> new PortAllocator(5000, 4000, ALWAYS_FREE));
    }

    @Test
    void allocateConsecutive_concurrentCallersReceiveDisjointRuns() throws Exception {
        PortAllocator allocator = new PortAllocator(10000, 10999, ALWAYS_FREE);
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<List<List<Integer>>>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    List<List<Integer>> mine = new ArrayList<>();
                    for (int i = 0; i < 20; i++) {
                        Optional<List<Integer>> run = allocator.allocateConsecutive(3);
                        run.ifPresent(mine::add);
                        if (i % 4 == 3 && !mine.isEmpty()) {
                            allocator.release(mine.remove(0));
                        }
                    }
                    return mine;
                }));
            }
            start.countDown();

            Set<Integer> seen = Collections.synchronizedSet(new HashSet<>());
            int held = 0;
            for (Future<List<List<Integer>>> f : futures) {
                for (List<Integer> run : f.get(30, TimeUnit.SECONDS)) {
                    for (int port : run) {
                        assertTrue(seen.add(port), "port handed out twice: " + port);
                        held++;
                    }
                }
            }
            assertEquals(held, allocator.allocatedPorts().size());
        } finally {
            pool.shutdownNow();
        }
    }
}
