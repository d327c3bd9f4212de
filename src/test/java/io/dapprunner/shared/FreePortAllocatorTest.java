package io.dapprunner.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import org.junit.jupiter.api.Test;

class FreePortAllocatorTest {
    @Test
    void handsOutDistinctPortsWithinRange() {
        var allocator = new FreePortAllocator(20100, 20199);
        var first = allocator.next();
        var second = allocator.next();
        assertNotEquals(first, second);
        assertTrue(first >= 20100 && first <= 20199);
        assertTrue(second >= 20100 && second <= 20199);
    }

    @Test
    void reusesReleasedPorts() {
        var allocator = new FreePortAllocator(20200, 20299);
        var first = allocator.next();
        allocator.release(first);
        assertEquals(first, allocator.next());
    }

    @Test
    void skipsPortsBoundByOthers() throws Exception {
        try (var socket = new ServerSocket()) {
            socket.bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0));
            var taken = socket.getLocalPort();
            var allocator = new FreePortAllocator(taken, taken);
            var ex = assertThrows(IllegalStateException.class, allocator::next);
            assertEquals("No free ports found. range_start=" + taken + ", range_end=" + taken, ex.getMessage());
        }
    }

    @Test
    void rejectsInvalidRange() {
        assertThrows(IllegalArgumentException.class, () -> new FreePortAllocator(9000, 8000));
    }
}
