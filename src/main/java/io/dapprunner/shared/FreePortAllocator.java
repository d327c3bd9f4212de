package io.dapprunner.shared;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.util.HashSet;
import java.util.Set;

/**
 * Hands out local ports from a fixed range, skipping ports already handed out or currently bound.
 */
public final class FreePortAllocator {
    public static final int DEFAULT_RANGE_START = 8080;
    public static final int DEFAULT_RANGE_END = 9090;

    private final int rangeStart;
    private final int rangeEnd;
    private final Set<Integer> allocated = new HashSet<>();

    public FreePortAllocator() {
        this(DEFAULT_RANGE_START, DEFAULT_RANGE_END);
    }

    public FreePortAllocator(int rangeStart, int rangeEnd) {
        if (rangeStart < 1 || rangeEnd > 65535 || rangeStart > rangeEnd) {
            throw new IllegalArgumentException("Invalid port range: " + rangeStart + "-" + rangeEnd);
        }
        this.rangeStart = rangeStart;
        this.rangeEnd = rangeEnd;
    }

    public synchronized int next() {
        for (int port = rangeStart; port <= rangeEnd; port++) {
            if (!allocated.contains(port) && isFree(port)) {
                allocated.add(port);
                return port;
            }
        }
        throw new IllegalStateException(
            "No free ports found. range_start=" + rangeStart + ", range_end=" + rangeEnd
        );
    }

    public synchronized void release(int port) {
        allocated.remove(port);
    }

    private static boolean isFree(int port) {
        try (var socket = new ServerSocket()) {
            socket.setReuseAddress(false);
            socket.bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), port));
            return true;
        } catch (IOException ex) {
            return false;
        }
    }
}
