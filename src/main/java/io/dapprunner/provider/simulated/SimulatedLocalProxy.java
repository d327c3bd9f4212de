package io.dapprunner.provider.simulated;

import io.dapprunner.descriptor.ProxyKind;
import io.dapprunner.provider.LocalProxy;
import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binds the local port of a proxy without forwarding anything.
 */
final class SimulatedLocalProxy implements LocalProxy {
    private static final Logger LOG = LoggerFactory.getLogger(SimulatedLocalProxy.class);

    private final ProxyKind kind;
    private final int localPort;
    private final int remotePort;
    private ServerSocket socket;

    SimulatedLocalProxy(ProxyKind kind, int localPort, int remotePort) {
        this.kind = kind;
        this.localPort = localPort;
        this.remotePort = remotePort;
    }

    @Override
    public synchronized void start() throws IOException {
        if (socket != null) {
            return;
        }
        var server = new ServerSocket();
        try {
            server.bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), localPort));
        } catch (IOException ex) {
            server.close();
            throw ex;
        }
        socket = server;
        LOG.debug("Simulated {} proxy listening on {} for remote port {}", kind, localPort, remotePort);
    }

    @Override
    public String address() {
        return kind == ProxyKind.HTTP ? "http://localhost:" + localPort : "localhost:" + localPort;
    }

    @Override
    public synchronized void stop() {
        if (socket == null) {
            return;
        }
        try {
            socket.close();
        } catch (IOException ex) {
            LOG.warn("Failed to close proxy on port {}: {}", localPort, ex.getMessage());
        }
        socket = null;
    }
}
