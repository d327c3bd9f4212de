package io.dapprunner.provider;

import io.dapprunner.descriptor.NetworkDescriptor;
import io.dapprunner.descriptor.PortMapping;
import io.dapprunner.descriptor.ProxyKind;
import java.util.List;

/**
 * Seam between the runner and a compute marketplace.
 */
public interface ComputeProvider extends AutoCloseable {
    String name();

    /**
     * Connects to the marketplace. Called once before any other operation.
     */
    void start();

    NetworkHandle createNetwork(String name, NetworkDescriptor descriptor);

    /**
     * Re-attaches a network created by an earlier session, identified by {@link NetworkDescriptor#networkId()}.
     */
    NetworkHandle attachNetwork(String name, NetworkDescriptor descriptor);

    void removeNetwork(NetworkHandle network);

    List<RemoteInstance> instantiate(InstanceRequest request);

    LocalProxy openProxy(ProxyKind kind, RemoteInstance instance, PortMapping mapping, int localPort);

    OfferScorer defaultOfferScorer();

    void useOfferScorer(OfferScorer scorer);

    @Override
    void close();
}
