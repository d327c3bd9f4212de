package io.dapprunner.provider.simulated;

import io.dapprunner.descriptor.NetworkDescriptor;
import io.dapprunner.descriptor.PortMapping;
import io.dapprunner.descriptor.ProxyKind;
import io.dapprunner.provider.ComputeProvider;
import io.dapprunner.provider.ComputeProviderException;
import io.dapprunner.provider.InstanceRequest;
import io.dapprunner.provider.LocalProxy;
import io.dapprunner.provider.NetworkHandle;
import io.dapprunner.provider.Offer;
import io.dapprunner.provider.OfferScorer;
import io.dapprunner.provider.RemoteInstance;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compute marketplace kept entirely in memory. Each provider publishes one offer per request and the
 * best-scored offer wins; cheaper providers score higher by default.
 */
public final class SimulatedComputeProvider implements ComputeProvider {
    public static final String NAME = "simulated";

    private static final Logger LOG = LoggerFactory.getLogger(SimulatedComputeProvider.class);

    private final SimulatedSettings settings;
    private final AtomicInteger sequence = new AtomicInteger();
    private final List<SimulatedInstance> instances = new CopyOnWriteArrayList<>();
    private final Map<String, AtomicInteger> networkHosts = new ConcurrentHashMap<>();
    private final Map<String, NetworkHandle> networks = new ConcurrentHashMap<>();
    private volatile OfferScorer scorer = SimulatedComputeProvider::cheapestFirst;
    private volatile boolean started;
    private volatile boolean closed;

    public SimulatedComputeProvider() {
        this(SimulatedSettings.defaults());
    }

    public SimulatedComputeProvider(SimulatedSettings settings) {
        this.settings = settings;
    }

    private static double cheapestFirst(Offer offer) {
        var price = offer.properties().get("price");
        return price instanceof Number number ? 1d / (1d + number.doubleValue()) : 0d;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void start() {
        started = true;
        LOG.info("Simulated marketplace ready with providers {}", settings.providers());
    }

    @Override
    public NetworkHandle createNetwork(String name, NetworkDescriptor descriptor) {
        ensureOpen();
        var handle = new NetworkHandle(name, "net-" + sequence.incrementAndGet(), descriptor.ip(), "ready");
        register(handle);
        return handle;
    }

    @Override
    public NetworkHandle attachNetwork(String name, NetworkDescriptor descriptor) {
        ensureOpen();
        if (descriptor.networkId() == null) {
            throw new ComputeProviderException("Network `" + name + "` has no id to attach to");
        }
        var handle = new NetworkHandle(name, descriptor.networkId(), descriptor.ip(), "ready");
        register(handle);
        return handle;
    }

    private void register(NetworkHandle handle) {
        networks.put(handle.networkId(), handle);
        networkHosts.putIfAbsent(handle.networkId(), new AtomicInteger(1));
    }

    @Override
    public void removeNetwork(NetworkHandle network) {
        networks.remove(network.networkId());
        networkHosts.remove(network.networkId());
    }

    @Override
    public List<RemoteInstance> instantiate(InstanceRequest request) {
        ensureOpen();
        var address = networkAddress(request);
        if (request.isResume()) {
            var resumed = new SimulatedInstance(
                request.nodeName(),
                request.resumeProviderId(),
                request.resumeAgreementId(),
                request.resumeActivityId(),
                address,
                Duration.ZERO,
                false
            );
            instances.add(resumed);
            LOG.info("Re-attached `{}` to activity {}", request.nodeName(), request.resumeActivityId());
            return List.of(resumed);
        }

        var offer = bestOffer(request.nodeName());
        var id = sequence.incrementAndGet();
        var instance = new SimulatedInstance(
            request.nodeName(),
            offer.issuerId(),
            "agreement-" + id,
            "activity-" + id,
            address,
            settings.startupDelay(),
            settings.failingNodes().contains(request.nodeName())
        );
        instances.add(instance);
        LOG.info("Node `{}` deployed on {} ({})", request.nodeName(), offer.issuerId(), instance.activityId());
        return List.of(instance);
    }

    private Offer bestOffer(String nodeName) {
        Offer best = null;
        var bestScore = Double.NEGATIVE_INFINITY;
        var providers = settings.providers();
        for (int i = 0; i < providers.size(); i++) {
            var offer = new Offer(
                "offer-" + sequence.incrementAndGet(),
                providers.get(i),
                Map.of("price", 0.1d * (i + 1))
            );
            var score = scorer.score(offer);
            if (score >= 0 && score > bestScore) {
                best = offer;
                bestScore = score;
            }
        }
        if (best == null) {
            throw new ComputeProviderException("No acceptable offers for node `" + nodeName + "`");
        }
        return best;
    }

    private String networkAddress(InstanceRequest request) {
        if (request.network() == null) {
            return null;
        }
        if (!request.networkAddresses().isEmpty()) {
            return request.networkAddresses().get(0);
        }
        var hosts = networkHosts.computeIfAbsent(request.network().networkId(), id -> new AtomicInteger(1));
        var cidr = request.network().ip().split("/");
        var prefix = cidr.length > 1 ? Integer.parseInt(cidr[1].trim()) : 24;
        if (prefix < 0 || prefix > 30) {
            throw new ComputeProviderException("Unsupported network prefix in " + request.network().ip());
        }
        // .1 is the gateway; the broadcast address is never handed out
        var lastHost = (1L << (32 - prefix)) - 2;
        var host = hosts.incrementAndGet();
        if (host > lastHost) {
            throw new ComputeProviderException("No free address left in network " + request.network().ip());
        }
        var mask = prefix == 0 ? 0L : (0xFFFFFFFFL << (32 - prefix)) & 0xFFFFFFFFL;
        var address = (ipv4(cidr[0]) & mask) + host;
        return (address >>> 24 & 0xFF) + "." + (address >>> 16 & 0xFF) + "." + (address >>> 8 & 0xFF) + "." + (address & 0xFF);
    }

    private static long ipv4(String text) {
        var octets = text.trim().split("\\.");
        if (octets.length != 4) {
            throw new ComputeProviderException("Not an IPv4 address: " + text);
        }
        long value = 0;
        for (var octet : octets) {
            value = value << 8 | Integer.parseInt(octet);
        }
        return value;
    }

    @Override
    public LocalProxy openProxy(ProxyKind kind, RemoteInstance instance, PortMapping mapping, int localPort) {
        ensureOpen();
        return new SimulatedLocalProxy(kind, localPort, mapping.remotePort());
    }

    @Override
    public OfferScorer defaultOfferScorer() {
        return SimulatedComputeProvider::cheapestFirst;
    }

    @Override
    public void useOfferScorer(OfferScorer scorer) {
        this.scorer = scorer;
    }

    /**
     * Every instance handed out so far, in creation order.
     */
    public List<SimulatedInstance> instances() {
        return new ArrayList<>(instances);
    }

    public List<NetworkHandle> networks() {
        return new ArrayList<>(networks.values());
    }

    public boolean isClosed() {
        return closed;
    }

    private void ensureOpen() {
        if (!started || closed) {
            throw new IllegalStateException("Simulated marketplace is not running");
        }
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            LOG.info("Simulated marketplace closed");
        }
    }
}
