package io.dapprunner.provider.simulated;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.dapprunner.descriptor.CommandDescriptor;
import io.dapprunner.descriptor.NetworkDescriptor;
import io.dapprunner.descriptor.PortMapping;
import io.dapprunner.descriptor.ProxyKind;
import io.dapprunner.provider.ComputeProviderException;
import io.dapprunner.provider.InstanceRequest;
import io.dapprunner.provider.RemoteState;
import io.dapprunner.shared.FreePortAllocator;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class SimulatedComputeProviderTest {
    private static SimulatedComputeProvider started(Duration delay, String... failing) {
        var provider = new SimulatedComputeProvider(
            new SimulatedSettings(List.of("cheap", "pricey"), delay, Set.of(failing))
        );
        provider.start();
        return provider;
    }

    private static InstanceRequest request(String node) {
        return new InstanceRequest(node, "vm", Map.of(), null, List.of(), null, null, null);
    }

    @Test
    void picksCheapestOfferByDefault() {
        var provider = started(Duration.ZERO);
        var instance = provider.instantiate(request("db")).get(0);
        assertEquals("cheap", instance.providerId());
        assertEquals(RemoteState.READY, instance.state());
    }

    @Test
    void honoursCustomScorer() {
        var provider = started(Duration.ZERO);
        provider.useOfferScorer(offer -> "cheap".equals(offer.issuerId()) ? -1d : 1d);
        assertEquals("pricey", provider.instantiate(request("db")).get(0).providerId());

        provider.useOfferScorer(offer -> -1d);
        var ex = assertThrows(ComputeProviderException.class, () -> provider.instantiate(request("db")));
        assertEquals("No acceptable offers for node `db`", ex.getMessage());
    }

    @Test
    void reportsStartupProgress() throws Exception {
        var provider = started(Duration.ofMillis(300));
        var instance = provider.instantiate(request("db")).get(0);
        assertEquals(RemoteState.PENDING, instance.state());
        Thread.sleep(400);
        assertEquals(RemoteState.READY, instance.state());
    }

    @Test
    void failingNodesTerminateWhenReady() {
        var provider = started(Duration.ZERO, "db");
        assertEquals(RemoteState.TERMINATED, provider.instantiate(request("db")).get(0).state());
    }

    @Test
    void echoesRunCommands() throws Exception {
        var provider = started(Duration.ZERO);
        var instance = provider.instantiate(request("db")).get(0);
        var results = instance.submit(List.of(
            CommandDescriptor.run(List.of("/bin/echo", "hello", "world")),
            new CommandDescriptor("deploy", Map.of()),
            new CommandDescriptor("transfer", Map.of())
        )).await(Duration.ofSeconds(1));

        assertEquals("hello world", results.get(0).stdout());
        assertTrue(results.get(1).success());
        assertFalse(results.get(2).success());
        assertEquals("Unsupported command: transfer", results.get(2).stderr());
    }

    @Test
    void assignsNetworkAddressesInOrder() {
        var provider = started(Duration.ZERO);
        var network = provider.createNetwork("default", new NetworkDescriptor());
        var first = provider.instantiate(
            new InstanceRequest("db", "vm", Map.of(), network, List.of(), null, null, null)).get(0);
        var second = provider.instantiate(
            new InstanceRequest("http", "vm", Map.of(), network, List.of(), null, null, null)).get(0);
        var fixed = provider.instantiate(
            new InstanceRequest("cache", "vm", Map.of(), network, List.of("192.168.0.50"), null, null, null)).get(0);

        assertEquals("192.168.0.2", first.networkAddress());
        assertEquals("192.168.0.3", second.networkAddress());
        assertEquals("192.168.0.50", fixed.networkAddress());
    }

    @Test
    void carriesAddressesAcrossOctetsWithinTheNetwork() {
        var provider = started(Duration.ZERO);
        var network = provider.createNetwork("wide", new NetworkDescriptor("10.1.0.0/23", null, null, null));
        String last = null;
        for (int i = 0; i < 300; i++) {
            last = provider.instantiate(
                new InstanceRequest("node" + i, "vm", Map.of(), network, List.of(), null, null, null)).get(0).networkAddress();
        }
        assertEquals("10.1.1.45", last);
    }

    @Test
    void refusesAddressesBeyondTheNetworkRange() {
        var provider = started(Duration.ZERO);
        var network = provider.createNetwork("tiny", new NetworkDescriptor("10.0.0.0/30", null, null, null));
        var only = provider.instantiate(
            new InstanceRequest("db", "vm", Map.of(), network, List.of(), null, null, null)).get(0);
        assertEquals("10.0.0.2", only.networkAddress());

        var ex = assertThrows(ComputeProviderException.class, () -> provider.instantiate(
            new InstanceRequest("http", "vm", Map.of(), network, List.of(), null, null, null)));
        assertEquals("No free address left in network 10.0.0.0/30", ex.getMessage());
    }

    @Test
    void resumesExistingActivity() {
        var provider = started(Duration.ofHours(1));
        var resumed = provider.instantiate(
            new InstanceRequest("db", "vm", Map.of(), null, List.of(), "agreement-7", "activity-7", "cheap")).get(0);
        assertEquals("activity-7", resumed.activityId());
        assertEquals("agreement-7", resumed.agreementId());
        assertEquals(RemoteState.READY, resumed.state());
    }

    @Test
    void opensLocalProxies() throws Exception {
        var provider = started(Duration.ZERO);
        var instance = provider.instantiate(request("http")).get(0);
        var port = new FreePortAllocator(22000, 22999).next();
        var proxy = provider.openProxy(ProxyKind.TCP, instance, new PortMapping(22, null), port);
        proxy.start();
        try {
            assertEquals("localhost:" + port, proxy.address());
        } finally {
            proxy.stop();
        }
    }

    @Test
    void refusesWorkOnceClosed() {
        var provider = started(Duration.ZERO);
        provider.close();
        assertTrue(provider.isClosed());
        assertThrows(IllegalStateException.class, () -> provider.instantiate(request("db")));
    }

    @Test
    void readsSettingsFromParams() {
        var settings = SimulatedSettings.from(Map.of(
            "providers", List.of("a"), "startup_delay", "250ms", "fail_nodes", List.of("db")
        ));
        assertEquals(List.of("a"), settings.providers());
        assertEquals(Duration.ofMillis(250), settings.startupDelay());
        assertEquals(Set.of("db"), settings.failingNodes());
        assertEquals(SimulatedSettings.defaults(), SimulatedSettings.from(Map.of()));
    }
}
