package io.dapprunner.runner;

import static io.dapprunner.support.Awaits.message;
import static io.dapprunner.support.Awaits.until;
import static io.dapprunner.support.DescriptorFixtures.dapp;
import static io.dapprunner.support.DescriptorFixtures.webapp;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.dapprunner.descriptor.DappDescriptor;
import io.dapprunner.provider.RemoteState;
import io.dapprunner.provider.simulated.SimulatedComputeProvider;
import io.dapprunner.provider.simulated.SimulatedInstance;
import io.dapprunner.provider.simulated.SimulatedSettings;
import io.dapprunner.shared.FreePortAllocator;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class RunnerTest {
    private static final RunnerOptions OPTIONS = RunnerOptions.builder()
        .pollInterval(Duration.ofMillis(20))
        .commandTimeout(Duration.ofSeconds(5))
        .shutdownTimeout(Duration.ofSeconds(5))
        .build();

    private static final String DATABASE = """
        payloads:
          db:
            runtime: vm
            params:
              image_hash: 85021afecf51687ecae8bdc21e10f3b11b82d2e3b169ba44e177340c
        nodes:
          db:
            payload: db
            network: default
        networks:
          default: {}
        """;

    private final List<Runner> runners = new ArrayList<>();

    private static SimulatedComputeProvider provider(String... failingNodes) {
        return new SimulatedComputeProvider(new SimulatedSettings(
            List.of("sim-provider-1", "sim-provider-2"), Duration.ofMillis(60), Set.of(failingNodes)
        ));
    }

    private Runner runner(DappDescriptor dapp, SimulatedComputeProvider provider) {
        var runner = new Runner(dapp, provider, OPTIONS, new FreePortAllocator(21000, 21999));
        runners.add(runner);
        return runner;
    }

    @AfterEach
    void abortLeftovers() {
        runners.forEach(Runner::abort);
    }

    @Test
    void startsNodesInDependencyOrderAndStops() throws Exception {
        var provider = provider();
        var dapp = dapp(webapp());
        var runner = runner(dapp, provider);

        runner.start().get(10, TimeUnit.SECONDS);
        until("application running", () -> runner.appState() == ServiceState.RUNNING);

        var started = provider.instances().stream().map(SimulatedInstance::nodeName).toList();
        assertEquals(List.of("db", "http"), started);
        until("db state bound", () -> "running".equals(dapp.nodes().get("db").state()));
        assertEquals("net-1", dapp.networks().get("default").networkId());

        var http = provider.instances().get(1);
        assertEquals("echo 192.168.0.2 > /tmp/db-address", http.executed().get(0).args().get(2));
        assertEquals("192.168.0.3", http.networkAddress());

        var proxyMessage = message(runner.dataQueue(),
            m -> m.get("http") instanceof Map<?, ?> proxied && proxied.containsKey("local_proxy_address"));
        @SuppressWarnings("unchecked")
        var proxy = (Map<String, Object>) proxyMessage.get("http");
        var address = String.valueOf(proxy.get("local_proxy_address"));
        assertTrue(address.startsWith("http://localhost:21"), address);
        assertEquals(address, dapp.nodes().get("http").proxy().ports().get(0).address());

        runner.stop();
        assertEquals(ServiceState.TERMINATED, runner.appState());
        assertTrue(provider.isClosed());
        provider.instances().forEach(instance -> assertEquals(RemoteState.TERMINATED, instance.state()));
        assertTrue(provider.networks().isEmpty());
        assertEquals("removed", dapp.networks().get("default").state());

        Map<String, Object> last = null;
        for (var snapshot : runner.stateQueue()) {
            last = snapshot;
        }
        assertNotNull(last);
        assertEquals("terminated", last.get("app"));
        assertEquals(Map.of("db", Map.of("0", "terminated"), "http", Map.of("0", "terminated")), last.get("nodes"));
    }

    @Test
    void publishesInitResults() throws Exception {
        var provider = provider();
        var runner = runner(dapp("""
            payloads:
              db: {runtime: vm}
            nodes:
              db:
                payload: db
                network: default
                init:
                  - ["run", "echo", "hello from ${nodes.db.network_node}"]
            networks:
              default: {}
            """), provider);

        runner.start();
        var result = message(runner.dataQueue(), m -> m.containsKey("db"));
        assertEquals(
            Map.of("db", Map.of("0", List.of(Map.of(
                "command", "run", "success", true, "stdout", "hello from 192.168.0.2", "stderr", ""
            )))),
            result
        );
    }

    @Test
    void routesInboundCommandsToInstances() throws Exception {
        var provider = provider();
        var runner = runner(dapp(DATABASE), provider);

        runner.start();
        until("application running", () -> runner.appState() == ServiceState.RUNNING);

        runner.commandQueue().offer(Map.of("unknown", Map.of("0", List.of("echo", "lost"))));
        runner.commandQueue().offer(Map.of("db", Map.of("0", List.of(Map.of("run", List.of("echo", "hello"))))));

        var result = message(runner.dataQueue(), m -> m.containsKey("db"));
        @SuppressWarnings("unchecked")
        var results = (List<Map<String, Object>>) ((Map<String, Object>) result.get("db")).get("0");
        assertEquals("hello", results.get(0).get("stdout"));
        assertEquals(1, provider.instances().get(0).executed().size());
    }

    @Test
    void blacklistsProvidersOfFailedInstances() throws Exception {
        var provider = provider("db");
        var dapp = dapp(DATABASE);
        var runner = runner(dapp, provider);

        runner.start();
        until("provider blacklisted", () -> runner.offerScorer().isBlacklisted("sim-provider-1"));

        assertEquals(ServiceState.TERMINATED, runner.group("db").orElseThrow().states().get(0));
        assertEquals(ServiceState.STARTING, runner.appState());
        assertFalse(runner.offerScorer().isBlacklisted("sim-provider-2"));
    }

    @Test
    void waitsForDependenciesToRun() throws Exception {
        var provider = provider("db");
        var runner = runner(dapp(webapp()), provider);

        runner.start();
        until("db terminated", () -> runner.group("db")
            .map(group -> group.states().get(0) == ServiceState.TERMINATED)
            .orElse(false));
        TimeUnit.MILLISECONDS.sleep(200);

        assertTrue(runner.group("http").isEmpty());
        assertFalse(runner.startup().isDone());

        runner.stop();
        assertTrue(runner.startup().isCancelled());
        assertEquals(1, provider.instances().size());
    }

    @Test
    void suspendsAndResumesInstances() throws Exception {
        var provider = provider();
        var runner = runner(dapp(DATABASE), provider);

        runner.start();
        until("application running", () -> runner.appState() == ServiceState.RUNNING);
        var original = provider.instances().get(0);

        var suspended = runner.suspend();
        assertEquals(ServiceState.SUSPENDED, runner.appState());
        assertTrue(original.isSuspended());
        assertEquals(RemoteState.READY, original.state());

        @SuppressWarnings("unchecked")
        var db = (Map<String, Object>) ((Map<String, Object>) suspended.get("nodes")).get("db");
        assertEquals(original.activityId(), db.get("activity_id"));
        assertEquals(original.agreementId(), db.get("agreement_id"));
        assertEquals(original.providerId(), db.get("provider_id"));

        var next = provider();
        var resumedRunner = runner(DappDescriptor.load(suspended), next);
        resumedRunner.start();
        until("resumed application running", () -> resumedRunner.appState() == ServiceState.RUNNING);

        var resumed = next.instances().get(0);
        assertEquals(original.activityId(), resumed.activityId());
        assertEquals(original.networkAddress(), resumed.networkAddress());
        assertEquals(List.of("net-1"), next.networks().stream().map(n -> n.networkId()).toList());
        resumedRunner.stop();
    }

    @Test
    void failsStartupWhenProviderRejectsRequests() {
        var provider = provider();
        provider.close();
        var runner = runner(dapp(DATABASE), provider);

        var ex = assertThrows(ExecutionException.class, () -> runner.start().get(10, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, ex.getCause());
        runner.stop();
        assertEquals(ServiceState.TERMINATED, runner.appState());
    }

    @Test
    void startsOnlyOnce() {
        var runner = runner(dapp(DATABASE), provider());
        runner.start();
        assertThrows(IllegalStateException.class, runner::start);
    }
}
