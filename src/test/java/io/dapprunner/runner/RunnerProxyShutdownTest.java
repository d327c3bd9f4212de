package io.dapprunner.runner;

import static io.dapprunner.support.Awaits.until;
import static io.dapprunner.support.DescriptorFixtures.dapp;
import static io.dapprunner.support.DescriptorFixtures.webapp;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.dapprunner.descriptor.NetworkDescriptor;
import io.dapprunner.descriptor.PortMapping;
import io.dapprunner.descriptor.ProxyKind;
import io.dapprunner.provider.ComputeProvider;
import io.dapprunner.provider.InstanceRequest;
import io.dapprunner.provider.LocalProxy;
import io.dapprunner.provider.NetworkHandle;
import io.dapprunner.provider.OfferScorer;
import io.dapprunner.provider.RemoteInstance;
import io.dapprunner.provider.simulated.SimulatedComputeProvider;
import io.dapprunner.provider.simulated.SimulatedSettings;
import io.dapprunner.shared.FreePortAllocator;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class RunnerProxyShutdownTest {
    private static final RunnerOptions OPTIONS = RunnerOptions.builder()
        .pollInterval(Duration.ofMillis(20))
        .commandTimeout(Duration.ofSeconds(5))
        .shutdownTimeout(Duration.ofSeconds(5))
        .build();

    @Test
    void proxyStartedDuringStopIsClosedAndNeverPublished() throws Exception {
        var provider = new GatedProxyProvider(new SimulatedComputeProvider(new SimulatedSettings(
            List.of("sim-provider-1"), Duration.ofMillis(20), Set.of()
        )));
        var dapp = dapp(webapp());
        var runner = new Runner(dapp, provider, OPTIONS, new FreePortAllocator(22000, 22099));
        try {
            runner.start().get(10, TimeUnit.SECONDS);
            assertTrue(provider.opening.await(10, TimeUnit.SECONDS), "proxy start not reached");

            var stopper = new Thread(runner::stop, "test-stopper");
            stopper.start();
            until("shutdown begun", () -> runner.appState() != ServiceState.RUNNING
                && runner.appState() != ServiceState.STARTING);
            provider.release.countDown();
            stopper.join(TimeUnit.SECONDS.toMillis(15));
            assertFalse(stopper.isAlive());

            var proxy = provider.proxy;
            assertTrue(proxy.started);
            assertTrue(proxy.stopped);
            assertNull(dapp.nodes().get("http").proxy().ports().get(0).address());
            for (var message : runner.dataQueue()) {
                assertFalse(message.get("http") instanceof Map<?, ?> http && http.containsKey("local_proxy_address"));
            }
            assertEquals(ServiceState.TERMINATED, runner.appState());
        } finally {
            provider.release.countDown();
            runner.abort();
        }
    }

    /**
     * Delegates to the simulated provider but holds every proxy inside {@code start()} until released.
     */
    private static final class GatedProxyProvider implements ComputeProvider {
        private final ComputeProvider delegate;
        private final CountDownLatch opening = new CountDownLatch(1);
        private final CountDownLatch release = new CountDownLatch(1);
        private volatile GatedProxy proxy;

        GatedProxyProvider(ComputeProvider delegate) {
            this.delegate = delegate;
        }

        @Override
        public String name() {
            return delegate.name();
        }

        @Override
        public void start() {
            delegate.start();
        }

        @Override
        public NetworkHandle createNetwork(String name, NetworkDescriptor descriptor) {
            return delegate.createNetwork(name, descriptor);
        }

        @Override
        public NetworkHandle attachNetwork(String name, NetworkDescriptor descriptor) {
            return delegate.attachNetwork(name, descriptor);
        }

        @Override
        public void removeNetwork(NetworkHandle network) {
            delegate.removeNetwork(network);
        }

        @Override
        public List<RemoteInstance> instantiate(InstanceRequest request) {
            return delegate.instantiate(request);
        }

        @Override
        public LocalProxy openProxy(ProxyKind kind, RemoteInstance instance, PortMapping mapping, int localPort) {
            var opened = new GatedProxy(delegate.openProxy(kind, instance, mapping, localPort), opening, release);
            proxy = opened;
            return opened;
        }

        @Override
        public OfferScorer defaultOfferScorer() {
            return delegate.defaultOfferScorer();
        }

        @Override
        public void useOfferScorer(OfferScorer scorer) {
            delegate.useOfferScorer(scorer);
        }

        @Override
        public void close() {
            delegate.close();
        }
    }

    private static final class GatedProxy implements LocalProxy {
        private final LocalProxy delegate;
        private final CountDownLatch opening;
        private final CountDownLatch release;
        private volatile boolean started;
        private volatile boolean stopped;

        GatedProxy(LocalProxy delegate, CountDownLatch opening, CountDownLatch release) {
            this.delegate = delegate;
            this.opening = opening;
            this.release = release;
        }

        @Override
        public void start() throws IOException {
            opening.countDown();
            var interrupted = false;
            while (true) {
                try {
                    release.await();
                    break;
                } catch (InterruptedException ex) {
                    interrupted = true;
                }
            }
            delegate.start();
            started = true;
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }

        @Override
        public String address() {
            return delegate.address();
        }

        @Override
        public void stop() {
            delegate.stop();
            stopped = true;
        }
    }
}
