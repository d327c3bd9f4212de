package io.dapprunner.runner;

import io.dapprunner.descriptor.CommandDescriptor;
import io.dapprunner.descriptor.DappDescriptor;
import io.dapprunner.descriptor.DescriptorValidationException;
import io.dapprunner.descriptor.NodeDescriptor;
import io.dapprunner.provider.CommandResult;
import io.dapprunner.provider.ComputeProvider;
import io.dapprunner.provider.ComputeProviderException;
import io.dapprunner.provider.InstanceRequest;
import io.dapprunner.provider.LocalProxy;
import io.dapprunner.provider.NetworkHandle;
import io.dapprunner.shared.FreePortAllocator;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Brings an application up on a compute provider in dependency order, aggregates the state of its
 * instances and tears everything down (or suspends it) on request.
 *
 * <p>State snapshots and command results are published on {@link #stateQueue()} and {@link #dataQueue()};
 * commands addressed as {@code {node: {index: command}}} are accepted on {@link #commandQueue()}.</p>
 */
public final class Runner {
    private static final Logger LOG = LoggerFactory.getLogger(Runner.class);
    private static final AtomicInteger RUNNERS = new AtomicInteger();

    private final DappDescriptor dapp;
    private final ComputeProvider provider;
    private final RunnerOptions options;
    private final BlacklistOnFailure offerScorer;
    private final FreePortAllocator ports;
    private final ExecutorService executor;
    private final BlockingQueue<Map<String, Object>> stateQueue = new LinkedBlockingQueue<>();
    private final BlockingQueue<Map<String, Object>> dataQueue = new LinkedBlockingQueue<>();
    private final BlockingQueue<Map<String, Object>> commandQueue = new LinkedBlockingQueue<>();
    private final Map<String, InstanceGroup> groups = new ConcurrentHashMap<>();
    private final Map<String, NetworkHandle> networks = new ConcurrentHashMap<>();
    private final List<LocalProxy> proxies = new CopyOnWriteArrayList<>();
    private final List<Future<?>> tasks = new CopyOnWriteArrayList<>();
    private final List<Future<?>> instanceTasks = new CopyOnWriteArrayList<>();
    private final CompletableFuture<Void> startup = new CompletableFuture<>();
    private volatile ServiceState desiredState = ServiceState.PENDING;
    private volatile boolean startupFinished;
    private volatile Instant commissioningTime;
    private volatile Future<?> startupTask;

    public Runner(DappDescriptor dapp, ComputeProvider provider) {
        this(dapp, provider, RunnerOptions.defaults(), new FreePortAllocator());
    }

    public Runner(DappDescriptor dapp, ComputeProvider provider, RunnerOptions options, FreePortAllocator ports) {
        this.dapp = dapp;
        this.provider = provider;
        this.options = options;
        this.ports = ports;
        this.offerScorer = new BlacklistOnFailure(provider.defaultOfferScorer());
        provider.useOfferScorer(offerScorer);
        var runnerId = RUNNERS.incrementAndGet();
        var threads = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(task -> {
            var thread = new Thread(task, "dapp-runner-" + runnerId + "-" + threads.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Starts the application. The returned future completes once every node has been requested.
     */
    public synchronized CompletableFuture<Void> start() {
        if (desiredState != ServiceState.PENDING) {
            throw new IllegalStateException("Runner already " + desiredState);
        }
        desiredState = ServiceState.RUNNING;
        commissioningTime = Instant.now();
        LOG.info("Starting application with nodes {}", dapp.dependencyGraph().nodesPrioritized());
        emitState();
        tasks.add(executor.submit(this::routeCommands));
        startupTask = executor.submit(() -> {
            try {
                if (startNodes()) {
                    startup.complete(null);
                } else {
                    startup.cancel(false);
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                startup.cancel(false);
            } catch (RuntimeException ex) {
                LOG.error("Application startup failed: {}", ex.getMessage());
                startup.completeExceptionally(ex);
            }
        });
        tasks.add(startupTask);
        return startup;
    }

    private boolean startNodes() throws InterruptedException {
        provider.start();
        startNetworks();
        for (var entry : dapp.nodesPrioritized()) {
            if (!awaitDependencies(entry.getKey(), entry.getValue())) {
                return false;
            }
            startNode(entry.getKey(), entry.getValue());
        }
        startupFinished = true;
        emitState();
        return true;
    }

    private void startNetworks() {
        dapp.networks().forEach((name, descriptor) -> {
            var handle = descriptor.networkId() != null
                ? provider.attachNetwork(name, descriptor)
                : provider.createNetwork(name, descriptor);
            descriptor.bind(handle.networkId(), handle.state());
            networks.put(name, handle);
            LOG.info("Network `{}` ready: {} ({})", name, handle.networkId(), handle.ip());
        });
    }

    private boolean awaitDependencies(String name, NodeDescriptor node) throws InterruptedException {
        var dependencies = node.dependsOn();
        var logged = false;
        while (!dependencies.stream().allMatch(this::isNodeRunning)) {
            if (desiredState != ServiceState.RUNNING) {
                return false;
            }
            if (!logged) {
                LOG.info("Node `{}` waiting for {}", name, dependencies);
                logged = true;
            }
            TimeUnit.MILLISECONDS.sleep(options.dependencyPollInterval().toMillis());
        }
        return desiredState == ServiceState.RUNNING;
    }

    private boolean isNodeRunning(String name) {
        var group = groups.get(name);
        return group != null && group.isAnyRunning();
    }

    private void startNode(String name, NodeDescriptor node) {
        var payload = dapp.payloads().get(node.payload());
        if (payload == null) {
            throw new RunnerException("Undefined payload `" + node.payload() + "` for node `" + name + "`");
        }
        NetworkHandle network = null;
        if (node.network() != null) {
            network = networks.get(node.network());
            if (network == null) {
                throw new RunnerException("Undefined network `" + node.network() + "` for node `" + name + "`");
            }
        }
        var request = new InstanceRequest(
            name,
            payload.runtime(),
            payload.params(),
            network,
            node.ip(),
            node.agreementId(),
            node.activityId(),
            node.providerId()
        );
        LOG.info("Starting node `{}`{}", name, request.isResume() ? " (resuming " + node.activityId() + ")" : "");
        var remotes = provider.instantiate(request);
        var group = new InstanceGroup(name);
        groups.put(name, group);
        for (int i = 0; i < remotes.size(); i++) {
            var remote = remotes.get(i);
            node.bindInstance(remote.providerId(), remote.agreementId(), remote.activityId(), remote.networkAddress());
            var instance = new DappInstance(name, i, node, remote, dapp, options);
            group.add(instance);
            tasks.add(executor.submit(() -> forwardStates(node, instance)));
            tasks.add(executor.submit(() -> forwardData(instance)));
            instanceTasks.add(executor.submit(instance));
        }
        if (node.proxy() != null) {
            tasks.add(executor.submit(() -> startProxies(name, node, group)));
        }
        emitState();
    }

    private void forwardStates(NodeDescriptor node, DappInstance instance) {
        try {
            while (!Thread.currentThread().isInterrupted()) {
                onStateChange(node, instance, instance.stateQueue().take());
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    private void onStateChange(NodeDescriptor node, DappInstance instance, ServiceState state) {
        node.bindState(state.value());
        LOG.info("{} is {}", instance, state);
        if (state == ServiceState.TERMINATED && desiredState == ServiceState.RUNNING) {
            LOG.warn("{} failed on provider {}", instance, instance.providerId());
            offerScorer.blacklist(instance.providerId());
        }
        emitState();
    }

    private void forwardData(DappInstance instance) {
        try {
            while (!Thread.currentThread().isInterrupted()) {
                publishResults(instance, instance.dataQueue().take());
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    private void publishResults(DappInstance instance, List<CommandResult> results) {
        var serialized = new ArrayList<Map<String, Object>>(results.size());
        results.forEach(result -> serialized.add(result.toMap()));
        var byIndex = new LinkedHashMap<String, Object>();
        byIndex.put(String.valueOf(instance.index()), serialized);
        var message = new LinkedHashMap<String, Object>();
        message.put(instance.nodeName(), byIndex);
        dataQueue.offer(message);
    }

    private void startProxies(String name, NodeDescriptor node, InstanceGroup group) {
        try {
            while (!group.isAllRunning()) {
                if (desiredState != ServiceState.RUNNING) {
                    return;
                }
                TimeUnit.MILLISECONDS.sleep(options.proxyPollInterval().toMillis());
            }
            var remote = group.instances().get(0).remote();
            for (var mapping : node.proxy().ports()) {
                var localPort = mapping.localPort() != null ? mapping.localPort() : ports.next();
                var proxy = provider.openProxy(node.proxyKind(), remote, mapping, localPort);
                proxy.start();
                if (!registerProxy(proxy)) {
                    proxy.stop();
                    LOG.debug("Discarded the local proxy of `{}` opened during shutdown", name);
                    return;
                }
                mapping.bindAddress(proxy.address());
                LOG.info("Node `{}` port {} available at {}", name, mapping.remotePort(), proxy.address());
                var message = new LinkedHashMap<String, Object>();
                message.put(name, Map.of("local_proxy_address", proxy.address()));
                dataQueue.offer(message);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        } catch (IOException | IllegalStateException | ComputeProviderException ex) {
            LOG.error("Failed to start the local proxy of `{}`: {}", name, ex.getMessage());
        }
    }

    private void routeCommands() {
        try {
            while (!Thread.currentThread().isInterrupted()) {
                route(commandQueue.take());
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    private void route(Map<String, Object> message) {
        message.forEach((nodeName, byIndex) -> {
            var group = groups.get(nodeName);
            if (group == null) {
                LOG.warn("Dropping commands for unknown node `{}`", nodeName);
                return;
            }
            if (!(byIndex instanceof Map<?, ?> indexed)) {
                LOG.warn("Dropping malformed commands for `{}`: {}", nodeName, byIndex);
                return;
            }
            indexed.forEach((rawIndex, raw) -> {
                var instance = parseIndex(rawIndex).flatMap(group::instance);
                if (instance.isEmpty()) {
                    LOG.warn("Dropping commands for unknown instance `{}`[{}]", nodeName, rawIndex);
                    return;
                }
                try {
                    CommandDescriptor.parseList(nodeName + "[" + rawIndex + "]", raw).forEach(instance.get()::enqueue);
                } catch (DescriptorValidationException ex) {
                    LOG.warn("Dropping invalid command for `{}`[{}]: {}", nodeName, rawIndex, ex.getMessage());
                }
            });
        });
    }

    private static Optional<Integer> parseIndex(Object raw) {
        if (raw instanceof Number number) {
            return Optional.of(number.intValue());
        }
        try {
            return Optional.of(Integer.parseInt(String.valueOf(raw).trim()));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }

    /**
     * Stops every instance, tears down proxies and networks and closes the provider.
     */
    public void stop() {
        if (!beginShutdown(ServiceState.TERMINATED)) {
            return;
        }
        LOG.info("Stopping the application");
        emitState();
        awaitStartupTask();
        groups.values().forEach(InstanceGroup::stop);
        stopProxies();
        awaitInstances();
        removeNetworks();
        finish();
        LOG.info("Application stopped");
    }

    /**
     * Detaches from the running instances without terminating them and returns the object model,
     * runtime ids included, from which a later session can resume.
     */
    public Map<String, Object> suspend() {
        if (beginShutdown(ServiceState.SUSPENDED)) {
            LOG.info("Suspending the application");
            emitState();
            awaitStartupTask();
            stopProxies();
            groups.values().forEach(InstanceGroup::suspend);
            awaitInstances();
            finish();
            LOG.info("Application suspended");
        }
        return dapp.toMap();
    }

    /**
     * Cancels everything immediately, without waiting for remote teardown.
     */
    public void abort() {
        synchronized (this) {
            if (desiredState != ServiceState.SUSPENDED) {
                desiredState = ServiceState.TERMINATED;
            }
        }
        LOG.warn("Aborting the application");
        instanceTasks.forEach(task -> task.cancel(true));
        tasks.forEach(task -> task.cancel(true));
        stopProxies();
        executor.shutdownNow();
        provider.close();
        startup.cancel(false);
    }

    private synchronized boolean beginShutdown(ServiceState target) {
        if (desiredState == ServiceState.TERMINATED || desiredState == ServiceState.SUSPENDED) {
            return false;
        }
        desiredState = target;
        return true;
    }

    private void awaitStartupTask() {
        var task = startupTask;
        if (task == null) {
            return;
        }
        try {
            task.get(options.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | CancellationException ex) {
            LOG.debug("Startup ended abnormally: {}", ex.toString());
        } catch (TimeoutException ex) {
            LOG.warn("Startup did not wind down within {}", options.shutdownTimeout());
            task.cancel(true);
        }
    }

    private void awaitInstances() {
        var deadline = System.nanoTime() + options.shutdownTimeout().toNanos();
        for (var task : instanceTasks) {
            try {
                task.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return;
            } catch (ExecutionException ex) {
                LOG.error("Instance task failed", ex.getCause());
            } catch (CancellationException ex) {
                LOG.debug("Instance task already cancelled");
            } catch (TimeoutException ex) {
                LOG.warn("Instance teardown did not finish within {}", options.shutdownTimeout());
                task.cancel(true);
            }
        }
    }

    // holds the same lock as beginShutdown, so a proxy is either stopped by stopProxies or never registered
    private synchronized boolean registerProxy(LocalProxy proxy) {
        if (desiredState != ServiceState.RUNNING) {
            return false;
        }
        proxies.add(proxy);
        return true;
    }

    private void stopProxies() {
        for (var proxy : proxies) {
            proxy.stop();
            LOG.info("Local proxy {} stopped", proxy.address());
        }
        proxies.clear();
    }

    private void removeNetworks() {
        networks.forEach((name, handle) -> {
            try {
                provider.removeNetwork(handle);
                dapp.networks().get(name).bind(handle.networkId(), "removed");
            } catch (ComputeProviderException ex) {
                LOG.warn("Failed to remove network `{}`: {}", name, ex.getMessage());
            }
        });
        networks.clear();
    }

    private void finish() {
        tasks.forEach(task -> task.cancel(true));
        // listeners may have been cancelled with events still queued
        for (var group : groups.values()) {
            var node = dapp.nodes().get(group.nodeName());
            for (var instance : group.instances()) {
                ServiceState state;
                while ((state = instance.stateQueue().poll()) != null) {
                    onStateChange(node, instance, state);
                }
                List<CommandResult> results;
                while ((results = instance.dataQueue().poll()) != null) {
                    publishResults(instance, results);
                }
            }
        }
        provider.close();
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(options.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Runner tasks still running after {}", options.shutdownTimeout());
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
        emitState();
    }

    private void emitState() {
        stateQueue.offer(stateSnapshot());
    }

    public Map<String, Object> stateSnapshot() {
        var nodes = new LinkedHashMap<String, Object>();
        nodeStates().forEach((name, states) -> {
            var replicas = new LinkedHashMap<String, Object>();
            states.forEach((index, state) -> replicas.put(String.valueOf(index), state.value()));
            nodes.put(name, replicas);
        });
        var snapshot = new LinkedHashMap<String, Object>();
        snapshot.put("nodes", nodes);
        snapshot.put("app", appState().value());
        snapshot.put("timestamp", Instant.now().toString());
        return snapshot;
    }

    /**
     * States of the instances started so far, by node in declaration order.
     */
    public Map<String, Map<Integer, ServiceState>> nodeStates() {
        var states = new LinkedHashMap<String, Map<Integer, ServiceState>>();
        for (var name : dapp.nodes().keySet()) {
            var group = groups.get(name);
            if (group != null) {
                states.put(name, group.states());
            }
        }
        return states;
    }

    public ServiceState appState() {
        return appState(dapp.nodes().size(), desiredState, startupFinished, nodeStates());
    }

    /**
     * Derives the application state from the desired state and the states reported by the instances.
     */
    public static ServiceState appState(
        int nodeCount,
        ServiceState desired,
        boolean startupFinished,
        Map<String, Map<Integer, ServiceState>> nodeStates
    ) {
        return switch (desired) {
            case PENDING -> ServiceState.PENDING;
            case SUSPENDED -> ServiceState.SUSPENDED;
            case RUNNING -> {
                var allRunning = nodeStates.values().stream()
                    .flatMap(states -> states.values().stream())
                    .allMatch(state -> state == ServiceState.RUNNING);
                yield startupFinished && nodeStates.size() == nodeCount && allRunning
                    ? ServiceState.RUNNING
                    : ServiceState.STARTING;
            }
            case TERMINATED -> {
                var allTerminated = nodeStates.values().stream()
                    .flatMap(states -> states.values().stream())
                    .allMatch(state -> state == ServiceState.TERMINATED);
                yield allTerminated ? ServiceState.TERMINATED : ServiceState.STOPPING;
            }
            default -> throw new IllegalArgumentException("Not a desired state: " + desired);
        };
    }

    public Optional<InstanceGroup> group(String nodeName) {
        return Optional.ofNullable(groups.get(nodeName));
    }

    public ServiceState desiredState() {
        return desiredState;
    }

    public Optional<Instant> commissioningTime() {
        return Optional.ofNullable(commissioningTime);
    }

    public CompletableFuture<Void> startup() {
        return startup;
    }

    public DappDescriptor dapp() {
        return dapp;
    }

    public BlacklistOnFailure offerScorer() {
        return offerScorer;
    }

    public BlockingQueue<Map<String, Object>> stateQueue() {
        return stateQueue;
    }

    public BlockingQueue<Map<String, Object>> dataQueue() {
        return dataQueue;
    }

    public BlockingQueue<Map<String, Object>> commandQueue() {
        return commandQueue;
    }
}
