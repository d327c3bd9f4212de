package io.dapprunner.runner;

import io.dapprunner.descriptor.CommandDescriptor;
import io.dapprunner.descriptor.NodeDescriptor;
import io.dapprunner.gaom.GaomLookupException;
import io.dapprunner.provider.CommandResult;
import io.dapprunner.provider.ComputeProviderException;
import io.dapprunner.provider.RemoteInstance;
import io.dapprunner.provider.RemoteState;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one remote instance of a node: waits for deployment, runs the {@code init} commands, serves
 * incoming commands and tears the activity down on stop.
 *
 * <p>State changes and command results are published on private queues drained by the runner.</p>
 */
public final class DappInstance implements Runnable {
    private static final Logger LOG = LoggerFactory.getLogger(DappInstance.class);

    private final String nodeName;
    private final int index;
    private final NodeDescriptor node;
    private final RemoteInstance remote;
    private final Object gaomRoot;
    private final RunnerOptions options;
    private final BlockingQueue<ServiceState> stateQueue = new LinkedBlockingQueue<>();
    private final BlockingQueue<List<CommandResult>> dataQueue = new LinkedBlockingQueue<>();
    private final BlockingQueue<CommandDescriptor> commandQueue = new LinkedBlockingQueue<>();
    private volatile ServiceState state = ServiceState.PENDING;
    private volatile boolean stopRequested;
    private volatile boolean suspendRequested;

    DappInstance(
        String nodeName,
        int index,
        NodeDescriptor node,
        RemoteInstance remote,
        Object gaomRoot,
        RunnerOptions options
    ) {
        this.nodeName = nodeName;
        this.index = index;
        this.node = node;
        this.remote = remote;
        this.gaomRoot = gaomRoot;
        this.options = options;
        stateQueue.offer(state);
    }

    @Override
    public void run() {
        try {
            if (awaitReady()) {
                if (!node.init().isEmpty()) {
                    execute(node.init());
                }
                if (isActive()) {
                    report(ServiceState.RUNNING);
                    serve();
                }
            }
            if (state == ServiceState.TERMINATED) {
                return;
            }
            if (suspendRequested && !stopRequested) {
                remote.suspend();
                LOG.info("{} suspended, activity {} kept alive", this, remote.activityId());
                return;
            }
            shutdown();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOG.debug("{} interrupted in state {}", this, state);
        }
    }

    private boolean awaitReady() throws InterruptedException {
        while (isActive()) {
            switch (remote.state()) {
                case STARTING -> report(ServiceState.STARTING);
                case READY -> {
                    report(ServiceState.STARTING);
                    return true;
                }
                case TERMINATED -> {
                    failed();
                    return false;
                }
                default -> {
                }
            }
            TimeUnit.MILLISECONDS.sleep(options.statePollInterval().toMillis());
        }
        return false;
    }

    private void serve() throws InterruptedException {
        while (isActive()) {
            var command = commandQueue.poll(options.statePollInterval().toMillis(), TimeUnit.MILLISECONDS);
            if (command != null) {
                execute(List.of(command));
            }
            if (remote.state() == RemoteState.TERMINATED) {
                failed();
                return;
            }
        }
    }

    private void execute(List<CommandDescriptor> commands) throws InterruptedException {
        List<CommandResult> results;
        try {
            var resolved = new ArrayList<CommandDescriptor>(commands.size());
            for (var command : commands) {
                resolved.add(command.interpolate(gaomRoot, true));
            }
            results = remote.submit(resolved).await(options.commandTimeout());
        } catch (GaomLookupException | IllegalArgumentException ex) {
            LOG.warn("{} cannot resolve command arguments: {}", this, ex.getMessage());
            results = failures(commands, ex.getMessage());
        } catch (TimeoutException ex) {
            LOG.warn("{} command batch timed out after {}", this, options.commandTimeout());
            results = failures(commands, "Timed out after " + options.commandTimeout());
        } catch (ComputeProviderException ex) {
            LOG.warn("{} command batch failed: {}", this, ex.getMessage());
            results = failures(commands, ex.getMessage());
        }
        dataQueue.offer(results);
    }

    private static List<CommandResult> failures(List<CommandDescriptor> commands, String message) {
        var results = new ArrayList<CommandResult>(commands.size());
        commands.forEach(command -> results.add(CommandResult.failure(command.cmd(), message)));
        return results;
    }

    private void shutdown() {
        report(ServiceState.STOPPING);
        try {
            remote.terminate();
        } catch (ComputeProviderException ex) {
            LOG.warn("{} failed to terminate activity {}: {}", this, remote.activityId(), ex.getMessage());
        }
        report(ServiceState.TERMINATED);
    }

    private void failed() {
        LOG.warn("{} terminated unexpectedly on provider {}", this, remote.providerId());
        report(ServiceState.TERMINATED);
    }

    private void report(ServiceState next) {
        if (next.ordinal() <= state.ordinal()) {
            return;
        }
        state = next;
        stateQueue.offer(next);
    }

    private boolean isActive() {
        return !stopRequested && !suspendRequested;
    }

    public void enqueue(CommandDescriptor command) {
        commandQueue.offer(command);
    }

    public void stop() {
        stopRequested = true;
    }

    public void suspend() {
        suspendRequested = true;
    }

    public String nodeName() {
        return nodeName;
    }

    public int index() {
        return index;
    }

    public ServiceState state() {
        return state;
    }

    public String providerId() {
        return remote.providerId();
    }

    public RemoteInstance remote() {
        return remote;
    }

    BlockingQueue<ServiceState> stateQueue() {
        return stateQueue;
    }

    BlockingQueue<List<CommandResult>> dataQueue() {
        return dataQueue;
    }

    @Override
    public String toString() {
        return nodeName + "[" + index + "]";
    }
}
