package io.dapprunner.provider.simulated;

import io.dapprunner.descriptor.CommandDescriptor;
import io.dapprunner.provider.CommandBatch;
import io.dapprunner.provider.CommandResult;
import io.dapprunner.provider.RemoteInstance;
import io.dapprunner.provider.RemoteState;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process activity: becomes ready once its startup delay has elapsed and echoes {@code run} commands.
 */
public final class SimulatedInstance implements RemoteInstance {
    private static final AtomicInteger BATCHES = new AtomicInteger();

    private final String nodeName;
    private final String providerId;
    private final String agreementId;
    private final String activityId;
    private final String networkAddress;
    private final long startedAtNanos;
    private final long startupDelayNanos;
    private final boolean failOnReady;
    private final List<CommandDescriptor> executed = new CopyOnWriteArrayList<>();
    private volatile boolean terminated;
    private volatile boolean suspended;

    SimulatedInstance(
        String nodeName,
        String providerId,
        String agreementId,
        String activityId,
        String networkAddress,
        Duration startupDelay,
        boolean failOnReady
    ) {
        this.nodeName = nodeName;
        this.providerId = providerId;
        this.agreementId = agreementId;
        this.activityId = activityId;
        this.networkAddress = networkAddress;
        this.startedAtNanos = System.nanoTime();
        this.startupDelayNanos = startupDelay.toNanos();
        this.failOnReady = failOnReady;
    }

    public String nodeName() {
        return nodeName;
    }

    @Override
    public String providerId() {
        return providerId;
    }

    @Override
    public String agreementId() {
        return agreementId;
    }

    @Override
    public String activityId() {
        return activityId;
    }

    @Override
    public String networkAddress() {
        return networkAddress;
    }

    @Override
    public RemoteState state() {
        if (terminated) {
            return RemoteState.TERMINATED;
        }
        var elapsed = System.nanoTime() - startedAtNanos;
        if (elapsed >= startupDelayNanos) {
            if (failOnReady) {
                terminated = true;
                return RemoteState.TERMINATED;
            }
            return RemoteState.READY;
        }
        return elapsed * 2 >= startupDelayNanos ? RemoteState.STARTING : RemoteState.PENDING;
    }

    @Override
    public CommandBatch submit(List<CommandDescriptor> commands) {
        var ready = state() == RemoteState.READY;
        var results = new ArrayList<CommandResult>();
        for (var command : commands) {
            if (!ready) {
                results.add(CommandResult.failure(command.cmd(), "Activity " + activityId + " is not ready"));
                continue;
            }
            executed.add(command);
            results.add(execute(command));
        }
        return new SimulatedCommandBatch("batch-" + BATCHES.incrementAndGet(), results);
    }

    private static CommandResult execute(CommandDescriptor command) {
        return switch (command.cmd()) {
            case CommandDescriptor.RUN -> {
                var args = command.args();
                if (!args.isEmpty() && (args.get(0).equals("echo") || args.get(0).endsWith("/echo"))) {
                    args = args.subList(1, args.size());
                }
                yield new CommandResult(CommandDescriptor.RUN, true, String.join(" ", args), "");
            }
            case "deploy", "start" -> new CommandResult(command.cmd(), true, "", "");
            default -> CommandResult.failure(command.cmd(), "Unsupported command: " + command.cmd());
        };
    }

    /**
     * Commands executed so far, in order.
     */
    public List<CommandDescriptor> executed() {
        return List.copyOf(executed);
    }

    /**
     * Simulates the provider dropping the activity.
     */
    public void kill() {
        terminated = true;
    }

    public boolean isSuspended() {
        return suspended;
    }

    @Override
    public void terminate() {
        terminated = true;
    }

    @Override
    public void suspend() {
        suspended = true;
    }
}
