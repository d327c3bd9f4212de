package io.dapprunner.api;

import io.dapprunner.descriptor.ConfigDescriptor;
import io.dapprunner.descriptor.DappDescriptor;
import io.dapprunner.descriptor.DescriptorException;
import io.dapprunner.descriptor.DescriptorReader;
import io.dapprunner.descriptor.ManifestVerifier;
import io.dapprunner.provider.ComputeProvider;
import io.dapprunner.provider.ComputeProviders;
import io.dapprunner.runner.Runner;
import io.dapprunner.runner.ServiceState;
import io.dapprunner.runner.stream.CommandFileFeeder;
import io.dapprunner.runner.stream.StreamMultiplexer;
import io.dapprunner.runner.stream.StreamSinks;
import io.dapprunner.shared.FreePortAllocator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Public entry point: loads descriptors and config, runs the application and supervises its time limits.
 */
public final class DappLauncher {
    private static final Logger LOG = LoggerFactory.getLogger(DappLauncher.class);
    private static final Duration DEFAULT_SUPERVISION_INTERVAL = Duration.ofSeconds(1);

    private enum Outcome { STOP_REQUESTED, STARTUP_FAILED, STARTUP_TIMEOUT, MAX_RUNNING_TIME }

    private final Function<ConfigDescriptor, ComputeProvider> providerFactory;
    private final Duration supervisionInterval;
    private final AtomicInteger stopRequests = new AtomicInteger();
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final CountDownLatch finished = new CountDownLatch(1);
    private volatile Runner runner;

    public DappLauncher() {
        this(ComputeProviders::create, DEFAULT_SUPERVISION_INTERVAL);
    }

    public DappLauncher(Function<ConfigDescriptor, ComputeProvider> providerFactory, Duration supervisionInterval) {
        this.providerFactory = providerFactory;
        this.supervisionInterval = supervisionInterval;
    }

    public RunResult run(RunnerConfiguration configuration) {
        var started = Instant.now();
        var metadata = new LinkedHashMap<String, Object>();
        var descriptors = new ArrayList<String>();
        configuration.descriptors().forEach(path -> descriptors.add(path.toString()));
        metadata.put("descriptors", descriptors);
        StreamMultiplexer streams = null;
        CommandFileFeeder feeder = null;
        try {
            var dapp = DappDescriptor.load(DescriptorReader.readAll(configuration.descriptors()));
            var config = ConfigDescriptor.load(DescriptorReader.read(configuration.config()));
            new ManifestVerifier().verifyAll(dapp);
            var startupTimeout = configuration.startupTimeout().or(() -> config.limits().startupTimeout());
            var maxRunningTime = configuration.maxRunningTime().or(() -> config.limits().maxRunningTime());

            var current = new Runner(
                dapp,
                providerFactory.apply(config),
                configuration.runnerOptions(),
                new FreePortAllocator()
            );
            runner = current;
            streams = openStreams(configuration, current);
            if (configuration.commandsFile().isPresent()) {
                feeder = new CommandFileFeeder(configuration.commandsFile().get(), current.commandQueue());
                var thread = new Thread(feeder, "dapp-commands");
                thread.setDaemon(true);
                thread.start();
            }

            current.start();
            var outcome = supervise(current, startupTimeout, maxRunningTime);
            metadata.put("outcome", outcome.name().toLowerCase(Locale.ROOT));
            metadata.put("blacklisted", new ArrayList<>(current.offerScorer().blacklisted()));

            if (outcome == Outcome.STOP_REQUESTED && configuration.suspendFile().isPresent()) {
                var suspendFile = configuration.suspendFile().get();
                writeSuspended(suspendFile, current.suspend());
                metadata.put("suspendFile", suspendFile.toString());
                LOG.info("Application suspended to {}", suspendFile);
                return RunResult.suspended(metadata, started);
            }
            current.stop();
            return switch (outcome) {
                case STARTUP_FAILED -> RunResult.failure(startupError(current), metadata, started);
                case STARTUP_TIMEOUT ->
                    RunResult.failure("Application failed to start within " + startupTimeout.get(), metadata, started);
                default -> RunResult.success(metadata, started);
            };
        } catch (DescriptorException ex) {
            LOG.error("Invalid descriptor: {}", ex.getMessage());
            return RunResult.invalid(ex.getMessage(), metadata, started);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            abortRunner();
            return RunResult.failure("Interrupted", metadata, started);
        } catch (Exception ex) {
            LOG.error("Application failed: {}", ex.getMessage(), ex);
            abortRunner();
            return RunResult.failure(ex.getMessage(), metadata, started);
        } finally {
            if (feeder != null) {
                feeder.close();
            }
            closeStreams(streams);
            finished.countDown();
        }
    }

    private Outcome supervise(
        Runner current,
        Optional<Duration> startupTimeout,
        Optional<Duration> maxRunningTime
    ) throws InterruptedException {
        var running = false;
        while (true) {
            if (stopRequests.get() > 0) {
                return Outcome.STOP_REQUESTED;
            }
            var startup = current.startup();
            if (startup.isCompletedExceptionally() && !startup.isCancelled()) {
                return Outcome.STARTUP_FAILED;
            }
            var now = Instant.now();
            var commissioned = current.commissioningTime().orElse(now);
            if (!running && current.appState() == ServiceState.RUNNING) {
                running = true;
                LOG.info("Application is running");
            }
            if (!running && startupTimeout.isPresent() && runningTimeElapsed(commissioned, startupTimeout.get(), now)) {
                LOG.error("Application failed to start within {}", startupTimeout.get());
                return Outcome.STARTUP_TIMEOUT;
            }
            if (maxRunningTime.isPresent() && runningTimeElapsed(commissioned, maxRunningTime.get(), now)) {
                LOG.info("Maximum running time of {} elapsed", maxRunningTime.get());
                return Outcome.MAX_RUNNING_TIME;
            }
            stopSignal.await(supervisionInterval.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    /**
     * True once more than {@code maxRunningTime} has passed since {@code startedAt}; false when either is unknown.
     */
    public static boolean runningTimeElapsed(Instant startedAt, Duration maxRunningTime, Instant now) {
        if (startedAt == null || maxRunningTime == null) {
            return false;
        }
        return Duration.between(startedAt, now).compareTo(maxRunningTime) > 0;
    }

    /**
     * First call stops the application gracefully; any further call aborts it immediately.
     */
    public void requestStop() {
        var requests = stopRequests.incrementAndGet();
        stopSignal.countDown();
        if (requests == 1) {
            LOG.info("Shutting down, request again to abort");
            return;
        }
        LOG.warn("Aborting the application");
        abortRunner();
    }

    private void abortRunner() {
        var current = runner;
        if (current != null) {
            current.abort();
        }
    }

    /**
     * Waits until {@link #run} has returned.
     */
    public boolean awaitCompletion(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public Optional<Runner> runner() {
        return Optional.ofNullable(runner);
    }

    private StreamMultiplexer openStreams(RunnerConfiguration configuration, Runner current) throws IOException {
        var streams = new StreamMultiplexer();
        if (configuration.stateFile().isPresent()) {
            streams.registerStream(
                current.stateQueue(), StreamSinks.truncating(configuration.stateFile().get()), StreamSinks.jsonLines()
            );
        }
        if (configuration.dataFile().isPresent()) {
            streams.registerStream(
                current.dataQueue(), StreamSinks.truncating(configuration.dataFile().get()), StreamSinks.jsonLines()
            );
        }
        if (!configuration.silent()) {
            streams.registerStream(current.stateQueue(), StreamSinks.console(System.out), StreamSinks.labelled("state"));
            streams.registerStream(current.dataQueue(), StreamSinks.console(System.out), StreamSinks.labelled("data"));
        }
        return streams;
    }

    private void closeStreams(StreamMultiplexer streams) {
        if (streams == null) {
            return;
        }
        if (stopRequests.get() > 1) {
            streams.abort();
            return;
        }
        try {
            streams.stop();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            streams.abort();
        }
    }

    private static void writeSuspended(Path path, Map<String, Object> gaom) throws IOException {
        var parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, DescriptorReader.toYaml(gaom));
    }

    private static String startupError(Runner current) {
        try {
            current.startup().getNow(null);
            return "Application startup failed";
        } catch (RuntimeException ex) {
            var cause = ex.getCause() != null ? ex.getCause() : ex;
            return cause.getMessage();
        }
    }
}
