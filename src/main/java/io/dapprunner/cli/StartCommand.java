package io.dapprunner.cli;

import io.dapprunner.api.DappLauncher;
import io.dapprunner.api.LogLevel;
import io.dapprunner.api.RunResult;
import io.dapprunner.api.RunnerConfiguration;
import io.dapprunner.shared.DurationParser;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

@CommandLine.Command(
    name = "start",
    description = "Start an application from a config file and a set of descriptor files.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class StartCommand implements Callable<Integer> {
    private static final Logger LOG = LoggerFactory.getLogger(StartCommand.class);
    private static final String RUN_ID_ALPHABET = "23456789ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz";
    private static final DateTimeFormatter RUN_ID_TIME = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final Duration SHUTDOWN_GRACE = Duration.ofMinutes(2);

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(arity = "1..*", paramLabel = "DESCRIPTOR", description = "Descriptor files, merged in order.")
    private List<Path> descriptors;

    @CommandLine.Option(names = { "-c", "--config" }, required = true, description = "Runner configuration file.")
    private Path config;

    @CommandLine.Option(names = { "-d", "--data" }, description = "Data stream file (defaults to the run directory).")
    private Path data;

    @CommandLine.Option(names = { "-s", "--state" }, description = "State stream file (defaults to the run directory).")
    private Path state;

    @CommandLine.Option(names = { "-l", "--log" }, description = "Log file (defaults to the run directory).")
    private Path log;

    @CommandLine.Option(names = "--commands", description = "File of JSON command lines to feed to the instances.")
    private Path commands;

    @CommandLine.Option(names = "--suspend-to", description = "On stop, suspend instead and save the application here.")
    private Path suspendTo;

    @CommandLine.Option(names = "--startup-timeout", description = "Startup timeout (e.g. 90, 90s, 5m).")
    private String startupTimeout;

    @CommandLine.Option(names = "--max-running-time", description = "Maximum running time (e.g. 600, 10m, 1h).")
    private String maxRunningTime;

    @CommandLine.Option(names = "--debug", description = "Display debug messages in the console.")
    private boolean debug;

    @CommandLine.Option(names = "--silent", description = "Do not echo the state and data streams to stdout.")
    private boolean silent;

    @Override
    public Integer call() throws IOException, InterruptedException {
        Path runDirectory = null;
        if (data == null || state == null || log == null) {
            runDirectory = Files.createDirectories(dataDirectory().resolve(runId()));
        }
        var configuration = RunnerConfiguration.builder()
            .descriptors(descriptors)
            .config(config)
            .dataFile(data != null ? data : runDirectory.resolve("data"))
            .stateFile(state != null ? state : runDirectory.resolve("state"))
            .commandsFile(commands)
            .suspendFile(suspendTo)
            .startupTimeout(DurationParser.parse(startupTimeout))
            .maxRunningTime(DurationParser.parse(maxRunningTime))
            .silent(silent)
            .logLevel(debug ? LogLevel.DEBUG : LogLevel.INFO)
            .build();
        LoggingSetup.configure(configuration.logLevel(), log != null ? log : runDirectory.resolve("log"));

        var launcher = new DappLauncher();
        var hook = new Thread(() -> stopOnSignal(launcher), "dapp-runner-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        var result = launcher.run(configuration);
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException ex) {
            LOG.debug("JVM already shutting down");
        }

        if (result.status() == RunResult.Status.FAILURE || result.status() == RunResult.Status.INVALID) {
            var err = spec.commandLine().getErr();
            err.println(spec.commandLine().getColorScheme().errorText(String.valueOf(result.metadata().get("error"))));
            err.flush();
        }
        return result.status().exitCode();
    }

    private static void stopOnSignal(DappLauncher launcher) {
        launcher.requestStop();
        try {
            if (!launcher.awaitCompletion(SHUTDOWN_GRACE)) {
                launcher.requestStop();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            launcher.requestStop();
        }
    }

    private static Path dataDirectory() {
        var xdg = System.getenv("XDG_DATA_HOME");
        var base = xdg != null && !xdg.isBlank()
            ? Path.of(xdg)
            : Path.of(System.getProperty("user.home"), ".local", "share");
        return base.resolve("dapp-runner");
    }

    static String runId() {
        var random = new SecureRandom();
        var prefix = new StringBuilder();
        for (int i = 0; i < 6; i++) {
            prefix.append(RUN_ID_ALPHABET.charAt(random.nextInt(RUN_ID_ALPHABET.length())));
        }
        return prefix + "_" + LocalDateTime.now().format(RUN_ID_TIME);
    }
}
