package io.dapprunner.api;

import io.dapprunner.runner.RunnerOptions;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration of one launcher session.
 *
 * <p>Timeouts given here take precedence over the {@code limits} section of the config file.</p>
 */
public record RunnerConfiguration(
    List<Path> descriptors,
    Path config,
    Optional<Path> dataFile,
    Optional<Path> stateFile,
    Optional<Path> commandsFile,
    Optional<Path> suspendFile,
    Optional<Duration> startupTimeout,
    Optional<Duration> maxRunningTime,
    boolean silent,
    LogLevel logLevel,
    RunnerOptions runnerOptions
) {
    public RunnerConfiguration {
        Objects.requireNonNull(descriptors, "descriptors");
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(dataFile, "dataFile");
        Objects.requireNonNull(stateFile, "stateFile");
        Objects.requireNonNull(commandsFile, "commandsFile");
        Objects.requireNonNull(suspendFile, "suspendFile");
        Objects.requireNonNull(startupTimeout, "startupTimeout");
        Objects.requireNonNull(maxRunningTime, "maxRunningTime");
        Objects.requireNonNull(logLevel, "logLevel");
        Objects.requireNonNull(runnerOptions, "runnerOptions");
        if (descriptors.isEmpty()) {
            throw new IllegalArgumentException("At least one descriptor is required");
        }
        descriptors = List.copyOf(descriptors);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private List<Path> descriptors = List.of();
        private Path config;
        private Optional<Path> dataFile = Optional.empty();
        private Optional<Path> stateFile = Optional.empty();
        private Optional<Path> commandsFile = Optional.empty();
        private Optional<Path> suspendFile = Optional.empty();
        private Optional<Duration> startupTimeout = Optional.empty();
        private Optional<Duration> maxRunningTime = Optional.empty();
        private boolean silent;
        private LogLevel logLevel = LogLevel.INFO;
        private RunnerOptions runnerOptions = RunnerOptions.defaults();

        public Builder descriptors(List<Path> descriptors) {
            this.descriptors = descriptors;
            return this;
        }

        public Builder config(Path config) {
            this.config = config;
            return this;
        }

        public Builder dataFile(Path dataFile) {
            this.dataFile = Optional.ofNullable(dataFile);
            return this;
        }

        public Builder stateFile(Path stateFile) {
            this.stateFile = Optional.ofNullable(stateFile);
            return this;
        }

        public Builder commandsFile(Path commandsFile) {
            this.commandsFile = Optional.ofNullable(commandsFile);
            return this;
        }

        public Builder suspendFile(Path suspendFile) {
            this.suspendFile = Optional.ofNullable(suspendFile);
            return this;
        }

        public Builder startupTimeout(Optional<Duration> startupTimeout) {
            this.startupTimeout = startupTimeout;
            return this;
        }

        public Builder maxRunningTime(Optional<Duration> maxRunningTime) {
            this.maxRunningTime = maxRunningTime;
            return this;
        }

        public Builder silent(boolean silent) {
            this.silent = silent;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public Builder runnerOptions(RunnerOptions runnerOptions) {
            this.runnerOptions = runnerOptions;
            return this;
        }

        public RunnerConfiguration build() {
            return new RunnerConfiguration(
                descriptors,
                config,
                dataFile,
                stateFile,
                commandsFile,
                suspendFile,
                startupTimeout,
                maxRunningTime,
                silent,
                logLevel,
                runnerOptions
            );
        }
    }
}
