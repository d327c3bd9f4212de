package io.dapprunner.runner;

import java.time.Duration;
import java.util.Objects;

/**
 * Polling intervals and timeouts used by the runner.
 */
public record RunnerOptions(
    Duration dependencyPollInterval,
    Duration statePollInterval,
    Duration proxyPollInterval,
    Duration commandTimeout,
    Duration shutdownTimeout
) {
    public RunnerOptions {
        Objects.requireNonNull(dependencyPollInterval, "dependencyPollInterval");
        Objects.requireNonNull(statePollInterval, "statePollInterval");
        Objects.requireNonNull(proxyPollInterval, "proxyPollInterval");
        Objects.requireNonNull(commandTimeout, "commandTimeout");
        Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
    }

    public static RunnerOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Duration dependencyPollInterval = Duration.ofSeconds(1);
        private Duration statePollInterval = Duration.ofSeconds(1);
        private Duration proxyPollInterval = Duration.ofSeconds(1);
        private Duration commandTimeout = Duration.ofMinutes(5);
        private Duration shutdownTimeout = Duration.ofMinutes(1);

        public Builder dependencyPollInterval(Duration dependencyPollInterval) {
            this.dependencyPollInterval = dependencyPollInterval;
            return this;
        }

        public Builder statePollInterval(Duration statePollInterval) {
            this.statePollInterval = statePollInterval;
            return this;
        }

        public Builder proxyPollInterval(Duration proxyPollInterval) {
            this.proxyPollInterval = proxyPollInterval;
            return this;
        }

        public Builder commandTimeout(Duration commandTimeout) {
            this.commandTimeout = commandTimeout;
            return this;
        }

        public Builder shutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        /**
         * Uses the same interval for every poll loop.
         */
        public Builder pollInterval(Duration interval) {
            this.dependencyPollInterval = interval;
            this.statePollInterval = interval;
            this.proxyPollInterval = interval;
            return this;
        }

        public RunnerOptions build() {
            return new RunnerOptions(
                dependencyPollInterval,
                statePollInterval,
                proxyPollInterval,
                commandTimeout,
                shutdownTimeout
            );
        }
    }
}
