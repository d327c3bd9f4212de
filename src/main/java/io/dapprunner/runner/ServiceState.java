package io.dapprunner.runner;

import java.util.Locale;

/**
 * Lifecycle state of an instance, and of the application as a whole.
 */
public enum ServiceState {
    PENDING,
    STARTING,
    RUNNING,
    STOPPING,
    TERMINATED,
    SUSPENDED;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return value();
    }
}
