package io.dapprunner.api;

/**
 * Verbosity of the runner's own log output.
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR
}
