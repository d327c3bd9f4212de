package io.dapprunner.provider;

/**
 * Lifecycle of an activity as reported by the marketplace.
 */
public enum RemoteState {
    PENDING,
    STARTING,
    /** Deployed and started; ready to execute commands. */
    READY,
    TERMINATED
}
