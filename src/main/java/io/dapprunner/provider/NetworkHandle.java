package io.dapprunner.provider;

/**
 * A virtual network created or re-attached on the marketplace.
 */
public record NetworkHandle(String name, String networkId, String ip, String state) {}
