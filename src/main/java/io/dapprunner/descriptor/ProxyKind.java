package io.dapprunner.descriptor;

/**
 * How a node is exposed locally: not at all, through an HTTP proxy or through a raw TCP proxy.
 */
public enum ProxyKind {
    PLAIN,
    HTTP,
    TCP
}
