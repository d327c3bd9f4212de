package io.dapprunner.provider;

import java.io.IOException;

/**
 * A local listener forwarding traffic to a port of a remote instance.
 */
public interface LocalProxy {
    void start() throws IOException;

    /**
     * Address the proxy is reachable on, e.g. {@code http://localhost:8080}.
     */
    String address();

    void stop();
}
