package io.dapprunner.provider;

import java.util.Map;

/**
 * A marketplace proposal from one provider node.
 */
public record Offer(String id, String issuerId, Map<String, Object> properties) {
    public Offer {
        properties = Map.copyOf(properties);
    }
}
