package io.dapprunner.provider;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything a provider needs to start (or re-attach to) the instances of one node.
 */
public record InstanceRequest(
    String nodeName,
    String runtime,
    Map<String, Object> payloadParams,
    NetworkHandle network,
    List<String> networkAddresses,
    String resumeAgreementId,
    String resumeActivityId,
    String resumeProviderId
) {
    public InstanceRequest {
        Objects.requireNonNull(nodeName, "nodeName");
        Objects.requireNonNull(runtime, "runtime");
        payloadParams = Collections.unmodifiableMap(new LinkedHashMap<>(payloadParams));
        networkAddresses = List.copyOf(networkAddresses);
    }

    public boolean isResume() {
        return resumeActivityId != null;
    }
}
