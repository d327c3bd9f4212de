package io.dapprunner.provider;

import io.dapprunner.descriptor.ConfigDescriptor;

/**
 * Service-loaded factory of {@link ComputeProvider}s, selected by name from the runner configuration.
 */
public interface ComputeProviderFactory {
    String name();

    ComputeProvider create(ConfigDescriptor config);
}
