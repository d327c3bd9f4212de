package io.dapprunner.provider.simulated;

import io.dapprunner.descriptor.ConfigDescriptor;
import io.dapprunner.provider.ComputeProvider;
import io.dapprunner.provider.ComputeProviderFactory;

/**
 * Registers the in-memory marketplace under the name {@value SimulatedComputeProvider#NAME}.
 */
public final class SimulatedComputeProviderFactory implements ComputeProviderFactory {
    @Override
    public String name() {
        return SimulatedComputeProvider.NAME;
    }

    @Override
    public ComputeProvider create(ConfigDescriptor config) {
        return new SimulatedComputeProvider(SimulatedSettings.from(config.provider().params()));
    }
}
