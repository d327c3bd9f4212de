package io.dapprunner.provider;

import io.dapprunner.descriptor.ConfigDescriptor;
import java.util.ArrayList;
import java.util.ServiceLoader;

/**
 * Looks up {@link ComputeProviderFactory} implementations on the classpath.
 */
public final class ComputeProviders {
    private ComputeProviders() {}

    public static ComputeProvider create(ConfigDescriptor config) {
        var name = config.provider().name();
        var available = new ArrayList<String>();
        for (var factory : ServiceLoader.load(ComputeProviderFactory.class)) {
            if (factory.name().equals(name)) {
                return factory.create(config);
            }
            available.add(factory.name());
        }
        throw new IllegalStateException("Unknown compute provider `" + name + "`, available: " + available);
    }
}
