package io.dapprunner.provider.simulated;

import io.dapprunner.shared.DurationParser;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Knobs of the simulated marketplace, read from {@code provider.params} of the runner configuration.
 */
public record SimulatedSettings(List<String> providers, Duration startupDelay, Set<String> failingNodes) {
    public static final Duration DEFAULT_STARTUP_DELAY = Duration.ofSeconds(1);

    public SimulatedSettings {
        if (providers.isEmpty()) {
            throw new IllegalArgumentException("The simulated marketplace needs at least one provider");
        }
        providers = List.copyOf(providers);
        failingNodes = Set.copyOf(failingNodes);
    }

    public static SimulatedSettings defaults() {
        return new SimulatedSettings(defaultProviders(), DEFAULT_STARTUP_DELAY, Set.of());
    }

    public static SimulatedSettings from(Map<String, Object> params) {
        var providers = params.get("providers") instanceof List<?> list ? strings(list) : defaultProviders();
        var startupDelay = DurationParser.parse(params.get("startup_delay")).orElse(DEFAULT_STARTUP_DELAY);
        var failing = params.get("fail_nodes") instanceof List<?> list ? Set.copyOf(strings(list)) : Set.<String>of();
        return new SimulatedSettings(providers, startupDelay, failing);
    }

    private static List<String> defaultProviders() {
        return List.of("sim-provider-1", "sim-provider-2", "sim-provider-3");
    }

    private static List<String> strings(List<?> values) {
        var strings = new ArrayList<String>();
        values.forEach(value -> strings.add(String.valueOf(value)));
        return strings;
    }
}
