package io.dapprunner.descriptor;

import java.util.List;

/**
 * Raised when {@code depends_on} declarations form a cycle.
 */
public final class DependencyCycleException extends DescriptorException {
    private final List<String> cycle;

    public DependencyCycleException(List<String> cycle) {
        super("Node definition contains a circular `depends_on`: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> cycle() {
        return cycle;
    }
}
