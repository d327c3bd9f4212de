package io.dapprunner.descriptor;

/**
 * Raised when a {@code depends_on} entry names a node that is not declared.
 */
public final class UnmetDependencyException extends DescriptorException {
    private final String node;
    private final String dependency;

    public UnmetDependencyException(String node, String dependency) {
        super("Unmet `depends_on`: \"" + dependency + "\" in node: \"" + node + "\"");
        this.node = node;
        this.dependency = dependency;
    }

    public String node() {
        return node;
    }

    public String dependency() {
        return dependency;
    }
}
