package io.dapprunner.descriptor;

/**
 * Raised when a node refers to a payload or network the descriptor does not define.
 */
public final class DescriptorReferenceException extends DescriptorException {
    private final String node;
    private final String reference;

    public DescriptorReferenceException(String node, String reference, String message) {
        super(message);
        this.node = node;
        this.reference = reference;
    }

    public String node() {
        return node;
    }

    public String reference() {
        return reference;
    }
}
