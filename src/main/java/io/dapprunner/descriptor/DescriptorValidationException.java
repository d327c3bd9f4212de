package io.dapprunner.descriptor;

/**
 * Raised for malformed descriptor trees: unexpected or missing keys, wrong value shapes.
 */
public final class DescriptorValidationException extends DescriptorException {
    public DescriptorValidationException(String message) {
        super(message);
    }

    public DescriptorValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
