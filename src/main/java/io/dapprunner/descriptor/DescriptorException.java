package io.dapprunner.descriptor;

/**
 * Base error raised while loading a descriptor, always before any remote resource is touched.
 */
public class DescriptorException extends RuntimeException {
    public DescriptorException(String message) {
        super(message);
    }

    public DescriptorException(String message, Throwable cause) {
        super(message, cause);
    }
}
