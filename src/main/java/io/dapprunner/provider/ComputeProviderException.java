package io.dapprunner.provider;

/**
 * Raised by compute providers when the marketplace cannot satisfy a request.
 */
public class ComputeProviderException extends RuntimeException {
    public ComputeProviderException(String message) {
        super(message);
    }

    public ComputeProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
