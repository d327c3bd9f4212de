package io.dapprunner.gaom;

/**
 * Raised when a query path does not resolve against the object model.
 */
public class GaomLookupException extends RuntimeException {
    public GaomLookupException(String message) {
        super(message);
    }
}
