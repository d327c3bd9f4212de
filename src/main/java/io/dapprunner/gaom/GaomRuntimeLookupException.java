package io.dapprunner.gaom;

/**
 * Raised when a query reaches a runtime-only field outside of a runtime context.
 */
public final class GaomRuntimeLookupException extends GaomLookupException {
    public GaomRuntimeLookupException(String message) {
        super(message);
    }
}
