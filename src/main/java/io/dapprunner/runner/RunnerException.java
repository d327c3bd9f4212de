package io.dapprunner.runner;

/**
 * Raised when the runner cannot bring up the application, e.g. a node refers to an unknown payload.
 */
public class RunnerException extends RuntimeException {
    public RunnerException(String message) {
        super(message);
    }

    public RunnerException(String message, Throwable cause) {
        super(message, cause);
    }
}
