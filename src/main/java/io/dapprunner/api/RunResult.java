package io.dapprunner.api;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a {@link DappLauncher} session.
 */
public record RunResult(Status status, Map<String, Object> metadata, Instant startedAt, Instant finishedAt) {
    public RunResult {
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static RunResult success(Map<String, Object> metadata, Instant startedAt) {
        return new RunResult(Status.SUCCESS, metadata, startedAt, Instant.now());
    }

    public static RunResult suspended(Map<String, Object> metadata, Instant startedAt) {
        return new RunResult(Status.SUSPENDED, metadata, startedAt, Instant.now());
    }

    public static RunResult failure(String message, Map<String, Object> metadata, Instant startedAt) {
        return withError(Status.FAILURE, message, metadata, startedAt);
    }

    public static RunResult invalid(String message, Map<String, Object> metadata, Instant startedAt) {
        return withError(Status.INVALID, message, metadata, startedAt);
    }

    private static RunResult withError(Status status, String message, Map<String, Object> metadata, Instant startedAt) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        if (message != null) {
            meta.putIfAbsent("error", message);
        }
        return new RunResult(status, meta, startedAt, Instant.now());
    }

    public enum Status {
        SUCCESS(0),
        SUSPENDED(0),
        FAILURE(1),
        INVALID(2);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
