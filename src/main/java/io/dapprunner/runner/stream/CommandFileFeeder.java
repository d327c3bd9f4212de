package io.dapprunner.runner.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tails a file of JSON lines ({@code {node: {index: command}}}) into a command queue.
 */
public final class CommandFileFeeder implements Runnable {
    public static final Duration DEFAULT_READ_INTERVAL = Duration.ofSeconds(1);

    private static final Logger LOG = LoggerFactory.getLogger(CommandFileFeeder.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MESSAGE = new TypeReference<>() {};

    private final Path path;
    private final BlockingQueue<Map<String, Object>> target;
    private final Duration readInterval;
    private volatile boolean closed;

    public CommandFileFeeder(Path path, BlockingQueue<Map<String, Object>> target) {
        this(path, target, DEFAULT_READ_INTERVAL);
    }

    public CommandFileFeeder(Path path, BlockingQueue<Map<String, Object>> target, Duration readInterval) {
        this.path = path;
        this.target = target;
        this.readInterval = readInterval;
    }

    @Override
    public void run() {
        try {
            if (!Files.exists(path)) {
                Files.createFile(path);
            }
            try (var reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
                while (!closed) {
                    var line = reader.readLine();
                    if (line == null) {
                        TimeUnit.MILLISECONDS.sleep(readInterval.toMillis());
                        continue;
                    }
                    if (!line.isBlank()) {
                        feed(line);
                    }
                }
            }
        } catch (IOException ex) {
            LOG.error("Cannot read commands from {}: {}", path, ex.getMessage());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    private void feed(String line) {
        try {
            target.offer(JSON.readValue(line, MESSAGE));
        } catch (JsonProcessingException ex) {
            LOG.error("Ignoring malformed command line `{}`: {}", line, ex.getOriginalMessage());
        }
    }

    public void close() {
        closed = true;
    }
}
