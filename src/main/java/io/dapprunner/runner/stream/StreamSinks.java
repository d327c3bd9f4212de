package io.dapprunner.runner.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.FilterWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.function.Function;

/**
 * Sinks and formatters for {@link StreamMultiplexer}.
 */
public final class StreamSinks {
    private static final ObjectMapper JSON = new ObjectMapper();

    private StreamSinks() {}

    /**
     * Opens {@code path} for writing, discarding previous content.
     */
    public static Writer truncating(Path path) throws IOException {
        var parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        return Files.newBufferedWriter(
            path,
            StandardCharsets.UTF_8,
            StandardOpenOption.CREATE,
            StandardOpenOption.TRUNCATE_EXISTING,
            StandardOpenOption.WRITE
        );
    }

    /**
     * Writes to a console stream that stays open when the sink is closed.
     */
    public static Writer console(PrintStream stream) {
        return new FilterWriter(new OutputStreamWriter(stream, StandardCharsets.UTF_8)) {
            @Override
            public void close() throws IOException {
                flush();
            }
        };
    }

    /**
     * One compact JSON document per message.
     */
    public static Function<Object, String> jsonLines() {
        return message -> {
            try {
                return JSON.writeValueAsString(message);
            } catch (JsonProcessingException ex) {
                throw new IllegalArgumentException("Message is not serializable: " + ex.getOriginalMessage(), ex);
            }
        };
    }

    /**
     * Prefixes every JSON line with a label, e.g. {@code state: {...}} on the console.
     */
    public static Function<Object, String> labelled(String label) {
        var json = jsonLines();
        return message -> label + ": " + json.apply(message);
    }
}
