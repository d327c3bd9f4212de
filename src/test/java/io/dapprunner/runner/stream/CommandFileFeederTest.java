package io.dapprunner.runner.stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CommandFileFeederTest {
    @Test
    void feedsAppendedLinesAndSkipsMalformedOnes(@TempDir Path dir) throws Exception {
        var file = dir.resolve("commands");
        BlockingQueue<Map<String, Object>> queue = new LinkedBlockingQueue<>();
        var feeder = new CommandFileFeeder(file, queue, Duration.ofMillis(20));
        var thread = new Thread(feeder, "test-commands");
        thread.start();
        try {
            var deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (!Files.exists(file) && System.nanoTime() < deadline) {
                TimeUnit.MILLISECONDS.sleep(10);
            }
            Files.writeString(file, String.join("\n",
                "{\"db\": {\"0\": [\"echo\", \"one\"]}}",
                "not json",
                "",
                "{\"http\": {\"0\": [{\"run\": [\"echo\", \"two\"]}]}}"
            ) + "\n", StandardOpenOption.APPEND);

            var first = queue.poll(5, TimeUnit.SECONDS);
            var second = queue.poll(5, TimeUnit.SECONDS);
            assertNotNull(first);
            assertNotNull(second);
            assertEquals(Map.of("db", Map.of("0", List.of("echo", "one"))), first);
            assertTrue(second.containsKey("http"));
            assertTrue(queue.isEmpty());
        } finally {
            feeder.close();
            thread.join(TimeUnit.SECONDS.toMillis(5));
        }
    }
}
