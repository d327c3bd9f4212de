package io.dapprunner.support;

import static org.junit.jupiter.api.Assertions.fail;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.function.Predicate;

/**
 * Polling helpers for assertions on asynchronous runner behaviour.
 */
public final class Awaits {
    public static final Duration TIMEOUT = Duration.ofSeconds(10);

    private Awaits() {}

    public static void until(String what, BooleanSupplier condition) throws InterruptedException {
        var deadline = System.nanoTime() + TIMEOUT.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Timed out waiting for " + what);
            }
            TimeUnit.MILLISECONDS.sleep(10);
        }
    }

    /**
     * Takes messages from {@code queue} until one matches, collecting everything taken on the way.
     */
    public static Map<String, Object> message(
        BlockingQueue<Map<String, Object>> queue,
        Predicate<Map<String, Object>> matcher,
        List<Map<String, Object>> seen
    ) throws InterruptedException {
        var deadline = System.nanoTime() + TIMEOUT.toNanos();
        while (System.nanoTime() < deadline) {
            var message = queue.poll(50, TimeUnit.MILLISECONDS);
            if (message == null) {
                continue;
            }
            seen.add(message);
            if (matcher.test(message)) {
                return message;
            }
        }
        return fail("No matching message among " + seen);
    }

    public static Map<String, Object> message(
        BlockingQueue<Map<String, Object>> queue,
        Predicate<Map<String, Object>> matcher
    ) throws InterruptedException {
        return message(queue, matcher, new ArrayList<>());
    }
}
