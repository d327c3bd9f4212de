package io.dapprunner.runner.stream;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fans messages from source queues out to any number of writers. Each source gets one fan-out task and
 * each sink its own writer task, so a slow sink never holds up the others.
 */
public final class StreamMultiplexer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(StreamMultiplexer.class);
    private static final long POLL_MILLIS = 100L;
    private static final Object END = new Object();

    private final ExecutorService executor;
    private final Map<BlockingQueue<?>, Feed<?>> feeds = new IdentityHashMap<>();
    private final List<Future<?>> tasks = new CopyOnWriteArrayList<>();
    private volatile boolean stopping;

    public StreamMultiplexer() {
        var threads = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(task -> {
            var thread = new Thread(task, "dapp-stream-" + threads.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Copies every message of {@code source} to {@code sink}, one formatted line per message.
     * The sink is closed when the multiplexer stops.
     */
    public synchronized <T> void registerStream(BlockingQueue<T> source, Writer sink, Function<? super T, String> formatter) {
        if (stopping) {
            throw new IllegalStateException("Stream multiplexer already stopped");
        }
        @SuppressWarnings("unchecked")
        var feed = (Feed<T>) feeds.get(source);
        if (feed == null) {
            feed = new Feed<>(source);
            feeds.put(source, feed);
            tasks.add(executor.submit(feed));
        }
        var writer = new SinkWriter<T>(sink, formatter);
        feed.sinks.add(writer);
        tasks.add(executor.submit(writer));
    }

    /**
     * Delivers every message already queued, then ends all tasks and waits for them.
     */
    public void stop() throws InterruptedException {
        synchronized (this) {
            stopping = true;
        }
        for (var task : new ArrayList<>(tasks)) {
            try {
                task.get();
            } catch (ExecutionException ex) {
                LOG.error("Stream task failed", ex.getCause());
            }
        }
        executor.shutdown();
        executor.awaitTermination(1, TimeUnit.SECONDS);
    }

    /**
     * Cancels every task without flushing pending messages.
     */
    public void abort() {
        synchronized (this) {
            stopping = true;
        }
        tasks.forEach(task -> task.cancel(true));
        executor.shutdownNow();
    }

    @Override
    public void close() throws InterruptedException {
        stop();
    }

    private final class Feed<T> implements Runnable {
        private final BlockingQueue<T> source;
        private final List<SinkWriter<T>> sinks = new CopyOnWriteArrayList<>();

        private Feed(BlockingQueue<T> source) {
            this.source = source;
        }

        @Override
        public void run() {
            try {
                while (true) {
                    var message = source.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                    if (message != null) {
                        sinks.forEach(sink -> sink.queue.offer(message));
                    } else if (stopping) {
                        break;
                    }
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            } finally {
                sinks.forEach(sink -> sink.queue.offer(END));
            }
        }
    }

    private static final class SinkWriter<T> implements Runnable {
        private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();
        private final Writer sink;
        private final Function<? super T, String> formatter;

        private SinkWriter(Writer sink, Function<? super T, String> formatter) {
            this.sink = sink;
            this.formatter = formatter;
        }

        @Override
        @SuppressWarnings("unchecked")
        public void run() {
            try {
                while (true) {
                    var item = queue.take();
                    if (item == END) {
                        break;
                    }
                    write(formatter.apply((T) item));
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            } finally {
                try {
                    sink.close();
                } catch (IOException ex) {
                    LOG.warn("Failed to close stream sink: {}", ex.getMessage());
                }
            }
        }

        private void write(String line) {
            try {
                sink.write(line);
                sink.write(System.lineSeparator());
                sink.flush();
            } catch (IOException ex) {
                LOG.error("Failed to write to stream sink: {}", ex.getMessage());
            }
        }
    }
}
