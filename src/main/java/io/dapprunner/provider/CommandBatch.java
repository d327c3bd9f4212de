package io.dapprunner.provider;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Commands submitted together to a remote instance.
 */
public interface CommandBatch {
    String id();

    boolean isDone();

    /**
     * Waits for every command of the batch, returning one result per command in submission order.
     */
    List<CommandResult> await(Duration timeout) throws InterruptedException, TimeoutException;
}
