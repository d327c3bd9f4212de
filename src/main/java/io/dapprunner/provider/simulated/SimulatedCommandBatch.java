package io.dapprunner.provider.simulated;

import io.dapprunner.provider.CommandBatch;
import io.dapprunner.provider.CommandResult;
import java.time.Duration;
import java.util.List;

/**
 * Batch whose commands were executed synchronously on submission.
 */
final class SimulatedCommandBatch implements CommandBatch {
    private final String id;
    private final List<CommandResult> results;

    SimulatedCommandBatch(String id, List<CommandResult> results) {
        this.id = id;
        this.results = List.copyOf(results);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean isDone() {
        return true;
    }

    @Override
    public List<CommandResult> await(Duration timeout) {
        return results;
    }
}
