package io.dapprunner.provider;

import io.dapprunner.descriptor.CommandDescriptor;
import java.util.List;

/**
 * One activity running on a provider node.
 */
public interface RemoteInstance {
    String providerId();

    String agreementId();

    String activityId();

    /**
     * Address on the virtual network, or {@code null} when the instance is not attached to one.
     */
    String networkAddress();

    RemoteState state();

    CommandBatch submit(List<CommandDescriptor> commands);

    /**
     * Ends the activity and its agreement.
     */
    void terminate();

    /**
     * Detaches from the activity while keeping the agreement alive so it can be resumed later.
     */
    void suspend();
}
