package io.dapprunner.runner;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * The instances started for one node.
 */
public final class InstanceGroup {
    private final String nodeName;
    private final List<DappInstance> instances = new CopyOnWriteArrayList<>();

    InstanceGroup(String nodeName) {
        this.nodeName = nodeName;
    }

    void add(DappInstance instance) {
        instances.add(instance);
    }

    public String nodeName() {
        return nodeName;
    }

    public List<DappInstance> instances() {
        return List.copyOf(instances);
    }

    public Optional<DappInstance> instance(int index) {
        return index >= 0 && index < instances.size() ? Optional.of(instances.get(index)) : Optional.empty();
    }

    public Map<Integer, ServiceState> states() {
        var states = new LinkedHashMap<Integer, ServiceState>();
        instances.forEach(instance -> states.put(instance.index(), instance.state()));
        return states;
    }

    public boolean isAnyRunning() {
        return instances.stream().anyMatch(instance -> instance.state() == ServiceState.RUNNING);
    }

    public boolean isAllRunning() {
        return !instances.isEmpty()
            && instances.stream().allMatch(instance -> instance.state() == ServiceState.RUNNING);
    }

    void stop() {
        instances.forEach(DappInstance::stop);
    }

    void suspend() {
        instances.forEach(DappInstance::suspend);
    }
}
