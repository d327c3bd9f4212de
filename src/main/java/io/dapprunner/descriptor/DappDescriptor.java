package io.dapprunner.descriptor;

import io.dapprunner.gaom.Gaom;
import io.dapprunner.gaom.GaomField;
import io.dapprunner.gaom.GaomObject;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Root of the application object model: payloads, nodes, networks and free-form metadata.
 */
public final class DappDescriptor implements GaomObject {
    private static final String OWNER = "DappDescriptor";
    private static final Set<String> KEYS = Set.of("payloads", "nodes", "networks", "meta");

    private final Map<String, PayloadDescriptor> payloads;
    private final Map<String, NodeDescriptor> nodes;
    private final Map<String, NetworkDescriptor> networks;
    private final Map<String, Object> meta;
    private DependencyGraph dependencyGraph;

    private DappDescriptor(
        Map<String, PayloadDescriptor> payloads,
        Map<String, NodeDescriptor> nodes,
        Map<String, NetworkDescriptor> networks,
        Map<String, Object> meta
    ) {
        this.payloads = payloads;
        this.nodes = nodes;
        this.networks = networks;
        this.meta = meta;
    }

    /**
     * Validates a merged descriptor tree, derives implicit defaults and resolves the dependency graph.
     * Payload params may gain derived capabilities.
     */
    public static DappDescriptor load(Map<String, Object> tree) {
        var fields = DescriptorFields.of(OWNER, tree, KEYS);

        var payloads = new LinkedHashMap<String, PayloadDescriptor>();
        fields.optionalMap("payloads").forEach((name, raw) ->
            payloads.put(name, PayloadDescriptor.load("payloads." + name, raw)));
        var nodes = new LinkedHashMap<String, NodeDescriptor>();
        fields.optionalMap("nodes").forEach((name, raw) ->
            nodes.put(name, NodeDescriptor.load("nodes." + name, raw)));
        var networks = new LinkedHashMap<String, NetworkDescriptor>();
        fields.optionalMap("networks").forEach((name, raw) ->
            networks.put(name, NetworkDescriptor.load("networks." + name, raw)));

        var dapp = new DappDescriptor(payloads, nodes, networks, fields.optionalMap("meta"));
        dapp.checkReferences();
        dapp.applyImplicitDefaults();
        dapp.resolveDependencies();
        return dapp;
    }

    private void checkReferences() {
        nodes.forEach((name, node) -> {
            if (!payloads.containsKey(node.payload())) {
                throw new DescriptorReferenceException(
                    name, node.payload(), "Undefined payload: `" + node.payload() + "` in node: `" + name + "`"
                );
            }
            if (node.network() != null && !networks.containsKey(node.network())) {
                throw new DescriptorReferenceException(
                    name, node.network(), "Undefined network: `" + node.network() + "` in node: `" + name + "`"
                );
            }
        });
    }

    private void applyImplicitDefaults() {
        nodes.values().forEach(node -> {
            if (node.proxy() != null && node.network() == null) {
                networks.computeIfAbsent(NetworkDescriptor.DEFAULT_NAME, name -> new NetworkDescriptor());
                node.assignNetwork(NetworkDescriptor.DEFAULT_NAME);
            }
        });
        nodes.values().forEach(node -> {
            var payload = payloads.get(node.payload());
            if (payload.isVm() && node.network() != null) {
                payload.addCapability(PayloadDescriptor.CAPABILITY_VPN);
            }
        });
        payloads.values().forEach(payload -> {
            if (payload.isManifest()) {
                payload.addCapability(PayloadDescriptor.CAPABILITY_MANIFEST_SUPPORT);
            }
        });
    }

    private void resolveDependencies() {
        var dependsOn = new LinkedHashMap<String, List<String>>();
        nodes.forEach((name, node) -> dependsOn.put(name, node.dependsOn()));
        dependencyGraph = DependencyGraph.build(dependsOn);
    }

    public Map<String, PayloadDescriptor> payloads() {
        return Collections.unmodifiableMap(payloads);
    }

    public Map<String, NodeDescriptor> nodes() {
        return Collections.unmodifiableMap(nodes);
    }

    public Map<String, NetworkDescriptor> networks() {
        return Collections.unmodifiableMap(networks);
    }

    public Map<String, Object> meta() {
        return Collections.unmodifiableMap(meta);
    }

    public DependencyGraph dependencyGraph() {
        return dependencyGraph;
    }

    /**
     * Nodes in start order: every node after all of its dependencies.
     */
    public List<Map.Entry<String, NodeDescriptor>> nodesPrioritized() {
        var entries = new ArrayList<Map.Entry<String, NodeDescriptor>>();
        for (var name : dependencyGraph.nodesPrioritized()) {
            entries.add(Map.entry(name, nodes.get(name)));
        }
        return entries;
    }

    /**
     * Serializes the whole tree, runtime fields included, into plain maps accepted again by {@link #load}.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> toMap() {
        return (Map<String, Object>) Gaom.toPlain(this);
    }

    @Override
    public List<GaomField> gaomFields() {
        return List.of(
            GaomField.of("payloads", payloads),
            GaomField.of("nodes", nodes),
            GaomField.of("networks", networks),
            GaomField.of("meta", meta)
        );
    }
}
