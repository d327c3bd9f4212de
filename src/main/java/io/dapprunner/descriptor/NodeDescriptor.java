package io.dapprunner.descriptor;

import io.dapprunner.gaom.GaomField;
import io.dapprunner.gaom.GaomObject;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * One service of the application. Runtime-only fields are bound by the runner once instances exist.
 */
public final class NodeDescriptor implements GaomObject {
    private static final Set<String> KEYS = Set.of(
        "payload", "init", "network", "ip", "http_proxy", "tcp_proxy", "depends_on",
        "state", "network_node", "agreement_id", "activity_id", "provider_id"
    );

    private final String payload;
    private final List<CommandDescriptor> init;
    private final List<String> ip;
    private final ProxyDescriptor proxy;
    private final List<String> dependsOn;
    private volatile String network;
    private volatile String state;
    private volatile String networkNode;
    private volatile String agreementId;
    private volatile String activityId;
    private volatile String providerId;

    public NodeDescriptor(
        String payload,
        List<CommandDescriptor> init,
        String network,
        List<String> ip,
        ProxyDescriptor proxy,
        List<String> dependsOn
    ) {
        this.payload = payload;
        this.init = List.copyOf(init);
        this.network = network;
        this.ip = List.copyOf(ip);
        this.proxy = proxy;
        this.dependsOn = List.copyOf(dependsOn);
    }

    static NodeDescriptor load(String owner, Object raw) {
        var fields = DescriptorFields.of(owner, raw, KEYS);
        if (fields.has("http_proxy") && fields.has("tcp_proxy")) {
            throw new DescriptorValidationException(
                "`http_proxy` and `tcp_proxy` are mutually exclusive in `" + owner + "`"
            );
        }
        ProxyDescriptor proxy = null;
        if (fields.has("http_proxy")) {
            proxy = ProxyDescriptor.load(fields.child("http_proxy"), ProxyKind.HTTP, fields.raw("http_proxy"));
        } else if (fields.has("tcp_proxy")) {
            proxy = ProxyDescriptor.load(fields.child("tcp_proxy"), ProxyKind.TCP, fields.raw("tcp_proxy"));
        }
        var node = new NodeDescriptor(
            fields.requireString("payload"),
            CommandDescriptor.parseList(fields.child("init"), fields.raw("init")),
            fields.optionalString("network"),
            fields.stringOrList("ip"),
            proxy,
            fields.stringList("depends_on")
        );
        node.state = fields.optionalString("state");
        node.networkNode = fields.optionalString("network_node");
        node.agreementId = fields.optionalString("agreement_id");
        node.activityId = fields.optionalString("activity_id");
        node.providerId = fields.optionalString("provider_id");
        return node;
    }

    public String payload() {
        return payload;
    }

    public List<CommandDescriptor> init() {
        return init;
    }

    public String network() {
        return network;
    }

    void assignNetwork(String network) {
        this.network = network;
    }

    public List<String> ip() {
        return ip;
    }

    public ProxyDescriptor proxy() {
        return proxy;
    }

    public ProxyKind proxyKind() {
        return proxy == null ? ProxyKind.PLAIN : proxy.kind();
    }

    public List<String> dependsOn() {
        return dependsOn;
    }

    public String state() {
        return state;
    }

    public void bindState(String state) {
        this.state = state;
    }

    public String networkNode() {
        return networkNode;
    }

    public String agreementId() {
        return agreementId;
    }

    public String activityId() {
        return activityId;
    }

    public String providerId() {
        return providerId;
    }

    public void bindInstance(String providerId, String agreementId, String activityId, String networkNode) {
        this.providerId = providerId;
        this.agreementId = agreementId;
        this.activityId = activityId;
        this.networkNode = networkNode;
    }

    @Override
    public List<GaomField> gaomFields() {
        var fields = new ArrayList<GaomField>();
        fields.add(GaomField.of("payload", payload));
        fields.add(GaomField.of("init", init));
        fields.add(GaomField.of("network", network));
        fields.add(GaomField.of("ip", ip));
        fields.add(GaomField.of("http_proxy", proxyKind() == ProxyKind.HTTP ? proxy : null));
        fields.add(GaomField.of("tcp_proxy", proxyKind() == ProxyKind.TCP ? proxy : null));
        fields.add(GaomField.of("depends_on", dependsOn));
        fields.add(GaomField.runtime("state", state));
        fields.add(GaomField.runtime("network_node", networkNode));
        fields.add(GaomField.runtime("agreement_id", agreementId));
        fields.add(GaomField.runtime("activity_id", activityId));
        fields.add(GaomField.runtime("provider_id", providerId));
        return fields;
    }
}
