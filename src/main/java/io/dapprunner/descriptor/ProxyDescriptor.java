package io.dapprunner.descriptor;

import io.dapprunner.gaom.GaomField;
import io.dapprunner.gaom.GaomObject;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Local proxy definition of a node ({@code http_proxy} or {@code tcp_proxy}).
 */
public final class ProxyDescriptor implements GaomObject {
    private static final Set<String> KEYS = Set.of("ports");

    private final ProxyKind kind;
    private final List<PortMapping> ports;

    public ProxyDescriptor(ProxyKind kind, List<PortMapping> ports) {
        if (kind == ProxyKind.PLAIN) {
            throw new IllegalArgumentException("A proxy must be HTTP or TCP");
        }
        this.kind = kind;
        this.ports = List.copyOf(ports);
    }

    static ProxyDescriptor load(String owner, ProxyKind kind, Object raw) {
        var fields = DescriptorFields.of(owner, raw, KEYS);
        var ports = new ArrayList<PortMapping>();
        var entries = fields.optionalList("ports");
        for (int i = 0; i < entries.size(); i++) {
            ports.add(PortMapping.parse(fields.child("ports") + "[" + i + "]", entries.get(i)));
        }
        if (ports.isEmpty()) {
            throw new DescriptorValidationException("Missing key `ports` for `" + owner + "`");
        }
        return new ProxyDescriptor(kind, ports);
    }

    public ProxyKind kind() {
        return kind;
    }

    public List<PortMapping> ports() {
        return ports;
    }

    @Override
    public List<GaomField> gaomFields() {
        return List.of(GaomField.of("ports", ports));
    }
}
