package io.dapprunner.descriptor;

import io.dapprunner.gaom.GaomField;
import io.dapprunner.gaom.GaomObject;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One proxied port: {@code "remote"} or {@code "local:remote"}. The bound address is filled at runtime.
 */
public final class PortMapping implements GaomObject {
    private static final Set<String> KEYS = Set.of("remote_port", "local_port", "address");

    private final int remotePort;
    private final Integer localPort;
    private volatile String address;

    public PortMapping(int remotePort, Integer localPort) {
        this.remotePort = checkPort(remotePort, "remote");
        this.localPort = localPort == null ? null : checkPort(localPort, "local");
    }

    public static PortMapping parse(String owner, Object raw) {
        if (raw instanceof Map<?, ?>) {
            var fields = DescriptorFields.of(owner, raw, KEYS);
            var mapping = new PortMapping(
                parsePort(owner, fields.requireString("remote_port")),
                fields.has("local_port") ? parsePort(owner, fields.requireString("local_port")) : null
            );
            mapping.address = fields.optionalString("address");
            return mapping;
        }
        if (raw == null) {
            throw new DescriptorValidationException("Missing port definition in `" + owner + "`");
        }
        var text = String.valueOf(raw).trim();
        var parts = text.split(":", -1);
        if (parts.length == 1) {
            return new PortMapping(parsePort(owner, parts[0]), null);
        }
        if (parts.length == 2) {
            return new PortMapping(parsePort(owner, parts[1]), parsePort(owner, parts[0]));
        }
        throw new DescriptorValidationException("Invalid port definition `" + text + "` in `" + owner + "`");
    }

    private static int parsePort(String owner, String text) {
        try {
            var port = Integer.parseInt(text.trim());
            if (port < 1 || port > 65535) {
                throw new DescriptorValidationException("Port out of range `" + text + "` in `" + owner + "`");
            }
            return port;
        } catch (NumberFormatException ex) {
            throw new DescriptorValidationException("Invalid port `" + text + "` in `" + owner + "`", ex);
        }
    }

    private static int checkPort(int port, String label) {
        if (port < 1 || port > 65535) {
            throw new DescriptorValidationException("Invalid " + label + " port: " + port);
        }
        return port;
    }

    public int remotePort() {
        return remotePort;
    }

    public Integer localPort() {
        return localPort;
    }

    public String address() {
        return address;
    }

    public void bindAddress(String address) {
        this.address = address;
    }

    @Override
    public List<GaomField> gaomFields() {
        return List.of(
            GaomField.of("remote_port", remotePort),
            GaomField.of("local_port", localPort),
            GaomField.runtime("address", address)
        );
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof PortMapping mapping
            && remotePort == mapping.remotePort
            && Objects.equals(localPort, mapping.localPort);
    }

    @Override
    public int hashCode() {
        return Objects.hash(remotePort, localPort);
    }

    @Override
    public String toString() {
        return localPort == null ? String.valueOf(remotePort) : localPort + ":" + remotePort;
    }
}
