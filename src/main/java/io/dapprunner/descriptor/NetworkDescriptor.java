package io.dapprunner.descriptor;

import io.dapprunner.gaom.GaomField;
import io.dapprunner.gaom.GaomObject;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Virtual private network shared by nodes. {@code network_id} and {@code state} are bound at runtime.
 */
public final class NetworkDescriptor implements GaomObject {
    public static final String DEFAULT_NAME = "default";
    public static final String DEFAULT_IP = "192.168.0.0/24";

    private static final Set<String> KEYS = Set.of("ip", "owner_ip", "mask", "gateway", "network_id", "state");

    private final String ip;
    private final String ownerIp;
    private final String mask;
    private final String gateway;
    private volatile String networkId;
    private volatile String state;

    public NetworkDescriptor() {
        this(DEFAULT_IP, null, null, null);
    }

    public NetworkDescriptor(String ip, String ownerIp, String mask, String gateway) {
        this.ip = ip == null ? DEFAULT_IP : ip;
        this.ownerIp = ownerIp;
        this.mask = mask;
        this.gateway = gateway;
    }

    static NetworkDescriptor load(String owner, Object raw) {
        var fields = DescriptorFields.of(owner, raw, KEYS);
        var network = new NetworkDescriptor(
            fields.optionalString("ip"),
            fields.optionalString("owner_ip"),
            fields.optionalString("mask"),
            fields.optionalString("gateway")
        );
        checkCidr(owner, network.ip);
        network.networkId = fields.optionalString("network_id");
        network.state = fields.optionalString("state");
        return network;
    }

    private static void checkCidr(String owner, String cidr) {
        var parts = cidr.split("/", -1);
        var octets = parts[0].split("\\.", -1);
        var valid = parts.length <= 2 && octets.length == 4
            && Arrays.stream(octets).allMatch(NetworkDescriptor::isOctet)
            && (parts.length == 1 || isNumberBetween(parts[1], 0, 32));
        if (!valid) {
            throw new DescriptorValidationException("Invalid network address `" + cidr + "` for `" + owner + "`");
        }
    }

    private static boolean isOctet(String text) {
        return isNumberBetween(text, 0, 255);
    }

    private static boolean isNumberBetween(String text, int min, int max) {
        if (text.isEmpty() || text.length() > 3 || !text.chars().allMatch(Character::isDigit)) {
            return false;
        }
        var value = Integer.parseInt(text);
        return value >= min && value <= max;
    }

    public String ip() {
        return ip;
    }

    public String ownerIp() {
        return ownerIp;
    }

    public String mask() {
        return mask;
    }

    public String gateway() {
        return gateway;
    }

    public String networkId() {
        return networkId;
    }

    public String state() {
        return state;
    }

    public void bind(String networkId, String state) {
        this.networkId = networkId;
        this.state = state;
    }

    @Override
    public List<GaomField> gaomFields() {
        return List.of(
            GaomField.of("ip", ip),
            GaomField.of("owner_ip", ownerIp),
            GaomField.of("mask", mask),
            GaomField.of("gateway", gateway),
            GaomField.runtime("network_id", networkId),
            GaomField.runtime("state", state)
        );
    }
}
