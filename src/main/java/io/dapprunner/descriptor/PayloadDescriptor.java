package io.dapprunner.descriptor;

import io.dapprunner.gaom.GaomField;
import io.dapprunner.gaom.GaomObject;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runtime id plus the opaque parameters handed to the compute provider.
 */
public final class PayloadDescriptor implements GaomObject {
    public static final String RUNTIME_VM = "vm";
    public static final String RUNTIME_VM_MANIFEST = "vm/manifest";
    public static final String CAPABILITIES = "capabilities";
    public static final String CAPABILITY_VPN = "vpn";
    public static final String CAPABILITY_MANIFEST_SUPPORT = "manifest-support";

    private static final Set<String> KEYS = Set.of("runtime", "params");

    private final String runtime;
    private final Map<String, Object> params;

    public PayloadDescriptor(String runtime, Map<String, Object> params) {
        this.runtime = runtime;
        this.params = params == null ? new LinkedHashMap<>() : new LinkedHashMap<>(params);
    }

    static PayloadDescriptor load(String owner, Object raw) {
        var fields = DescriptorFields.of(owner, raw, KEYS);
        var payload = new PayloadDescriptor(fields.requireString("runtime"), fields.optionalMap("params"));
        if (payload.params.containsKey(CAPABILITIES) && !(payload.params.get(CAPABILITIES) instanceof List<?>)) {
            throw new DescriptorValidationException("`" + owner + ".params.capabilities` must be a list");
        }
        return payload;
    }

    public String runtime() {
        return runtime;
    }

    public Map<String, Object> params() {
        return params;
    }

    public boolean isVm() {
        return RUNTIME_VM.equals(runtime) || RUNTIME_VM_MANIFEST.equals(runtime);
    }

    public boolean isManifest() {
        return RUNTIME_VM_MANIFEST.equals(runtime);
    }

    public List<String> capabilities() {
        var capabilities = new ArrayList<String>();
        if (params.get(CAPABILITIES) instanceof List<?> list) {
            list.forEach(item -> capabilities.add(String.valueOf(item)));
        }
        return capabilities;
    }

    /**
     * Adds a capability unless the payload already declares it.
     */
    public synchronized void addCapability(String capability) {
        var capabilities = capabilities();
        if (!capabilities.contains(capability)) {
            capabilities.add(capability);
            params.put(CAPABILITIES, capabilities);
        }
    }

    @Override
    public List<GaomField> gaomFields() {
        return List.of(GaomField.of("runtime", runtime), GaomField.of("params", params));
    }
}
