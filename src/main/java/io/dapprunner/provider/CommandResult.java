package io.dapprunner.provider;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one command executed on a remote instance.
 */
public record CommandResult(String command, boolean success, String stdout, String stderr) {
    public static CommandResult failure(String command, String stderr) {
        return new CommandResult(command, false, null, stderr);
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("command", command);
        map.put("success", success);
        map.put("stdout", stdout);
        map.put("stderr", stderr);
        return map;
    }
}
