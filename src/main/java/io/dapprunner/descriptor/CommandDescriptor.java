package io.dapprunner.descriptor;

import io.dapprunner.gaom.Gaom;
import io.dapprunner.gaom.GaomField;
import io.dapprunner.gaom.GaomObject;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One command sent to a remote instance: a verb such as {@code run} and its parameters.
 */
public record CommandDescriptor(String cmd, Map<String, Object> params) implements GaomObject {
    public static final String RUN = "run";
    public static final String ARGS = "args";

    public CommandDescriptor {
        Objects.requireNonNull(cmd, "cmd");
        params = params == null ? new LinkedHashMap<>() : new LinkedHashMap<>(params);
    }

    public static CommandDescriptor run(List<String> args) {
        var params = new LinkedHashMap<String, Object>();
        params.put(ARGS, List.copyOf(args));
        return new CommandDescriptor(RUN, params);
    }

    /**
     * Canonicalizes the accepted command list shorthands:
     * a flat argv list, a list of single-key command maps, or a list of argv lists.
 * In the last form the first word of each inner list is the verb and the rest are its args.
     * A single command map is accepted as a one-element list.
     */
    public static List<CommandDescriptor> parseList(String owner, Object raw) {
        if (raw == null) {
            return new ArrayList<>();
        }
        if (raw instanceof Map<?, ?> single) {
            return new ArrayList<>(List.of(parseMap(owner, single)));
        }
        if (!(raw instanceof List<?> items)) {
            throw new DescriptorValidationException("`" + owner + "` must be a list of commands");
        }
        if (items.isEmpty()) {
            return new ArrayList<>();
        }
        if (items.stream().noneMatch(item -> item instanceof Map<?, ?> || item instanceof List<?>)) {
            return new ArrayList<>(List.of(run(argv(owner, items))));
        }
        var commands = new ArrayList<CommandDescriptor>();
        for (int i = 0; i < items.size(); i++) {
            var item = items.get(i);
            var itemOwner = owner + "[" + i + "]";
            if (item instanceof Map<?, ?> map) {
                commands.add(parseMap(itemOwner, map));
            } else if (item instanceof List<?> argv) {
                commands.add(parseArgv(itemOwner, argv));
            } else {
                throw new DescriptorValidationException("Cannot mix plain arguments and commands in `" + owner + "`");
            }
        }
        return commands;
    }

    private static CommandDescriptor parseMap(String owner, Map<?, ?> map) {
        var populated = new ArrayList<Map.Entry<?, ?>>();
        for (var entry : map.entrySet()) {
            if (entry.getValue() != null) {
                populated.add(entry);
            }
        }
        if (populated.size() != 1) {
            throw new DescriptorValidationException(
                "A command entry in `" + owner + "` must have exactly one command, got: " + map.keySet()
            );
        }
        var entry = populated.get(0);
        var cmd = String.valueOf(entry.getKey());
        var value = entry.getValue();
        if (value instanceof List<?> args) {
            var params = new LinkedHashMap<String, Object>();
            params.put(ARGS, argv(owner, args));
            return new CommandDescriptor(cmd, params);
        }
        return new CommandDescriptor(cmd, DescriptorFields.mapping(owner + "." + cmd, value));
    }

    private static CommandDescriptor parseArgv(String owner, List<?> argv) {
        if (argv.isEmpty()) {
            throw new DescriptorValidationException("Empty command in `" + owner + "`");
        }
        var words = argv(owner, argv);
        var params = new LinkedHashMap<String, Object>();
        params.put(ARGS, List.copyOf(words.subList(1, words.size())));
        return new CommandDescriptor(words.get(0), params);
    }

    private static List<String> argv(String owner, List<?> items) {
        var args = new ArrayList<String>();
        for (var item : items) {
            if (item == null || item instanceof Map<?, ?> || item instanceof List<?>) {
                throw new DescriptorValidationException("Command arguments in `" + owner + "` must be scalars");
            }
            args.add(String.valueOf(item));
        }
        return args;
    }

    /**
     * Positional arguments of the command, empty when it carries none.
     */
    public List<String> args() {
        if (params.get(ARGS) instanceof List<?> list) {
            var args = new ArrayList<String>();
            list.forEach(item -> args.add(String.valueOf(item)));
            return args;
        }
        return List.of();
    }

    public CommandDescriptor interpolate(Object root, boolean isRuntime) {
        return new CommandDescriptor(cmd, Gaom.interpolate(params, root, isRuntime));
    }

    @Override
    public List<GaomField> gaomFields() {
        return List.of(GaomField.of(cmd, params));
    }
}
