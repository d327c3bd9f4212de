package io.dapprunner.descriptor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CommandDescriptorTest {
    private static final String OWNER = "nodes.http.init";

    @Test
    void flatListIsSingleRunCommand() {
        var commands = CommandDescriptor.parseList(OWNER, List.of("test", "blah"));
        assertEquals(List.of(CommandDescriptor.run(List.of("test", "blah"))), commands);
    }

    @Test
    void listOfListsIsOneCommandPerEntry() {
        var commands = CommandDescriptor.parseList(OWNER, List.of(List.of("run", "a"), List.of("run", "b")));
        assertEquals(List.of(CommandDescriptor.run(List.of("a")), CommandDescriptor.run(List.of("b"))), commands);
        assertEquals(List.of("a"), commands.get(0).args());
        assertEquals(List.of("b"), commands.get(1).args());
    }

    @Test
    void firstWordOfAnArgvEntryIsTheVerb() {
        var commands = CommandDescriptor.parseList(OWNER, List.of(List.of("deploy"), List.of("run", "/bin/sh", "-c", "true")));
        assertEquals("deploy", commands.get(0).cmd());
        assertEquals(List.of(), commands.get(0).args());
        assertEquals(CommandDescriptor.run(List.of("/bin/sh", "-c", "true")), commands.get(1));
    }

    @Test
    void rejectsEmptyArgvEntry() {
        assertThrows(DescriptorValidationException.class,
            () -> CommandDescriptor.parseList(OWNER, List.of(List.of("run", "a"), List.of())));
    }

    @Test
    void commandMapWithListValueBecomesArgs() {
        var commands = CommandDescriptor.parseList(OWNER, List.of(Map.of("run", List.of("test", "blah"))));
        assertEquals(List.of(CommandDescriptor.run(List.of("test", "blah"))), commands);
    }

    @Test
    void keepsArbitraryVerbsAndParams() {
        var commands = CommandDescriptor.parseList(OWNER, List.of(
            Map.of("deploy", Map.of("kwargs", Map.of("foo", "bar"))),
            Map.of("run", Map.of("args", List.of("test", "command")))
        ));
        assertEquals(2, commands.size());
        assertEquals("deploy", commands.get(0).cmd());
        assertEquals(Map.of("kwargs", Map.of("foo", "bar")), commands.get(0).params());
        assertTrue(commands.get(0).args().isEmpty());
        assertEquals("run", commands.get(1).cmd());
        assertEquals(List.of("test", "command"), commands.get(1).args());
    }

    @Test
    void acceptsSingleCommandMap() {
        var commands = CommandDescriptor.parseList(OWNER, Map.of("start", Map.of()));
        assertEquals(1, commands.size());
        assertEquals("start", commands.get(0).cmd());
    }

    @Test
    void treatsMissingListAsEmpty() {
        assertTrue(CommandDescriptor.parseList(OWNER, null).isEmpty());
        assertTrue(CommandDescriptor.parseList(OWNER, List.of()).isEmpty());
    }

    @Test
    void rejectsMapsWithSeveralCommands() {
        var map = new LinkedHashMap<String, Object>();
        map.put("run", List.of("a"));
        map.put("deploy", Map.of());
        assertThrows(DescriptorValidationException.class, () -> CommandDescriptor.parseList(OWNER, List.of(map)));
    }

    @Test
    void rejectsMixedEntries() {
        var ex = assertThrows(DescriptorValidationException.class,
            () -> CommandDescriptor.parseList(OWNER, List.of("echo", List.of("hi"))));
        assertEquals("Cannot mix plain arguments and commands in `nodes.http.init`", ex.getMessage());
    }

    @Test
    void rejectsScalarCommandList() {
        assertThrows(DescriptorValidationException.class, () -> CommandDescriptor.parseList(OWNER, "echo hi"));
    }

    @Test
    void interpolatesParams() {
        var command = CommandDescriptor.run(List.of("echo", "${name}"));
        var interpolated = command.interpolate(Map.of("name", "db"), true);
        assertEquals(List.of("echo", "db"), interpolated.args());
        assertEquals(List.of("echo", "${name}"), command.args());
    }
}
