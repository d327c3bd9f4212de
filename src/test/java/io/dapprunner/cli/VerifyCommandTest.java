package io.dapprunner.cli;

import static io.dapprunner.support.DescriptorFixtures.resource;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class VerifyCommandTest {
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int execute(String... args) {
        var commandLine = Main.commandLine();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    @Test
    void printsInterpretedDescriptor() {
        var exitCode = execute(
            "verify",
            resource("descriptors", "base.yml").toString(),
            resource("descriptors", "override.yml").toString()
        );
        assertEquals(0, exitCode, err.toString());
        var yaml = out.toString();
        assertTrue(yaml.contains("payloads:"), yaml);
        assertTrue(yaml.contains("10.0.0.0/24"), yaml);
        assertTrue(yaml.contains("vpn"), yaml);
    }

    @Test
    void reportsDescriptorErrors(@TempDir Path dir) throws Exception {
        var descriptor = dir.resolve("cycle.yml");
        Files.writeString(descriptor, """
            payloads:
              web: {runtime: vm}
            nodes:
              a: {payload: web, depends_on: [b]}
              b: {payload: web, depends_on: [a]}
            """);
        assertEquals(2, execute("verify", descriptor.toString()));
        assertTrue(err.toString().contains("circular"), err.toString());
    }

    @Test
    void printsVersion() {
        assertEquals(0, execute("--version"));
        assertTrue(out.toString().startsWith("dapp-runner (java) "));
    }

    @Test
    void requiresConfigForStart() {
        assertEquals(2, execute("start", resource("descriptors", "base.yml").toString()));
        assertTrue(err.toString().contains("--config"), err.toString());
    }
}
