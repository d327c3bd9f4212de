package io.dapprunner.support;

import io.dapprunner.descriptor.DappDescriptor;
import io.dapprunner.descriptor.DescriptorReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;

/**
 * Shared helpers to build descriptor trees from inline YAML.
 */
public final class DescriptorFixtures {
    private DescriptorFixtures() {}

    public static Map<String, Object> yaml(String text) {
        try {
            return DescriptorReader.parse(new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)), "inline");
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    public static DappDescriptor dapp(String text) {
        return DappDescriptor.load(yaml(text));
    }

    public static Path resource(String... segments) {
        return Path.of("src/test/resources", segments).toAbsolutePath();
    }

    /**
     * Two nodes, {@code http} depending on {@code db}, the former behind an HTTP proxy.
     */
    public static String webapp() {
        return """
            payloads:
              db:
                runtime: vm
                params:
                  image_hash: 85021afecf51687ecae8bdc21e10f3b11b82d2e3b169ba44e177340c
              http:
                runtime: vm
                params:
                  image_hash: c37c1364f637c199fe710ca62241ff486db92c875b786814c6030aa1
            nodes:
              http:
                payload: http
                init:
                  - ["run", "/bin/bash", "-c", "echo ${nodes.db.network_node} > /tmp/db-address"]
                http_proxy:
                  ports:
                    - "80"
                depends_on:
                  - db
              db:
                payload: db
                init:
                  - run:
                      args: ["/bin/run_rqlite.sh"]
                network: default
            networks:
              default:
                ip: 192.168.0.0/24
            meta:
              name: webapp
            """;
    }
}
