package io.dapprunner.descriptor;

import static io.dapprunner.support.DescriptorFixtures.resource;
import static io.dapprunner.support.DescriptorFixtures.yaml;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigDescriptorTest {
    @Test
    void loadsAllSections() {
        var config = ConfigDescriptor.load(DescriptorReader.read(resource("descriptors", "config.yml")));
        assertEquals("public", config.yagna().subnetTag());
        var payment = config.paymentConfig().orElseThrow();
        assertEquals(1.0, payment.budget());
        assertEquals("erc20", payment.driver());
        assertEquals("holesky", payment.network());
        assertEquals(Optional.of(Duration.ofSeconds(30)), config.limits().startupTimeout());
        assertEquals(Optional.of(Duration.ofSeconds(2)), config.limits().maxRunningTime());
        assertEquals("simulated", config.provider().name());
        assertEquals("50ms", config.provider().params().get("startup_delay"));
    }

    @Test
    void defaultsToSimulatedProvider() {
        var config = ConfigDescriptor.load(yaml("yagna: {}"));
        assertEquals(ConfigDescriptor.DEFAULT_PROVIDER, config.provider().name());
        assertTrue(config.paymentConfig().isEmpty());
        assertTrue(config.limits().startupTimeout().isEmpty());
    }

    @Test
    void acceptsProviderName() {
        assertEquals("golem", ConfigDescriptor.load(yaml("provider: golem")).provider().name());
    }

    @Test
    void requiresCompletePayment() {
        var ex = assertThrows(DescriptorValidationException.class,
            () -> ConfigDescriptor.load(yaml("payment: {budget: 1.0, driver: erc20}")));
        assertEquals("Missing key `network` for `ConfigDescriptor.payment`", ex.getMessage());
    }

    @Test
    void rejectsInvalidDurations() {
        var ex = assertThrows(DescriptorValidationException.class,
            () -> ConfigDescriptor.load(yaml("limits: {startup_timeout: soon}")));
        assertEquals("Invalid duration: soon for `ConfigDescriptor.limits.startup_timeout`", ex.getMessage());
    }
}
