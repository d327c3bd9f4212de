package io.dapprunner.descriptor;

import io.dapprunner.shared.DurationParser;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Runner configuration: marketplace connection, payment, time limits and the compute provider to use.
 */
public record ConfigDescriptor(YagnaConfig yagna, PaymentConfig payment, LimitsConfig limits, ProviderConfig provider) {
    public static final String DEFAULT_PROVIDER = "simulated";

    private static final String OWNER = "ConfigDescriptor";
    private static final Set<String> KEYS = Set.of("yagna", "payment", "limits", "provider");

    public static ConfigDescriptor load(Map<String, Object> tree) {
        var fields = DescriptorFields.of(OWNER, tree, KEYS);
        return new ConfigDescriptor(
            YagnaConfig.load(fields.child("yagna"), fields.raw("yagna")),
            fields.has("payment") ? PaymentConfig.load(fields.child("payment"), fields.raw("payment")) : null,
            LimitsConfig.load(fields.child("limits"), fields.raw("limits")),
            ProviderConfig.load(fields.child("provider"), fields.raw("provider"))
        );
    }

    public Optional<PaymentConfig> paymentConfig() {
        return Optional.ofNullable(payment);
    }

    public record YagnaConfig(String subnetTag, String apiUrl, String gsbUrl, String appKey) {
        private static final Set<String> KEYS = Set.of("subnet_tag", "api_url", "gsb_url", "app_key");

        static YagnaConfig load(String owner, Object raw) {
            var fields = DescriptorFields.of(owner, raw, KEYS);
            return new YagnaConfig(
                fields.optionalString("subnet_tag"),
                fields.optionalString("api_url"),
                fields.optionalString("gsb_url"),
                fields.optionalString("app_key")
            );
        }
    }

    public record PaymentConfig(double budget, String driver, String network) {
        private static final Set<String> KEYS = Set.of("budget", "driver", "network");

        static PaymentConfig load(String owner, Object raw) {
            var fields = DescriptorFields.of(owner, raw, KEYS);
            var budget = fields.requireString("budget");
            try {
                return new PaymentConfig(
                    Double.parseDouble(budget),
                    fields.requireString("driver"),
                    fields.requireString("network")
                );
            } catch (NumberFormatException ex) {
                throw new DescriptorValidationException("Invalid budget `" + budget + "` for `" + owner + "`", ex);
            }
        }
    }

    public record LimitsConfig(Optional<Duration> startupTimeout, Optional<Duration> maxRunningTime) {
        private static final Set<String> KEYS = Set.of("startup_timeout", "max_running_time");

        static LimitsConfig load(String owner, Object raw) {
            var fields = DescriptorFields.of(owner, raw, KEYS);
            return new LimitsConfig(
                duration(fields, "startup_timeout"),
                duration(fields, "max_running_time")
            );
        }

        private static Optional<Duration> duration(DescriptorFields fields, String key) {
            try {
                return DurationParser.parse(fields.raw(key));
            } catch (IllegalArgumentException ex) {
                throw new DescriptorValidationException(ex.getMessage() + " for `" + fields.child(key) + "`", ex);
            }
        }
    }

    /**
     * Name of the {@code ComputeProvider} implementation plus its opaque settings.
     */
    public record ProviderConfig(String name, Map<String, Object> params) {
        private static final Set<String> KEYS = Set.of("name", "params");

        static ProviderConfig load(String owner, Object raw) {
            if (raw instanceof String name) {
                return new ProviderConfig(name, Map.of());
            }
            var fields = DescriptorFields.of(owner, raw, KEYS);
            var name = fields.optionalString("name");
            return new ProviderConfig(name == null ? DEFAULT_PROVIDER : name, fields.optionalMap("params"));
        }
    }
}
