package io.dapprunner.descriptor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.Signature;
import java.security.cert.CertificateExpiredException;
import java.security.cert.CertificateFactory;
import java.security.cert.CertificateNotYetValidException;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks the manifest, certificate and signature carried by {@code vm/manifest} payloads.
 */
public final class ManifestVerifier {
    private static final Logger LOG = LoggerFactory.getLogger(ManifestVerifier.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    private final Clock clock;

    public ManifestVerifier() {
        this(Clock.systemUTC());
    }

    public ManifestVerifier(Clock clock) {
        this.clock = clock;
    }

    public void verifyAll(DappDescriptor dapp) {
        dapp.payloads().forEach((name, payload) -> {
            if (payload.isManifest()) {
                verify(name, payload);
            }
        });
    }

    public void verify(String payloadName, PayloadDescriptor payload) {
        var params = payload.params();
        var manifest = readManifest(payloadName, params);
        if (params.get("node_descriptor_path") != null) {
            readJsonFile(payloadName, String.valueOf(params.get("node_descriptor_path")));
            if (manifest == null) {
                throw invalid(payloadName, "node_descriptor requires a manifest to be present");
            }
            return;
        }
        if (manifest == null) {
            return;
        }

        var now = clock.instant();
        if (timestamp(payloadName, manifest, "createdAt").isAfter(now)) {
            throw invalid(payloadName, "Manifest creation date is set to future.");
        }
        if (timestamp(payloadName, manifest, "expiresAt").isBefore(now)) {
            throw invalid(payloadName, "Manifest already expired.");
        }

        var certificates = readCertificates(payloadName, params);
        var signature = params.get("manifest_sig") == null ? "" : String.valueOf(params.get("manifest_sig"));
        if (!certificates.isEmpty()) {
            checkValidity(payloadName, certificates.get(0), now);
            if (signature.isEmpty()) {
                LOG.warn("`{}`: Manifest certificate provided but no signature present.", payloadName);
            }
        }
        if (!signature.isEmpty()) {
            if (certificates.isEmpty()) {
                throw invalid(payloadName, "Manifest signature present but no certificate to verify it.");
            }
            verifySignature(payloadName, params, certificates.get(certificates.size() - 1), signature);
        }
    }

    private JsonNode readManifest(String payloadName, Map<String, Object> params) {
        if (params.get("manifest") != null) {
            var content = params.get("manifest");
            if (content instanceof Map<?, ?>) {
                return JSON.valueToTree(content);
            }
            var text = String.valueOf(content);
            try {
                return JSON.readTree(Base64.getDecoder().decode(text.trim()));
            } catch (IllegalArgumentException | IOException notBase64) {
                try {
                    return JSON.readTree(text);
                } catch (IOException ex) {
                    throw invalid(payloadName, "Manifest content is neither valid base64 nor valid JSON");
                }
            }
        }
        if (params.get("manifest_path") != null) {
            return readJsonFile(payloadName, String.valueOf(params.get("manifest_path")));
        }
        return null;
    }

    private JsonNode readJsonFile(String payloadName, String path) {
        try {
            return JSON.readTree(Files.readString(Path.of(path)));
        } catch (IOException ex) {
            throw new DescriptorValidationException("`" + payloadName + "`: Cannot read `" + path + "`", ex);
        }
    }

    private List<X509Certificate> readCertificates(String payloadName, Map<String, Object> params) {
        String encoded;
        try {
            if (params.get("manifest_cert") != null) {
                encoded = String.valueOf(params.get("manifest_cert"));
            } else if (params.get("manifest_cert_path") != null) {
                encoded = Files.readString(Path.of(String.valueOf(params.get("manifest_cert_path"))));
            } else {
                return List.of();
            }
            var pem = Base64.getMimeDecoder().decode(encoded.trim());
            var factory = CertificateFactory.getInstance("X.509");
            var certificates = new ArrayList<X509Certificate>();
            for (var certificate : factory.generateCertificates(new ByteArrayInputStream(pem))) {
                certificates.add((X509Certificate) certificate);
            }
            if (certificates.isEmpty()) {
                throw invalid(payloadName, "Invalid manifest certificate.");
            }
            return certificates;
        } catch (IOException | GeneralSecurityException | IllegalArgumentException ex) {
            throw new DescriptorValidationException("`" + payloadName + "`: Invalid manifest certificate.", ex);
        }
    }

    private void checkValidity(String payloadName, X509Certificate certificate, Instant now) {
        try {
            certificate.checkValidity(Date.from(now));
        } catch (CertificateNotYetValidException ex) {
            throw invalid(payloadName, "Manifest certificate is not yet valid (not valid before: "
                + certificate.getNotBefore().toInstant() + ").");
        } catch (CertificateExpiredException ex) {
            throw invalid(payloadName, "Manifest certificate is no longer valid (not valid after: "
                + certificate.getNotAfter().toInstant() + ").");
        }
    }

    private void verifySignature(
        String payloadName,
        Map<String, Object> params,
        X509Certificate certificate,
        String signature
    ) {
        var algorithm = String.valueOf(params.getOrDefault("manifest_sig_algorithm", "sha256"));
        try {
            var verifier = Signature.getInstance(jcaAlgorithm(algorithm, certificate.getPublicKey().getAlgorithm()));
            verifier.initVerify(certificate);
            verifier.update(String.valueOf(params.getOrDefault("manifest", "")).getBytes(StandardCharsets.UTF_8));
            if (!verifier.verify(Base64.getDecoder().decode(signature.trim()))) {
                throw invalid(payloadName, "Manifest signature verification failed.");
            }
        } catch (GeneralSecurityException | IllegalArgumentException ex) {
            throw new DescriptorValidationException("`" + payloadName + "`: Manifest signature verification failed.", ex);
        }
    }

    static String jcaAlgorithm(String digest, String keyAlgorithm) {
        if (digest.toLowerCase(Locale.ROOT).contains("with")) {
            return digest;
        }
        var hash = digest.toUpperCase(Locale.ROOT).replace("-", "");
        var key = "EC".equals(keyAlgorithm) ? "ECDSA" : keyAlgorithm;
        return hash + "with" + key;
    }

    private static Instant timestamp(String payloadName, JsonNode manifest, String field) {
        var value = manifest.path(field);
        if (!value.isTextual()) {
            throw invalid(payloadName, "Manifest is missing `" + field + "`.");
        }
        var text = value.asText();
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException noOffset) {
            try {
                return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException ex) {
                throw invalid(payloadName, "Invalid manifest `" + field + "`: " + text);
            }
        }
    }

    private static DescriptorValidationException invalid(String payloadName, String message) {
        return new DescriptorValidationException("`" + payloadName + "`: " + message);
    }
}
