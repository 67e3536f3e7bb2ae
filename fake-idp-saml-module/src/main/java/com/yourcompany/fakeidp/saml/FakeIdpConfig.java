package com.yourcompany.fakeidp.saml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration holder for the fake Identity Provider.
 * <p>
 * Values are resolved using the following precedence:
 * <ol>
 *     <li>Options provided by the caller (for example the init parameters of a deployment).</li>
 *     <li>Fallback to JVM system properties, which is convenient when starting the IdP inside an integration test.</li>
 * </ol>
 * The class performs light validation and turns itself into a {@link ResponseRequest} for each incoming request.
 */
public final class FakeIdpConfig {

    private final String callbackUrl;
    private final String issuer;
    private final String nameId;
    private final Path certificatePath;
    private final Path privateKeyPath;
    private final DigestAlgorithm algorithm;
    private final Map<String, String> attributes;
    private final boolean encryptionEnabled;

    private FakeIdpConfig(
            String callbackUrl,
            String issuer,
            String nameId,
            Path certificatePath,
            Path privateKeyPath,
            DigestAlgorithm algorithm,
            Map<String, String> attributes,
            boolean encryptionEnabled) {
        this.callbackUrl = Objects.requireNonNull(callbackUrl, "Callback URL is required");
        this.issuer = Objects.requireNonNull(issuer, "Issuer is required");
        this.nameId = Objects.requireNonNull(nameId, "NameID is required");
        this.certificatePath = Objects.requireNonNull(certificatePath, "Certificate path is required");
        this.privateKeyPath = Objects.requireNonNull(privateKeyPath, "Private key path is required");
        this.algorithm = Objects.requireNonNull(algorithm, "Algorithm is required");
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.encryptionEnabled = encryptionEnabled;
    }

    /**
     * Factory that reads configuration keys from the provided options and system properties.
     * Supported keys:
     * <ul>
     *     <li>{@code callback-url}</li>
     *     <li>{@code issuer}</li>
     *     <li>{@code name-id}</li>
     *     <li>{@code certificate-path}</li>
     *     <li>{@code private-key-path}</li>
     *     <li>{@code algorithm} (sha1, sha256, sha384 or sha512; defaults to sha256)</li>
     *     <li>{@code attributes} (comma separated {@code name=value} pairs)</li>
     *     <li>{@code encryption-enabled} (defaults to false)</li>
     * </ul>
     *
     * @param options map of options, may be {@code null}
     * @return resolved configuration instance
     * @throws SamlProcessingException when the configured algorithm is not supported
     */
    public static FakeIdpConfig from(Map<String, ?> options) throws SamlProcessingException {
        Map<String, ?> resolved = options == null ? Collections.emptyMap() : options;

        String callbackUrl = readOption("callback-url", resolved)
                .orElseThrow(() -> new IllegalArgumentException("Missing callback-url"));
        String issuer = readOption("issuer", resolved)
                .orElseThrow(() -> new IllegalArgumentException("Missing issuer"));
        String nameId = readOption("name-id", resolved)
                .orElseThrow(() -> new IllegalArgumentException("Missing name-id"));
        Path certificatePath = Path.of(readOption("certificate-path", resolved)
                .orElseThrow(() -> new IllegalArgumentException("Missing certificate-path")));
        Path privateKeyPath = Path.of(readOption("private-key-path", resolved)
                .orElseThrow(() -> new IllegalArgumentException("Missing private-key-path")));
        DigestAlgorithm algorithm = DigestAlgorithm.fromName(readOption("algorithm", resolved).orElse("sha256"));
        Map<String, String> attributes = readOption("attributes", resolved)
                .map(FakeIdpConfig::splitAttributes)
                .orElseGet(Map::of);
        boolean encryptionEnabled = readOption("encryption-enabled", resolved)
                .map(Boolean::parseBoolean)
                .orElse(false);

        return new FakeIdpConfig(
                callbackUrl,
                issuer,
                nameId,
                certificatePath,
                privateKeyPath,
                algorithm,
                attributes,
                encryptionEnabled);
    }

    private static Map<String, String> splitAttributes(String value) {
        Map<String, String> result = new LinkedHashMap<>();
        for (String token : value.split(",")) {
            String trimmed = token.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int separator = trimmed.indexOf('=');
            if (separator <= 0) {
                throw new IllegalArgumentException("Attribute '" + trimmed + "' must be written as name=value");
            }
            result.put(trimmed.substring(0, separator).trim(), trimmed.substring(separator + 1).trim());
        }
        return result;
    }

    private static Optional<String> readOption(String key, Map<String, ?> options) {
        if (options != null && options.containsKey(key)) {
            Object value = options.get(key);
            if (value != null) {
                String asString = String.valueOf(value).trim();
                if (!asString.isEmpty()) {
                    return Optional.of(asString);
                }
            }
        }
        String sysValue = System.getProperty(key);
        if (sysValue != null && !sysValue.isBlank()) {
            return Optional.of(sysValue.trim());
        }
        return Optional.empty();
    }

    /**
     * Builds the response input answering the given request, reading certificate and key from disk.
     *
     * @param requestId ID of the {@code AuthnRequest} being answered
     * @return response input
     * @throws SamlProcessingException when a credential file cannot be read
     */
    public ResponseRequest toResponseRequest(String requestId) throws SamlProcessingException {
        return ResponseRequest.builder()
                .nameId(nameId)
                .issuerUri(issuer)
                .acsUrl(callbackUrl)
                .requestId(requestId)
                .userAttributes(attributes)
                .digestAlgorithm(algorithm)
                .certificate(read(certificatePath, "certificate"))
                .privateKey(read(privateKeyPath, "private key"))
                .encryptionEnabled(encryptionEnabled)
                .build();
    }

    private static byte[] read(Path path, String description) throws SamlProcessingException {
        try {
            return Files.readAllBytes(path);
        } catch (IOException e) {
            throw new SamlProcessingException("Unable to read " + description + " from " + path, e);
        }
    }

    /**
     * Convenience check to ensure the configured files are reachable, useful when validating a test setup at boot time.
     *
     * @return list of human readable warnings; empty when everything looks valid
     */
    public List<String> validatePaths() {
        List<String> warnings = new ArrayList<>();
        if (!Files.exists(certificatePath)) {
            warnings.add("Certificate not found at " + certificatePath);
        }
        if (!Files.exists(privateKeyPath)) {
            warnings.add("Private key not found at " + privateKeyPath);
        }
        return warnings;
    }

    public String getCallbackUrl() {
        return callbackUrl;
    }

    public String getIssuer() {
        return issuer;
    }

    public String getNameId() {
        return nameId;
    }

    public Path getCertificatePath() {
        return certificatePath;
    }

    public Path getPrivateKeyPath() {
        return privateKeyPath;
    }

    public DigestAlgorithm getAlgorithm() {
        return algorithm;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    public boolean isEncryptionEnabled() {
        return encryptionEnabled;
    }

    @Override
    public String toString() {
        return "FakeIdpConfig{" +
                "callbackUrl='" + callbackUrl + '\'' +
                ", issuer='" + issuer + '\'' +
                ", nameId='" + nameId + '\'' +
                ", certificatePath=" + certificatePath +
                ", privateKeyPath=" + privateKeyPath +
                ", algorithm=" + algorithm +
                ", attributes=" + attributes.keySet() +
                ", encryptionEnabled=" + encryptionEnabled +
                '}';
    }
}
