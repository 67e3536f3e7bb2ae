package com.yourcompany.fakeidp.saml;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable input of a single {@link SamlResponseBuilder#build(ResponseRequest)} call.
 * <p>
 * User attributes keep the insertion order of the map they were copied from, so the produced
 * {@code AttributeStatement} is deterministic. Certificate and key are kept as raw PEM or DER bytes and are only
 * parsed when the response is built.
 */
public final class ResponseRequest {

    private final String nameId;
    private final String issuerUri;
    private final String acsUrl;
    private final String requestId;
    private final Map<String, String> userAttributes;
    private final DigestAlgorithm digestAlgorithm;
    private final byte[] certificate;
    private final byte[] privateKey;
    private final boolean encryptionEnabled;

    private ResponseRequest(Builder builder) {
        this.nameId = Objects.requireNonNull(builder.nameId, "NameID is required");
        this.issuerUri = Objects.requireNonNull(builder.issuerUri, "Issuer URI is required");
        this.acsUrl = Objects.requireNonNull(builder.acsUrl, "ACS URL is required");
        this.requestId = Objects.requireNonNull(builder.requestId, "Request ID is required");
        this.digestAlgorithm = Objects.requireNonNull(builder.digestAlgorithm, "Digest algorithm is required");
        this.certificate = Objects.requireNonNull(builder.certificate, "Certificate is required").clone();
        this.privateKey = Objects.requireNonNull(builder.privateKey, "Private key is required").clone();
        this.userAttributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.userAttributes));
        this.encryptionEnabled = builder.encryptionEnabled;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getNameId() {
        return nameId;
    }

    public String getIssuerUri() {
        return issuerUri;
    }

    public String getAcsUrl() {
        return acsUrl;
    }

    public String getRequestId() {
        return requestId;
    }

    public Map<String, String> getUserAttributes() {
        return userAttributes;
    }

    public DigestAlgorithm getDigestAlgorithm() {
        return digestAlgorithm;
    }

    public byte[] getCertificate() {
        return certificate.clone();
    }

    public byte[] getPrivateKey() {
        return privateKey.clone();
    }

    public boolean isEncryptionEnabled() {
        return encryptionEnabled;
    }

    @Override
    public String toString() {
        return "ResponseRequest{" +
                "nameId='" + nameId + '\'' +
                ", issuerUri='" + issuerUri + '\'' +
                ", acsUrl='" + acsUrl + '\'' +
                ", requestId='" + requestId + '\'' +
                ", userAttributes=" + userAttributes.keySet() +
                ", digestAlgorithm=" + digestAlgorithm +
                ", encryptionEnabled=" + encryptionEnabled +
                '}';
    }

    /**
     * Mutable builder; {@link #build()} validates that every required field is present.
     */
    public static final class Builder {
        private String nameId;
        private String issuerUri;
        private String acsUrl;
        private String requestId;
        private final Map<String, String> userAttributes = new LinkedHashMap<>();
        private DigestAlgorithm digestAlgorithm = DigestAlgorithm.SHA256;
        private byte[] certificate;
        private byte[] privateKey;
        private boolean encryptionEnabled;

        private Builder() {
        }

        public Builder nameId(String nameId) {
            this.nameId = nameId;
            return this;
        }

        public Builder issuerUri(String issuerUri) {
            this.issuerUri = issuerUri;
            return this;
        }

        public Builder acsUrl(String acsUrl) {
            this.acsUrl = acsUrl;
            return this;
        }

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder userAttribute(String name, String value) {
            this.userAttributes.put(Objects.requireNonNull(name, "Attribute name is required"),
                    Objects.requireNonNull(value, "Attribute value is required"));
            return this;
        }

        public Builder userAttributes(Map<String, String> attributes) {
            attributes.forEach(this::userAttribute);
            return this;
        }

        public Builder digestAlgorithm(DigestAlgorithm digestAlgorithm) {
            this.digestAlgorithm = digestAlgorithm;
            return this;
        }

        public Builder certificate(byte[] certificate) {
            this.certificate = certificate;
            return this;
        }

        public Builder privateKey(byte[] privateKey) {
            this.privateKey = privateKey;
            return this;
        }

        public Builder encryptionEnabled(boolean encryptionEnabled) {
            this.encryptionEnabled = encryptionEnabled;
            return this;
        }

        public ResponseRequest build() {
            return new ResponseRequest(this);
        }
    }
}
