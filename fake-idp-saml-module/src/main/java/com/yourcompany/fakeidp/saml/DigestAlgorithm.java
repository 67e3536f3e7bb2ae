package com.yourcompany.fakeidp.saml;

import org.apache.xml.security.algorithms.MessageDigestAlgorithm;
import org.apache.xml.security.signature.XMLSignature;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;

/**
 * Hash algorithms the fake IdP can digest and sign with. Each constant carries the XML-DSig URIs written
 * into {@code DigestMethod} and {@code SignatureMethod} as well as the JCA names used to compute the values.
 */
public enum DigestAlgorithm {

    SHA1("SHA-1", "SHA1withRSA",
            MessageDigestAlgorithm.ALGO_ID_DIGEST_SHA1, XMLSignature.ALGO_ID_SIGNATURE_RSA_SHA1),
    SHA256("SHA-256", "SHA256withRSA",
            MessageDigestAlgorithm.ALGO_ID_DIGEST_SHA256, XMLSignature.ALGO_ID_SIGNATURE_RSA_SHA256),
    SHA384("SHA-384", "SHA384withRSA",
            MessageDigestAlgorithm.ALGO_ID_DIGEST_SHA384, XMLSignature.ALGO_ID_SIGNATURE_RSA_SHA384),
    SHA512("SHA-512", "SHA512withRSA",
            MessageDigestAlgorithm.ALGO_ID_DIGEST_SHA512, XMLSignature.ALGO_ID_SIGNATURE_RSA_SHA512);

    private final String jcaDigestName;
    private final String jcaSignatureName;
    private final String digestMethodUri;
    private final String signatureMethodUri;

    DigestAlgorithm(String jcaDigestName, String jcaSignatureName, String digestMethodUri, String signatureMethodUri) {
        this.jcaDigestName = jcaDigestName;
        this.jcaSignatureName = jcaSignatureName;
        this.digestMethodUri = digestMethodUri;
        this.signatureMethodUri = signatureMethodUri;
    }

    /**
     * Resolves a configured algorithm name such as {@code sha256} or {@code SHA-256}.
     * Unknown names are rejected rather than mapped to a default hash.
     *
     * @param name algorithm name, case-insensitive, dashes ignored
     * @return matching algorithm
     * @throws SamlProcessingException when the name is blank or not supported
     */
    public static DigestAlgorithm fromName(String name) throws SamlProcessingException {
        if (name == null || name.isBlank()) {
            throw new SamlProcessingException("Digest algorithm must not be blank");
        }
        String normalized = name.trim().replace("-", "").toUpperCase(Locale.ROOT);
        for (DigestAlgorithm algorithm : values()) {
            if (algorithm.name().equals(normalized)) {
                return algorithm;
            }
        }
        throw new SamlProcessingException("Unsupported digest algorithm '" + name + "', expected one of sha1, sha256, sha384, sha512");
    }

    /**
     * Hashes the given bytes.
     */
    public byte[] digest(byte[] input) throws SamlProcessingException {
        try {
            return MessageDigest.getInstance(jcaDigestName).digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new SamlProcessingException("Digest algorithm " + jcaDigestName + " is not available", e);
        }
    }

    public String getJcaSignatureName() {
        return jcaSignatureName;
    }

    public String getDigestMethodUri() {
        return digestMethodUri;
    }

    public String getSignatureMethodUri() {
        return signatureMethodUri;
    }
}
