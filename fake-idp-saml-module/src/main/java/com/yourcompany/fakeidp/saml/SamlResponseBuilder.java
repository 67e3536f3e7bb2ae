package com.yourcompany.fakeidp.saml;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;

/**
 * Produces signed, and optionally encrypted, SAML 2.0 responses for a fake Identity Provider.
 * <p>
 * Typical usage:
 * <pre>{@code
 * ResponseRequest request = ResponseRequest.builder()
 *         .nameId("user@example.com")
 *         .issuerUri("https://idp.example.com")
 *         .acsUrl("https://sp.example.com/acs")
 *         .requestId(requestId)
 *         .userAttribute("email", "user@example.com")
 *         .digestAlgorithm(DigestAlgorithm.SHA256)
 *         .certificate(certificatePem)
 *         .privateKey(privateKeyPem)
 *         .build();
 * String xml = new SamlResponseBuilder().build(request);
 * }</pre>
 * Each call captures its own timestamp and identifiers; instances hold no per-call state and may be shared.
 */
public class SamlResponseBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(SamlResponseBuilder.class);

    private final Clock clock;
    private final ResponseAssembler assembler = new ResponseAssembler();
    private final ResponseSigner signer = new ResponseSigner();
    private final AssertionEncrypter encrypter;

    public SamlResponseBuilder() {
        this(Clock.systemUTC(), new XmlEncryptor());
    }

    public SamlResponseBuilder(Clock clock, Encryptor encryptor) {
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        this.encrypter = new AssertionEncrypter(encryptor);
    }

    /**
     * Runs assemble, digest, sign and, when enabled, encrypt.
     *
     * @param request response input
     * @return serialized {@code samlp:Response}
     * @throws SamlProcessingException when the credentials are unusable or any stage fails
     */
    public String build(ResponseRequest request) throws SamlProcessingException {
        Objects.requireNonNull(request, "ResponseRequest must not be null");
        validateText(request);
        X509Certificate certificate = SamlCredentials.loadCertificate(request.getCertificate());
        PrivateKey privateKey = SamlCredentials.loadPrivateKey(request.getPrivateKey());

        ResponseTimestamps timestamps = ResponseTimestamps.capture(clock);
        SamlIdentifiers identifiers = SamlIdentifiers.generate();
        LOGGER.info("Building SAML response {} in response to {} for {}",
                identifiers.responseId(), request.getRequestId(), request.getAcsUrl());

        String document = assembler.assemble(request, identifiers, timestamps, certificate);
        document = signer.applyDigest(document, identifiers.assertionId(), request.getDigestAlgorithm());
        document = signer.applySignature(document, privateKey, request.getDigestAlgorithm());
        if (request.isEncryptionEnabled()) {
            document = encrypter.encrypt(document, certificate);
        }
        return document;
    }

    private static void validateText(ResponseRequest request) throws SamlProcessingException {
        requireXmlText("NameID", request.getNameId());
        requireXmlText("Issuer", request.getIssuerUri());
        requireXmlText("ACS URL", request.getAcsUrl());
        requireXmlText("Request ID", request.getRequestId());
        for (Map.Entry<String, String> attribute : request.getUserAttributes().entrySet()) {
            if (attribute.getKey().isBlank()) {
                throw new SamlProcessingException("Attribute name must not be blank");
            }
            requireXmlText("Attribute name '" + attribute.getKey() + "'", attribute.getKey());
            requireXmlText("Attribute '" + attribute.getKey() + "' value", attribute.getValue());
        }
    }

    private static void requireXmlText(String field, String value) throws SamlProcessingException {
        if (!SamlUtils.isXmlText(value)) {
            throw new SamlProcessingException(field + " contains characters not allowed in XML");
        }
    }
}
