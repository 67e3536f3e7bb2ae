package com.yourcompany.fakeidp.saml;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.time.Instant;

import static com.yourcompany.fakeidp.saml.SamlConstants.DSIG_NS;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResponseSignerTest {

    private final ResponseAssembler assembler = new ResponseAssembler();
    private final ResponseSigner signer = new ResponseSigner();
    private final SamlIdentifiers identifiers = new SamlIdentifiers("_response-1", "_assertion-1");
    private final ResponseTimestamps timestamps = ResponseTimestamps.at(Instant.parse("2026-10-19T12:00:00Z"));

    private TestCredentials credentials;

    @BeforeEach
    void setUp() throws Exception {
        credentials = TestCredentials.get();
    }

    @ParameterizedTest
    @EnumSource(DigestAlgorithm.class)
    void digestMatchesCanonicalAssertionWithoutSignature(DigestAlgorithm algorithm) throws Exception {
        String assembled = assemble(algorithm);

        String digested = signer.applyDigest(assembled, identifiers.assertionId(), algorithm);

        String written = SamlTestSupport.text(SamlUtils.parse(digested), DSIG_NS, "DigestValue");
        assertFalse(written.isEmpty());
        assertEquals(SamlTestSupport.recomputeDigest(digested, algorithm), written);
        assertEquals("", SamlTestSupport.text(SamlUtils.parse(digested), DSIG_NS, "SignatureValue"));
    }

    @ParameterizedTest
    @EnumSource(DigestAlgorithm.class)
    void signatureVerifiesAgainstCanonicalSignedInfo(DigestAlgorithm algorithm) throws Exception {
        String digested = signer.applyDigest(assemble(algorithm), identifiers.assertionId(), algorithm);

        String signed = signer.applySignature(digested, credentials.keyPair().getPrivate(), algorithm);

        String signatureValue = SamlTestSupport.text(SamlUtils.parse(signed), DSIG_NS, "SignatureValue");
        assertFalse(signatureValue.contains("\n"));
        assertTrue(SamlTestSupport.verifySignedInfo(signed, credentials.certificate(), algorithm));
        assertTrue(SamlTestSupport.verifyWithSantuario(SamlUtils.parse(signed), credentials.certificate()));
    }

    @Test
    void digestValueIsIndependentOfSignaturePlaceholderContent() throws Exception {
        String assembled = assemble(DigestAlgorithm.SHA256);
        String digested = signer.applyDigest(assembled, identifiers.assertionId(), DigestAlgorithm.SHA256);
        String signed = signer.applySignature(digested, credentials.keyPair().getPrivate(), DigestAlgorithm.SHA256);

        String before = SamlTestSupport.text(SamlUtils.parse(digested), DSIG_NS, "DigestValue");
        assertEquals(before, SamlTestSupport.recomputeDigest(signed, DigestAlgorithm.SHA256));
    }

    @Test
    void failsWhenAssertionIdDoesNotMatch() throws Exception {
        String assembled = assemble(DigestAlgorithm.SHA256);

        SamlProcessingException e = assertThrows(SamlProcessingException.class,
                () -> signer.applyDigest(assembled, "_unknown", DigestAlgorithm.SHA256));
        assertTrue(e.getMessage().contains("_unknown"));
    }

    @Test
    void failsWhenDigestPlaceholderIsMissing() throws Exception {
        Document document = SamlUtils.parse(assemble(DigestAlgorithm.SHA256));
        Element digestValue = SamlUtils.requireSingleElement(document, DSIG_NS, "DigestValue");
        digestValue.getParentNode().removeChild(digestValue);
        String broken = SamlUtils.serialize(document);

        SamlProcessingException e = assertThrows(SamlProcessingException.class,
                () -> signer.applyDigest(broken, identifiers.assertionId(), DigestAlgorithm.SHA256));
        assertTrue(e.getMessage().contains("DigestValue"));
    }

    @Test
    void failsWhenSignatureValuePlaceholderIsMissing() throws Exception {
        String digested = signer.applyDigest(assemble(DigestAlgorithm.SHA256), identifiers.assertionId(), DigestAlgorithm.SHA256);
        Document document = SamlUtils.parse(digested);
        Element signatureValue = SamlUtils.requireSingleElement(document, DSIG_NS, "SignatureValue");
        signatureValue.getParentNode().removeChild(signatureValue);
        String broken = SamlUtils.serialize(document);

        SamlProcessingException e = assertThrows(SamlProcessingException.class,
                () -> signer.applySignature(broken, credentials.keyPair().getPrivate(), DigestAlgorithm.SHA256));
        assertTrue(e.getMessage().contains("SignatureValue"));
    }

    @Test
    void failsWithoutSigningKey() throws Exception {
        String digested = signer.applyDigest(assemble(DigestAlgorithm.SHA256), identifiers.assertionId(), DigestAlgorithm.SHA256);

        assertThrows(SamlProcessingException.class, () -> signer.applySignature(digested, null, DigestAlgorithm.SHA256));
    }

    private String assemble(DigestAlgorithm algorithm) throws Exception {
        ResponseRequest request = SamlTestSupport.sampleRequest(algorithm).build();
        return assembler.assemble(request, identifiers, timestamps, credentials.certificate());
    }
}
