package com.yourcompany.fakeidp.saml;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.Signature;
import java.util.Base64;
import java.util.List;

import static com.yourcompany.fakeidp.saml.SamlConstants.DSIG_NS;

/**
 * Second and third pipeline stages: fills the {@code DigestValue} and then the {@code SignatureValue}
 * placeholders written by {@link ResponseAssembler}.
 * <p>
 * Both methods take a serialized document and return a new serialized document; the input is parsed twice so the
 * copy that is measured is never the copy that is written to.
 */
public class ResponseSigner {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResponseSigner.class);

    /**
     * Computes the digest of the assertion, as covered by the enveloped-signature and exclusive canonicalization
     * transforms, and writes it into {@code DigestValue}.
     *
     * @param document    assembled response with an empty {@code DigestValue}
     * @param assertionId ID of the signed assertion
     * @param algorithm   digest algorithm announced in {@code DigestMethod}
     * @return serialized response carrying the digest
     * @throws SamlProcessingException when a required node is missing or canonicalization fails
     */
    public String applyDigest(String document, String assertionId, DigestAlgorithm algorithm)
            throws SamlProcessingException {
        Document working = SamlUtils.parse(document);
        // A signature never covers itself.
        Element signature = SamlUtils.requireSingleElement(working, DSIG_NS, "Signature");
        signature.getParentNode().removeChild(signature);

        Element assertion = SamlUtils.requireElementById(working, assertionId);
        byte[] canonical = SamlUtils.canonicalize(assertion);
        String digestValue = Base64.getEncoder().encodeToString(algorithm.digest(canonical)).strip();

        Document target = SamlUtils.parse(document);
        SamlUtils.requireSingleElement(target, DSIG_NS, "DigestValue").setTextContent(digestValue);
        LOGGER.debug("Computed {} digest of assertion {}", algorithm, assertionId);
        return SamlUtils.serialize(target);
    }

    /**
     * Signs the canonical {@code SignedInfo} and writes the result into {@code SignatureValue}.
     *
     * @param document   response whose {@code DigestValue} is already filled
     * @param privateKey RSA signing key
     * @param algorithm  hash announced in {@code SignatureMethod}
     * @return serialized signed response
     * @throws SamlProcessingException when a required node is missing or signing fails
     */
    public String applySignature(String document, PrivateKey privateKey, DigestAlgorithm algorithm)
            throws SamlProcessingException {
        Document working = SamlUtils.parse(document);
        Element signature = SamlUtils.requireSingleElement(working, DSIG_NS, "Signature");
        List<Element> signedInfo = SamlUtils.childElements(signature, DSIG_NS, "SignedInfo");
        if (signedInfo.size() != 1) {
            throw new SamlProcessingException("Expected a single SignedInfo in Signature but found " + signedInfo.size());
        }
        byte[] canonical = SamlUtils.canonicalize(signedInfo.get(0));
        String signatureValue = Base64.getEncoder().encodeToString(sign(canonical, privateKey, algorithm));

        Document target = SamlUtils.parse(document);
        SamlUtils.requireSingleElement(target, DSIG_NS, "SignatureValue").setTextContent(signatureValue);
        LOGGER.debug("Computed {} signature over SignedInfo", algorithm.getJcaSignatureName());
        return SamlUtils.serialize(target);
    }

    private static byte[] sign(byte[] data, PrivateKey privateKey, DigestAlgorithm algorithm)
            throws SamlProcessingException {
        if (privateKey == null) {
            throw new SamlProcessingException("Signing key is missing");
        }
        try {
            Signature signer = Signature.getInstance(algorithm.getJcaSignatureName());
            signer.initSign(privateKey);
            signer.update(data);
            return signer.sign();
        } catch (GeneralSecurityException e) {
            throw new SamlProcessingException("Unable to sign SignedInfo with " + algorithm.getJcaSignatureName(), e);
        }
    }
}
