package com.yourcompany.fakeidp.saml;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.security.cert.X509Certificate;
import java.util.Objects;

import static com.yourcompany.fakeidp.saml.SamlConstants.ASSERTION_NS;

/**
 * Last, optional pipeline stage: swaps the signed {@code saml:Assertion} for the fragment returned by an
 * {@link Encryptor}.
 */
public class AssertionEncrypter {

    private static final Logger LOGGER = LoggerFactory.getLogger(AssertionEncrypter.class);

    private final Encryptor encryptor;

    public AssertionEncrypter(Encryptor encryptor) {
        this.encryptor = Objects.requireNonNull(encryptor, "Encryptor must not be null");
    }

    /**
     * @param document    fully signed response
     * @param certificate certificate handed to the encryptor
     * @return serialized response whose assertion is replaced by the encrypted fragment
     * @throws SamlProcessingException when the assertion is missing, the fragment is not well-formed, or the
     *                                 encryptor fails (its exception is propagated as thrown)
     */
    public String encrypt(String document, X509Certificate certificate) throws SamlProcessingException {
        Document source = SamlUtils.parse(document);
        Element assertion = SamlUtils.requireSingleElement(source, ASSERTION_NS, "Assertion");
        String fragment = encryptor.encrypt(SamlUtils.serializeElement(assertion), certificate);
        if (fragment == null || fragment.isBlank()) {
            throw new SamlProcessingException("Encryptor returned no encrypted assertion");
        }

        Document target = SamlUtils.parse(document);
        Element targetAssertion = SamlUtils.requireSingleElement(target, ASSERTION_NS, "Assertion");
        Node replacement = target.importNode(SamlUtils.parse(fragment).getDocumentElement(), true);
        targetAssertion.getParentNode().replaceChild(replacement, targetAssertion);
        LOGGER.debug("Replaced assertion with {}", replacement.getLocalName());
        return SamlUtils.serialize(target);
    }
}
