package com.yourcompany.fakeidp.saml;

import java.security.cert.X509Certificate;

/**
 * Encrypts a serialized assertion for the holder of a certificate.
 */
@FunctionalInterface
public interface Encryptor {

    /**
     * @param assertionXml serialized {@code saml:Assertion} element
     * @param certificate  certificate whose public key protects the content encryption key
     * @return serialized {@code saml:EncryptedAssertion} fragment that replaces the assertion
     * @throws SamlProcessingException when encryption fails
     */
    String encrypt(String assertionXml, X509Certificate certificate) throws SamlProcessingException;
}
