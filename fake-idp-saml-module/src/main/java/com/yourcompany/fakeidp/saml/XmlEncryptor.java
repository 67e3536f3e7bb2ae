package com.yourcompany.fakeidp.saml;

import org.apache.xml.security.encryption.EncryptedData;
import org.apache.xml.security.encryption.EncryptedKey;
import org.apache.xml.security.encryption.XMLCipher;
import org.apache.xml.security.keys.KeyInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import javax.xml.XMLConstants;
import java.security.cert.X509Certificate;

import static com.yourcompany.fakeidp.saml.SamlConstants.ASSERTION_NS;
import static com.yourcompany.fakeidp.saml.SamlConstants.ASSERTION_PREFIX;

/**
 * {@link Encryptor} producing a W3C XML Encryption {@code EncryptedAssertion}: the assertion is encrypted with a
 * fresh AES-256-CBC key which is itself wrapped with RSA-OAEP for the certificate and carried inline in
 * {@code KeyInfo}.
 */
public class XmlEncryptor implements Encryptor {

    private static final Logger LOGGER = LoggerFactory.getLogger(XmlEncryptor.class);
    private static final int CONTENT_KEY_SIZE = 256;

    @Override
    public String encrypt(String assertionXml, X509Certificate certificate) throws SamlProcessingException {
        SamlUtils.initializeXmlSecurity();
        Document source = SamlUtils.parse(assertionXml);

        Document document = SamlUtils.newDocument();
        Element encryptedAssertion = document.createElementNS(ASSERTION_NS, ASSERTION_PREFIX + ":EncryptedAssertion");
        encryptedAssertion.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI,
                XMLConstants.XMLNS_ATTRIBUTE + ":" + ASSERTION_PREFIX, ASSERTION_NS);
        document.appendChild(encryptedAssertion);
        Node assertion = document.importNode(source.getDocumentElement(), true);
        encryptedAssertion.appendChild(assertion);

        try {
            KeyGenerator keyGenerator = KeyGenerator.getInstance("AES");
            keyGenerator.init(CONTENT_KEY_SIZE);
            SecretKey contentKey = keyGenerator.generateKey();

            XMLCipher keyCipher = XMLCipher.getInstance(XMLCipher.RSA_OAEP);
            keyCipher.init(XMLCipher.WRAP_MODE, certificate.getPublicKey());
            EncryptedKey encryptedKey = keyCipher.encryptKey(document, contentKey);

            XMLCipher dataCipher = XMLCipher.getInstance(XMLCipher.AES_256);
            dataCipher.init(XMLCipher.ENCRYPT_MODE, contentKey);
            EncryptedData encryptedData = dataCipher.getEncryptedData();
            KeyInfo keyInfo = new KeyInfo(document);
            keyInfo.add(encryptedKey);
            encryptedData.setKeyInfo(keyInfo);

            dataCipher.doFinal(document, (Element) assertion, false);
        } catch (Exception e) {
            // XMLCipher.doFinal declares a bare Exception.
            throw new SamlProcessingException("Unable to encrypt assertion", e);
        }
        LOGGER.debug("Encrypted assertion for {}", certificate.getSubjectX500Principal().getName());
        return SamlUtils.serializeElement(encryptedAssertion);
    }
}
