package com.yourcompany.fakeidp.saml;

import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.openssl.PEMException;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringReader;
import java.security.PrivateKey;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.security.interfaces.RSAPrivateKey;

import static java.nio.charset.StandardCharsets.US_ASCII;

/**
 * Parses the signing certificate and private key handed to the fake IdP as raw bytes.
 * Both PEM and DER encodings are accepted; keys may be PKCS#1 ({@code RSA PRIVATE KEY}) or PKCS#8.
 */
public final class SamlCredentials {

    private static final String PEM_BOUNDARY = "-----BEGIN";

    private SamlCredentials() {
        // Utility class
    }

    /**
     * @param certificate PEM or DER encoded X.509 certificate
     * @return parsed certificate
     * @throws SamlProcessingException when the bytes do not hold a certificate
     */
    public static X509Certificate loadCertificate(byte[] certificate) throws SamlProcessingException {
        if (certificate == null || certificate.length == 0) {
            throw new SamlProcessingException("Certificate is missing");
        }
        try {
            CertificateFactory factory = CertificateFactory.getInstance("X.509");
            return (X509Certificate) factory.generateCertificate(new ByteArrayInputStream(certificate));
        } catch (CertificateException e) {
            throw new SamlProcessingException("Unable to parse X.509 certificate", e);
        }
    }

    /**
     * @param privateKey PEM (PKCS#1 or PKCS#8) or DER (PKCS#8) encoded RSA private key
     * @return parsed RSA key
     * @throws SamlProcessingException when the key is missing, malformed, encrypted or not an RSA key
     */
    public static PrivateKey loadPrivateKey(byte[] privateKey) throws SamlProcessingException {
        if (privateKey == null || privateKey.length == 0) {
            throw new SamlProcessingException("Private key is missing");
        }
        PrivateKey key;
        try {
            JcaPEMKeyConverter converter = new JcaPEMKeyConverter();
            String text = new String(privateKey, US_ASCII);
            if (text.contains(PEM_BOUNDARY)) {
                key = readPem(text, converter);
            } else {
                key = converter.getPrivateKey(PrivateKeyInfo.getInstance(privateKey));
            }
        } catch (PEMException | IllegalArgumentException | IllegalStateException e) {
            throw new SamlProcessingException("Unable to parse private key: " + e.getMessage(), e);
        }
        if (!(key instanceof RSAPrivateKey)) {
            throw new SamlProcessingException("Private key must be an RSA key but was " + key.getAlgorithm());
        }
        return key;
    }

    private static PrivateKey readPem(String pem, JcaPEMKeyConverter converter) throws SamlProcessingException, PEMException {
        Object object;
        try (PEMParser parser = new PEMParser(new StringReader(pem))) {
            object = parser.readObject();
        } catch (IOException e) {
            throw new SamlProcessingException("Unable to read PEM private key", e);
        }
        if (object instanceof PEMKeyPair) {
            return converter.getKeyPair((PEMKeyPair) object).getPrivate();
        }
        if (object instanceof PrivateKeyInfo) {
            return converter.getPrivateKey((PrivateKeyInfo) object);
        }
        throw new SamlProcessingException("PEM input does not hold an unencrypted private key"
                + (object == null ? "" : " but " + object.getClass().getSimpleName()));
    }
}
