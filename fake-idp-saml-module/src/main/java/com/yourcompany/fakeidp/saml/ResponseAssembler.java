package com.yourcompany.fakeidp.saml;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import javax.xml.XMLConstants;
import java.security.cert.CertificateEncodingException;
import java.security.cert.X509Certificate;
import java.util.Base64;
import java.util.Map;

import static com.yourcompany.fakeidp.saml.SamlConstants.ASSERTION_NS;
import static com.yourcompany.fakeidp.saml.SamlConstants.ASSERTION_PREFIX;
import static com.yourcompany.fakeidp.saml.SamlConstants.DSIG_NS;
import static com.yourcompany.fakeidp.saml.SamlConstants.DSIG_PREFIX;
import static com.yourcompany.fakeidp.saml.SamlConstants.PROTOCOL_NS;
import static com.yourcompany.fakeidp.saml.SamlConstants.PROTOCOL_PREFIX;

/**
 * First pipeline stage: writes the complete {@code samlp:Response} tree with an unsigned signature skeleton.
 * <p>
 * Child order follows the SAML 2.0 schema. {@code DigestValue} and {@code SignatureValue} are left empty and
 * are filled later by {@link ResponseSigner}.
 */
public class ResponseAssembler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResponseAssembler.class);

    /**
     * @param request     response input
     * @param identifiers IDs of the response and its assertion
     * @param timestamps  validity window of the response
     * @param certificate signing certificate embedded in {@code KeyInfo}
     * @return serialized response document
     * @throws SamlProcessingException when the DOM cannot be created or the certificate cannot be encoded
     */
    public String assemble(ResponseRequest request, SamlIdentifiers identifiers, ResponseTimestamps timestamps,
                           X509Certificate certificate) throws SamlProcessingException {
        Document document = SamlUtils.newDocument();
        String issueInstant = ResponseTimestamps.format(timestamps.getIssueInstant());

        Element response = append(document, PROTOCOL_NS, PROTOCOL_PREFIX, "Response");
        declareNamespace(response, PROTOCOL_PREFIX, PROTOCOL_NS);
        response.setAttributeNS(null, "Consent", SamlConstants.CONSENT_UNSPECIFIED);
        response.setAttributeNS(null, "Destination", request.getAcsUrl());
        response.setAttributeNS(null, "ID", identifiers.responseId());
        response.setAttributeNS(null, "InResponseTo", request.getRequestId());
        response.setAttributeNS(null, "IssueInstant", issueInstant);
        response.setAttributeNS(null, "Version", SamlConstants.SAML_VERSION);

        Element issuer = append(response, ASSERTION_NS, ASSERTION_PREFIX, "Issuer");
        declareNamespace(issuer, ASSERTION_PREFIX, ASSERTION_NS);
        issuer.setTextContent(request.getIssuerUri());

        Element status = append(response, PROTOCOL_NS, PROTOCOL_PREFIX, "Status");
        append(status, PROTOCOL_NS, PROTOCOL_PREFIX, "StatusCode")
                .setAttributeNS(null, "Value", SamlConstants.STATUS_SUCCESS);

        appendAssertion(response, request, identifiers, timestamps, issueInstant, certificate);

        LOGGER.debug("Assembled response {} for destination {}", identifiers.responseId(), request.getAcsUrl());
        return SamlUtils.serialize(document);
    }

    private void appendAssertion(Element response, ResponseRequest request, SamlIdentifiers identifiers,
                                 ResponseTimestamps timestamps, String issueInstant, X509Certificate certificate)
            throws SamlProcessingException {
        Element assertion = append(response, ASSERTION_NS, ASSERTION_PREFIX, "Assertion");
        declareNamespace(assertion, ASSERTION_PREFIX, ASSERTION_NS);
        assertion.setAttributeNS(null, "ID", identifiers.assertionId());
        assertion.setAttributeNS(null, "IssueInstant", issueInstant);
        assertion.setAttributeNS(null, "Version", SamlConstants.SAML_VERSION);

        Element issuer = append(assertion, ASSERTION_NS, ASSERTION_PREFIX, "Issuer");
        issuer.setAttributeNS(null, "Format", SamlConstants.ENTITY_FORMAT);
        issuer.setTextContent(request.getIssuerUri());

        appendSignatureSkeleton(assertion, request.getDigestAlgorithm(), identifiers, certificate);

        Element subject = append(assertion, ASSERTION_NS, ASSERTION_PREFIX, "Subject");
        Element nameId = append(subject, ASSERTION_NS, ASSERTION_PREFIX, "NameID");
        nameId.setAttributeNS(null, "Format", SamlConstants.EMAIL_ADDRESS_FORMAT);
        nameId.setTextContent(request.getNameId());
        Element confirmation = append(subject, ASSERTION_NS, ASSERTION_PREFIX, "SubjectConfirmation");
        confirmation.setAttributeNS(null, "Method", SamlConstants.BEARER_METHOD);
        Element confirmationData = append(confirmation, ASSERTION_NS, ASSERTION_PREFIX, "SubjectConfirmationData");
        confirmationData.setAttributeNS(null, "InResponseTo", request.getRequestId());
        confirmationData.setAttributeNS(null, "NotOnOrAfter",
                ResponseTimestamps.format(timestamps.getSubjectConfirmationNotOnOrAfter()));
        confirmationData.setAttributeNS(null, "Recipient", request.getAcsUrl());

        Element conditions = append(assertion, ASSERTION_NS, ASSERTION_PREFIX, "Conditions");
        conditions.setAttributeNS(null, "NotBefore", ResponseTimestamps.format(timestamps.getNotBefore()));
        conditions.setAttributeNS(null, "NotOnOrAfter", ResponseTimestamps.format(timestamps.getNotOnOrAfter()));
        Element restriction = append(conditions, ASSERTION_NS, ASSERTION_PREFIX, "AudienceRestriction");
        append(restriction, ASSERTION_NS, ASSERTION_PREFIX, "Audience").setTextContent(request.getIssuerUri());

        Element attributeStatement = append(assertion, ASSERTION_NS, ASSERTION_PREFIX, "AttributeStatement");
        for (Map.Entry<String, String> entry : request.getUserAttributes().entrySet()) {
            Element attribute = append(attributeStatement, ASSERTION_NS, ASSERTION_PREFIX, "Attribute");
            attribute.setAttributeNS(null, "Name", entry.getKey());
            append(attribute, ASSERTION_NS, ASSERTION_PREFIX, "AttributeValue").setTextContent(entry.getValue());
        }

        Element authnStatement = append(assertion, ASSERTION_NS, ASSERTION_PREFIX, "AuthnStatement");
        authnStatement.setAttributeNS(null, "AuthnInstant", issueInstant);
        authnStatement.setAttributeNS(null, "SessionIndex", identifiers.responseId());
        Element authnContext = append(authnStatement, ASSERTION_NS, ASSERTION_PREFIX, "AuthnContext");
        append(authnContext, ASSERTION_NS, ASSERTION_PREFIX, "AuthnContextClassRef")
                .setTextContent(SamlConstants.AUTHN_CONTEXT_CLASS);
    }

    private void appendSignatureSkeleton(Element assertion, DigestAlgorithm algorithm, SamlIdentifiers identifiers,
                                         X509Certificate certificate) throws SamlProcessingException {
        Element signature = append(assertion, DSIG_NS, DSIG_PREFIX, "Signature");
        declareNamespace(signature, DSIG_PREFIX, DSIG_NS);

        Element signedInfo = append(signature, DSIG_NS, DSIG_PREFIX, "SignedInfo");
        append(signedInfo, DSIG_NS, DSIG_PREFIX, "CanonicalizationMethod")
                .setAttributeNS(null, "Algorithm", SamlConstants.EXCLUSIVE_C14N);
        append(signedInfo, DSIG_NS, DSIG_PREFIX, "SignatureMethod")
                .setAttributeNS(null, "Algorithm", algorithm.getSignatureMethodUri());

        Element reference = append(signedInfo, DSIG_NS, DSIG_PREFIX, "Reference");
        reference.setAttributeNS(null, "URI", identifiers.referenceUri());
        Element transforms = append(reference, DSIG_NS, DSIG_PREFIX, "Transforms");
        append(transforms, DSIG_NS, DSIG_PREFIX, "Transform")
                .setAttributeNS(null, "Algorithm", SamlConstants.ENVELOPED_SIGNATURE);
        append(transforms, DSIG_NS, DSIG_PREFIX, "Transform")
                .setAttributeNS(null, "Algorithm", SamlConstants.EXCLUSIVE_C14N);
        append(reference, DSIG_NS, DSIG_PREFIX, "DigestMethod")
                .setAttributeNS(null, "Algorithm", algorithm.getDigestMethodUri());
        // Placeholder, filled in once the assertion digest is known.
        append(reference, DSIG_NS, DSIG_PREFIX, "DigestValue");

        // Placeholder, filled in once SignedInfo carries the digest.
        append(signature, DSIG_NS, DSIG_PREFIX, "SignatureValue");

        Element keyInfo = append(signature, DSIG_NS, DSIG_PREFIX, "KeyInfo");
        Element x509Data = append(keyInfo, DSIG_NS, DSIG_PREFIX, "X509Data");
        append(x509Data, DSIG_NS, DSIG_PREFIX, "X509Certificate").setTextContent(encode(certificate));
    }

    private static String encode(X509Certificate certificate) throws SamlProcessingException {
        try {
            return Base64.getEncoder().encodeToString(certificate.getEncoded());
        } catch (CertificateEncodingException e) {
            throw new SamlProcessingException("Unable to encode signing certificate", e);
        }
    }

    private static Element append(Node parent, String namespace, String prefix, String localName) {
        Document document = parent instanceof Document ? (Document) parent : parent.getOwnerDocument();
        Element element = document.createElementNS(namespace, prefix + ":" + localName);
        parent.appendChild(element);
        return element;
    }

    private static void declareNamespace(Element element, String prefix, String namespace) {
        element.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, XMLConstants.XMLNS_ATTRIBUTE + ":" + prefix, namespace);
    }
}
