package com.yourcompany.fakeidp.saml;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.stream.Collectors;

import static com.yourcompany.fakeidp.saml.SamlConstants.ASSERTION_NS;
import static com.yourcompany.fakeidp.saml.SamlConstants.DSIG_NS;
import static com.yourcompany.fakeidp.saml.SamlConstants.PROTOCOL_NS;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResponseAssemblerTest {

    private final ResponseAssembler assembler = new ResponseAssembler();
    private final SamlIdentifiers identifiers = new SamlIdentifiers("_response-1", "_assertion-1");
    private final ResponseTimestamps timestamps = ResponseTimestamps.at(Instant.parse("2026-10-19T12:00:00Z"));

    private TestCredentials credentials;

    @BeforeEach
    void setUp() throws Exception {
        credentials = TestCredentials.get();
    }

    @Test
    void writesResponseRootAndTopLevelChildren() throws Exception {
        Document document = assemble(SamlTestSupport.sampleRequest(DigestAlgorithm.SHA256).build());

        Element response = document.getDocumentElement();
        assertEquals(PROTOCOL_NS, response.getNamespaceURI());
        assertEquals("samlp:Response", response.getTagName());
        assertEquals(SamlConstants.CONSENT_UNSPECIFIED, response.getAttribute("Consent"));
        assertEquals(SamlTestSupport.ACS_URL, response.getAttribute("Destination"));
        assertEquals("_response-1", response.getAttribute("ID"));
        assertEquals(SamlTestSupport.REQUEST_ID, response.getAttribute("InResponseTo"));
        assertEquals("2026-10-19T12:00:00Z", response.getAttribute("IssueInstant"));
        assertEquals("2.0", response.getAttribute("Version"));

        assertEquals(List.of("Issuer", "Status", "Assertion"), childNames(response));
        Element status = SamlUtils.requireSingleElement(document, PROTOCOL_NS, "StatusCode");
        assertEquals(SamlConstants.STATUS_SUCCESS, status.getAttribute("Value"));
    }

    @Test
    void writesAssertionChildrenInSchemaOrder() throws Exception {
        Document document = assemble(SamlTestSupport.sampleRequest(DigestAlgorithm.SHA256).build());

        Element assertion = SamlTestSupport.assertion(document);
        assertEquals("_assertion-1", assertion.getAttribute("ID"));
        assertEquals(List.of("Issuer", "Signature", "Subject", "Conditions", "AttributeStatement", "AuthnStatement"),
                childNames(assertion));

        Element issuer = SamlUtils.childElements(assertion, ASSERTION_NS, "Issuer").get(0);
        assertEquals(SamlConstants.ENTITY_FORMAT, issuer.getAttribute("Format"));
        assertEquals(SamlTestSupport.ISSUER, issuer.getTextContent());

        Element nameId = SamlUtils.requireSingleElement(document, ASSERTION_NS, "NameID");
        assertEquals(SamlConstants.EMAIL_ADDRESS_FORMAT, nameId.getAttribute("Format"));
        assertEquals(SamlTestSupport.NAME_ID, nameId.getTextContent());

        Element confirmation = SamlUtils.requireSingleElement(document, ASSERTION_NS, "SubjectConfirmation");
        assertEquals(SamlConstants.BEARER_METHOD, confirmation.getAttribute("Method"));
        Element confirmationData = SamlUtils.requireSingleElement(document, ASSERTION_NS, "SubjectConfirmationData");
        assertEquals(SamlTestSupport.REQUEST_ID, confirmationData.getAttribute("InResponseTo"));
        assertEquals(SamlTestSupport.ACS_URL, confirmationData.getAttribute("Recipient"));

        assertEquals(SamlTestSupport.ISSUER, SamlTestSupport.text(document, ASSERTION_NS, "Audience"));

        Element authnStatement = SamlUtils.requireSingleElement(document, ASSERTION_NS, "AuthnStatement");
        assertEquals("_response-1", authnStatement.getAttribute("SessionIndex"));
        assertEquals("2026-10-19T12:00:00Z", authnStatement.getAttribute("AuthnInstant"));
        assertEquals(SamlConstants.AUTHN_CONTEXT_CLASS,
                SamlTestSupport.text(document, ASSERTION_NS, "AuthnContextClassRef"));
    }

    @Test
    void writesSignatureSkeletonWithEmptyPlaceholders() throws Exception {
        Document document = assemble(SamlTestSupport.sampleRequest(DigestAlgorithm.SHA384).build());

        Element reference = SamlUtils.requireSingleElement(document, DSIG_NS, "Reference");
        assertEquals("#_assertion-1", reference.getAttribute("URI"));
        List<String> transforms = SamlUtils.childElements(
                        SamlUtils.requireSingleElement(document, DSIG_NS, "Transforms"), DSIG_NS, "Transform")
                .stream()
                .map(transform -> transform.getAttribute("Algorithm"))
                .collect(Collectors.toList());
        assertEquals(List.of(SamlConstants.ENVELOPED_SIGNATURE, SamlConstants.EXCLUSIVE_C14N), transforms);

        assertEquals(SamlConstants.EXCLUSIVE_C14N,
                SamlUtils.requireSingleElement(document, DSIG_NS, "CanonicalizationMethod").getAttribute("Algorithm"));
        assertEquals(DigestAlgorithm.SHA384.getSignatureMethodUri(),
                SamlUtils.requireSingleElement(document, DSIG_NS, "SignatureMethod").getAttribute("Algorithm"));
        assertEquals(DigestAlgorithm.SHA384.getDigestMethodUri(),
                SamlUtils.requireSingleElement(document, DSIG_NS, "DigestMethod").getAttribute("Algorithm"));
        assertEquals("", SamlTestSupport.text(document, DSIG_NS, "DigestValue"));
        assertEquals("", SamlTestSupport.text(document, DSIG_NS, "SignatureValue"));

        String embedded = SamlTestSupport.text(document, DSIG_NS, "X509Certificate");
        assertEquals(credentials.certificate(),
                SamlCredentials.loadCertificate(Base64.getDecoder().decode(embedded)));
    }

    @Test
    void keepsAttributeInsertionOrder() throws Exception {
        ResponseRequest request = SamlTestSupport.sampleRequest(DigestAlgorithm.SHA256)
                .userAttribute("first_name", "Jane")
                .userAttribute("last_name", "Doe")
                .userAttribute("groups", "admins")
                .build();

        Document document = assemble(request);

        Element statement = SamlUtils.requireSingleElement(document, ASSERTION_NS, "AttributeStatement");
        List<Element> attributes = SamlUtils.childElements(statement, ASSERTION_NS, "Attribute");
        assertEquals(List.of("email", "first_name", "last_name", "groups"),
                attributes.stream().map(attribute -> attribute.getAttribute("Name")).collect(Collectors.toList()));
        assertEquals(List.of("user@example.com", "Jane", "Doe", "admins"),
                attributes.stream().map(Element::getTextContent).collect(Collectors.toList()));
    }

    @Test
    void writesEmptyAttributeStatementWithoutAttributes() throws Exception {
        ResponseRequest request = ResponseRequest.builder()
                .nameId(SamlTestSupport.NAME_ID)
                .issuerUri(SamlTestSupport.ISSUER)
                .acsUrl(SamlTestSupport.ACS_URL)
                .requestId(SamlTestSupport.REQUEST_ID)
                .certificate(credentials.certificatePem())
                .privateKey(credentials.privateKeyPkcs8Pem())
                .build();

        Document document = assemble(request);

        Element statement = SamlUtils.requireSingleElement(document, ASSERTION_NS, "AttributeStatement");
        assertTrue(SamlUtils.childElements(statement, ASSERTION_NS, "Attribute").isEmpty());
    }

    private Document assemble(ResponseRequest request) throws SamlProcessingException {
        return SamlUtils.parse(assembler.assemble(request, identifiers, timestamps, credentials.certificate()));
    }

    private static List<String> childNames(Element parent) {
        List<String> names = new ArrayList<>();
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() == Node.ELEMENT_NODE) {
                names.add(child.getLocalName());
            }
        }
        return names;
    }
}
