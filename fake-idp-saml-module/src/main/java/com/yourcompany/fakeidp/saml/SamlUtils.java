package com.yourcompany.fakeidp.saml;

import org.apache.xml.security.c14n.CanonicalizationException;
import org.apache.xml.security.c14n.Canonicalizer;
import org.apache.xml.security.c14n.InvalidCanonicalizerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.w3c.dom.ls.DOMImplementationLS;
import org.w3c.dom.ls.LSOutput;
import org.w3c.dom.ls.LSSerializer;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Collection of DOM and XML Security helpers shared by the response pipeline stages.
 * <p>
 * Every stage works on its own parsed copy of the serialized document:
 * <pre>{@code
 * Document working = SamlUtils.parse(xml);
 * Element assertion = SamlUtils.requireElementById(working, assertionId);
 * byte[] canonical = SamlUtils.canonicalize(assertion);
 * }</pre>
 */
public final class SamlUtils {
    private static final Logger LOGGER = LoggerFactory.getLogger(SamlUtils.class);

    private static volatile boolean initialized;

    private SamlUtils() {
        // Utility class
    }

    /**
     * Initializes Apache Santuario exactly once. The initialization is threadsafe and idempotent so it can be
     * invoked from application code or tests without side effects.
     */
    public static void initializeXmlSecurity() {
        if (initialized) {
            return;
        }
        synchronized (SamlUtils.class) {
            if (initialized) {
                return;
            }
            org.apache.xml.security.Init.init();
            LOGGER.debug("Apache Santuario initialized");
            initialized = true;
        }
    }

    /**
     * Creates an empty namespace aware document.
     */
    public static Document newDocument() throws SamlProcessingException {
        return newDocumentBuilder().newDocument();
    }

    /**
     * Parses a serialized XML document into a fresh DOM tree. Doctype declarations are refused.
     *
     * @param xml serialized document
     * @return independent DOM copy of the document
     * @throws SamlProcessingException when the input is not well-formed
     */
    public static Document parse(String xml) throws SamlProcessingException {
        Objects.requireNonNull(xml, "XML must not be null");
        try (InputStream is = new ByteArrayInputStream(xml.getBytes(UTF_8))) {
            return newDocumentBuilder().parse(is);
        } catch (IOException | SAXException e) {
            throw new SamlProcessingException("Unable to parse XML document", e);
        }
    }

    /**
     * Serializes a complete document, with XML declaration, as UTF-8 text. No indentation is added so the
     * whitespace covered by a digest is left untouched.
     */
    public static String serialize(Document document) {
        return write(document, true);
    }

    /**
     * Serializes a single element and its subtree without an XML declaration.
     */
    public static String serializeElement(Element element) {
        return write(element, false);
    }

    /**
     * Tells whether every character of the value may appear in XML 1.0 content.
     */
    public static boolean isXmlText(String value) {
        return value.codePoints().allMatch(c -> c == 0x9 || c == 0xA || c == 0xD
                || (c >= 0x20 && c <= 0xD7FF)
                || (c >= 0xE000 && c <= 0xFFFD)
                || (c >= 0x10000 && c <= 0x10FFFF));
    }

    private static String write(Node node, boolean xmlDeclaration) {
        Document owner = node instanceof Document ? (Document) node : node.getOwnerDocument();
        DOMImplementationLS implementation = (DOMImplementationLS) owner.getImplementation().getFeature("LS", "3.0");
        LSSerializer serializer = implementation.createLSSerializer();
        serializer.getDomConfig().setParameter("xml-declaration", xmlDeclaration);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        LSOutput output = implementation.createLSOutput();
        output.setEncoding(UTF_8.name());
        output.setByteStream(out);
        serializer.write(node, output);
        return out.toString(UTF_8);
    }

    /**
     * Returns the only element with the given name, failing when it is missing or duplicated.
     */
    public static Element requireSingleElement(Node scope, String namespace, String localName)
            throws SamlProcessingException {
        NodeList nodes = scope instanceof Document
                ? ((Document) scope).getElementsByTagNameNS(namespace, localName)
                : ((Element) scope).getElementsByTagNameNS(namespace, localName);
        if (nodes.getLength() == 0) {
            throw new SamlProcessingException("Expected element " + localName + " is missing from the document");
        }
        if (nodes.getLength() > 1) {
            throw new SamlProcessingException("Expected a single " + localName + " element but found " + nodes.getLength());
        }
        return (Element) nodes.item(0);
    }

    /**
     * Returns the direct children of {@code parent} with the given name, in document order.
     */
    public static List<Element> childElements(Element parent, String namespace, String localName) {
        List<Element> result = new ArrayList<>();
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() == Node.ELEMENT_NODE
                    && Objects.equals(namespace, child.getNamespaceURI())
                    && localName.equals(child.getLocalName())) {
                result.add((Element) child);
            }
        }
        return result;
    }

    /**
     * Finds the element whose unqualified {@code ID} attribute equals {@code id}.
     *
     * @throws SamlProcessingException when no element carries that ID
     */
    public static Element requireElementById(Document document, String id) throws SamlProcessingException {
        NodeList elements = document.getElementsByTagNameNS("*", "*");
        for (int i = 0; i < elements.getLength(); i++) {
            Element element = (Element) elements.item(i);
            if (id.equals(element.getAttributeNS(null, "ID"))) {
                return element;
            }
        }
        throw new SamlProcessingException("No element with ID " + id + " found in the document");
    }

    /**
     * Canonicalizes an element subtree with Exclusive XML Canonicalization, omitting comments.
     */
    public static byte[] canonicalize(Element element) throws SamlProcessingException {
        initializeXmlSecurity();
        try {
            Canonicalizer canonicalizer = Canonicalizer.getInstance(Canonicalizer.ALGO_ID_C14N_EXCL_OMIT_COMMENTS);
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            canonicalizer.canonicalizeSubtree(element, out);
            return out.toByteArray();
        } catch (InvalidCanonicalizerException | CanonicalizationException e) {
            throw new SamlProcessingException("Unable to canonicalize " + element.getLocalName(), e);
        }
    }

    /**
     * Reads the {@code ID} of an incoming {@code SAMLRequest} so the response can answer it. The value may be
     * deflated (HTTP-Redirect binding) or plain (HTTP-POST binding); no other part of the request is inspected.
     *
     * @param samlRequest Base64 encoded request parameter
     * @return value of the root {@code ID} attribute
     * @throws SamlProcessingException when the parameter cannot be decoded or carries no ID
     */
    public static String extractRequestId(String samlRequest) throws SamlProcessingException {
        Objects.requireNonNull(samlRequest, "SAMLRequest must not be null");
        byte[] decoded;
        try {
            decoded = Base64.getMimeDecoder().decode(samlRequest);
        } catch (IllegalArgumentException e) {
            throw new SamlProcessingException("SAMLRequest is not valid Base64", e);
        }
        String xml = inflateIfDeflated(decoded);
        Element root = parse(xml).getDocumentElement();
        String id = root.getAttributeNS(null, "ID");
        if (id.isBlank()) {
            throw new SamlProcessingException("SAMLRequest " + root.getLocalName() + " carries no ID attribute");
        }
        return id;
    }

    private static String inflateIfDeflated(byte[] data) {
        Inflater inflater = new Inflater(true);
        try {
            inflater.setInput(data);
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            byte[] buffer = new byte[1024];
            while (!inflater.finished()) {
                int count = inflater.inflate(buffer);
                if (count == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    // Not a complete raw deflate stream, treat as plain XML.
                    return new String(data, UTF_8);
                }
                out.write(buffer, 0, count);
            }
            return out.toString(UTF_8);
        } catch (DataFormatException e) {
            LOGGER.debug("SAMLRequest is not deflated, reading it as plain XML");
            return new String(data, UTF_8);
        } finally {
            inflater.end();
        }
    }

    private static DocumentBuilder newDocumentBuilder() throws SamlProcessingException {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setExpandEntityReferences(false);
            return factory.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new SamlProcessingException("Unable to create XML parser", e);
        }
    }
}
