package guraa.epubcompare.core;

import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Namespace-aware DOM parsing for the XML documents found inside EPUB containers.
 * External DTDs and entities are never fetched.
 */
@Slf4j
public final class XmlDocuments {

    private static final ErrorHandler QUIET_ERROR_HANDLER = new ErrorHandler() {
        @Override
        public void warning(SAXParseException exception) {
            log.trace("XML warning: {}", exception.getMessage());
        }

        @Override
        public void error(SAXParseException exception) {
            log.trace("XML error: {}", exception.getMessage());
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }
    };

    private XmlDocuments() {
        // Utility class, no instances allowed
    }

    /**
     * Parse a document.
     *
     * @param xml The document text
     * @return The parsed document
     * @throws SAXException If the text is not well-formed XML
     * @throws IOException If the text cannot be read
     */
    public static Document parse(String xml) throws SAXException, IOException {
        String text = xml.startsWith("\uFEFF") ? xml.substring(1) : xml;
        DocumentBuilder builder = newBuilder();
        return builder.parse(new InputSource(new StringReader(text)));
    }

    /**
     * Check whether text is well-formed XML.
     *
     * @param xml The document text
     * @return true if it parses
     */
    public static boolean isWellFormed(String xml) {
        try {
            parse(xml);
            return true;
        } catch (SAXException | IOException e) {
            log.debug("Document is not well-formed: {}", e.getMessage());
            return false;
        }
    }

    private static DocumentBuilder newBuilder() {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setValidating(false);
        factory.setExpandEntityReferences(false);
        factory.setXIncludeAware(false);
        setFeature(factory, XMLConstants.FEATURE_SECURE_PROCESSING, true);
        setFeature(factory, "http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
        setFeature(factory, "http://xml.org/sax/features/external-general-entities", false);
        setFeature(factory, "http://xml.org/sax/features/external-parameter-entities", false);

        try {
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(QUIET_ERROR_HANDLER);
            return builder;
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser is not available", e);
        }
    }

    private static void setFeature(DocumentBuilderFactory factory, String feature, boolean value) {
        try {
            factory.setFeature(feature, value);
        } catch (ParserConfigurationException e) {
            log.debug("XML parser does not support feature {}", feature);
        }
    }

    /**
     * Find all descendant elements with the given local name and namespace.
     *
     * @param root The element to search under
     * @param namespaceUri The namespace, null for elements without one
     * @param localName The local element name
     * @return Matching elements in document order
     */
    public static List<Element> descendants(Element root, String namespaceUri, String localName) {
        List<Element> result = new ArrayList<>();
        collect(root, namespaceUri, localName, result);
        return result;
    }

    private static void collect(Element parent, String namespaceUri, String localName, List<Element> result) {
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node node = children.item(i);
            if (node.getNodeType() != Node.ELEMENT_NODE) {
                continue;
            }
            Element element = (Element) node;
            if (matches(element, namespaceUri, localName)) {
                result.add(element);
            }
            collect(element, namespaceUri, localName, result);
        }
    }

    /**
     * Find all descendant elements with the given local name, whatever their namespace.
     *
     * @param root The element to search under
     * @param localName The local element name
     * @return Matching elements in document order
     */
    public static List<Element> descendantsByLocalName(Element root, String localName) {
        List<Element> result = new ArrayList<>();
        NodeList nodes = root.getElementsByTagNameNS("*", localName);
        for (int i = 0; i < nodes.getLength(); i++) {
            result.add((Element) nodes.item(i));
        }
        return result;
    }

    /**
     * Find the direct child elements with the given local name and namespace.
     *
     * @param parent The parent element
     * @param namespaceUri The namespace, null for elements without one
     * @param localName The local element name
     * @return Matching children in document order
     */
    public static List<Element> children(Element parent, String namespaceUri, String localName) {
        List<Element> result = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE && matches((Element) node, namespaceUri, localName)) {
                result.add((Element) node);
            }
        }
        return result;
    }

    private static boolean matches(Element element, String namespaceUri, String localName) {
        return localName.equals(element.getLocalName()) && Objects.equals(emptyToNull(element.getNamespaceURI()), emptyToNull(namespaceUri));
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
