package net.lexiconnect.parser;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import net.lexiconnect.exceptions.InvalidInputException;

/**
 * XML utility functions for the parsers. Element lookups go by local name, so that
 * namespaced and un-namespaced files are read alike.
 */
public class Util {

    // XML parsing utilities
    static Document openFileStream(InputStream filestream, String fileName) throws InvalidInputException {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            DocumentBuilder builder = factory.newDocumentBuilder();
            // Fatal errors still throw, but nothing is printed to stderr
            builder.setErrorHandler(new DefaultHandler());
            Document doc = builder.parse(filestream);
            doc.getDocumentElement().normalize();
            return doc;
        } catch (SAXException e) {
            throw new InvalidInputException(fileName, "malformed XML: " + e.getMessage(), e);
        } catch (IOException | ParserConfigurationException e) {
            throw new InvalidInputException(fileName, e.getMessage(), e);
        }
    }

    static String localName(Node n) {
        String name = n.getLocalName();
        if (name == null) {
            name = n.getNodeName();
            int colon = name.indexOf(':');
            if (colon >= 0) name = name.substring(colon + 1);
        }
        return name;
    }

    // The direct element children of parent with the given local name, in document order
    static List<Element> childElements(Element parent, String name) {
        List<Element> result = new ArrayList<>();
        if (parent == null) return result;
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node n = children.item(i);
            if (n.getNodeType() == Node.ELEMENT_NODE && localName(n).equals(name))
                result.add((Element) n);
        }
        return result;
    }

    static Element firstChild(Element parent, String name) {
        List<Element> found = childElements(parent, name);
        return found.isEmpty() ? null : found.get(0);
    }

    // The children of the container element, e.g. paragraph elements under paragraphs
    static List<Element> containedElements(Element parent, String container, String name) {
        return childElements(firstChild(parent, container), name);
    }

    // All elements with the given local name in document order, the root included
    static List<Element> elementsNamed(Element root, String name) {
        List<Element> result = new ArrayList<>();
        if (localName(root).equals(name))
            result.add(root);
        NodeList found = root.getElementsByTagNameNS("*", name);
        for (int i = 0; i < found.getLength(); i++)
            result.add((Element) found.item(i));
        return result;
    }

    // Attribute value, or null if the attribute is missing
    static String attribute(Element el, String name) {
        return el.hasAttribute(name) ? el.getAttribute(name) : null;
    }

    static String textOf(Element el) {
        if (el == null) return "";
        String content = el.getTextContent();
        return content == null ? "" : content;
    }

    // An explicit integer order attribute, or the fallback index
    static int orderOf(Element el, int index) {
        String explicit = attribute(el, "order");
        if (explicit != null && explicit.trim().matches("\\d{1,9}"))
            return Integer.parseInt(explicit.trim());
        return index;
    }
}
