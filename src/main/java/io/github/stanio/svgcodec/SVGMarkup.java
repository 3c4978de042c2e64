/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgcodec;

import static javax.xml.XMLConstants.XMLNS_ATTRIBUTE;
import static javax.xml.XMLConstants.XMLNS_ATTRIBUTE_NS_URI;
import static org.apache.batik.util.SVGConstants.SVG_NAMESPACE_URI;
import static org.apache.batik.util.SVGConstants.SVG_PATH_TAG;
import static org.apache.batik.util.SVGConstants.XLINK_NAMESPACE_URI;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.Locale;
import java.util.logging.Logger;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerConfigurationException;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/**
 * Converts between {@code SVGElement} trees and DOM documents, or markup text.
 * <p>
 * Output options are read from system properties:</p>
 * <dl>
 * <dt>{@code svgcodec.indent}</dt>
 * <dd>Indent the text output ({@code false})</dd>
 * <dt>{@code svgcodec.omitXmlDeclaration}</dt>
 * <dd>Omit the XML declaration from the text output ({@code true})</dd>
 * </dl>
 */
public final class SVGMarkup {

    static final Logger log = Logger.getLogger(SVGMarkup.class.getName());

    private static final boolean indent =
            getBoolean("svgcodec.indent", false);
    private static final boolean omitXmlDeclaration =
            getBoolean("svgcodec.omitXmlDeclaration", true);

    private static final ThreadLocal<DocumentBuilder> localBuilder =
            ThreadLocal.withInitial(SVGMarkup::newDocumentBuilder);

    private static final ThreadLocal<Transformer> identityTransformer =
            ThreadLocal.withInitial(SVGMarkup::newTransformer);

    private SVGMarkup() {}

    private static boolean getBoolean(String name, boolean defaultValue) {
        String str = System.getProperty(name);
        return (str != null)
                ? !Arrays.asList("f", "false", "n", "no", "0", "off")
                        .contains(str.trim().toLowerCase(Locale.ROOT))
                : defaultValue;
    }

    /**
     * Reads the document element, its attributes and descendant elements.
     * Text content is not read.  Elements outside the SVG namespace keep
     * their prefixed name, f.e. {@code sodipodi:namedview}.
     */
    public static SVGElement read(Document document) {
        return read(document.getDocumentElement());
    }

    public static SVGElement read(Element source) {
        SVGElement element = newElement(elementName(source));
        element.readAttributes(source);
        for (Node child = source.getFirstChild();
                child != null; child = child.getNextSibling()) {
            if (child.getNodeType() == Node.ELEMENT_NODE) {
                element.addChild(read((Element) child));
            }
        }
        return element;
    }

    private static String elementName(Element element) {
        String localName = element.getLocalName();
        if (localName == null
                || SVG_NAMESPACE_URI.equals(element.getNamespaceURI())) {
            return (localName == null) ? element.getNodeName() : localName;
        }
        // Foreign element: prefix resolved through the declarations read
        return element.getNodeName();
    }

    static SVGElement newElement(String name) {
        return name.equals(SVG_PATH_TAG) ? new SVGPathElement()
                                         : new SVGElement(name);
    }

    /**
     * Parses the given markup text.
     *
     * @throws  IllegalArgumentException  if the text is not well-formed XML,
     *          or contains malformed {@code style} or {@code transform}
     *          attributes
     */
    public static SVGElement parse(String markup) {
        return read(parseDocument(markup));
    }

    static Document parseDocument(String markup) {
        try {
            return localBuilder.get()
                    .parse(new InputSource(new StringReader(markup)));
        } catch (SAXException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Creates a new document with the given element tree as its content.
     */
    public static Document write(SVGElement root) {
        Document document = localBuilder.get().newDocument();
        Element target = root.writeTo(document, null);
        if (root.lookupNamespaceURI("") == null) {
            target.setAttributeNS(XMLNS_ATTRIBUTE_NS_URI,
                    XMLNS_ATTRIBUTE, SVG_NAMESPACE_URI);
        }
        if (usesXLink(root)) {
            target.setAttributeNS(XMLNS_ATTRIBUTE_NS_URI,
                    XMLNS_ATTRIBUTE + ":xlink", XLINK_NAMESPACE_URI);
        }
        return document;
    }

    private static boolean usesXLink(SVGElement element) {
        AttributeStore attributes = element.attributes();
        for (String name : attributes.names()) {
            if (name.startsWith(SVGElement.XLINK_PREFIX)
                    && attributes.get(name) != null) {
                return true;
            }
        }
        for (SVGElement child : element.children()) {
            if (usesXLink(child)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the markup text for the given element tree.
     */
    public static String toString(SVGElement root) {
        StringWriter buf = new StringWriter();
        try {
            identityTransformer.get()
                    .transform(new DOMSource(write(root)), new StreamResult(buf));
        } catch (TransformerException e) {
            throw new IllegalStateException(e);
        }
        return buf.toString();
    }

    private static DocumentBuilder newDocumentBuilder() {
        DocumentBuilder builder;
        try {
            DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
            dbf.setNamespaceAware(true);
            dbf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            builder = dbf.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException(e);
        }
        builder.setErrorHandler(new ErrorHandler() {
            @Override public void warning(SAXParseException exception) {
                log.fine(() -> "Parse warning: " + exception);
            }
            @Override public void error(SAXParseException exception)
                    throws SAXException {
                throw exception;
            }
            @Override public void fatalError(SAXParseException exception)
                    throws SAXException {
                throw exception;
            }
        });
        return builder;
    }

    private static Transformer newTransformer() {
        Transformer transformer;
        try {
            transformer = TransformerFactory.newInstance().newTransformer();
        } catch (TransformerConfigurationException e) {
            throw new IllegalStateException(e);
        }
        transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
        transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION,
                                      omitXmlDeclaration ? "yes" : "no");
        transformer.setOutputProperty(OutputKeys.INDENT, indent ? "yes" : "no");
        return transformer;
    }

}
