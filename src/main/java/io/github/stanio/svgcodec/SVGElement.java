/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgcodec;

import static javax.xml.XMLConstants.XMLNS_ATTRIBUTE;
import static javax.xml.XMLConstants.XMLNS_ATTRIBUTE_NS_URI;
import static javax.xml.XMLConstants.XML_NS_URI;
import static org.apache.batik.util.SVGConstants.SVG_ID_ATTRIBUTE;
import static org.apache.batik.util.SVGConstants.SVG_NAMESPACE_URI;
import static org.apache.batik.util.SVGConstants.SVG_STYLE_ATTRIBUTE;
import static org.apache.batik.util.SVGConstants.SVG_TRANSFORM_ATTRIBUTE;
import static org.apache.batik.util.SVGConstants.XLINK_NAMESPACE_URI;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;

import io.github.stanio.svgcodec.types.Style;
import io.github.stanio.svgcodec.types.TransformList;

/**
 * An SVG element with its attributes and child elements.
 * <p>
 * Attribute names may carry an {@code xlink:} or {@code xml:} prefix, which
 * is mapped to the corresponding namespace when writing markup:</p>
 * <pre>
 * <code>element.set("xlink:href", "#arrow");   →  &lt;use xlink:href="#arrow" /></code></pre>
 * <p>
 * Other prefixes, in attribute and element names, are resolved through the
 * namespaces {@linkplain #declareNamespace(String, String) declared} on the
 * element or its ancestors.  Unprefixed element names are in the SVG
 * namespace, unless a default namespace is declared.</p>
 * <p>
 * The {@code style} and {@code transform} attributes are read as {@link Style}
 * and {@link TransformList} values.</p>
 */
public class SVGElement {

    static final String XLINK_PREFIX = "xlink:";
    static final String XML_PREFIX = "xml:";

    static final Logger log = Logger.getLogger(SVGElement.class.getName());

    private final String name;
    private final AttributeStore attributes = new AttributeStore();
    private final List<SVGElement> children = new ArrayList<>();
    private final Map<String, String> namespaces = new LinkedHashMap<>(2);

    private SVGElement parent;

    public SVGElement(String name) {
        this.name = Objects.requireNonNull(name, "null name");
    }

    public SVGElement(String name, String id) {
        this(name);
        setId(id);
    }

    /**
     * @return  the element name, f.e. {@code "g"}, {@code "path"}, or
     *          {@code "sodipodi:namedview"} for a foreign element
     */
    public String name() {
        return name;
    }

    public AttributeStore attributes() {
        return attributes;
    }

    public Object get(String attributeName) {
        return attributes.get(attributeName);
    }

    public SVGElement set(String attributeName, Object value) {
        attributes.set(attributeName, value);
        return this;
    }

    public String getId() {
        return attributes.getText(SVG_ID_ATTRIBUTE);
    }

    public void setId(String id) {
        attributes.set(SVG_ID_ATTRIBUTE, id);
    }

    /**
     * Returns the {@code style} attribute value.  If no style has been set,
     * an empty one is created and set.
     */
    public Style getStyle() {
        return attributes.getTyped(SVG_STYLE_ATTRIBUTE, AttributeType.STYLE);
    }

    public void setStyle(Style style) {
        attributes.set(SVG_STYLE_ATTRIBUTE, style);
    }

    /**
     * Returns the {@code transform} attribute value.  If no transform has
     * been set, an empty list is created and set.
     */
    public TransformList getTransform() {
        return attributes.getTyped(SVG_TRANSFORM_ATTRIBUTE, AttributeType.TRANSFORM);
    }

    public void setTransform(TransformList transform) {
        attributes.set(SVG_TRANSFORM_ATTRIBUTE, transform);
    }

    /**
     * Declares a namespace prefix for this element and its descendants.
     * An empty prefix declares the default namespace for unprefixed element
     * names.
     *
     * @return  this element
     */
    public SVGElement declareNamespace(String prefix, String namespaceURI) {
        namespaces.put(Objects.requireNonNull(prefix, "null prefix"),
                       Objects.requireNonNull(namespaceURI, "null namespaceURI"));
        return this;
    }

    /**
     * @return  unmodifiable view of the prefix-to-URI mappings declared on
     *          this element
     */
    public Map<String, String> namespaces() {
        return Collections.unmodifiableMap(namespaces);
    }

    /**
     * Resolves the given prefix through the namespaces declared on this
     * element and its ancestors.
     *
     * @param   prefix  namespace prefix, or {@code ""} for the default one
     * @return  the namespace URI, or {@code null} if not declared
     */
    public String lookupNamespaceURI(String prefix) {
        for (SVGElement e = this; e != null; e = e.parent) {
            String uri = e.namespaces.get(prefix);
            if (uri != null)
                return uri;
        }
        return null;
    }

    /**
     * @return  the namespace URI of this element, or {@code null} if its
     *          name has an undeclared prefix
     */
    public String namespaceURI() {
        int colon = name.indexOf(':');
        if (colon > 0) {
            return lookupNamespaceURI(name.substring(0, colon));
        }
        String uri = lookupNamespaceURI("");
        return (uri == null) ? SVG_NAMESPACE_URI : uri;
    }

    /**
     * @return  the parent element, or {@code null}
     */
    public SVGElement parent() {
        return parent;
    }

    /**
     * @return  unmodifiable view of the child elements
     */
    public List<SVGElement> children() {
        return Collections.unmodifiableList(children);
    }

    /**
     * Appends the given element as last child of this one.
     *
     * @return  this element
     * @throws  IllegalArgumentException  if the child already has a parent,
     *          or is this element or one of its ancestors
     */
    public SVGElement addChild(SVGElement child) {
        if (child.parent != null) {
            throw new IllegalArgumentException("<" + child.name
                    + "> already has a parent: <" + child.parent.name + ">");
        }
        for (SVGElement p = this; p != null; p = p.parent) {
            if (p == child) {
                throw new IllegalArgumentException("<" + child.name
                        + "> is this element or one of its ancestors");
            }
        }
        children.add(child);
        child.parent = this;
        return this;
    }

    /**
     * @return  {@code true} if the given element was a child of this one
     */
    public boolean removeChild(SVGElement child) {
        if (child.parent != this)
            return false;

        children.remove(child);
        child.parent = null;
        return true;
    }

    /**
     * Reads the attributes of the given markup element into this element.
     * Attributes in the XLink and XML namespaces are named with the
     * {@code xlink:} and {@code xml:} prefixes, whatever prefix the source
     * uses.  Other namespace declarations are read as {@link #namespaces()}.
     *
     * @param   source  markup element to read attributes from
     * @throws  IllegalArgumentException  if the {@code style} or
     *          {@code transform} attribute value is malformed
     */
    public void readAttributes(Element source) {
        NamedNodeMap sourceAttributes = source.getAttributes();
        for (int i = 0, len = sourceAttributes.getLength(); i < len; i++) {
            Attr attr = (Attr) sourceAttributes.item(i);
            String value = attr.getValue();
            if (isNamespaceDeclaration(attr)) {
                readNamespaceDeclaration(attr);
                continue;
            }

            String attrName = attributeName(attr);
            if (attrName.equals(SVG_STYLE_ATTRIBUTE)) {
                setStyle(Style.valueOf(value));
            } else if (attrName.equals(SVG_TRANSFORM_ATTRIBUTE)) {
                setTransform(TransformList.valueOf(value));
            } else {
                attributes.set(attrName, value);
            }
        }
    }

    private static boolean isNamespaceDeclaration(Attr attr) {
        String attrName = attr.getName();
        return XMLNS_ATTRIBUTE_NS_URI.equals(attr.getNamespaceURI())
                || attrName.equals(XMLNS_ATTRIBUTE)
                || attrName.startsWith(XMLNS_ATTRIBUTE + ":");
    }

    private void readNamespaceDeclaration(Attr attr) {
        String attrName = attr.getName();
        String uri = attr.getValue();
        if (uri.equals(XLINK_NAMESPACE_URI) || uri.equals(XML_NS_URI)) {
            // Written back as xlink: and xml:
            log.finer(() -> "<" + name + ">: Skipping " + attrName);
            return;
        }
        String prefix = attrName.equals(XMLNS_ATTRIBUTE)
                        ? "" : attrName.substring(XMLNS_ATTRIBUTE.length() + 1);
        declareNamespace(prefix, uri);
    }

    private static String attributeName(Attr attr) {
        String namespaceURI = attr.getNamespaceURI();
        String localName = attr.getLocalName();
        if (namespaceURI == null || localName == null) {
            return attr.getName();
        }
        switch (namespaceURI) {
        case XLINK_NAMESPACE_URI:
            return XLINK_PREFIX + localName;
        case XML_NS_URI:
            return XML_PREFIX + localName;
        default:
            return attr.getName();
        }
    }

    /**
     * Writes this element, its attributes, and its child elements as markup.
     * The namespaces declared on this element are written as {@code xmlns}
     * attributes.  Names with an undeclared prefix are written without a
     * namespace, which a namespace-aware serializer may reject.
     *
     * @param   doc  document to create nodes with
     * @param   parentNode  node to append the new element to, or {@code null}
     *          to append it as the document element
     * @return  the new markup element
     */
    public Element writeTo(Document doc, Node parentNode) {
        String namespaceURI = namespaceURI();
        Element target;
        if (namespaceURI == null) {
            log.fine(() -> "Unknown namespace prefix: <" + name + ">");
            target = doc.createElement(name);
        } else {
            target = doc.createElementNS(namespaceURI, name);
        }

        for (Map.Entry<String, String> entry : namespaces.entrySet()) {
            String prefix = entry.getKey();
            target.setAttributeNS(XMLNS_ATTRIBUTE_NS_URI, prefix.isEmpty()
                    ? XMLNS_ATTRIBUTE : XMLNS_ATTRIBUTE + ":" + prefix, entry.getValue());
        }

        for (String attrName : attributes.names()) {
            Object value = attributes.get(attrName);
            if (value == null)
                continue;

            // Style and TransformList toString() give their canonical text
            if (attrName.startsWith(XLINK_PREFIX)) {
                // {http://www.w3.org/1999/xlink}href
                target.setAttributeNS(XLINK_NAMESPACE_URI, attrName, value.toString());
            } else if (attrName.startsWith(XML_PREFIX)) {
                target.setAttributeNS(XML_NS_URI, attrName, value.toString());
            } else if (attrName.indexOf(':') > 0) {
                String prefix = attrName.substring(0, attrName.indexOf(':'));
                String uri = lookupNamespaceURI(prefix);
                if (uri == null) {
                    log.fine(() -> "<" + name + ">: Unknown namespace prefix: " + attrName);
                    target.setAttribute(attrName, value.toString());
                } else {
                    target.setAttributeNS(uri, attrName, value.toString());
                }
            } else {
                target.setAttributeNS(null, attrName, value.toString());
            }
        }

        for (SVGElement child : new ArrayList<>(children)) {
            child.writeTo(doc, target);
        }

        if (parentNode == null) {
            doc.appendChild(target);
        } else {
            parentNode.appendChild(target);
        }
        return target;
    }

    @Override
    public String toString() {
        return "<" + name + "> " + attributes;
    }

}
