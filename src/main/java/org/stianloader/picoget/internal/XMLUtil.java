package org.stianloader.picoget.internal;

import java.io.IOException;
import java.io.InputStream;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

/**
 * DOM helpers for namespace-aware documents. Elements are always matched by their local name,
 * so "d:Version" and "Version" are treated alike regardless of the prefix a feed chooses.
 */
public class XMLUtil {

    public static class ChildElementIterable implements Iterable<@NotNull Element> {

        @NotNull
        private final Element parent;

        public ChildElementIterable(@NotNull Element parent) {
            this.parent = Objects.requireNonNull(parent, "parent may not be null");
        }

        @Override
        public Iterator<@NotNull Element> iterator() {
            return new ElementNodeListIterator(this.parent.getChildNodes());
        }
    }

    public static class ElementNodeListIterator implements Iterator<@NotNull Element> {
        private int i = 0;
        private final NodeList nodeList;

        public ElementNodeListIterator(NodeList list) {
            this.nodeList = list;
        }

        @Override
        public boolean hasNext() {
            while (this.i < this.nodeList.getLength()) {
                if (this.nodeList.item(this.i) instanceof Element) {
                    return true;
                }
                this.i++;
            }
            return false;
        }

        @Override
        @NotNull
        public Element next() {
            if (!this.hasNext()) {
                throw new NoSuchElementException("Iterator exausted: i = " + this.i + ", len = " + this.nodeList.getLength());
            }
            return (Element) this.nodeList.item(this.i++);
        }
    }

    @Nullable
    public static String elementText(@NotNull Node node, @NotNull String localName) {
        Element e = XMLUtil.optElement(node, localName);
        if (e == null) {
            return null;
        }
        return e.getTextContent();
    }

    @NotNull
    public static String localName(@NotNull Element element) {
        String name = element.getLocalName();
        if (name == null) {
            // Document was not parsed namespace-aware
            name = element.getTagName();
            int colon = name.indexOf(':');
            if (colon != -1) {
                name = name.substring(colon + 1);
            }
        }
        return name;
    }

    @Nullable
    public static Element optElement(@NotNull Node node, @NotNull String localName) {
        NodeList list = node.getChildNodes();
        for (int i = 0; i < list.getLength(); i++) {
            if (list.item(i) instanceof Element) {
                Element e = (Element) list.item(i);
                if (localName.equals(XMLUtil.localName(e))) {
                    return e;
                }
            }
        }
        return null;
    }

    @NotNull
    public static Document parse(@NotNull InputStream is) throws IOException {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            Document xmlDoc = factory.newDocumentBuilder().parse(is);
            xmlDoc.getDocumentElement().normalize();
            return xmlDoc;
        } catch (ParserConfigurationException | SAXException e) {
            throw new IOException("Unable to parse XML document", e);
        }
    }
}
