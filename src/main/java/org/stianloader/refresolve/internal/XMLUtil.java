package org.stianloader.refresolve.internal;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
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

public class XMLUtil {

    public static class ChildElementIterable implements Iterable<@NotNull Element> {

        @NotNull
        private final Element parent;

        public ChildElementIterable(@NotNull Element parent) {
            this.parent = Objects.requireNonNull(parent, "parent may not be null");
        }

        @Override
        public Iterator<@NotNull Element> iterator() {
            NodeList nodes = this.parent.getChildNodes();
            return new Iterator<Element>() {
                private int i = this.skip(0);

                private int skip(int from) {
                    int index = from;
                    while (index < nodes.getLength() && !(nodes.item(index) instanceof Element)) {
                        index++;
                    }
                    return index;
                }

                @Override
                public boolean hasNext() {
                    return this.i < nodes.getLength();
                }

                @Override
                @NotNull
                public Element next() {
                    if (!this.hasNext()) {
                        throw new NoSuchElementException("Iterator exhausted: i = " + this.i + ", len = " + nodes.getLength());
                    }
                    Element e = (Element) nodes.item(this.i);
                    this.i = this.skip(this.i + 1);
                    return e;
                }
            };
        }
    }

    /**
     * Obtains the tag name of the element without any namespace prefix.
     *
     * @param element The element
     * @return The local name of the element
     */
    @NotNull
    public static String localName(@NotNull Element element) {
        String tag = element.getTagName();
        int colon = tag.indexOf(':');
        return colon == -1 ? tag : tag.substring(colon + 1);
    }

    @Nullable
    public static String elementText(@NotNull Node node, @NotNull String name) {
        Element e = XMLUtil.optElement(node, name);
        if (e == null) {
            return null;
        }
        return e.getTextContent().trim();
    }

    @NotNull
    public static List<@NotNull Element> getChildElements(@NotNull Element parent, @NotNull String name) {
        List<@NotNull Element> collected = new ArrayList<>();
        for (Element child : new ChildElementIterable(parent)) {
            if (XMLUtil.localName(child).equals(name)) {
                collected.add(child);
            }
        }
        return collected;
    }

    @Nullable
    public static Element optElement(@NotNull Node node, @NotNull String name) {
        NodeList list = node.getChildNodes();
        for (int i = 0; i < list.getLength(); i++) {
            if (list.item(i) instanceof Element) {
                Element e = (Element) list.item(i);
                if (XMLUtil.localName(e).equals(name)) {
                    return e;
                }
            }
        }

        return null;
    }

    @NotNull
    public static Document parse(@NotNull InputStream in) throws IOException {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setExpandEntityReferences(false);
            Document xmlDoc = factory.newDocumentBuilder().parse(in);
            xmlDoc.getDocumentElement().normalize();
            return xmlDoc;
        } catch (ParserConfigurationException | SAXException e) {
            throw new IOException("Unable to parse XML document", e);
        }
    }

    @NotNull
    public static Element reqElement(@NotNull Node node, @NotNull String name) {
        Element e = XMLUtil.optElement(node, name);
        if (e == null) {
            throw new NoSuchElementException("No element tagged " + name + " for node " + node.getNodeName());
        }
        return e;
    }
}
