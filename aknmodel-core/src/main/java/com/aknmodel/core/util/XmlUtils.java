package com.aknmodel.core.util;

import org.dom4j.Element;
import org.dom4j.Node;
import org.dom4j.io.OutputFormat;
import org.dom4j.io.XMLWriter;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * dom4j helpers shared by the document model.
 */
public final class XmlUtils {

    private XmlUtils() {
        // Utility class
    }

    /**
     * Serializes a node to a string.
     *
     * @param node node to serialize
     * @param format output format, or null for dom4j's defaults
     * @return serialized markup
     */
    public static String toString(Node node, OutputFormat format) {
        StringWriter writer = new StringWriter();
        try {
            // XMLWriter rejects a null format, its default one is protected
            XMLWriter xmlWriter = format == null ? new XMLWriter(writer) : new XMLWriter(writer, format);
            xmlWriter.write(node);
            xmlWriter.close();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return writer.toString();
    }

    /**
     * Serializes a node to bytes in the format's encoding.
     *
     * @param node node to serialize
     * @param format output format, or null for dom4j's defaults (UTF-8)
     * @return serialized markup
     */
    public static byte[] toBytes(Node node, OutputFormat format) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            XMLWriter xmlWriter = format == null ? new XMLWriter(out) : new XMLWriter(out, format);
            xmlWriter.write(node);
            xmlWriter.close();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }

    /**
     * Inserts {@code node} as the next sibling of {@code after}.
     *
     * @param after existing element with a parent
     * @param node node to insert
     */
    public static void insertAfter(Element after, Node node) {
        Element parent = after.getParent();
        if (parent == null) {
            throw new IllegalArgumentException("Cannot insert a sibling after the root element " + after.getName());
        }
        List<Node> siblings = parent.content();
        siblings.add(siblings.indexOf(after) + 1, node);
    }

    /**
     * Returns a child element or fails if it is absent.
     *
     * @param parent parent element
     * @param child the child, possibly null
     * @param localName child local name, for the error message
     * @return the child
     * @throws NoSuchElementException if the child is null
     */
    public static Element require(Element parent, Element child, String localName) {
        if (child == null) {
            throw new NoSuchElementException(
                "Expected <" + localName + "> inside <" + parent.getName() + "> but none was found");
        }
        return child;
    }
}
