package com.aknmodel.core.xml;

import com.aknmodel.core.config.ModelConfig.SourceTool;
import com.aknmodel.core.util.XmlUtils;
import org.dom4j.Document;
import org.dom4j.DocumentException;
import org.dom4j.DocumentHelper;
import org.dom4j.Element;
import org.dom4j.Namespace;
import org.dom4j.QName;
import org.dom4j.io.OutputFormat;
import org.dom4j.io.SAXReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Base wrapper for Akoma Ntoso documents.
 *
 * <p>Owns a parsed dom4j tree whose root element is {@code akomaNtoso} and which declares
 * one of the known Akoma Ntoso namespaces. Mutations through this wrapper or through the
 * elements it hands out change the owned tree in place.
 *
 * <p>Elements are addressed with dotted paths of child names, e.g.
 * {@code meta.identification.FRBRWork}. Each segment is a direct child lookup in the
 * document's namespace; there is no wildcard or index support.
 *
 * <p>Instances are not thread-safe.
 *
 * @see NamespaceResolver
 */
public class AknDocument {

    /** Local name of the root element. */
    public static final String ROOT_ELEMENT = "akomaNtoso";

    private static final Pattern ENCODING_PATTERN = Pattern.compile("encoding=([\"'])[\\w-]+\\1");
    private static final int ENCODING_SCAN_LIMIT = 200;

    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final Document document;
    private final Element root;
    private final String namespace;
    private final Namespace elementNamespace;
    private final SourceTool source;

    /**
     * Wraps a parsed tree.
     *
     * @param document parsed document
     * @param source tool recorded as the provenance of generated metadata
     * @throws AknValidationException if the root is not {@code akomaNtoso} or no known
     *         namespace is declared
     */
    public AknDocument(Document document, SourceTool source) {
        this.document = Objects.requireNonNull(document, "document must not be null");
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.root = checkRoot(document).getRootElement();
        this.namespace = NamespaceResolver.DEFAULT.resolve(root);

        Namespace declared = root.getNamespaceForURI(namespace);
        this.elementNamespace = declared != null ? declared : Namespace.get(namespace);

        log.debug("Parsed <{}> document using namespace {}", root.getName(), namespace);
    }

    /**
     * Parses markup into a document wrapper with the default provenance.
     *
     * @param xml markup text
     * @return the wrapper
     * @throws DocumentException if the markup is not well-formed
     * @throws AknValidationException if the markup is not Akoma Ntoso
     */
    public static AknDocument of(String xml) throws DocumentException {
        return new AknDocument(parse(xml), SourceTool.defaults());
    }

    // ==================== Parsing ====================

    /**
     * Parses markup text and checks the root element.
     *
     * <p>An encoding declaration within the first 200 characters is rewritten to UTF-8 and
     * the text is parsed as UTF-8 bytes, so declarations that do not match the text's
     * in-memory form are accepted.
     *
     * @param xml markup text
     * @return parsed document
     * @throws DocumentException if the markup is not well-formed
     * @throws AknValidationException if the root element is not {@code akomaNtoso}
     */
    public static Document parse(String xml) throws DocumentException {
        Objects.requireNonNull(xml, "xml must not be null");

        Matcher matcher = ENCODING_PATTERN.matcher(xml);
        matcher.region(0, Math.min(xml.length(), ENCODING_SCAN_LIMIT));
        if (matcher.find()) {
            String normalized = xml.substring(0, matcher.start()) + "encoding=\"UTF-8\"" + xml.substring(matcher.end());
            return parse(normalized.getBytes(StandardCharsets.UTF_8));
        }

        return checkRoot(SAXReader.createDefault().read(new StringReader(xml)));
    }

    /**
     * Parses markup bytes, honoring their encoding declaration, and checks the root element.
     *
     * @param xml markup bytes
     * @return parsed document
     * @throws DocumentException if the markup is not well-formed
     * @throws AknValidationException if the root element is not {@code akomaNtoso}
     */
    public static Document parse(byte[] xml) throws DocumentException {
        Objects.requireNonNull(xml, "xml must not be null");
        return checkRoot(SAXReader.createDefault().read(new ByteArrayInputStream(xml)));
    }

    /**
     * Checks that a document's root element is {@code akomaNtoso}.
     *
     * @param document parsed document
     * @return the same document
     * @throws AknValidationException if the root element is misnamed
     */
    public static Document checkRoot(Document document) {
        String name = document.getRootElement().getName();
        if (!ROOT_ELEMENT.equals(name)) {
            throw new AknValidationException(
                "XML root element must be " + ROOT_ELEMENT + ", but got " + name + " instead");
        }
        return document;
    }

    // ==================== Serialization ====================

    /**
     * Serializes the whole tree with dom4j's default output format (UTF-8 declaration,
     * no reformatting).
     *
     * @return markup text
     */
    public String toXml() {
        return toXml(null);
    }

    /**
     * Serializes the whole tree.
     *
     * @param format output options passed to dom4j unchanged, or null for defaults
     * @return markup text
     */
    public String toXml(OutputFormat format) {
        return XmlUtils.toString(document, format);
    }

    /**
     * Serializes the whole tree to bytes in the format's encoding.
     *
     * @param format output options passed to dom4j unchanged, or null for defaults
     * @return markup bytes
     */
    public byte[] toXmlBytes(OutputFormat format) {
        return XmlUtils.toBytes(document, format);
    }

    // ==================== Dotted-path access ====================

    /**
     * Looks up a dotted-path element starting at this document.
     *
     * <p>The first segment is resolved by {@link #resolveName(String)}, the rest as
     * direct children.
     *
     * @param path dotted path, e.g. {@code meta.identification}
     * @return the element, or null if any segment is absent
     */
    public Element getElement(String path) {
        return getElement(path, null);
    }

    /**
     * Looks up a dotted-path element.
     *
     * @param path dotted path of child names
     * @param at element to start at, or null to start at this document
     * @return the element, or null if any segment is absent
     */
    public Element getElement(String path, Element at) {
        String[] parts = path.split("\\.");
        Element node = at;

        for (String part : parts) {
            node = node == null ? resolveName(part) : node.element(qname(part));
            if (node == null) {
                return null;
            }
        }
        return node;
    }

    /**
     * Gets a dotted-path element, creating it if it doesn't exist.
     *
     * @param path dotted path from this document
     * @param after element after which the new element is placed
     * @return the existing or new element
     * @see #ensureElement(String, Element, Element)
     */
    public Element ensureElement(String path, Element after) {
        return ensureElement(path, after, null);
    }

    /**
     * Gets a dotted-path element, creating it if it doesn't exist.
     *
     * <p>Only the final segment is created, as an empty element inserted immediately after
     * {@code after}. Intermediate segments are never created: callers make sure they exist.
     *
     * @param path dotted path from {@code at}
     * @param after element after which the new element is placed
     * @param at element to start at, or null to start at this document
     * @return the existing or new element
     */
    public Element ensureElement(String path, Element after, Element at) {
        Element node = getElement(path, at);
        if (node == null) {
            node = makeElement(path.substring(path.lastIndexOf('.') + 1));
            XmlUtils.insertAfter(after, node);
        }
        return node;
    }

    /**
     * Creates a detached, empty element in the document's namespace.
     *
     * @param localName element name
     * @return new element
     */
    public Element makeElement(String localName) {
        return DocumentHelper.createElement(qname(localName));
    }

    /**
     * Resolves the first segment of a dotted path that has no starting element.
     *
     * <p>The base wrapper exposes the root element's children. Subclasses add named
     * accessors such as {@code meta}.
     *
     * @param name segment name
     * @return the element, or null if there is none
     */
    protected Element resolveName(String name) {
        return root.element(qname(name));
    }

    /**
     * Qualifies a local name with the document's namespace.
     *
     * @param localName element name
     * @return qualified name
     */
    public QName qname(String localName) {
        return QName.get(localName, elementNamespace);
    }

    public Document getDocument() {
        return document;
    }

    public Element getRoot() {
        return root;
    }

    /**
     * Returns the Akoma Ntoso namespace URI this document uses.
     *
     * @return namespace URI
     */
    public String getNamespace() {
        return namespace;
    }

    public SourceTool getSource() {
        return source;
    }
}
