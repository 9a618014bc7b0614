package com.aknmodel.core.document;

import com.aknmodel.core.config.ModelConfig;
import com.aknmodel.core.xml.AknDocument;
import com.aknmodel.core.xml.AknVersion;
import org.dom4j.Document;
import org.dom4j.DocumentException;
import org.dom4j.Element;
import org.dom4j.QName;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Describes one Akoma Ntoso document type: the structure type it extends, the tag of
 * its main content element, and the tag of its primary document element.
 *
 * <p>Each concrete {@link StructuredDocument} subclass declares a single instance as its
 * {@code TYPE} constant and registers it through a {@link DocumentTypeProvider}. The
 * descriptor parses markup into the subclass and builds empty skeleton documents.
 * Subclasses of this descriptor may override {@link #addEmptyContent(Element)} and
 * {@link #emptyDocumentAttributes()} to shape the skeleton.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Act act = Act.TYPE.parse(xml);
 * Act blank = Act.TYPE.newDocument();
 * String skeleton = Act.TYPE.emptyDocument("2.0");
 * }</pre>
 *
 * @param <T> document class produced
 */
public class DocumentType<T extends StructuredDocument> {

    /**
     * Creates a document instance over an already parsed tree.
     *
     * @param <T> document class produced
     */
    @FunctionalInterface
    public interface Factory<T extends StructuredDocument> {
        T create(Document document, ModelConfig config);
    }

    private final String structureType;
    private final String mainContentTag;
    private final String name;
    private final Factory<T> factory;

    /**
     * Creates a descriptor.
     *
     * @param structureType structure type name, e.g. {@code hierarchicalStructure}
     * @param mainContentTag main content element, e.g. {@code body}
     * @param name document type, e.g. {@code act}
     * @param factory constructor of the document class
     */
    public DocumentType(String structureType, String mainContentTag, String name, Factory<T> factory) {
        this.structureType = Objects.requireNonNull(structureType, "structureType must not be null");
        this.mainContentTag = Objects.requireNonNull(mainContentTag, "mainContentTag must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.factory = Objects.requireNonNull(factory, "factory must not be null");
    }

    // ==================== Parsing ====================

    public T parse(String xml) throws DocumentException {
        return parse(xml, ModelConfig.defaults());
    }

    /**
     * Parses markup into a document of this type.
     *
     * @param xml markup text; null or blank produces an empty skeleton document
     * @param config configuration owned by the new document
     * @return the document
     * @throws DocumentException if the markup is not well-formed
     * @throws com.aknmodel.core.xml.AknValidationException if the markup is not a valid
     *         document of this type
     */
    public T parse(String xml, ModelConfig config) throws DocumentException {
        if (xml == null || xml.isBlank()) {
            xml = emptyDocument(config);
        }
        return factory.create(AknDocument.parse(xml), config);
    }

    /**
     * Parses markup bytes into a document of this type.
     *
     * @param xml markup bytes, decoded per their encoding declaration
     * @param config configuration owned by the new document
     * @return the document
     * @throws DocumentException if the markup is not well-formed
     */
    public T parse(byte[] xml, ModelConfig config) throws DocumentException {
        return factory.create(AknDocument.parse(xml), config);
    }

    public T newDocument() {
        return newDocument(ModelConfig.defaults());
    }

    /**
     * Creates an empty skeleton document of this type using the configured defaults.
     *
     * @param config configuration owned by the new document
     * @return the document
     */
    public T newDocument(ModelConfig config) {
        try {
            return parse(emptyDocument(config), config);
        } catch (DocumentException e) {
            throw new IllegalStateException("Generated skeleton for " + name + " is not well-formed", e);
        }
    }

    // ==================== Skeletons ====================

    /**
     * Returns skeleton markup for the default version.
     *
     * @return skeleton markup
     */
    public String emptyDocument() {
        return emptyDocument(AknVersion.DEFAULT, ModelConfig.defaults());
    }

    /**
     * Returns skeleton markup for a version label.
     *
     * @param version {@code "2.0"} or {@code "3.0"}
     * @return skeleton markup
     * @throws IllegalArgumentException if the version is unknown
     */
    public String emptyDocument(String version) {
        return emptyDocument(AknVersion.fromLabel(version), ModelConfig.defaults());
    }

    public String emptyDocument(ModelConfig config) {
        return emptyDocument(config.skeleton().aknVersion(), config);
    }

    /**
     * Returns skeleton markup dated today.
     *
     * @param version Akoma Ntoso version
     * @param config provenance and default coordinates
     * @return skeleton markup, without an XML declaration
     */
    public String emptyDocument(AknVersion version, ModelConfig config) {
        return new EmptyDocumentBuilder(this, version, config).build();
    }

    /**
     * Adds the main content of a skeleton document. The default adds an empty main content
     * element.
     *
     * @param main primary document element
     */
    protected void addEmptyContent(Element main) {
        main.addElement(QName.get(mainContentTag, main.getNamespace()));
    }

    /**
     * Returns the attributes of a skeleton's primary document element.
     *
     * @return attribute name to value, by default {@code name} set to the lower-cased type
     */
    protected Map<String, String> emptyDocumentAttributes() {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("name", name.toLowerCase(Locale.ROOT));
        return attributes;
    }

    // ==================== Accessors ====================

    /**
     * Checks whether this type has the given name, ignoring case.
     *
     * @param documentType name to compare
     * @return true on a match
     */
    public boolean matches(String documentType) {
        return name.equalsIgnoreCase(documentType);
    }

    public String getStructureType() {
        return structureType;
    }

    public String getMainContentTag() {
        return mainContentTag;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return name + " (" + structureType + ")";
    }
}
