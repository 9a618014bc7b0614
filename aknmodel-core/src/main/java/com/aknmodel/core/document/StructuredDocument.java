package com.aknmodel.core.document;

import com.aknmodel.core.config.ModelConfig;
import com.aknmodel.core.config.ModelConfig.SourceTool;
import com.aknmodel.core.uri.FrbrUri;
import com.aknmodel.core.util.DateStrings;
import com.aknmodel.core.util.XmlUtils;
import com.aknmodel.core.xml.AknDocument;
import com.aknmodel.core.xml.AknValidationException;
import org.dom4j.Document;
import org.dom4j.Element;
import org.dom4j.Node;
import org.dom4j.XPath;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Common base class for Akoma Ntoso documents with a known document structure.
 *
 * <p>The root's first child is the primary document element, named after the
 * {@link DocumentType}. This class exposes its identification metadata as typed
 * properties (title, work/expression/manifestation dates, language, FRBR URI) and keeps
 * the FRBR URIs of the document and of every embedded component consistent when they
 * change.
 *
 * <p>Concrete subclasses declare a {@code TYPE} constant and a constructor taking a
 * parsed {@link Document} and a {@link ModelConfig}; they inherit all behavior.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Act act = Act.TYPE.parse(xml);
 * act.setTitle("Fire Safety By-law");
 * act.setFrbrUri("/akn/za-cpt/act/by-law/2009/1");
 * String updated = act.toXml();
 * }</pre>
 *
 * @see DocumentType
 * @see DocumentTypeRegistry
 */
public abstract class StructuredDocument extends AknDocument {

    /** Component name of the primary document. */
    public static final String MAIN_COMPONENT = "main";

    /** Generic alias of the primary document element. */
    public static final String MAIN_ALIAS = "main";

    /** Generic alias of the main content element. */
    public static final String MAIN_CONTENT_ALIAS = "mainContent";

    static final String DEFAULT_LANGUAGE = "eng";

    private static final String COMPONENTS_XPATH =
        "./a:attachments/a:attachment/a:*/a:meta | ./a:components/a:component/a:*/a:meta";
    private static final String IDENTIFICATION_XPATH = ".//a:meta/a:identification";

    private final DocumentType<?> documentType;
    private final ModelConfig config;
    private final Map<String, Supplier<Element>> aliases;

    /**
     * Wraps a parsed tree after checking its shape.
     *
     * @param documentType type the tree must match
     * @param document parsed document
     * @param config configuration owned by this document
     * @throws AknValidationException if the tree is not a valid document of this type
     */
    protected StructuredDocument(DocumentType<?> documentType, Document document, ModelConfig config) {
        super(checkStructure(documentType, document), config.source());
        this.documentType = documentType;
        this.config = config;

        Map<String, Supplier<Element>> names = new LinkedHashMap<>();
        names.put(MAIN_ALIAS, this::main);
        names.put(MAIN_CONTENT_ALIAS, this::mainContent);
        names.putIfAbsent(documentType.getName(), this::main);
        names.putIfAbsent(documentType.getMainContentTag(), this::mainContent);
        this.aliases = Collections.unmodifiableMap(names);
    }

    /**
     * Checks the root element and that its first child is the primary document element.
     *
     * @param documentType expected type
     * @param document parsed document
     * @return the same document
     * @throws AknValidationException if the shape is wrong
     */
    public static Document checkStructure(DocumentType<?> documentType, Document document) {
        Element root = checkRoot(document).getRootElement();

        List<Element> children = root.elements();
        if (children.isEmpty()) {
            throw new AknValidationException("XML root element must have at least one child");
        }

        String name = children.get(0).getName();
        if (!documentType.getName().equals(name)) {
            throw new AknValidationException(
                "Expected " + documentType.getName() + " as first child of root element, but got " + name + " instead");
        }
        return document;
    }

    /**
     * Finds the registered type for a document type name, ignoring case.
     *
     * @param documentType name such as {@code act}
     * @return the type, or empty if none is registered
     * @see DocumentTypeRegistry#forDocumentType(String)
     */
    public static Optional<DocumentType<?>> forDocumentType(String documentType) {
        return DocumentTypeRegistry.getDefault().forDocumentType(documentType);
    }

    // ==================== Structure ====================

    /**
     * Returns the primary document element, e.g. {@code <act>}.
     *
     * @return primary document element
     */
    public Element main() {
        return XmlUtils.require(getRoot(), getRoot().element(qname(documentType.getName())), documentType.getName());
    }

    /**
     * Returns the main content element, e.g. {@code <body>}.
     *
     * @return main content element, or null if the document has none
     */
    public Element mainContent() {
        return main().element(qname(documentType.getMainContentTag()));
    }

    public Element meta() {
        return child(main(), "meta");
    }

    /**
     * Resolves an alias: {@code main}, {@code mainContent}, the document type name or the
     * main content tag.
     *
     * @param name alias
     * @return the element, or null if the name is not an alias or the element is absent
     */
    public Element alias(String name) {
        Supplier<Element> accessor = aliases.get(name);
        return accessor == null ? null : accessor.get();
    }

    @Override
    protected Element resolveName(String name) {
        if ("meta".equals(name)) {
            return main().element(qname("meta"));
        }
        if (aliases.containsKey(name)) {
            return alias(name);
        }
        return super.resolveName(name);
    }

    // ==================== Title and dates ====================

    /**
     * Returns the short title: the {@code FRBRalias} named {@code title}, or failing that
     * the last alias of the work.
     *
     * @return title, or null if the work has no alias
     */
    public String getTitle() {
        String title = null;
        for (Element alias : work().elements(qname("FRBRalias"))) {
            if ("title".equals(alias.attributeValue("name"))) {
                return alias.attributeValue("value");
            }
            title = alias.attributeValue("value");
        }
        return title;
    }

    public void setTitle(String title) {
        Element work = work();
        Element alias = null;
        for (Element candidate : work.elements(qname("FRBRalias"))) {
            if ("title".equals(candidate.attributeValue("name"))) {
                alias = candidate;
                break;
            }
        }

        if (alias == null) {
            alias = ensureElement("meta.identification.FRBRWork.FRBRalias", child(work, "FRBRuri"));
            alias.addAttribute("name", "title");
        }
        alias.addAttribute("value", title);
    }

    public LocalDate getWorkDate() {
        return DateStrings.parse(child(work(), "FRBRdate").attributeValue("date"));
    }

    public void setWorkDate(LocalDate date) {
        child(work(), "FRBRdate").addAttribute("date", DateStrings.format(date));
    }

    public LocalDate getExpressionDate() {
        return DateStrings.parse(child(expression(), "FRBRdate").attributeValue("date"));
    }

    /**
     * Sets the expression date and rewrites every FRBR URI to embed it.
     *
     * @param date expression date
     */
    public void setExpressionDate(LocalDate date) {
        child(expression(), "FRBRdate").addAttribute("date", DateStrings.format(date));
        resynchronize();
    }

    public LocalDate getManifestationDate() {
        return DateStrings.parse(child(manifestation(), "FRBRdate").attributeValue("date"));
    }

    public void setManifestationDate(LocalDate date) {
        child(manifestation(), "FRBRdate").addAttribute("date", DateStrings.format(date));
    }

    /**
     * Returns the 3-letter ISO-639-2 language code of this expression.
     *
     * @return language code, {@code eng} if not set
     */
    public String getLanguage() {
        return child(expression(), "FRBRlanguage").attributeValue("language", DEFAULT_LANGUAGE);
    }

    /**
     * Sets the language and rewrites every FRBR URI to embed it.
     *
     * @param language 3-letter ISO-639-2 language code
     */
    public void setLanguage(String language) {
        child(expression(), "FRBRlanguage").addAttribute("language", language);
        resynchronize();
    }

    // ==================== FRBR URI ====================

    /**
     * Returns the manifestation FRBR URI that identifies this document.
     *
     * @return parsed URI, or null if the document has none
     */
    public FrbrUri getFrbrUri() {
        String uri = child(manifestation(), "FRBRuri").attributeValue("value");
        if (uri == null || uri.isEmpty()) {
            return null;
        }
        return FrbrUri.parse(uri);
    }

    public void setFrbrUri(String uri) {
        setFrbrUri(FrbrUri.parse(uri));
    }

    /**
     * Sets the FRBR URI of this document and of all its components.
     *
     * <p>The URI takes this document's language and expression date, and defaults its
     * work component to {@code main}. Each component's work, expression and manifestation
     * identification is then rewritten with the URI scoped to that component's name.
     * The manifestation URIs are written in their expression form.
     *
     * <p>Components are updated one at a time; a component without identification
     * metadata fails with {@link NoSuchElementException}, leaving earlier components
     * updated.
     *
     * @param uri new URI; not modified
     */
    public void setFrbrUri(FrbrUri uri) {
        Objects.requireNonNull(uri, "uri must not be null");
        FrbrUri scoped = uri.copy();
        scoped.setLanguage(getLanguage());
        scoped.setExpressionDate("@" + DateStrings.format(getExpressionDate()));
        if (scoped.getWorkComponent() == null) {
            scoped.setWorkComponent(MAIN_COMPONENT);
        }

        for (Map.Entry<String, Element> component : components().entrySet()) {
            scoped.setWorkComponent(component.getKey());
            log.debug("Setting FRBR URI of component '{}' to {}", component.getKey(), scoped.workUri());

            Element identification = findIdentification(component.getValue(), component.getKey());

            Element work = child(identification, "FRBRWork");
            child(work, "FRBRuri").addAttribute("value", scoped.workUri(false));
            child(work, "FRBRthis").addAttribute("value", scoped.workUri());
            Element country = child(work, "FRBRcountry");
            country.addAttribute("value", scoped.getPlace());
            ensureElement("FRBRnumber", country, work).addAttribute("value", scoped.getNumber());

            if (scoped.getSubtype() != null && !scoped.getSubtype().isEmpty()) {
                ensureElement("FRBRsubtype", country, work).addAttribute("value", scoped.getSubtype());
            } else {
                Element subtype = work.element(qname("FRBRsubtype"));
                if (subtype != null) {
                    work.remove(subtype);
                }
            }

            Element expression = child(identification, "FRBRExpression");
            child(expression, "FRBRuri").addAttribute("value", scoped.expressionUri(false));
            child(expression, "FRBRthis").addAttribute("value", scoped.expressionUri());

            Element manifestation = child(identification, "FRBRManifestation");
            child(manifestation, "FRBRuri").addAttribute("value", scoped.expressionUri(false));
            child(manifestation, "FRBRthis").addAttribute("value", scoped.expressionUri());
        }
    }

    /**
     * Returns the expression FRBR URI of this document.
     *
     * @return parsed URI, or an empty URI if the document has none
     */
    public FrbrUri expressionFrbrUri() {
        String uri = child(expression(), "FRBRuri").attributeValue("value");
        if (uri == null || uri.isEmpty()) {
            return FrbrUri.empty();
        }
        return FrbrUri.parse(uri);
    }

    /**
     * Returns this document and its embedded components by component name.
     *
     * <p>The primary document comes first, followed by the documents inside
     * {@code attachments/attachment} and {@code components/component} in document order.
     * Names are the work components of each document's {@code FRBRWork/FRBRthis} URI, so
     * each component must already carry identification metadata.
     *
     * @return ordered map from component name to the component's document element
     */
    public Map<String, Element> components() {
        Map<String, Element> components = new LinkedHashMap<>();
        components.put(componentName(work()), main());

        for (Node node : createXPath(COMPONENTS_XPATH).selectNodes(main())) {
            Element meta = (Element) node;
            Element work = child(child(meta, "identification"), "FRBRWork");
            components.put(componentName(work), meta.getParent());
        }

        return components;
    }

    private void resynchronize() {
        FrbrUri uri = getFrbrUri();
        if (uri != null) {
            setFrbrUri(uri);
        }
    }

    private String componentName(Element work) {
        String name = FrbrUri.parse(child(work, "FRBRthis").attributeValue("value")).getWorkComponent();
        return name == null ? MAIN_COMPONENT : name;
    }

    private Element findIdentification(Element component, String name) {
        Node identification = createXPath(IDENTIFICATION_XPATH).selectSingleNode(component);
        if (identification == null) {
            throw new NoSuchElementException("Component '" + name + "' has no meta/identification block");
        }
        return (Element) identification;
    }

    // ==================== Lifecycle and references ====================

    /**
     * Gets or creates the lifecycle block, placed after the publication block if there is
     * one and after identification otherwise. On creation it is sourced to this
     * document's {@link SourceTool}, whose organization reference is ensured too.
     *
     * @return lifecycle element
     */
    protected Element ensureLifecycle() {
        Element meta = meta();
        Element after = meta.element(qname("publication"));
        if (after == null) {
            after = child(meta, "identification");
        }

        Element lifecycle = ensureElement("meta.lifecycle", after);
        String source = lifecycle.attributeValue("source");
        if (source == null || source.isEmpty()) {
            SourceTool tool = getSource();
            lifecycle.addAttribute("source", "#" + tool.id());
            ensureReference("TLCOrganization", tool.name(), tool.id(), tool.url());
        }
        return lifecycle;
    }

    /**
     * Gets or creates a reference in the references block, which is itself created after
     * the lifecycle block if missing. New references go first in the block.
     *
     * @param kind reference element, e.g. {@code TLCOrganization} or {@code passiveRef}
     * @param name display name, written to {@code showAs}
     * @param id reference id, written to {@code eId}
     * @param href reference target
     * @return the existing reference with that id, or a new one
     */
    protected Element ensureReference(String kind, String name, String id, String href) {
        Element references = ensureElement("meta.references", ensureLifecycle());

        for (Element reference : references.elements(qname(kind))) {
            if (id.equals(reference.attributeValue("eId"))) {
                return reference;
            }
        }

        Element reference = makeElement(kind);
        reference.addAttribute("eId", id);
        reference.addAttribute("href", href);
        reference.addAttribute("showAs", name);
        references.content().add(0, reference);
        return reference;
    }

    // ==================== Helpers ====================

    protected Element identification() {
        return child(meta(), "identification");
    }

    protected Element work() {
        return child(identification(), "FRBRWork");
    }

    protected Element expression() {
        return child(identification(), "FRBRExpression");
    }

    protected Element manifestation() {
        return child(identification(), "FRBRManifestation");
    }

    /**
     * Returns a required child in the document's namespace.
     *
     * @param parent parent element
     * @param name child local name
     * @return the child
     * @throws NoSuchElementException if the child is absent
     */
    protected Element child(Element parent, String name) {
        return XmlUtils.require(parent, parent.element(qname(name)), name);
    }

    protected XPath createXPath(String expression) {
        XPath xpath = getDocument().createXPath(expression);
        xpath.setNamespaceURIs(Map.of("a", getNamespace()));
        return xpath;
    }

    public DocumentType<?> getDocumentType() {
        return documentType;
    }

    public ModelConfig getConfig() {
        return config;
    }
}
