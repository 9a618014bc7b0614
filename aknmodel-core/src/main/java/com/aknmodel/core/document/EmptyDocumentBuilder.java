package com.aknmodel.core.document;

import com.aknmodel.core.config.ModelConfig;
import com.aknmodel.core.config.ModelConfig.DocumentDefaults;
import com.aknmodel.core.config.ModelConfig.SourceTool;
import com.aknmodel.core.uri.FrbrUri;
import com.aknmodel.core.util.DateStrings;
import com.aknmodel.core.util.XmlUtils;
import com.aknmodel.core.xml.AknDocument;
import com.aknmodel.core.xml.AknVersion;
import org.dom4j.DocumentHelper;
import org.dom4j.Element;
import org.dom4j.Namespace;
import org.dom4j.QName;
import org.dom4j.io.OutputFormat;

import java.time.LocalDate;
import java.util.Map;

/**
 * Builds the skeleton markup of a new document: identification metadata for the work,
 * expression and manifestation, the provenance reference, and the type's empty content.
 */
final class EmptyDocumentBuilder {

    static final String DEFAULT_TITLE = "Untitled";
    static final String DEFAULT_NUMBER = "1";
    static final String GENERATION = "Generation";

    private final DocumentType<?> type;
    private final AknVersion version;
    private final SourceTool source;
    private final DocumentDefaults defaults;
    private final Namespace namespace;

    EmptyDocumentBuilder(DocumentType<?> type, AknVersion version, ModelConfig config) {
        this.type = type;
        this.version = version;
        this.source = config.source();
        this.defaults = config.skeleton();
        this.namespace = Namespace.get(version.namespace());
    }

    String build() {
        String today = DateStrings.format(LocalDate.now());
        FrbrUri frbrUri = FrbrUri.builder()
            .prefix(version.uriPrefix())
            .country(defaults.country())
            .doctype(type.getName())
            .date(today)
            .number(DEFAULT_NUMBER)
            .workComponent(StructuredDocument.MAIN_COMPONENT)
            .language(defaults.language())
            .build();

        Element root = DocumentHelper.createElement(QName.get(AknDocument.ROOT_ELEMENT, namespace));
        Element main = add(root, type.getName());
        Element meta = add(main, "meta");

        Element identification = add(meta, "identification", "source", "#" + source.id());

        Element work = add(identification, "FRBRWork");
        add(work, "FRBRthis", "value", frbrUri.workUri());
        add(work, "FRBRuri", "value", frbrUri.workUri(false));
        add(work, "FRBRalias", "value", DEFAULT_TITLE, "name", "title");
        add(work, "FRBRdate", "date", today, "name", GENERATION);
        add(work, "FRBRauthor", "href", "");
        add(work, "FRBRcountry", "value", frbrUri.getPlace());
        add(work, "FRBRnumber", "value", frbrUri.getNumber());

        Element expression = add(identification, "FRBRExpression");
        add(expression, "FRBRthis", "value", frbrUri.expressionUri());
        add(expression, "FRBRuri", "value", frbrUri.expressionUri(false));
        add(expression, "FRBRdate", "date", today, "name", GENERATION);
        add(expression, "FRBRauthor", "href", "");
        add(expression, "FRBRlanguage", "language", frbrUri.getLanguage());

        Element manifestation = add(identification, "FRBRManifestation");
        add(manifestation, "FRBRthis", "value", frbrUri.manifestationUri());
        add(manifestation, "FRBRuri", "value", frbrUri.manifestationUri(false));
        add(manifestation, "FRBRdate", "date", today, "name", GENERATION);
        add(manifestation, "FRBRauthor", "href", "");

        Element references = add(meta, "references", "source", "#" + source.id());
        add(references, "TLCOrganization", "eId", source.id(), "href", source.url(), "showAs", source.name());

        type.addEmptyContent(main);
        for (Map.Entry<String, String> attribute : type.emptyDocumentAttributes().entrySet()) {
            main.addAttribute(attribute.getKey(), attribute.getValue());
        }

        OutputFormat format = new OutputFormat();
        format.setSuppressDeclaration(true);
        return XmlUtils.toString(DocumentHelper.createDocument(root), format);
    }

    private Element add(Element parent, String name, String... attributes) {
        Element element = parent.addElement(QName.get(name, namespace));
        for (int i = 0; i + 1 < attributes.length; i += 2) {
            element.addAttribute(attributes[i], attributes[i + 1]);
        }
        return element;
    }
}
