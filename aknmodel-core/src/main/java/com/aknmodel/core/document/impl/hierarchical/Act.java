package com.aknmodel.core.document.impl.hierarchical;

import com.aknmodel.core.config.ModelConfig;
import com.aknmodel.core.document.DocumentType;
import com.aknmodel.core.document.structure.HierarchicalStructure;
import com.aknmodel.core.model.AmendmentEvent;
import com.aknmodel.core.model.RepealEvent;
import com.aknmodel.core.util.DateStrings;
import org.dom4j.Document;
import org.dom4j.Element;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An act of a legislature.
 *
 * <p>Besides the common identification properties, an act carries publication details
 * ({@code meta/publication}) and lifecycle events: the amendments made to it and its
 * repeal. Each event is an {@code eventRef} in {@code meta/lifecycle} whose source is a
 * {@code passiveRef} to the amending or repealing work in {@code meta/references}.
 */
public class Act extends HierarchicalStructure {

    public static final String DOCUMENT_TYPE = "act";

    public static final DocumentType<Act> TYPE =
        new DocumentType<>(STRUCTURE_TYPE, MAIN_CONTENT_TAG, DOCUMENT_TYPE, Act::new) {
            @Override
            protected Map<String, String> emptyDocumentAttributes() {
                Map<String, String> attributes = super.emptyDocumentAttributes();
                attributes.put("contains", "originalVersion");
                return attributes;
            }
        };

    static final String AMENDMENT_EVENT = "amendment";
    static final String REPEAL_EVENT = "repeal";

    private static final String PASSIVE_REF = "passiveRef";

    public Act(Document document, ModelConfig config) {
        super(TYPE, document, config);
    }

    public Element act() {
        return main();
    }

    // ==================== Publication ====================

    /**
     * Returns the name of the publication the act appeared in, e.g. a gazette.
     *
     * @return publication name, or null if not set
     */
    public String getPublicationName() {
        return publicationAttribute("showAs");
    }

    public void setPublicationName(String name) {
        Element publication = ensurePublication();
        publication.addAttribute("name", name);
        publication.addAttribute("showAs", name);
    }

    public LocalDate getPublicationDate() {
        return DateStrings.parse(publicationAttribute("date"));
    }

    public void setPublicationDate(LocalDate date) {
        ensurePublication().addAttribute("date", DateStrings.format(date));
    }

    public String getPublicationNumber() {
        return publicationAttribute("number");
    }

    public void setPublicationNumber(String number) {
        ensurePublication().addAttribute("number", number);
    }

    private String publicationAttribute(String attribute) {
        Element publication = getElement("meta.publication");
        return publication == null ? null : publication.attributeValue(attribute);
    }

    private Element ensurePublication() {
        return ensureElement("meta.publication", identification());
    }

    // ==================== Lifecycle events ====================

    /**
     * Returns the amendments recorded in the lifecycle, oldest first.
     *
     * @return amendment events, empty if there are none
     */
    public List<AmendmentEvent> getAmendments() {
        List<AmendmentEvent> amendments = new ArrayList<>();
        for (Element event : events(AMENDMENT_EVENT)) {
            Element source = passiveRef(event);
            amendments.add(new AmendmentEvent(
                DateStrings.parse(event.attributeValue("date")),
                source == null ? null : source.attributeValue("showAs"),
                source == null ? null : source.attributeValue("href")));
        }
        amendments.sort(Comparator.comparing(AmendmentEvent::date));
        return amendments;
    }

    /**
     * Replaces the amendments recorded in the lifecycle.
     *
     * @param amendments new amendment events, possibly empty
     */
    public void setAmendments(List<AmendmentEvent> amendments) {
        removeEvents(AMENDMENT_EVENT);
        if (amendments.isEmpty()) {
            return;
        }

        Element lifecycle = ensureLifecycle();
        for (AmendmentEvent amendment : amendments) {
            addEvent(lifecycle, AMENDMENT_EVENT, amendment.date(), amendment.amendingTitle(), amendment.amendingUri());
        }
    }

    /**
     * Returns the repeal recorded in the lifecycle.
     *
     * @return repeal event, or null if the act is not repealed
     */
    public RepealEvent getRepeal() {
        List<Element> events = events(REPEAL_EVENT);
        if (events.isEmpty()) {
            return null;
        }

        Element event = events.get(0);
        Element source = passiveRef(event);
        return new RepealEvent(
            DateStrings.parse(event.attributeValue("date")),
            source == null ? null : source.attributeValue("showAs"),
            source == null ? null : source.attributeValue("href"));
    }

    /**
     * Records or clears the repeal of this act.
     *
     * @param repeal repeal event, or null to mark the act as not repealed
     */
    public void setRepeal(RepealEvent repeal) {
        removeEvents(REPEAL_EVENT);
        if (repeal != null) {
            addEvent(ensureLifecycle(), REPEAL_EVENT, repeal.date(), repeal.repealingTitle(), repeal.repealingUri());
        }
    }

    private void addEvent(Element lifecycle, String type, LocalDate date, String title, String uri) {
        String id = uniqueEventId(lifecycle, type + "-" + DateStrings.format(date));
        String sourceId = id + "-source";

        Element event = makeElement("eventRef");
        event.addAttribute("date", DateStrings.format(date));
        event.addAttribute("eId", id);
        event.addAttribute("source", "#" + sourceId);
        event.addAttribute("type", type);
        lifecycle.add(event);

        ensureReference(PASSIVE_REF, title, sourceId, uri);
    }

    /**
     * Returns {@code base}, or {@code base-2}, {@code base-3}, ... if events on the same
     * date already use it.
     */
    private String uniqueEventId(Element lifecycle, String base) {
        Set<String> taken = new HashSet<>();
        for (Element event : lifecycle.elements(qname("eventRef"))) {
            taken.add(event.attributeValue("eId"));
        }

        String id = base;
        for (int n = 2; taken.contains(id); n++) {
            id = base + "-" + n;
        }
        return id;
    }

    private List<Element> events(String type) {
        List<Element> events = new ArrayList<>();
        Element lifecycle = getElement("meta.lifecycle");
        if (lifecycle != null) {
            for (Element event : lifecycle.elements(qname("eventRef"))) {
                if (type.equals(event.attributeValue("type"))) {
                    events.add(event);
                }
            }
        }
        return events;
    }

    private void removeEvents(String type) {
        for (Element event : events(type)) {
            Element source = passiveRef(event);
            if (source != null) {
                source.getParent().remove(source);
            }
            event.getParent().remove(event);
        }
    }

    private Element passiveRef(Element event) {
        String source = event.attributeValue("source");
        Element references = getElement("meta.references");
        if (source == null || !source.startsWith("#") || references == null) {
            return null;
        }

        String id = source.substring(1);
        for (Element reference : references.elements(qname(PASSIVE_REF))) {
            if (id.equals(reference.attributeValue("eId"))) {
                return reference;
            }
        }
        return null;
    }
}
