package com.aknmodel.core.xml;

import org.dom4j.Element;
import org.dom4j.Namespace;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Picks the Akoma Ntoso namespace a parsed tree uses.
 *
 * <p>Candidates are tried from the highest version label down, so a tree declaring both
 * the 2.0 and the 3.0 namespace resolves to 3.0.
 */
public final class NamespaceResolver {

    /** Resolver over {@link AknVersion#namespaceTable()}. */
    public static final NamespaceResolver DEFAULT = new NamespaceResolver(AknVersion.namespaceTable());

    private final List<String> candidates;

    /**
     * Creates a resolver over a version table.
     *
     * @param namespaceTable version label (numeric, e.g. {@code "3.0"}) to namespace URI
     */
    public NamespaceResolver(Map<String, String> namespaceTable) {
        Objects.requireNonNull(namespaceTable, "namespaceTable must not be null");
        this.candidates = namespaceTable.entrySet().stream()
            .sorted(Comparator.comparing((Map.Entry<String, String> e) -> new BigDecimal(e.getKey())).reversed())
            .map(Map.Entry::getValue)
            .toList();
    }

    /**
     * Resolves the namespace in scope on a root element.
     *
     * @param root root element of a parsed tree
     * @return the namespace URI of the highest known version declared
     * @throws AknValidationException if no known namespace is declared
     */
    public String resolve(Element root) {
        Set<String> declared = new LinkedHashSet<>();
        declared.add(root.getNamespaceURI());
        for (Namespace namespace : root.declaredNamespaces()) {
            declared.add(namespace.getURI());
        }
        declared.remove("");
        return resolve(declared);
    }

    /**
     * Resolves the namespace from a set of declared namespace URIs.
     *
     * @param declared namespace URIs declared by a tree
     * @return the namespace URI of the highest known version declared
     * @throws AknValidationException if none of the known namespaces is declared
     */
    public String resolve(Collection<String> declared) {
        for (String candidate : candidates) {
            if (declared.contains(candidate)) {
                return candidate;
            }
        }

        throw new AknValidationException(String.format(
            "Expected to find one of the following Akoma Ntoso XML namespaces: %s. Only these namespaces were found: %s",
            String.join(", ", candidates), String.join(", ", new ArrayList<>(declared))));
    }

    /**
     * Returns the candidate namespaces in resolution order.
     *
     * @return namespace URIs, highest version first
     */
    public List<String> candidates() {
        return candidates;
    }
}
