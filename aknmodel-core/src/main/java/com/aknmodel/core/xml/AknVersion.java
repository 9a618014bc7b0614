package com.aknmodel.core.xml;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Known Akoma Ntoso format versions and their XML namespaces.
 */
public enum AknVersion {

    /** Akoma Ntoso 2.0. FRBR URIs carry no {@code /akn} prefix. */
    V2_0("2.0", "http://www.akomantoso.org/2.0", ""),

    /** Akoma Ntoso 3.0 (OASIS LegalDocML). */
    V3_0("3.0", "http://docs.oasis-open.org/legaldocml/ns/akn/3.0", "akn");

    /** Version used when none is requested. */
    public static final AknVersion DEFAULT = V3_0;

    private static final Map<String, String> NAMESPACE_TABLE;

    static {
        Map<String, String> table = new LinkedHashMap<>();
        for (AknVersion version : values()) {
            table.put(version.label, version.namespace);
        }
        NAMESPACE_TABLE = Collections.unmodifiableMap(table);
    }

    private final String label;
    private final String namespace;
    private final String uriPrefix;

    AknVersion(String label, String namespace, String uriPrefix) {
        this.label = label;
        this.namespace = namespace;
        this.uriPrefix = uriPrefix;
    }

    public String label() {
        return label;
    }

    public String namespace() {
        return namespace;
    }

    /**
     * Returns the FRBR URI prefix used by documents of this version.
     *
     * @return {@code "akn"}, or an empty string for 2.0
     */
    public String uriPrefix() {
        return uriPrefix;
    }

    /**
     * Looks up a version by its label.
     *
     * @param label version label such as {@code "3.0"}
     * @return the matching version
     * @throws IllegalArgumentException if the label is unknown
     */
    public static AknVersion fromLabel(String label) {
        for (AknVersion version : values()) {
            if (version.label.equals(label)) {
                return version;
            }
        }
        throw new IllegalArgumentException("Unknown Akoma Ntoso version: " + label + ". Known versions: "
            + Arrays.stream(values()).map(AknVersion::label).collect(Collectors.joining(", ")));
    }

    /**
     * Returns the version-label to namespace-URI table. Built once, never mutated.
     *
     * @return unmodifiable table in declaration order
     */
    public static Map<String, String> namespaceTable() {
        return NAMESPACE_TABLE;
    }
}
