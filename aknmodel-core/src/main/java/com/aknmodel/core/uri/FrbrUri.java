package com.aknmodel.core.uri;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * An Akoma Ntoso FRBR URI: the identifier of a work, one of its expressions, or a
 * manifestation of that expression.
 *
 * <p>Example: {@code /akn/za-cpt/act/by-law/2009/1/!main} is the work URI of the main
 * component, {@code /akn/za-cpt/act/by-law/2009/1/eng@2010-01-01} the expression URI.
 *
 * <p>Coordinates are mutable so the document model can rescope a single identifier to
 * each of a document's components.
 */
public class FrbrUri {

    private static final Pattern URI_PATTERN = Pattern.compile(
        "^(?<prefix>/akn)?"
            + "/(?<country>[a-z]{2})(-(?<locality>[^/]+))?"
            + "/(?<doctype>[^/]+)"
            + "/((?<subtype>[^/]+)/((?<actor>[^/]+)/)?)?"
            + "(?<date>[0-9]{4}(-[0-9]{2}(-[0-9]{2})?)?)"
            + "/(?<number>[^/.]+)"
            + "(/!(?<workComponent>[^/.]+))?"
            + "(/(?<language>[a-z]{3})(?<expressionDate>[@:][^/.]*)?"
            + "(/!(?<expressionComponent>[^/.]+))?"
            + "(/(?<portion>[^/.]+))?)?"
            + "(\\.(?<format>[a-z0-9]+))?"
            + "/?$");

    private String prefix;
    private String country;
    private String locality;
    private String doctype;
    private String subtype;
    private String actor;
    private String date;
    private String number;
    private String workComponent;
    private String language;
    private String expressionDate;
    private String expressionComponent;
    private String portion;
    private String format;

    private FrbrUri() {
    }

    private FrbrUri(Builder builder) {
        this.prefix = builder.prefix;
        this.country = builder.country;
        this.locality = builder.locality;
        this.doctype = builder.doctype;
        this.subtype = builder.subtype;
        this.actor = builder.actor;
        this.date = builder.date;
        this.number = builder.number;
        this.workComponent = builder.workComponent;
        this.language = builder.language;
        this.expressionDate = builder.expressionDate;
        this.expressionComponent = builder.expressionComponent;
        this.portion = builder.portion;
        this.format = builder.format;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a URI with every coordinate unset.
     *
     * @return empty URI
     */
    public static FrbrUri empty() {
        return new FrbrUri();
    }

    /**
     * Parses a work, expression or manifestation URI.
     *
     * <p>A component named after the expression ({@code .../eng@/!schedule1}) is also
     * taken as the work component when none precedes it.
     *
     * @param uri URI string
     * @return parsed URI
     * @throws IllegalArgumentException if the string is not a FRBR URI
     */
    public static FrbrUri parse(String uri) {
        if (uri == null) {
            throw new IllegalArgumentException("Invalid FRBR URI: null");
        }

        Matcher m = URI_PATTERN.matcher(uri.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("Invalid FRBR URI: " + uri);
        }

        FrbrUri parsed = builder()
            .prefix(m.group("prefix") != null ? "akn" : "")
            .country(m.group("country"))
            .locality(m.group("locality"))
            .doctype(m.group("doctype"))
            .subtype(m.group("subtype"))
            .actor(m.group("actor"))
            .date(m.group("date"))
            .number(m.group("number"))
            .workComponent(m.group("workComponent"))
            .language(m.group("language"))
            .expressionDate(m.group("expressionDate"))
            .expressionComponent(m.group("expressionComponent"))
            .portion(m.group("portion"))
            .format(m.group("format"))
            .build();

        if (parsed.workComponent == null) {
            parsed.workComponent = parsed.expressionComponent;
        }
        return parsed;
    }

    /**
     * Returns an independent copy.
     *
     * @return copy with the same coordinates
     */
    public FrbrUri copy() {
        return builder()
            .prefix(prefix).country(country).locality(locality).doctype(doctype).subtype(subtype)
            .actor(actor).date(date).number(number).workComponent(workComponent).language(language)
            .expressionDate(expressionDate).expressionComponent(expressionComponent)
            .portion(portion).format(format)
            .build();
    }

    // ==================== Derived forms ====================

    /**
     * Returns the jurisdiction: the country, suffixed with the locality if there is one.
     *
     * @return place, e.g. {@code za-cpt}
     */
    public String getPlace() {
        if (locality == null || locality.isEmpty()) {
            return country;
        }
        return country + "-" + locality;
    }

    public String workUri() {
        return workUri(true);
    }

    /**
     * Returns the work URI.
     *
     * @param withComponent whether to append {@code /!component}
     * @return work URI
     */
    public String workUri(boolean withComponent) {
        List<String> parts = new ArrayList<>();
        parts.add("");
        addIfPresent(parts, prefix);
        addIfPresent(parts, getPlace());
        addIfPresent(parts, doctype);
        addIfPresent(parts, subtype);
        addIfPresent(parts, actor);
        addIfPresent(parts, date);
        addIfPresent(parts, number);
        if (withComponent && workComponent != null && !workComponent.isEmpty()) {
            parts.add("!" + workComponent);
        }
        return String.join("/", parts);
    }

    public String expressionUri() {
        return expressionUri(true);
    }

    /**
     * Returns the expression URI: the work URI, language and expression date. Without a
     * language the expression coordinates are left out.
     *
     * @param withComponent whether to append {@code /!component}
     * @return expression URI
     */
    public String expressionUri(boolean withComponent) {
        StringBuilder uri = new StringBuilder(workUri(false));
        if (language != null && !language.isEmpty()) {
            uri.append('/').append(language);
            if (expressionDate != null) {
                uri.append(expressionDate);
            }
        }
        if (withComponent && workComponent != null && !workComponent.isEmpty()) {
            uri.append("/!").append(workComponent);
        }
        return uri.toString();
    }

    public String manifestationUri() {
        return manifestationUri(true);
    }

    /**
     * Returns the manifestation URI: the expression URI plus {@code .format} if set.
     *
     * @param withComponent whether to include {@code /!component}
     * @return manifestation URI
     */
    public String manifestationUri(boolean withComponent) {
        String uri = expressionUri(withComponent);
        if (format != null && !format.isEmpty()) {
            uri = uri + "." + format;
        }
        return uri;
    }

    private static void addIfPresent(List<String> parts, String value) {
        if (value != null && !value.isEmpty()) {
            parts.add(value);
        }
    }

    // ==================== Coordinates ====================

    public String getPrefix() {
        return prefix;
    }

    public String getCountry() {
        return country;
    }

    public String getLocality() {
        return locality;
    }

    public String getDoctype() {
        return doctype;
    }

    public String getSubtype() {
        return subtype;
    }

    public void setSubtype(String subtype) {
        this.subtype = subtype;
    }

    public String getActor() {
        return actor;
    }

    public String getDate() {
        return date;
    }

    public String getNumber() {
        return number;
    }

    public String getWorkComponent() {
        return workComponent;
    }

    public void setWorkComponent(String workComponent) {
        this.workComponent = workComponent;
    }

    public String getLanguage() {
        return language;
    }

    public void setLanguage(String language) {
        this.language = language;
    }

    /**
     * Returns the expression date including its marker.
     *
     * @return e.g. {@code @2010-01-01}, or null
     */
    public String getExpressionDate() {
        return expressionDate;
    }

    public void setExpressionDate(String expressionDate) {
        this.expressionDate = expressionDate;
    }

    public String getExpressionComponent() {
        return expressionComponent;
    }

    public String getPortion() {
        return portion;
    }

    public String getFormat() {
        return format;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FrbrUri other)) {
            return false;
        }
        return Objects.equals(prefix, other.prefix)
            && Objects.equals(country, other.country)
            && Objects.equals(locality, other.locality)
            && Objects.equals(doctype, other.doctype)
            && Objects.equals(subtype, other.subtype)
            && Objects.equals(actor, other.actor)
            && Objects.equals(date, other.date)
            && Objects.equals(number, other.number)
            && Objects.equals(workComponent, other.workComponent)
            && Objects.equals(language, other.language)
            && Objects.equals(expressionDate, other.expressionDate)
            && Objects.equals(expressionComponent, other.expressionComponent)
            && Objects.equals(portion, other.portion)
            && Objects.equals(format, other.format);
    }

    @Override
    public int hashCode() {
        return Objects.hash(prefix, country, locality, doctype, subtype, actor, date, number,
            workComponent, language, expressionDate, expressionComponent, portion, format);
    }

    @Override
    public String toString() {
        return language == null ? workUri() : expressionUri();
    }

    /**
     * Builder for {@link FrbrUri} from named coordinates.
     */
    public static final class Builder {
        private String prefix = "akn";
        private String country;
        private String locality;
        private String doctype;
        private String subtype;
        private String actor;
        private String date;
        private String number;
        private String workComponent;
        private String language;
        private String expressionDate;
        private String expressionComponent;
        private String portion;
        private String format;

        private Builder() {
        }

        /** URI scheme prefix: {@code "akn"} for 3.0 URIs, empty or null for 2.0. */
        public Builder prefix(String prefix) {
            this.prefix = prefix;
            return this;
        }

        public Builder country(String country) {
            this.country = country;
            return this;
        }

        public Builder locality(String locality) {
            this.locality = locality;
            return this;
        }

        public Builder doctype(String doctype) {
            this.doctype = doctype;
            return this;
        }

        public Builder subtype(String subtype) {
            this.subtype = subtype;
            return this;
        }

        public Builder actor(String actor) {
            this.actor = actor;
            return this;
        }

        public Builder date(String date) {
            this.date = date;
            return this;
        }

        public Builder number(String number) {
            this.number = number;
            return this;
        }

        public Builder workComponent(String workComponent) {
            this.workComponent = workComponent;
            return this;
        }

        public Builder language(String language) {
            this.language = language;
            return this;
        }

        public Builder expressionDate(String expressionDate) {
            this.expressionDate = expressionDate;
            return this;
        }

        public Builder expressionComponent(String expressionComponent) {
            this.expressionComponent = expressionComponent;
            return this;
        }

        public Builder portion(String portion) {
            this.portion = portion;
            return this;
        }

        public Builder format(String format) {
            this.format = format;
            return this;
        }

        public FrbrUri build() {
            return new FrbrUri(this);
        }
    }
}
