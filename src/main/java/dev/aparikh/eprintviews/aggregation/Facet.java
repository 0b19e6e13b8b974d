package dev.aparikh.eprintviews.aggregation;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * The grouping dimensions an {@link Aggregator} can build, addressed by their path name.
 */
public enum Facet {
    PEOPLE("people"),
    PERSON("person"),
    PERSON_AZ("person_az"),
    AUTHOR("author"),
    YEAR("year"),
    PUBLICATION("publication"),
    ISSN("issn"),
    COLLECTION("collection"),
    EVENT("event"),
    SUBJECT("subject"),
    IDS("ids"),
    TYPE("type"),
    LATEST("latest");

    private final String pathName;

    Facet(String pathName) {
        this.pathName = pathName;
    }

    public String pathName() {
        return pathName;
    }

    /**
     * Person, person_az and author are aliases of the people facet.
     */
    public boolean isAlias() {
        return this == PERSON || this == PERSON_AZ || this == AUTHOR;
    }

    /**
     * Facets with their own grouping rules, aliases excluded, in declaration order.
     */
    public static List<Facet> distinct() {
        return Arrays.stream(values()).filter(f -> !f.isAlias()).toList();
    }

    public static Facet fromPathName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Facet name cannot be null or blank");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(f -> f.pathName.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown facet: " + name));
    }
}
