package dev.aparikh.eprintviews.aggregation;

/**
 * Raised when a grouping key cannot be interpreted the way a facet orders its groups,
 * such as a non-numeric record identifier in the identifier facet.
 */
public class MalformedKeyException extends RuntimeException {

    private final Facet facet;
    private final String key;

    public MalformedKeyException(Facet facet, String key, Throwable cause) {
        super("Facet '" + facet.pathName() + "' cannot order key '" + key + "'", cause);
        this.facet = facet;
        this.key = key;
    }

    public Facet getFacet() {
        return facet;
    }

    public String getKey() {
        return key;
    }
}
