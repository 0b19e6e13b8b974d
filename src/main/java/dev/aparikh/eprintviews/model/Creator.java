package dev.aparikh.eprintviews.model;

/**
 * A contributor entry of a record. Either value may be null.
 */
public record Creator(
        String id,
        String displayName
) {
    public static final String FIELD_ID = "id";
    public static final String FIELD_DISPLAY_NAME = "display_name";

    public boolean hasId() {
        return id != null && !id.isEmpty();
    }

    public boolean isIdentified() {
        return hasId() && displayName != null;
    }
}
