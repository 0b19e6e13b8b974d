package dev.aparikh.eprintviews.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One repository deposit record as decoded from its JSON metadata.
 * Every field is optional; accessors report absence instead of failing.
 * Serializes back to the same JSON object it was read from.
 */
public final class EprintRecord {

    // Metadata field names - centralized constants for use across the application
    public static final String FIELD_DATE = "date";
    public static final String FIELD_EPRINT_ID = "eprint_id";
    public static final String FIELD_TYPE = "type";
    public static final String FIELD_CREATORS = "creators";
    public static final String FIELD_PUBLICATION = "publication";
    public static final String FIELD_ISSN = "issn";
    public static final String FIELD_COLLECTION = "collection";
    public static final String FIELD_EVENT_TITLE = "event_title";
    public static final String FIELD_EVENT_LOCATION = "event_location";
    public static final String FIELD_EVENT_DATES = "event_dates";
    public static final String FIELD_LASTMOD = "lastmod";
    public static final String FIELD_SUBJECTS = "subjects";
    public static final String FIELD_ITEMS = "items";

    private final Map<String, Object> fields;

    private EprintRecord(Map<String, Object> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static EprintRecord of(Map<String, Object> fields) {
        return new EprintRecord(fields == null ? Map.of() : fields);
    }

    @JsonValue
    public Map<String, Object> fields() {
        return fields;
    }

    public boolean has(String name) {
        return fields.get(name) != null;
    }

    /**
     * Returns the scalar value of a top level field rendered as a string.
     * Nested objects and lists are not scalars and yield empty.
     */
    public Optional<String> text(String name) {
        return scalar(fields.get(name));
    }

    /**
     * Contributors in record order. Entries that are not JSON objects are dropped.
     */
    public List<Creator> creators() {
        Object value = fields.get(FIELD_CREATORS);
        if (!(value instanceof Collection<?> entries)) return List.of();
        return entries.stream()
                .filter(Map.class::isInstance)
                .map(entry -> (Map<?, ?>) entry)
                .map(entry -> new Creator(
                        scalar(entry.get(Creator.FIELD_ID)).orElse(null),
                        scalar(entry.get(Creator.FIELD_DISPLAY_NAME)).orElse(null)))
                .toList();
    }

    /**
     * Subject codes listed under {@code subjects.items}, in record order.
     */
    public List<String> subjectCodes() {
        Object subjects = fields.get(FIELD_SUBJECTS);
        if (!(subjects instanceof Map<?, ?> map)) return List.of();
        Object items = map.get(FIELD_ITEMS);
        if (!(items instanceof Collection<?> codes)) return List.of();
        return codes.stream()
                .map(EprintRecord::scalar)
                .flatMap(Optional::stream)
                .toList();
    }

    private static Optional<String> scalar(Object value) {
        if (value instanceof String s) return Optional.of(s);
        if (value instanceof Number || value instanceof Boolean) return Optional.of(String.valueOf(value));
        return Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EprintRecord that)) return false;
        return fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return "EprintRecord" + fields;
    }
}
