package dev.aparikh.eprintviews.aggregation;

import dev.aparikh.eprintviews.model.Creator;
import dev.aparikh.eprintviews.model.EprintRecord;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Stateless accessors deriving grouping keys and labels from a record.
 */
public final class RecordFields {

    private RecordFields() {
    }

    /**
     * Replaces spaces and slashes with underscores so a label can be used as a key.
     */
    public static String slugify(String s) {
        return s.replace(' ', '_').replace('/', '_');
    }

    /**
     * Year portion of {@code date}: its first four characters, trimmed.
     */
    public static Optional<String> dateYear(EprintRecord record) {
        return record.text(EprintRecord.FIELD_DATE).map(date -> prefix(date, 4).strip());
    }

    public static Optional<String> eprintId(EprintRecord record) {
        return record.text(EprintRecord.FIELD_EPRINT_ID);
    }

    public static Optional<String> objectType(EprintRecord record) {
        return record.text(EprintRecord.FIELD_TYPE);
    }

    /**
     * Date portion ({@code YYYY-MM-DD}) of {@code lastmod}; empty when missing or blank.
     */
    public static Optional<String> lastmodDate(EprintRecord record) {
        return record.text(EprintRecord.FIELD_LASTMOD)
                .map(lastmod -> prefix(lastmod, 10))
                .filter(date -> !date.isEmpty());
    }

    public static boolean hasCreatorIds(EprintRecord record) {
        return record.creators().stream().anyMatch(Creator::hasId);
    }

    /**
     * Turns a code such as {@code conference_item} into {@code Conference Item}.
     */
    public static String makeLabel(String code) {
        return makeLabel(code, "_");
    }

    public static String makeLabel(String code, String separator) {
        return Arrays.stream(code.split(Pattern.quote(separator), -1))
                .map(RecordFields::capitalize)
                .collect(Collectors.joining(" "));
    }

    private static String capitalize(String word) {
        if (word.isEmpty()) return word;
        return word.substring(0, 1).toUpperCase(Locale.ROOT) + word.substring(1).toLowerCase(Locale.ROOT);
    }

    private static String prefix(String s, int length) {
        return s.length() <= length ? s : s.substring(0, length);
    }
}
