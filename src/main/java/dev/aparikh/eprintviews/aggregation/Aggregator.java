package dev.aparikh.eprintviews.aggregation;

import dev.aparikh.eprintviews.model.Creator;
import dev.aparikh.eprintviews.model.EprintRecord;
import dev.aparikh.eprintviews.subject.SubjectDirectory;

import java.math.BigInteger;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds the browse facets of one record set.
 * <p>
 * Each facet operation scans the records once, accumulates groups keyed by the facet's grouping key
 * in first-seen order, then sorts the finished groups with a stable sort. No state is kept between
 * calls, so one instance can serve concurrent callers.
 */
public class Aggregator {

    public static final int DEFAULT_LATEST_WINDOW_DAYS = 7;

    private final String name;
    private final List<EprintRecord> records;
    private final Clock clock;
    private final int latestWindowDays;

    public Aggregator(String name, List<EprintRecord> records) {
        this(name, records, Clock.systemUTC(), DEFAULT_LATEST_WINDOW_DAYS);
    }

    public Aggregator(String name, List<EprintRecord> records, Clock clock, int latestWindowDays) {
        if (latestWindowDays < 0) {
            throw new IllegalArgumentException("latestWindowDays must be >= 0");
        }
        this.name = name;
        this.records = records == null ? List.of() : records.stream().filter(Objects::nonNull).toList();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.latestWindowDays = latestWindowDays;
    }

    public String name() {
        return name;
    }

    public List<EprintRecord> records() {
        return records;
    }

    public List<GroupDescriptor> aggregate(Facet facet, SubjectDirectory subjects) {
        return switch (facet) {
            case PEOPLE -> aggregatePeople();
            case PERSON -> aggregatePerson();
            case PERSON_AZ -> aggregatePersonAz();
            case AUTHOR -> aggregateAuthor();
            case YEAR -> aggregateYear();
            case PUBLICATION -> aggregatePublication();
            case ISSN -> aggregateIssn();
            case COLLECTION -> aggregateCollection();
            case EVENT -> aggregateEvent();
            case SUBJECT -> aggregateSubjects(subjects);
            case IDS -> aggregateIds();
            case TYPE -> aggregateTypes();
            case LATEST -> aggregateLatest();
        };
    }

    /**
     * Groups records by contributor id. A record joins one group per identified creator;
     * the first display name seen for an id becomes its label.
     */
    public List<GroupDescriptor> aggregatePeople() {
        Map<String, GroupDescriptor.Builder> people = new LinkedHashMap<>();
        for (EprintRecord record : records) {
            if (!RecordFields.hasCreatorIds(record)) continue;
            for (Creator creator : record.creators()) {
                if (!creator.isIdentified()) continue;
                people.computeIfAbsent(creator.id(), id -> GroupDescriptor.builder(id, creator.displayName())
                                .peopleId(id)
                                .sortName(creator.displayName()))
                        .add(record);
            }
        }
        return sorted(people, Comparator.comparing(GroupDescriptor::sortName));
    }

    public List<GroupDescriptor> aggregatePerson() {
        return aggregatePeople();
    }

    public List<GroupDescriptor> aggregatePersonAz() {
        return aggregatePeople();
    }

    public List<GroupDescriptor> aggregateAuthor() {
        return aggregatePeople();
    }

    /**
     * Groups records by the year of {@code date}, most recent year first.
     */
    public List<GroupDescriptor> aggregateYear() {
        Map<String, GroupDescriptor.Builder> years = new LinkedHashMap<>();
        for (EprintRecord record : records) {
            RecordFields.dateYear(record).ifPresent(year ->
                    years.computeIfAbsent(year, y -> GroupDescriptor.builder(y, y).year(y)).add(record));
        }
        return sorted(years, Comparator.comparing(GroupDescriptor::year).reversed());
    }

    public List<GroupDescriptor> aggregatePublication() {
        return bySluggedField(EprintRecord.FIELD_PUBLICATION);
    }

    public List<GroupDescriptor> aggregateIssn() {
        Map<String, GroupDescriptor.Builder> issns = new LinkedHashMap<>();
        for (EprintRecord record : records) {
            record.text(EprintRecord.FIELD_ISSN).ifPresent(issn ->
                    issns.computeIfAbsent(issn, k -> GroupDescriptor.builder(k, k).year(yearOf(record)))
                            .add(record));
        }
        return sorted(issns, Comparator.comparing(GroupDescriptor::key));
    }

    public List<GroupDescriptor> aggregateCollection() {
        return bySluggedField(EprintRecord.FIELD_COLLECTION);
    }

    /**
     * Groups records by event title. Records without a title are kept, in the group with the empty key.
     */
    public List<GroupDescriptor> aggregateEvent() {
        Map<String, GroupDescriptor.Builder> events = new LinkedHashMap<>();
        for (EprintRecord record : records) {
            String title = record.text(EprintRecord.FIELD_EVENT_TITLE).orElse("");
            events.computeIfAbsent(RecordFields.slugify(title), key -> GroupDescriptor.builder(key, title)
                            .year(yearOf(record)))
                    .add(record);
        }
        return sorted(events, Comparator.comparing(group -> group.label().strip()));
    }

    /**
     * Groups records by subject code. Codes the directory cannot resolve are ignored.
     */
    public List<GroupDescriptor> aggregateSubjects(SubjectDirectory directory) {
        Objects.requireNonNull(directory, "directory");
        Map<String, GroupDescriptor.Builder> subjects = new LinkedHashMap<>();
        for (EprintRecord record : records) {
            for (String code : record.subjectCodes()) {
                Optional<String> label = directory.resolve(code);
                if (label.isEmpty()) continue;
                subjects.computeIfAbsent(code, c -> GroupDescriptor.builder(c, label.get())
                                .subjectId(c)
                                .subjectName(label.get()))
                        .add(record);
            }
        }
        return sorted(subjects, Comparator.comparing(GroupDescriptor::subjectName));
    }

    /**
     * Groups records by identifier in numeric order.
     *
     * @throws MalformedKeyException if an identifier is not an integer
     */
    public List<GroupDescriptor> aggregateIds() {
        Map<String, GroupDescriptor.Builder> ids = new LinkedHashMap<>();
        for (EprintRecord record : records) {
            RecordFields.eprintId(record).ifPresent(id ->
                    ids.computeIfAbsent(id, k -> GroupDescriptor.builder(k, k).eprintId(k)).add(record));
        }
        Map<String, BigInteger> numericKeys = new HashMap<>();
        for (String key : ids.keySet()) {
            numericKeys.put(key, parseIdentifier(key));
        }
        return sorted(ids, Comparator.comparing(group -> numericKeys.get(group.key())));
    }

    /**
     * Groups records by type code; the label is the code rendered as capitalized words.
     */
    public List<GroupDescriptor> aggregateTypes() {
        Map<String, GroupDescriptor.Builder> types = new LinkedHashMap<>();
        for (EprintRecord record : records) {
            RecordFields.objectType(record).ifPresent(type ->
                    types.computeIfAbsent(type, t -> GroupDescriptor.builder(t, RecordFields.makeLabel(t)).type(t))
                            .add(record));
        }
        return sorted(types, Comparator.comparing(GroupDescriptor::key));
    }

    /**
     * Groups records modified within the recent window by their full {@code lastmod} timestamp,
     * newest first. The window ends today and starts {@code latestWindowDays} days earlier, both inclusive.
     */
    public List<GroupDescriptor> aggregateLatest() {
        String since = LocalDate.now(clock).minusDays(latestWindowDays).toString();
        Map<String, GroupDescriptor.Builder> latest = new LinkedHashMap<>();
        for (EprintRecord record : records) {
            Optional<String> modified = RecordFields.lastmodDate(record);
            if (modified.isEmpty() || modified.get().compareTo(since) < 0) continue;
            String key = record.text(EprintRecord.FIELD_LASTMOD).orElseThrow();
            latest.computeIfAbsent(key, k -> GroupDescriptor.builder(k, modified.get()).year(yearOf(record)))
                    .add(record);
        }
        return sorted(latest, Comparator.comparing(GroupDescriptor::key).reversed());
    }

    private List<GroupDescriptor> bySluggedField(String field) {
        Map<String, GroupDescriptor.Builder> groups = new LinkedHashMap<>();
        for (EprintRecord record : records) {
            record.text(field).ifPresent(value ->
                    groups.computeIfAbsent(RecordFields.slugify(value), key -> GroupDescriptor.builder(key, value)
                                    .year(yearOf(record)))
                            .add(record));
        }
        return sorted(groups, Comparator.comparing(GroupDescriptor::label));
    }

    private static String yearOf(EprintRecord record) {
        return RecordFields.dateYear(record).orElse("");
    }

    private static BigInteger parseIdentifier(String key) {
        try {
            return new BigInteger(key.strip());
        } catch (NumberFormatException e) {
            throw new MalformedKeyException(Facet.IDS, key, e);
        }
    }

    // List.sort is a stable merge sort, so equal keys keep first-seen order
    private static List<GroupDescriptor> sorted(Map<String, GroupDescriptor.Builder> groups,
                                                Comparator<GroupDescriptor> order) {
        List<GroupDescriptor> result = new ArrayList<>(groups.size());
        for (GroupDescriptor.Builder builder : groups.values()) {
            result.add(builder.build());
        }
        result.sort(order);
        return List.copyOf(result);
    }
}
