package dev.aparikh.eprintviews.subject;

import java.util.Map;
import java.util.Optional;

/**
 * Immutable map-backed subject directory.
 */
public final class InMemorySubjectDirectory implements SubjectDirectory {

    private static final InMemorySubjectDirectory EMPTY = new InMemorySubjectDirectory(Map.of());

    private final Map<String, String> labels;

    public InMemorySubjectDirectory(Map<String, String> labels) {
        this.labels = Map.copyOf(labels);
    }

    public static InMemorySubjectDirectory empty() {
        return EMPTY;
    }

    @Override
    public Optional<String> resolve(String code) {
        if (code == null) return Optional.empty();
        return Optional.ofNullable(labels.get(code));
    }

    public int size() {
        return labels.size();
    }
}
