package dev.aparikh.eprintviews.subject;

import java.util.Optional;

/**
 * Looks up the display label of a subject code. Implementations must be safe for concurrent reads.
 */
@FunctionalInterface
public interface SubjectDirectory {

    /**
     * @param code a subject code as listed in a record's {@code subjects.items}
     * @return the label, or empty when the code is unknown
     */
    Optional<String> resolve(String code);
}
