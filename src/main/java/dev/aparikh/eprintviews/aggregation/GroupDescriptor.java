package dev.aparikh.eprintviews.aggregation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import dev.aparikh.eprintviews.model.EprintRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * One bucket of a facet: the records sharing a grouping key.
 * Facet specific attributes are null when a facet does not use them and are left out of the JSON.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"key", "label", "count"})
public record GroupDescriptor(
        String key,
        String label,
        int count,
        String year,
        @JsonProperty("people_id") String peopleId,
        @JsonProperty("sort_name") String sortName,
        @JsonProperty("subject_id") String subjectId,
        @JsonProperty("subject_name") String subjectName,
        @JsonProperty("eprint_id") String eprintId,
        String type,
        List<EprintRecord> objects
) {
    public GroupDescriptor {
        if (key == null) {
            throw new IllegalArgumentException("Group key cannot be null");
        }
        objects = objects == null ? List.of() : List.copyOf(objects);
        if (count != objects.size()) {
            throw new IllegalArgumentException("count must equal the number of objects");
        }
    }

    public static Builder builder(String key, String label) {
        return new Builder(key, label);
    }

    /**
     * Accumulates a group during a single scan. Attributes are fixed by the record that opened the
     * group; later records only add membership.
     */
    public static class Builder {
        private final String key;
        private final String label;
        private String year;
        private String peopleId;
        private String sortName;
        private String subjectId;
        private String subjectName;
        private String eprintId;
        private String type;
        private final List<EprintRecord> objects = new ArrayList<>();

        private Builder(String key, String label) {
            this.key = key;
            this.label = label;
        }

        public Builder year(String year) {
            this.year = year;
            return this;
        }

        public Builder peopleId(String peopleId) {
            this.peopleId = peopleId;
            return this;
        }

        public Builder sortName(String sortName) {
            this.sortName = sortName;
            return this;
        }

        public Builder subjectId(String subjectId) {
            this.subjectId = subjectId;
            return this;
        }

        public Builder subjectName(String subjectName) {
            this.subjectName = subjectName;
            return this;
        }

        public Builder eprintId(String eprintId) {
            this.eprintId = eprintId;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder add(EprintRecord record) {
            objects.add(record);
            return this;
        }

        public GroupDescriptor build() {
            return new GroupDescriptor(key, label, objects.size(), year, peopleId, sortName,
                    subjectId, subjectName, eprintId, type, objects);
        }
    }
}
