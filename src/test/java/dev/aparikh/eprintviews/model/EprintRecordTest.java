package dev.aparikh.eprintviews.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class EprintRecordTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void textRendersScalarsAsStrings() {
        EprintRecord record = EprintRecord.of(Map.of(
                "eprint_id", 42,
                "title", "On Things",
                "refereed", true));

        assertThat(record.text("eprint_id")).contains("42");
        assertThat(record.text("title")).contains("On Things");
        assertThat(record.text("refereed")).contains("true");
    }

    @Test
    void textIsEmptyForMissingNullAndNestedValues() {
        Map<String, Object> fields = new HashMap<>();
        fields.put("date", null);
        fields.put("subjects", Map.of("items", List.of("bio")));
        EprintRecord record = EprintRecord.of(fields);

        assertThat(record.text("issn")).isEmpty();
        assertThat(record.text("date")).isEmpty();
        assertThat(record.text("subjects")).isEmpty();
        assertThat(record.has("date")).isFalse();
        assertThat(record.has("subjects")).isTrue();
    }

    @Test
    void creatorsSkipsEntriesThatAreNotObjects() {
        EprintRecord record = EprintRecord.of(Map.of("creators", Arrays.asList(
                Map.of("id", "Doe-J", "display_name", "Doe, Jane"),
                "not a creator",
                Map.of("display_name", "Anonymous"))));

        assertThat(record.creators()).containsExactly(
                new Creator("Doe-J", "Doe, Jane"),
                new Creator(null, "Anonymous"));
    }

    @Test
    void creatorsIsEmptyWhenFieldIsMissingOrWrongShape() {
        assertThat(EprintRecord.of(Map.of()).creators()).isEmpty();
        assertThat(EprintRecord.of(Map.of("creators", "Doe, Jane")).creators()).isEmpty();
    }

    @Test
    void subjectCodesReadsNestedItems() {
        EprintRecord record = EprintRecord.of(Map.of("subjects", Map.of("items", List.of("bio", "chem"))));

        assertThat(record.subjectCodes()).containsExactly("bio", "chem");
        assertThat(EprintRecord.of(Map.of("subjects", Map.of())).subjectCodes()).isEmpty();
        assertThat(EprintRecord.of(Map.of("subjects", List.of("bio"))).subjectCodes()).isEmpty();
    }

    @Test
    void deserializesFromJsonObjectAndWritesItBack() throws Exception {
        String json = "{\"eprint_id\":7,\"title\":\"Deep Sea\",\"creators\":[{\"id\":\"Fish-A\"}]}";

        EprintRecord record = objectMapper.readValue(json, EprintRecord.class);

        assertThat(record.text("eprint_id")).contains("7");
        assertThat(record.creators()).containsExactly(new Creator("Fish-A", null));
        assertThat(objectMapper.readTree(objectMapper.writeValueAsString(record)))
                .isEqualTo(objectMapper.readTree(json));
    }

    @Test
    void recordsWithSameFieldsAreEqual() {
        EprintRecord first = EprintRecord.of(Map.of("eprint_id", "1"));
        EprintRecord second = EprintRecord.of(Map.of("eprint_id", "1"));

        assertThat(first).isEqualTo(second);
        assertThat(first).hasSameHashCodeAs(second);
        assertThat(first).isNotEqualTo(EprintRecord.of(Map.of("eprint_id", "2")));
    }
}
