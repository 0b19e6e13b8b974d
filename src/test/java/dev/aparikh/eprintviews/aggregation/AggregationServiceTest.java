package dev.aparikh.eprintviews.aggregation;

import dev.aparikh.eprintviews.model.EprintRecord;
import dev.aparikh.eprintviews.subject.InMemorySubjectDirectory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AggregationServiceTest {

    private AggregationService service;

    private final List<EprintRecord> records = List.of(
            EprintRecord.of(Map.of(
                    "eprint_id", "20",
                    "date", "2023-04-01",
                    "type", "article",
                    "lastmod", "2024-01-11T09:00:00Z",
                    "creators", List.of(Map.of("id", "Doe-J", "display_name", "Doe, Jane")),
                    "subjects", Map.of("items", List.of("bio")))),
            EprintRecord.of(Map.of(
                    "eprint_id", "3",
                    "date", "2022-09-12",
                    "type", "book",
                    "publication", "Nature",
                    "lastmod", "2020-01-01T00:00:00Z")));

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-01-12T00:00:00Z"), ZoneOffset.UTC);
        service = new AggregationService(
                new InMemorySubjectDirectory(Map.of("bio", "Biology")),
                clock,
                AggregationSettings.defaults());
    }

    @Test
    void aggregateUsesInjectedClockAndDirectory() {
        assertThat(service.aggregate("sample", records, Facet.LATEST))
                .extracting(GroupDescriptor::key)
                .containsExactly("2024-01-11T09:00:00Z");
        assertThat(service.aggregate("sample", records, Facet.SUBJECT))
                .extracting(GroupDescriptor::label)
                .containsExactly("Biology");
    }

    @Test
    void aggregateRethrowsMalformedKeys() {
        List<EprintRecord> bad = List.of(EprintRecord.of(Map.of("eprint_id", "x-1")));

        assertThatThrownBy(() -> service.aggregate("bad", bad, Facet.IDS))
                .isInstanceOf(MalformedKeyException.class);
    }

    @Test
    void summarizeCountsGroupsPerDistinctFacet() {
        Map<Facet, Integer> summary = service.summarize("sample", records);

        assertThat(summary.keySet()).containsExactlyElementsOf(Facet.distinct());
        assertThat(summary.get(Facet.PEOPLE)).isEqualTo(1);
        assertThat(summary.get(Facet.YEAR)).isEqualTo(2);
        assertThat(summary.get(Facet.PUBLICATION)).isEqualTo(1);
        assertThat(summary.get(Facet.ISSN)).isZero();
        assertThat(summary.get(Facet.EVENT)).isEqualTo(1);
        assertThat(summary.get(Facet.SUBJECT)).isEqualTo(1);
        assertThat(summary.get(Facet.IDS)).isEqualTo(2);
        assertThat(summary.get(Facet.TYPE)).isEqualTo(2);
        assertThat(summary.get(Facet.LATEST)).isEqualTo(1);
    }

    @Test
    void aggregateStreamEmitsGroupsInFacetOrder() {
        StepVerifier.create(service.aggregateStream("sample", records, Facet.IDS))
                .assertNext(group -> assertThat(group.key()).isEqualTo("3"))
                .assertNext(group -> assertThat(group.key()).isEqualTo("20"))
                .verifyComplete();
    }

    @Test
    void aggregateStreamSignalsMalformedKeysAsError() {
        List<EprintRecord> bad = List.of(EprintRecord.of(Map.of("eprint_id", "n/a")));

        StepVerifier.create(service.aggregateStream("bad", bad, Facet.IDS))
                .expectError(MalformedKeyException.class)
                .verify();
    }
}
