package dev.aparikh.eprintviews.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.aparikh.eprintviews.subject.SubjectDirectory;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.time.ZoneId;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AggregationConfigTest {

    private static AggregationConfig configFor(EprintViewsProperties properties) {
        return new AggregationConfig(properties, new DefaultResourceLoader(), new ObjectMapper());
    }

    @Test
    void subjectDirectoryUsesInlineEntries() {
        EprintViewsProperties properties = new EprintViewsProperties();
        properties.setSubjects(Map.of("astro", "Astronomy"));

        SubjectDirectory directory = configFor(properties).subjectDirectory();

        assertThat(directory.resolve("astro")).contains("Astronomy");
        assertThat(directory.resolve("bio")).isEmpty();
    }

    @Test
    void subjectsFileIsMergedOverInlineEntries() {
        EprintViewsProperties properties = new EprintViewsProperties();
        properties.setSubjects(Map.of("bio", "Bio (inline)", "astro", "Astronomy"));
        properties.setSubjectsFile("classpath:subjects-test.json");

        SubjectDirectory directory = configFor(properties).subjectDirectory();

        assertThat(directory.resolve("bio")).contains("Biology");
        assertThat(directory.resolve("astro")).contains("Astronomy");
        assertThat(directory.resolve("geo")).contains("Geological and Planetary Sciences");
    }

    @Test
    void missingSubjectsFileFailsFast() {
        EprintViewsProperties properties = new EprintViewsProperties();
        properties.setSubjectsFile("classpath:no-such-subjects.json");

        assertThatThrownBy(() -> configFor(properties).subjectDirectory())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("no-such-subjects.json");
    }

    @Test
    void clockUsesConfiguredZone() {
        EprintViewsProperties properties = new EprintViewsProperties();
        properties.setZone("America/Los_Angeles");

        assertThat(configFor(properties).aggregationClock().getZone()).isEqualTo(ZoneId.of("America/Los_Angeles"));
    }

    @Test
    void settingsCarryLatestWindow() {
        EprintViewsProperties properties = new EprintViewsProperties();
        assertThat(configFor(properties).aggregationSettings().latestWindowDays()).isEqualTo(7);

        properties.setLatestWindowDays(30);
        assertThat(configFor(properties).aggregationSettings().latestWindowDays()).isEqualTo(30);
    }
}
