package dev.aparikh.eprintviews.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.aparikh.eprintviews.aggregation.AggregationSettings;
import dev.aparikh.eprintviews.subject.InMemorySubjectDirectory;
import dev.aparikh.eprintviews.subject.SubjectDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

@Configuration
@EnableConfigurationProperties(EprintViewsProperties.class)
class AggregationConfig {

    private static final Logger log = LoggerFactory.getLogger(AggregationConfig.class);

    private final EprintViewsProperties properties;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    AggregationConfig(EprintViewsProperties properties, ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        this.properties = properties;
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
    }

    @Bean
    Clock aggregationClock() {
        return Clock.system(ZoneId.of(properties.getZone()));
    }

    @Bean
    AggregationSettings aggregationSettings() {
        return new AggregationSettings(properties.getLatestWindowDays());
    }

    @Bean
    SubjectDirectory subjectDirectory() {
        Map<String, String> labels = new LinkedHashMap<>();
        if (properties.getSubjects() != null) {
            labels.putAll(properties.getSubjects());
        }
        String location = properties.getSubjectsFile();
        if (location != null && !location.isBlank()) {
            labels.putAll(readSubjectsFile(location.trim()));
        }
        labels.values().removeIf(Objects::isNull);
        log.info("Subject directory loaded with {} entries", labels.size());
        return new InMemorySubjectDirectory(labels);
    }

    private Map<String, String> readSubjectsFile(String location) {
        Resource resource = resourceLoader.getResource(location);
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, new TypeReference<LinkedHashMap<String, String>>() {
            });
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read subjects file " + location, e);
        }
    }
}
