package dev.aparikh.eprintviews.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed configuration properties for the aggregation service.
 */
@Validated
@ConfigurationProperties(prefix = "eprintviews")
class EprintViewsProperties {

    private Map<String, String> subjects = new LinkedHashMap<>();

    private String subjectsFile;

    @PositiveOrZero
    private int latestWindowDays = 7;

    @NotBlank
    private String zone = "UTC";

    Map<String, String> getSubjects() {
        return subjects;
    }

    void setSubjects(Map<String, String> subjects) {
        this.subjects = subjects;
    }

    String getSubjectsFile() {
        return subjectsFile;
    }

    void setSubjectsFile(String subjectsFile) {
        this.subjectsFile = subjectsFile;
    }

    int getLatestWindowDays() {
        return latestWindowDays;
    }

    void setLatestWindowDays(int latestWindowDays) {
        this.latestWindowDays = latestWindowDays;
    }

    String getZone() {
        return zone;
    }

    void setZone(String zone) {
        this.zone = zone;
    }
}
