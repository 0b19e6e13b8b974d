package dev.aparikh.eprintviews.api;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Map;

/**
 * Response DTO listing how many groups each facet produces.
 */
@Schema(description = "Group counts for every facet")
public record SummaryResponse(
        @Schema(description = "Name of the record set", example = "authors")
        String name,

        @Schema(description = "Number of records in the request", example = "250")
        int recordCount,

        @Schema(description = "Group count by facet name", example = "{\"people\": 40, \"year\": 12}")
        Map<String, Integer> groupCounts
) {
}
