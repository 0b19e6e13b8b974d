package dev.aparikh.eprintviews.api;

import dev.aparikh.eprintviews.aggregation.GroupDescriptor;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * Response DTO for a single facet.
 */
@Schema(description = "Ordered groups of one facet")
public record AggregationResponse(
        @Schema(description = "Name of the record set", example = "authors")
        String name,

        @Schema(description = "Facet the groups were built for", example = "year")
        String facet,

        @Schema(description = "Number of records in the request", example = "250")
        int recordCount,

        @Schema(description = "Number of groups returned", example = "12")
        int groupCount,

        @Schema(description = "Groups in facet order")
        List<GroupDescriptor> groups
) {
}
