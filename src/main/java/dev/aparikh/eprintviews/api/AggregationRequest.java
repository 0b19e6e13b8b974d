package dev.aparikh.eprintviews.api;

import dev.aparikh.eprintviews.model.EprintRecord;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Request DTO carrying one record set to aggregate.
 */
@Schema(description = "Record set to aggregate")
public record AggregationRequest(
        @NotBlank
        @Schema(description = "Name of the record set, used in labels and diagnostics",
                example = "authors",
                requiredMode = Schema.RequiredMode.REQUIRED)
        String name,

        @NotNull
        @Schema(description = "Decoded metadata records; every field is optional, null entries are rejected",
                example = "[{\"eprint_id\": 101, \"date\": \"2021-03-04\", \"type\": \"article\"}]",
                requiredMode = Schema.RequiredMode.REQUIRED)
        List<@NotNull EprintRecord> records
) {
}
