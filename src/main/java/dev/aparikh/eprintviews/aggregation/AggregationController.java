package dev.aparikh.eprintviews.aggregation;

import dev.aparikh.eprintviews.api.AggregationRequest;
import dev.aparikh.eprintviews.api.AggregationResponse;
import dev.aparikh.eprintviews.api.ErrorResponse;
import dev.aparikh.eprintviews.api.SummaryResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST Controller for facet aggregation over posted record sets.
 */
@RestController
@RequestMapping("/api/aggregations")
@Tag(name = "Aggregations", description = "Faceted grouping of repository records for browse pages")
public class AggregationController {

    private final AggregationService aggregationService;

    public AggregationController(AggregationService aggregationService) {
        this.aggregationService = aggregationService;
    }

    @PostMapping(value = "/summary", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Summarize all facets",
            description = "Builds every facet over the record set and returns how many groups each one produces. " +
                    "Aliases of the people facet are reported once, as 'people'."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Summary built successfully",
                    content = @Content(schema = @Schema(implementation = SummaryResponse.class))
            ),
            @ApiResponse(
                    responseCode = "400",
                    description = "Invalid request",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            ),
            @ApiResponse(
                    responseCode = "422",
                    description = "A record identifier is not numeric",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            )
    })
    public ResponseEntity<SummaryResponse> summarize(
            @Parameter(description = "Record set to summarize", required = true)
            @Valid @RequestBody AggregationRequest request) {

        Map<String, Integer> groupCounts = new LinkedHashMap<>();
        aggregationService.summarize(request.name(), request.records())
                .forEach((facet, count) -> groupCounts.put(facet.pathName(), count));

        return ResponseEntity.ok(new SummaryResponse(request.name(), request.records().size(), groupCounts));
    }

    @PostMapping(value = "/{facet}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Aggregate one facet",
            description = "Groups the posted records by the named facet and returns the groups in facet order. " +
                    "Facets: people, person, person_az, author, year, publication, issn, collection, event, " +
                    "subject, ids, type, latest."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Facet built successfully",
                    content = @Content(schema = @Schema(implementation = AggregationResponse.class))
            ),
            @ApiResponse(
                    responseCode = "400",
                    description = "Unknown facet or invalid request",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            ),
            @ApiResponse(
                    responseCode = "422",
                    description = "A record identifier is not numeric",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            )
    })
    public ResponseEntity<AggregationResponse> aggregate(
            @Parameter(description = "Facet name", example = "year", required = true)
            @PathVariable("facet") String facetName,
            @Parameter(description = "Record set to aggregate", required = true)
            @Valid @RequestBody AggregationRequest request) {

        Facet facet = Facet.fromPathName(facetName);
        List<GroupDescriptor> groups = aggregationService.aggregate(request.name(), request.records(), facet);

        AggregationResponse response = new AggregationResponse(
                request.name(), facet.pathName(), request.records().size(), groups.size(), groups);
        return ResponseEntity.ok(response);
    }

    @PostMapping(value = "/{facet}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(
            summary = "Stream one facet",
            description = "Streams the groups of the named facet one event at a time, in facet order. " +
                    "Suitable for rendering very large browse lists incrementally."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Stream started successfully",
                    content = @Content(mediaType = MediaType.TEXT_EVENT_STREAM_VALUE)
            ),
            @ApiResponse(
                    responseCode = "400",
                    description = "Unknown facet or invalid request",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            )
    })
    public Flux<ServerSentEvent<GroupDescriptor>> streamAggregation(
            @Parameter(description = "Facet name", example = "year", required = true)
            @PathVariable("facet") String facetName,
            @Parameter(description = "Record set to aggregate", required = true)
            @Valid @RequestBody AggregationRequest request) {

        Facet facet = Facet.fromPathName(facetName);
        return aggregationService.aggregateStream(request.name(), request.records(), facet)
                .map(group -> ServerSentEvent.<GroupDescriptor>builder()
                        .id(group.key())
                        .event(facet.pathName())
                        .data(group)
                        .build());
    }
}
