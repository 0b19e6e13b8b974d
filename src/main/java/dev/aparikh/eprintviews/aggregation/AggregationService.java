package dev.aparikh.eprintviews.aggregation;

import dev.aparikh.eprintviews.model.EprintRecord;
import dev.aparikh.eprintviews.subject.SubjectDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
class AggregationService {

    private static final Logger LOG = LoggerFactory.getLogger(AggregationService.class);

    private final SubjectDirectory subjects;
    private final Clock clock;
    private final AggregationSettings settings;

    AggregationService(SubjectDirectory subjects, Clock clock, AggregationSettings settings) {
        this.subjects = subjects;
        this.clock = clock;
        this.settings = settings;
    }

    public List<GroupDescriptor> aggregate(String name, List<EprintRecord> records, Facet facet) {
        Aggregator aggregator = newAggregator(name, records);
        try {
            List<GroupDescriptor> groups = aggregator.aggregate(facet, subjects);
            LOG.debug("Aggregated {} records of '{}' into {} {} groups",
                    aggregator.records().size(), name, groups.size(), facet.pathName());
            return groups;
        } catch (MalformedKeyException e) {
            LOG.warn("Facet {} failed for '{}': {}", facet.pathName(), name, e.getMessage());
            throw e;
        }
    }

    /**
     * Group counts for each distinct facet, aliases collapsed, in facet declaration order.
     */
    public Map<Facet, Integer> summarize(String name, List<EprintRecord> records) {
        Aggregator aggregator = newAggregator(name, records);
        Map<Facet, Integer> counts = new LinkedHashMap<>();
        for (Facet facet : Facet.distinct()) {
            counts.put(facet, aggregator.aggregate(facet, subjects).size());
        }
        LOG.debug("Summarized {} records of '{}' across {} facets", aggregator.records().size(), name, counts.size());
        return counts;
    }

    public Flux<GroupDescriptor> aggregateStream(String name, List<EprintRecord> records, Facet facet) {
        return Flux.defer(() -> {
            try {
                return Flux.fromIterable(aggregate(name, records, facet));
            } catch (RuntimeException e) {
                return Flux.error(e);
            }
        });
    }

    private Aggregator newAggregator(String name, List<EprintRecord> records) {
        return new Aggregator(name, records, clock, settings.latestWindowDays());
    }
}
