package dev.aparikh.eprintviews.aggregation;

/**
 * Tunables shared by every aggregation session.
 */
public record AggregationSettings(int latestWindowDays) {
    public AggregationSettings {
        if (latestWindowDays < 0) {
            throw new IllegalArgumentException("latestWindowDays must be >= 0");
        }
    }

    public static AggregationSettings defaults() {
        return new AggregationSettings(Aggregator.DEFAULT_LATEST_WINDOW_DAYS);
    }
}
