package io.chronolayout.core.distribution;

/** Summary of one distribution pass, for telemetry. */
public record DistributionMetrics(
        int totalEvents,
        double averageDensity,
        double maxDensity,
        double minDensity,
        double horizontalUtilization,
        boolean clusteringRecommended
) {
    public static final DistributionMetrics EMPTY = new DistributionMetrics(0, 0, 0, 0, 0, false);
}
