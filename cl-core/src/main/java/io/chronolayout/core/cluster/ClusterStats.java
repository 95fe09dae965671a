package io.chronolayout.core.cluster;

import java.util.List;
import java.util.Locale;

public record ClusterStats(int totalClusters, int totalEvents, double averageEventsPerCluster, int largestCluster) {

    public static ClusterStats of(List<EventCluster> clusters) {
        int total = 0, largest = 0;
        for (var c : clusters) {
            total += c.size();
            largest = Math.max(largest, c.size());
        }
        double avg = clusters.isEmpty() ? 0 : total / (double) clusters.size();
        return new ClusterStats(clusters.size(), total, avg, largest);
    }

    public String summary() {
        if (totalClusters == 0) return "No clusters";
        return String.format(Locale.ROOT, "%d clusters, %d events (avg %.1f/cluster)",
                totalClusters, totalEvents, averageEventsPerCluster);
    }
}
