package io.chronolayout.core.cluster;

import io.chronolayout.core.distribution.DistributedEvent;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Greedy proximity clustering over chronologically ordered events.
 *
 * Each event joins the nearest cluster whose anchor lies within the threshold (earliest cluster
 * on ties) or opens a new one. The anchor is the running mean of its members, updated once per
 * join. The scan is order dependent, so input is re-sorted by timestamp (stable) before it starts.
 */
public final class EventClustering {
    private final double threshold;

    public EventClustering(double threshold) {
        if (!(threshold >= 0)) throw new IllegalArgumentException("threshold must be >= 0: " + threshold);
        this.threshold = threshold;
    }

    public List<EventCluster> cluster(List<DistributedEvent> events) {
        if (events.isEmpty()) return List.of();

        var sorted = new ArrayList<>(events);
        sorted.sort(Comparator.comparingLong(DistributedEvent::timestamp));

        var open = new ArrayList<Builder>();
        for (var de : sorted) {
            Builder nearest = null;
            double best = Double.POSITIVE_INFINITY;
            for (var b : open) {
                double d = Math.abs(b.anchorX - de.x());
                if (d <= threshold && d < best) {
                    best = d;
                    nearest = b;
                }
            }
            if (nearest == null) {
                nearest = new Builder(open.size());
                open.add(nearest);
            }
            nearest.add(de);
        }
        return open.stream().map(Builder::build).toList();
    }

    /** Zoom changes re-run the whole scan on every event, carried-over ones included. */
    public List<EventCluster> recluster(List<EventCluster> clusters) {
        var all = new ArrayList<DistributedEvent>();
        clusters.forEach(c -> {
            all.addAll(c.members());
            all.addAll(c.overflow());
        });
        return cluster(all);
    }

    private static final class Builder {
        final int index;
        final List<DistributedEvent> members = new ArrayList<>();
        double anchorX;
        double anchorTime;

        Builder(int index) { this.index = index; }

        void add(DistributedEvent de) {
            members.add(de);
            // running mean stays exact when all members share one position
            anchorX += (de.x() - anchorX) / members.size();
            anchorTime += (de.timestamp() - anchorTime) / members.size();
        }

        EventCluster build() {
            var ids = members.stream().map(DistributedEvent::id).toList();
            var anchor = new Anchor("anchor-" + index, anchorX, Math.round(anchorTime), ids, ids.size());
            return new EventCluster("cluster-" + index, anchor, members);
        }
    }
}
