package io.chronolayout.core.distribution;

import io.chronolayout.core.TimelineEvent;
import io.chronolayout.core.bounds.TimelineBounds;
import io.chronolayout.core.bounds.ViewportMapping;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Maps events onto the timeline and measures local density.
 *
 * Events are sorted chronologically (stable: equal timestamps keep caller order). When many
 * events compete for few columns but the whole row still fits on screen at the column pitch,
 * a left-to-right spacing pass pushes each event right until it clears its predecessor by one
 * pitch. The pass never reorders events.
 */
public final class EventDistributionEngine {
    static final double UTILIZATION_TARGET = 0.8;
    static final double BASE_COLUMN_WIDTH = 200;
    static final double MIN_COLUMN_WIDTH = 150;
    static final double BASE_SPACING = 20;
    static final int EVENTS_PER_COLUMN = 8;
    private static final double DAY_MS = Duration.ofDays(1).toMillis();

    private final long densityWindowMs;

    public EventDistributionEngine(Duration densityWindow) {
        this.densityWindowMs = Objects.requireNonNull(densityWindow).toMillis();
        if (densityWindowMs <= 0) throw new IllegalArgumentException("densityWindow must be positive");
    }

    public List<DistributedEvent> distribute(List<TimelineEvent> events, ViewportMapping mapping) {
        if (events.isEmpty()) return List.of();

        var indexed = new ArrayList<DistributedEvent>(events.size());
        for (int i = 0; i < events.size(); i++) {
            var e = events.get(i);
            long t = e.epochMillis();
            indexed.add(new DistributedEvent(e, t, mapping.timeToX(t), i, 0));
        }
        indexed.sort(Comparator.comparingLong(DistributedEvent::timestamp));

        var withDensity = withLocalDensity(indexed);
        return optimizeHorizontalDistribution(withDensity, mapping);
    }

    /** Events per day inside a window centred on each event; input must be sorted. */
    private List<DistributedEvent> withLocalDensity(List<DistributedEvent> sorted) {
        double windowDays = densityWindowMs / DAY_MS;
        long half = densityWindowMs / 2;
        var out = new ArrayList<DistributedEvent>(sorted.size());
        int lo = 0, hi = 0;
        for (var de : sorted) {
            long t = de.timestamp();
            while (sorted.get(lo).timestamp() < t - half) lo++;
            while (hi < sorted.size() && sorted.get(hi).timestamp() <= t + half) hi++;
            double density = (hi - lo) / windowDays;
            out.add(new DistributedEvent(de.event(), t, de.x(), de.originalIndex(), density));
        }
        return out;
    }

    public SpaceAllocation calculateSpaceAllocation(int eventCount, ViewportMapping mapping) {
        double available = mapping.timelineWidth() * UTILIZATION_TARGET;
        int maxPossible = (int) Math.floor(available / (BASE_COLUMN_WIDTH + BASE_SPACING));
        int ideal = (int) Math.ceil(eventCount / (double) EVENTS_PER_COLUMN);
        int recommended = Math.max(0, Math.min(maxPossible, ideal));

        double columnWidth = BASE_COLUMN_WIDTH;
        if (recommended > 0) {
            columnWidth = Math.min(BASE_COLUMN_WIDTH, (available - (recommended - 1) * BASE_SPACING) / recommended);
        }
        return new SpaceAllocation(recommended, Math.max(MIN_COLUMN_WIDTH, columnWidth), BASE_SPACING, UTILIZATION_TARGET);
    }

    private List<DistributedEvent> optimizeHorizontalDistribution(List<DistributedEvent> sorted, ViewportMapping mapping) {
        if (sorted.size() <= 1) return List.copyOf(sorted);

        var allocation = calculateSpaceAllocation(sorted.size(), mapping);
        if (allocation.recommendedColumnCount() >= sorted.size() / 4.0) return List.copyOf(sorted);

        var spread = applySpacing(sorted, allocation.pitch());
        // only spread when the row still ends on screen
        if (spread.get(spread.size() - 1).x() > mapping.rightEdge()) return List.copyOf(sorted);
        return spread;
    }

    static List<DistributedEvent> applySpacing(List<DistributedEvent> sorted, double pitch) {
        var out = new ArrayList<DistributedEvent>(sorted.size());
        DistributedEvent prev = null;
        for (var de : sorted) {
            if (prev != null && de.x() - prev.x() < pitch) {
                de = de.withX(prev.x() + pitch);
            }
            out.add(de);
            prev = de;
        }
        return List.copyOf(out);
    }

    public DistributionMetrics calculateMetrics(List<DistributedEvent> events, ViewportMapping mapping) {
        if (events.isEmpty()) return DistributionMetrics.EMPTY;

        double sum = 0, max = Double.NEGATIVE_INFINITY, min = Double.POSITIVE_INFINITY;
        double minX = Double.POSITIVE_INFINITY, maxX = Double.NEGATIVE_INFINITY;
        int closePairs = 0;
        for (int i = 0; i < events.size(); i++) {
            var de = events.get(i);
            sum += de.density();
            max = Math.max(max, de.density());
            min = Math.min(min, de.density());
            minX = Math.min(minX, de.x());
            maxX = Math.max(maxX, de.x());
            if (i > 0 && Math.abs(de.timestamp() - events.get(i - 1).timestamp()) < DAY_MS) closePairs++;
        }
        double width = mapping.timelineWidth();
        double utilization = width > 0 ? (maxX - minX) / width * 100 : 0;
        double perPixel = width > 0 ? events.size() / width : Double.POSITIVE_INFINITY;
        boolean recommend = perPixel > 0.1 || utilization < 60 || closePairs > events.size() * 0.3;

        return new DistributionMetrics(events.size(), sum / events.size(), max, min, utilization, recommend);
    }

    public DensityAnalysis analyzeDensity(int eventCount, TimelineBounds bounds) {
        double days = Math.max(1, bounds.duration() / DAY_MS);
        return DensityAnalysis.of(eventCount / days);
    }
}
