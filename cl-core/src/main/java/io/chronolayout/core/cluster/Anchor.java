package io.chronolayout.core.cluster;

import java.util.List;

/**
 * Representative point of a cluster: centroid x and timestamp of its members.
 * {@code overflowCount} counts events carried over from a cluster that had no room to its right.
 */
public record Anchor(String id, double x, long timestamp, List<String> eventIds, int eventCount, int overflowCount) {
    public Anchor {
        eventIds = List.copyOf(eventIds);
        if (overflowCount < 0) throw new IllegalArgumentException("overflowCount must be >= 0: " + overflowCount);
    }

    public Anchor(String id, double x, long timestamp, List<String> eventIds, int eventCount) {
        this(id, x, timestamp, eventIds, eventCount, 0);
    }

    public Anchor withOverflow(int carried) {
        return new Anchor(id, x, timestamp, eventIds, eventCount, overflowCount + carried);
    }
}
