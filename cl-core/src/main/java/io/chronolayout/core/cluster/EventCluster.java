package io.chronolayout.core.cluster;

import io.chronolayout.core.TimelineEvent;
import io.chronolayout.core.distribution.DistributedEvent;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Events grouped under one anchor. Members are in chronological order.
 *
 * {@code overflow} holds events carried over from a later cluster; they are laid out with this
 * cluster but do not move its anchor.
 */
public record EventCluster(String id, Anchor anchor, List<DistributedEvent> members, List<DistributedEvent> overflow) {
    public EventCluster {
        members = List.copyOf(members);
        overflow = List.copyOf(overflow);
    }

    public EventCluster(String id, Anchor anchor, List<DistributedEvent> members) {
        this(id, anchor, members, List.of());
    }

    /** Members and carried events, chronological (stable). */
    public List<TimelineEvent> events() {
        if (overflow.isEmpty()) return members.stream().map(DistributedEvent::event).toList();
        var all = new ArrayList<DistributedEvent>(members.size() + overflow.size());
        all.addAll(members);
        all.addAll(overflow);
        all.sort(Comparator.comparingLong(DistributedEvent::timestamp));
        return all.stream().map(DistributedEvent::event).toList();
    }

    public int size() { return members.size() + overflow.size(); }

    /** This cluster with every event of {@code other} carried over into it. */
    public EventCluster absorb(EventCluster other) {
        var carried = new ArrayList<DistributedEvent>(overflow.size() + other.size());
        carried.addAll(overflow);
        carried.addAll(other.members());
        carried.addAll(other.overflow());
        return new EventCluster(id, anchor.withOverflow(other.size()), members, carried);
    }
}
