package io.chronolayout.core.distribution;

import io.chronolayout.core.TimelineEvent;

/**
 * An event with its horizontal position and local density (events per day).
 * {@code originalIndex} is the event's position in the caller's list.
 */
public record DistributedEvent(TimelineEvent event, long timestamp, double x, int originalIndex, double density) {

    public String id() { return event.id(); }

    public DistributedEvent withX(double newX) {
        return new DistributedEvent(event, timestamp, newX, originalIndex, density);
    }
}
