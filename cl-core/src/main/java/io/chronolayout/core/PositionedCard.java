package io.chronolayout.core;

import java.util.List;
import java.util.Objects;

/**
 * A card with its final geometry. {@code x}/{@code y} is the top-left corner in viewport pixels.
 * {@code cells} is the slot footprint actually held, 0 for a card not backed by slots.
 */
public record PositionedCard(
        String id,
        List<TimelineEvent> events,
        double x,
        double y,
        double width,
        double height,
        CardType cardType,
        String clusterId,
        Side side,
        int column,
        int eventCount,
        int cells
) {
    public PositionedCard {
        Objects.requireNonNull(id);
        Objects.requireNonNull(cardType);
        Objects.requireNonNull(side);
        events = List.copyOf(events);
    }

    public List<String> eventIds() {
        return events.stream().map(TimelineEvent::id).toList();
    }

    public double right() { return x + width; }
    public double bottom() { return y + height; }

    /** Strict rectangle intersection; touching edges do not overlap. */
    public boolean overlaps(PositionedCard other) {
        return x < other.right() && other.x < right() && y < other.bottom() && other.y < bottom();
    }
}
