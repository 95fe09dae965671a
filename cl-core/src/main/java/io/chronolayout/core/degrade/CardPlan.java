package io.chronolayout.core.degrade;

import io.chronolayout.core.CardType;
import io.chronolayout.core.Side;
import io.chronolayout.core.TimelineEvent;

import java.util.List;
import java.util.Objects;

/**
 * A card decided by degradation but not yet positioned in pixels.
 * {@code column} is -1 and {@code cells} 0 for a card that is not backed by slots.
 */
public record CardPlan(String cardId, CardType type, List<TimelineEvent> events, Side side, int column, int cells) {
    public CardPlan {
        Objects.requireNonNull(cardId);
        Objects.requireNonNull(type);
        Objects.requireNonNull(side);
        events = List.copyOf(events);
        if (events.isEmpty()) throw new IllegalArgumentException("card " + cardId + " has no events");
    }

    public boolean slotted() { return column >= 0; }

    public int eventCount() { return events.size(); }
}
