package io.chronolayout.core.degrade;

import io.chronolayout.core.CardType;
import io.chronolayout.core.Side;
import io.chronolayout.core.TimelineEvent;

import java.util.Comparator;
import java.util.List;

/**
 * Cards chosen for one side of one cluster, in chronological order.
 * {@code preferred} is the type the event count alone asked for.
 */
public record SidePlan(Side side, List<TimelineEvent> events, List<CardPlan> cards, CardType preferred, boolean promoted) {
    public SidePlan {
        events = List.copyOf(events);
        cards = List.copyOf(cards);
    }

    /** True when every card has the same type. */
    public boolean uniform() {
        return cards.stream().map(CardPlan::type).distinct().count() <= 1;
    }

    /** Lowest-fidelity type on the side; null for an empty side. */
    public CardType floorType() {
        return cards.stream().map(CardPlan::type).max(Comparator.comparingInt(CardType::level)).orElse(null);
    }

    public int cellsUsed() {
        return cards.stream().mapToInt(CardPlan::cells).sum();
    }

    public boolean hasSummaryCards() {
        return cards.stream().anyMatch(c -> c.type().isSummary());
    }

    SidePlan withCards(List<CardPlan> newCards, boolean wasPromoted) {
        return new SidePlan(side, events, newCards, preferred, wasPromoted);
    }
}
