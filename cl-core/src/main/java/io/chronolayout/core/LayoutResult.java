package io.chronolayout.core;

import io.chronolayout.core.bounds.TimelineBounds;
import io.chronolayout.core.cluster.Anchor;
import io.chronolayout.core.degrade.DegradationMetrics;
import io.chronolayout.core.slot.Utilization;

import java.util.List;

public record LayoutResult(
        List<PositionedCard> positionedCards,
        List<Anchor> anchors,
        List<ClusterLayout> clusters,
        Utilization utilization,
        TimelineBounds bounds,
        DegradationMetrics degradationMetrics
) {
    public LayoutResult {
        positionedCards = List.copyOf(positionedCards);
        anchors = List.copyOf(anchors);
        clusters = List.copyOf(clusters);
    }

    public static LayoutResult empty(TimelineBounds bounds) {
        return new LayoutResult(List.of(), List.of(), List.of(), Utilization.EMPTY, bounds, DegradationMetrics.EMPTY);
    }

    public int eventCount() {
        return positionedCards.stream().mapToInt(PositionedCard::eventCount).sum();
    }
}
