package io.chronolayout.core;

import io.chronolayout.core.cluster.Anchor;

import java.util.List;

/** Per-cluster summary of a layout pass. */
public record ClusterLayout(String id, Anchor anchor, Side primarySide, double columnCenter, List<String> cardIds) {
    public ClusterLayout {
        cardIds = List.copyOf(cardIds);
    }
}
