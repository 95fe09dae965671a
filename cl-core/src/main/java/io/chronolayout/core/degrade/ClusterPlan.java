package io.chronolayout.core.degrade;

import io.chronolayout.core.Side;
import io.chronolayout.core.cluster.EventCluster;
import io.chronolayout.core.slot.SlotGrid;

import java.util.List;

/** Degradation outcome for one cluster: its final grid and a plan per side in use. */
public record ClusterPlan(EventCluster cluster, Side primarySide, double columnCenter, SlotGrid grid, List<SidePlan> sides) {
    public ClusterPlan {
        sides = List.copyOf(sides);
    }

    public List<CardPlan> cards() {
        return sides.stream().flatMap(s -> s.cards().stream()).toList();
    }

    public boolean mixedTypes() {
        return sides.stream().anyMatch(s -> !s.uniform());
    }

    public boolean overflowed() {
        return sides.stream().anyMatch(SidePlan::hasSummaryCards);
    }
}
