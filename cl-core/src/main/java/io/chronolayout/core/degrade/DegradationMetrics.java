package io.chronolayout.core.degrade;

import io.chronolayout.core.CardType;

import java.util.ArrayList;
import java.util.List;

/**
 * Telemetry of one degradation pass. A group is one side of one cluster, classified by its
 * lowest-fidelity card.
 */
public record DegradationMetrics(
        int totalGroups,
        int fullCardGroups,
        int compactCardGroups,
        int titleOnlyGroups,
        int multiEventGroups,
        int infiniteGroups,
        int promotions,
        int clustersWithOverflow,
        int clustersWithMixedTypes,
        int aggregatedEvents,
        int infiniteContainers,
        List<DegradationTrigger> triggers
) {
    public static final DegradationMetrics EMPTY = new DegradationMetrics(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, List.of());

    public DegradationMetrics {
        triggers = List.copyOf(triggers);
    }

    static DegradationMetrics of(List<ClusterPlan> plans, int promotions) {
        var c = new Collector();
        plans.forEach(c::add);
        return c.build(promotions);
    }

    private static final class Collector {
        int groups, full, compact, titleOnly, multi, infinite;
        int overflow, mixed, aggregated, containers;
        final List<DegradationTrigger> triggers = new ArrayList<>();

        void add(ClusterPlan plan) {
            if (plan.overflowed()) overflow++;
            if (plan.mixedTypes()) mixed++;
            for (var side : plan.sides()) {
                if (side.cards().isEmpty()) continue;
                groups++;
                var floor = side.floorType();
                switch (floor) {
                    case FULL -> full++;
                    case COMPACT -> compact++;
                    case TITLE_ONLY -> titleOnly++;
                    case MULTI_EVENT -> multi++;
                    case INFINITE -> infinite++;
                }
                for (var card : side.cards()) {
                    if (card.type().isSummary()) aggregated += card.eventCount();
                    if (card.type() == CardType.INFINITE) containers++;
                }
                if (floor.level() > side.preferred().level()) {
                    int wanted = side.events().size() * side.preferred().footprint();
                    triggers.add(new DegradationTrigger(plan.cluster().id(), side.side(), side.preferred(), floor,
                            side.events().size(), plan.grid().capacity(side.side()), wanted - side.cellsUsed()));
                }
            }
        }

        DegradationMetrics build(int promotions) {
            return new DegradationMetrics(groups, full, compact, titleOnly, multi, infinite, promotions,
                    overflow, mixed, aggregated, containers, triggers);
        }
    }
}
