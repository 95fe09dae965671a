package io.chronolayout.core.degrade;

import io.chronolayout.core.LayoutConfig;
import io.chronolayout.core.Side;
import io.chronolayout.core.TimelineEvent;
import io.chronolayout.core.cluster.EventCluster;
import io.chronolayout.core.position.ColumnPlacement;
import io.chronolayout.core.position.Positioner;
import io.chronolayout.core.slot.SlotGrid;
import io.chronolayout.core.slot.Utilization;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Runs degradation for a whole layout pass.
 *
 * Splits each cluster's events between its sides, places cluster columns (carrying a cluster
 * that would be pushed off the right edge over into its neighbour), gives every cluster a
 * fresh slot grid and plans its sides, then promotes sparse sides while the layout is under the
 * low-water utilization mark.
 */
public final class DegradationCoordinator {
    private static final Logger log = LoggerFactory.getLogger(DegradationCoordinator.class);

    private final LayoutConfig config;
    private final DegradationEngine engine;
    private final Positioner positioner;

    public DegradationCoordinator(LayoutConfig config, DegradationEngine engine, Positioner positioner) {
        this.config = Objects.requireNonNull(config);
        this.engine = Objects.requireNonNull(engine);
        this.positioner = Objects.requireNonNull(positioner);
    }

    public record Coordination(List<ClusterPlan> plans, Utilization utilization, DegradationMetrics metrics) {
        public Coordination {
            plans = List.copyOf(plans);
        }
    }

    public Positioner positioner() { return positioner; }

    /** Clusters alternate their primary side, starting above. */
    public static Side primarySide(int clusterIndex) {
        return clusterIndex % 2 == 0 ? Side.ABOVE : Side.BELOW;
    }

    /**
     * All events go to the primary side when they fit there as title-only cards; otherwise
     * they alternate chronologically, starting with the primary side.
     */
    public static Map<Side, List<TimelineEvent>> splitSides(List<TimelineEvent> events, Side primary, int sideCapacity) {
        var split = new EnumMap<Side, List<TimelineEvent>>(Side.class);
        split.put(primary, new ArrayList<>());
        split.put(primary.opposite(), new ArrayList<>());
        boolean alternate = sideCapacity > 0 && events.size() > sideCapacity;
        for (int i = 0; i < events.size(); i++) {
            var side = !alternate || i % 2 == 0 ? primary : primary.opposite();
            split.get(side).add(events.get(i));
        }
        return split;
    }

    public Coordination coordinate(List<EventCluster> clusters, int cellsPerSide, double axisY) {
        return coordinate(clusters, cellsPerSide, axisY, Double.POSITIVE_INFINITY);
    }

    /**
     * As {@link #coordinate(List, int, double)}, with {@code rightLimit} as the x no pushed column
     * may cross. A cluster that would be pushed past it is carried over into its left neighbour.
     */
    public Coordination coordinate(List<EventCluster> input, int cellsPerSide, double axisY, double rightLimit) {
        if (input.isEmpty()) return new Coordination(List.of(), Utilization.EMPTY, DegradationMetrics.EMPTY);

        int columns = positioner.columns();
        double halfWidth = ColumnPlacement.footprintWidth(config, columns) / 2;
        var columnPlacement = new ColumnPlacement(config, columns);
        var clusters = new ArrayList<>(input);
        List<Map<Side, List<TimelineEvent>>> splits;
        double[] centres;
        while (true) {
            splits = new ArrayList<>(clusters.size());
            var footprints = new ArrayList<ColumnPlacement.Footprint>(clusters.size());
            for (int i = 0; i < clusters.size(); i++) {
                var cluster = clusters.get(i);
                var split = splitSides(cluster.events(), primarySide(i), cellsPerSide * columns);
                splits.add(split);
                var used = split.entrySet().stream().filter(e -> !e.getValue().isEmpty()).map(Map.Entry::getKey).toList();
                footprints.add(new ColumnPlacement.Footprint(cluster.anchor().x(), Set.copyOf(used)));
            }
            centres = columnPlacement.place(footprints);
            if (!carryOver(clusters, centres, halfWidth, rightLimit)) break;
        }

        var plans = new ArrayList<ClusterPlan>(clusters.size());
        for (int i = 0; i < clusters.size(); i++) {
            var cluster = clusters.get(i);
            var primary = primarySide(i);
            var columnXs = new double[columns];
            for (int c = 0; c < columns; c++) columnXs[c] = centres[i] + positioner.columnOffset(c, config);

            var grid = SlotGrid.create(cluster.id(), cellsPerSide, columnXs, axisY, config.cellPitch());
            var sides = new ArrayList<SidePlan>(2);
            for (var side : List.of(primary, primary.opposite())) {
                var events = splits.get(i).get(side);
                if (events.isEmpty()) continue;
                var placement = engine.planSide(cluster.id(), side, events, grid);
                grid = placement.grid();
                sides.add(placement.plan());
            }
            plans.add(new ClusterPlan(cluster, primary, centres[i], grid, sides));
        }

        int promotions = config.promotionEnabled() ? promote(plans) : 0;
        var utilization = utilization(plans);
        var metrics = DegradationMetrics.of(plans, promotions);
        log.debug("Degraded {} clusters into {} groups ({} promoted, {} with overflow), utilization {}%",
                plans.size(), metrics.totalGroups(), promotions, metrics.clustersWithOverflow(),
                Math.round(utilization.percentage()));
        return new Coordination(plans, utilization, metrics);
    }

    /**
     * Merges the leftmost cluster pushed past {@code rightLimit} into the cluster placed just
     * before it. Returns false when no cluster crosses the limit.
     */
    private static boolean carryOver(List<EventCluster> clusters, double[] centres, double halfWidth, double rightLimit) {
        var order = new ArrayList<Integer>(clusters.size());
        for (int i = 0; i < clusters.size(); i++) order.add(i);
        order.sort(Comparator.comparingDouble(i -> clusters.get(i).anchor().x()));
        for (int p = 1; p < order.size(); p++) {
            int i = order.get(p);
            var cluster = clusters.get(i);
            boolean pushed = centres[i] > cluster.anchor().x();
            if (!pushed || centres[i] + halfWidth <= rightLimit) continue;

            int target = order.get(p - 1);
            var into = clusters.get(target);
            log.debug("{} would end at {} past {}, carrying {} events into {}", cluster.id(),
                    Math.round(centres[i] + halfWidth), Math.round(rightLimit), cluster.size(), into.id());
            clusters.set(target, into.absorb(cluster));
            clusters.remove(i);
            return true;
        }
        return false;
    }

    /** Promotes uniform sides one step at a time, in cluster order, until utilization reaches the mark. */
    private int promote(List<ClusterPlan> plans) {
        int promotions = 0;
        boolean changed = true;
        while (changed) {
            changed = false;
            for (int i = 0; i < plans.size(); i++) {
                for (int s = 0; s < plans.get(i).sides().size(); s++) {
                    if (utilization(plans).percentage() >= config.promotionLowWater()) return promotions;
                    var plan = plans.get(i);
                    var side = plan.sides().get(s);
                    var promoted = engine.promote(plan.cluster().id(), side, plan.grid());
                    if (promoted == null) continue;

                    var sides = new ArrayList<>(plan.sides());
                    sides.set(s, promoted.plan());
                    plans.set(i, new ClusterPlan(plan.cluster(), plan.primarySide(), plan.columnCenter(), promoted.grid(), sides));
                    promotions++;
                    changed = true;
                    log.debug("{} {}: promoted {} -> {}", plan.cluster().id(), side.side(),
                            side.floorType(), promoted.plan().floorType());
                }
            }
        }
        return promotions;
    }

    private static Utilization utilization(List<ClusterPlan> plans) {
        var total = Utilization.EMPTY;
        for (var p : plans) total = total.plus(p.grid().utilization());
        return total;
    }
}
