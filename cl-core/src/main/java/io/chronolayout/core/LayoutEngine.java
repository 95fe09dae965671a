package io.chronolayout.core;

import io.chronolayout.core.bounds.TimelineBoundsCalculator;
import io.chronolayout.core.cluster.ClusterStats;
import io.chronolayout.core.cluster.EventClustering;
import io.chronolayout.core.degrade.CardPlan;
import io.chronolayout.core.degrade.DegradationCoordinator;
import io.chronolayout.core.degrade.DegradationEngine;
import io.chronolayout.core.degrade.DegradationStrategy;
import io.chronolayout.core.distribution.EventDistributionEngine;
import io.chronolayout.core.position.CardAssembler;
import io.chronolayout.core.position.Positioner;
import io.chronolayout.core.position.SingleColumnPositioner;
import io.chronolayout.core.validate.LayoutValidator;
import io.chronolayout.core.validate.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * Entry point of the layout pipeline: bounds, distribution, clustering, degradation, assembly.
 *
 * Each call is a full, stateless recomputation; the engine holds configuration only and can be
 * shared between threads. The clock is used for the default window when there are no events.
 */
public final class LayoutEngine {
    private static final Logger log = LoggerFactory.getLogger(LayoutEngine.class);

    private final LayoutConfig config;
    private final DegradationStrategy strategy;
    private final Positioner positioner;
    private final Clock clock;

    private final TimelineBoundsCalculator boundsCalculator;
    private final EventDistributionEngine distribution;
    private final EventClustering clustering;
    private final DegradationCoordinator coordinator;
    private final CardAssembler assembler;
    private final LayoutValidator validator;

    public LayoutEngine(LayoutConfig config, DegradationStrategy strategy, Positioner positioner, Clock clock) {
        this.config = Objects.requireNonNull(config);
        this.strategy = Objects.requireNonNull(strategy);
        this.positioner = Objects.requireNonNull(positioner);
        this.clock = Objects.requireNonNull(clock);
        this.boundsCalculator = new TimelineBoundsCalculator(clock);
        this.distribution = new EventDistributionEngine(config.densityWindow());
        this.clustering = new EventClustering(config.clusterThreshold());
        this.coordinator = new DegradationCoordinator(config, new DegradationEngine(config, strategy), positioner);
        this.assembler = new CardAssembler(config, positioner);
        this.validator = new LayoutValidator(config, strategy);
    }

    public static LayoutEngine defaults() {
        return new LayoutEngine(LayoutConfig.defaults(), DegradationStrategy.UNIFORM,
                new SingleColumnPositioner(), Clock.systemUTC());
    }

    public LayoutEngine withClock(Clock newClock) {
        return new LayoutEngine(config, strategy, positioner, newClock);
    }

    public LayoutConfig config() { return config; }
    public DegradationStrategy strategy() { return strategy; }
    public Positioner positioner() { return positioner; }

    /**
     * Lays out {@code events} in {@code viewport}. Null elements are ignored and a repeated id
     * keeps its first occurrence.
     */
    public LayoutResult layout(Collection<TimelineEvent> events, Viewport viewport, double zoomLevel) {
        Objects.requireNonNull(viewport, "viewport");
        var unique = uniqueEvents(events);
        var bounds = boundsCalculator.calculateBounds(unique, zoomLevel);
        if (unique.isEmpty()) return LayoutResult.empty(bounds);

        var mapping = boundsCalculator.createViewportMapping(bounds, viewport.width());
        var distributed = distribution.distribute(unique, mapping);
        if (log.isDebugEnabled()) {
            log.debug("Distributed: {}, density {}", distribution.calculateMetrics(distributed, mapping),
                    distribution.analyzeDensity(unique.size(), bounds));
        }
        var clusters = clustering.cluster(distributed);
        if (log.isDebugEnabled()) log.debug("Clustered: {}", ClusterStats.of(clusters).summary());

        int cellsPerSide = config.resolveCellsPerSide(viewport.height());
        double axisY = config.timelineY(viewport.height());
        double rightLimit = viewport.width() > 0 ? viewport.width() : Double.POSITIVE_INFINITY;
        var coordination = coordinator.coordinate(clusters, cellsPerSide, axisY, rightLimit);
        var cards = assembler.assemble(coordination.plans(), axisY);

        var clusterLayouts = coordination.plans().stream()
                .map(p -> new ClusterLayout(p.cluster().id(), p.cluster().anchor(), p.primarySide(), p.columnCenter(),
                        p.cards().stream().map(CardPlan::cardId).toList()))
                .toList();
        var anchors = coordination.plans().stream().map(p -> p.cluster().anchor()).toList();
        var result = new LayoutResult(cards, anchors, clusterLayouts, coordination.utilization(), bounds,
                coordination.metrics());

        var report = validator.validate(result, unique, viewport);
        if (!report.valid()) {
            log.warn("Layout of {} events has {} validation errors, first: {}",
                    unique.size(), report.errors().size(), report.errors().get(0));
        }
        log.debug("Laid out {} events as {} cards {}, {} cells per side, utilization {}%",
                unique.size(), cards.size(), LayoutValidator.typeCounts(cards), cellsPerSide,
                Math.round(coordination.utilization().percentage()));
        return result;
    }

    public ValidationReport validate(LayoutResult result, Collection<TimelineEvent> events, Viewport viewport) {
        return validator.validate(result, uniqueEvents(events), viewport);
    }

    private static List<TimelineEvent> uniqueEvents(Collection<TimelineEvent> events) {
        if (events == null) return List.of();
        var seen = new HashSet<String>();
        var out = new ArrayList<TimelineEvent>(events.size());
        for (var e : events) {
            if (e == null) continue;
            if (seen.add(e.id())) out.add(e);
            else log.warn("Skipping duplicate event id {}", e.id());
        }
        return out;
    }
}
