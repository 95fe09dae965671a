package io.chronolayout.core.distribution;

import io.chronolayout.core.TestEvents;
import io.chronolayout.core.TimelineEvent;
import io.chronolayout.core.bounds.TimelineBoundsCalculator;
import io.chronolayout.core.bounds.ViewportMapping;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class EventDistributionEngineTest {

    private EventDistributionEngine engine;
    private TimelineBoundsCalculator bounds;

    @BeforeEach
    void setUp() {
        engine = new EventDistributionEngine(Duration.ofDays(30));
        bounds = new TimelineBoundsCalculator(Clock.systemUTC());
    }

    private ViewportMapping mapping(List<TimelineEvent> events, double width) {
        return bounds.createViewportMapping(bounds.calculateBounds(events, 1.0), width);
    }

    @Test
    void distribute_sortsChronologicallyAndKeepsTieOrder() {
        var events = new ArrayList<TimelineEvent>();
        events.add(TimelineEvent.of("late", TestEvents.START.plusDays(5), "late"));
        events.add(TimelineEvent.of("tie-a", TestEvents.START, "a"));
        events.add(TimelineEvent.of("tie-b", TestEvents.START, "b"));

        var out = engine.distribute(events, mapping(events, 1200));

        assertThat(out).extracting(DistributedEvent::id).containsExactly("tie-a", "tie-b", "late");
        assertThat(out).extracting(DistributedEvent::originalIndex).containsExactly(1, 2, 0);
        assertThat(out.get(0).x()).isLessThan(out.get(2).x());
    }

    @Test
    void distribute_measuresDensityInWindow() {
        var events = TestEvents.sameDay(3);

        var out = engine.distribute(events, mapping(events, 1200));

        assertThat(out).allSatisfy(de -> assertThat(de.density()).isCloseTo(0.1, within(1e-9)));
    }

    @Test
    void distribute_emptyInput() {
        assertThat(engine.distribute(List.of(), mapping(List.of(), 1200))).isEmpty();
    }

    @Test
    void distribute_keepsPositionsWhenSpreadWouldLeaveTimeline() {
        var events = TestEvents.sameDay(8);

        var out = engine.distribute(events, mapping(events, 1200));

        assertThat(out).extracting(DistributedEvent::x).containsOnly(out.get(0).x());
    }

    @Test
    void distribute_spreadsCrowdedEventsWhenRowFits() {
        var events = TestEvents.sameDay(8);
        var wide = mapping(events, 3400);

        var out = engine.distribute(events, wide);

        assertThat(out).extracting(DistributedEvent::id).containsExactly("e0", "e1", "e2", "e3", "e4", "e5", "e6", "e7");
        for (int i = 1; i < out.size(); i++) {
            assertThat(out.get(i).x() - out.get(i - 1).x()).isGreaterThanOrEqualTo(220 - 1e-9);
        }
        assertThat(out.get(out.size() - 1).x()).isLessThanOrEqualTo(wide.rightEdge());
    }

    @Test
    void applySpacing_onlyPushesRight() {
        var e = TestEvents.daily(3);
        var sorted = List.of(
                new DistributedEvent(e.get(0), 0, 100, 0, 0),
                new DistributedEvent(e.get(1), 1, 110, 1, 0),
                new DistributedEvent(e.get(2), 2, 500, 2, 0));

        var out = EventDistributionEngine.applySpacing(sorted, 50);

        assertThat(out).extracting(DistributedEvent::x).containsExactly(100.0, 150.0, 500.0);
    }

    @Test
    void calculateSpaceAllocation_boundedByWidth() {
        var events = TestEvents.daily(25);
        var allocation = engine.calculateSpaceAllocation(25, mapping(events, 1200));

        assertThat(allocation.recommendedColumnCount()).isEqualTo(3);
        assertThat(allocation.columnWidth()).isEqualTo(200);
        assertThat(allocation.spacing()).isEqualTo(20);
        assertThat(allocation.utilizationTarget()).isEqualTo(0.8);
    }

    @Test
    void calculateSpaceAllocation_zeroWidthKeepsMinimumColumn() {
        var allocation = engine.calculateSpaceAllocation(10, mapping(TestEvents.daily(10), 0));

        assertThat(allocation.recommendedColumnCount()).isZero();
        assertThat(allocation.columnWidth()).isGreaterThanOrEqualTo(150);
    }

    @Test
    void calculateMetrics_reportsDensityRange() {
        var events = TestEvents.daily(10);
        var m = mapping(events, 1200);
        var metrics = engine.calculateMetrics(engine.distribute(events, m), m);

        assertThat(metrics.totalEvents()).isEqualTo(10);
        assertThat(metrics.maxDensity()).isGreaterThanOrEqualTo(metrics.averageDensity());
        assertThat(metrics.minDensity()).isLessThanOrEqualTo(metrics.averageDensity());
        assertThat(engine.calculateMetrics(List.of(), m)).isEqualTo(DistributionMetrics.EMPTY);
    }

    @Test
    void analyzeDensity_classifiesEventsPerDay() {
        var b = bounds.calculateBounds(TestEvents.daily(10), 1.0);

        assertThat(engine.analyzeDensity(200, b).level()).isEqualTo(DensityAnalysis.Level.HIGH);
        assertThat(engine.analyzeDensity(20, b).level()).isEqualTo(DensityAnalysis.Level.MEDIUM);
        assertThat(engine.analyzeDensity(2, b).level()).isEqualTo(DensityAnalysis.Level.LOW);
    }
}
