package io.chronolayout.core.validate;

import io.chronolayout.core.CardType;
import io.chronolayout.core.LayoutConfig;
import io.chronolayout.core.LayoutResult;
import io.chronolayout.core.PositionedCard;
import io.chronolayout.core.Side;
import io.chronolayout.core.TestEvents;
import io.chronolayout.core.TimelineEvent;
import io.chronolayout.core.Viewport;
import io.chronolayout.core.bounds.TimelineBounds;
import io.chronolayout.core.degrade.DegradationMetrics;
import io.chronolayout.core.degrade.DegradationStrategy;
import io.chronolayout.core.slot.Utilization;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LayoutValidatorTest {
    private static final Viewport VIEWPORT = new Viewport(1200, 1000);

    private LayoutValidator validator;
    private List<TimelineEvent> events;

    @BeforeEach
    void setUp() {
        validator = new LayoutValidator(LayoutConfig.defaults());
        events = TestEvents.daily(3);
    }

    private static PositionedCard card(String id, List<TimelineEvent> evs, double x, double y, CardType type, Side side) {
        var cfg = LayoutConfig.defaults().cardConfig(type);
        return new PositionedCard(id, evs, x, y, cfg.width(), cfg.height(), type, "cluster-0", side, 0,
                evs.size(), type.footprint());
    }

    private static LayoutResult result(PositionedCard... cards) {
        return new LayoutResult(List.of(cards), List.of(), List.of(), Utilization.EMPTY,
                new TimelineBounds(0, 1, 1, 0, 1), DegradationMetrics.EMPTY);
    }

    @Test
    void validate_acceptsCleanLayout() {
        var report = validator.validate(result(
                card("a", events.subList(0, 1), 100, 100, CardType.COMPACT, Side.ABOVE),
                card("b", events.subList(1, 3), 100, 200, CardType.MULTI_EVENT, Side.ABOVE)), events, VIEWPORT);

        assertThat(report.valid()).isTrue();
        assertThat(report.errors()).isEmpty();
        assertThat(report.warnings()).isEmpty();
        assertThat(report.cardTypeCounts()).containsEntry("compact", 1).containsEntry("multi-event", 1).containsEntry("full", 0);
        assertThat(report.degradationLevel()).isEqualTo(3);
        assertThat(report.hasMultiEventCards()).isTrue();
        assertThat(report.hasInfiniteCards()).isFalse();
    }

    @Test
    void validate_reportsOverlap() {
        var report = validator.validate(result(
                card("a", events.subList(0, 1), 100, 100, CardType.TITLE_ONLY, Side.ABOVE),
                card("b", events.subList(1, 2), 200, 110, CardType.TITLE_ONLY, Side.ABOVE),
                card("c", events.subList(2, 3), 100, 200, CardType.TITLE_ONLY, Side.ABOVE)), events, VIEWPORT);

        assertThat(report.valid()).isFalse();
        assertThat(report.errors()).containsExactly("Cards a and b overlap");
    }

    @Test
    void validate_reportsMissingAndRepeatedEvents() {
        var report = validator.validate(result(
                card("a", events.subList(0, 1), 100, 100, CardType.TITLE_ONLY, Side.ABOVE),
                card("b", events.subList(0, 1), 100, 200, CardType.TITLE_ONLY, Side.ABOVE)), events, VIEWPORT);

        assertThat(report.errors())
                .contains("Event e0 appears on 2 cards", "Event e1 is not on any card", "Event e2 is not on any card");
    }

    @Test
    void validate_reportsCapacityOverflow() {
        var tiny = new LayoutValidator(LayoutConfig.builder().cellsPerSide(2).build());

        var report = tiny.validate(result(
                card("a", events.subList(0, 1), 100, 100, CardType.COMPACT, Side.ABOVE),
                card("b", events.subList(1, 3), 100, 200, CardType.TITLE_ONLY, Side.ABOVE)), events, VIEWPORT);

        assertThat(report.errors()).anyMatch(e -> e.startsWith("Column cluster-0/above/0 uses 3 of 2"));
    }

    @Test
    void validate_reportsNonMonotonicTypes() {
        var report = validator.validate(result(
                card("a", events.subList(0, 1), 100, 300, CardType.TITLE_ONLY, Side.ABOVE),
                card("b", events.subList(1, 3), 100, 100, CardType.FULL, Side.ABOVE)), events, VIEWPORT);

        assertThat(report.errors()).anyMatch(e -> e.contains("b (full) follows a (title-only)"));
    }

    @Test
    void validate_mixedStrategyDowngradesNonMonotonicTypesToWarnings() {
        var mixed = new LayoutValidator(LayoutConfig.defaults(), DegradationStrategy.MIXED);

        var report = mixed.validate(result(
                card("a", events.subList(0, 1), 100, 300, CardType.TITLE_ONLY, Side.ABOVE),
                card("b", events.subList(1, 3), 100, 100, CardType.FULL, Side.ABOVE)), events, VIEWPORT);

        assertThat(report.valid()).isTrue();
        assertThat(report.warnings()).anyMatch(w -> w.contains("b (full) follows a (title-only)"));
    }

    @Test
    void validate_warnsOutsideViewport() {
        var report = validator.validate(result(
                card("a", events, -50, 100, CardType.MULTI_EVENT, Side.ABOVE)), events, VIEWPORT);

        assertThat(report.valid()).isTrue();
        assertThat(report.warnings()).containsExactly("Card a extends outside the viewport");
    }

    @Test
    void validate_emptyLayoutOfNoEventsIsValid() {
        var report = validator.validate(result(), List.of(), VIEWPORT);

        assertThat(report.valid()).isTrue();
        assertThat(report.degradationLevel()).isZero();
    }
}
