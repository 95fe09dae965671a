package io.chronolayout.core.position;

import io.chronolayout.core.CardType;
import io.chronolayout.core.LayoutConfig;
import io.chronolayout.core.PositionedCard;
import io.chronolayout.core.Side;
import io.chronolayout.core.TestEvents;
import io.chronolayout.core.cluster.Anchor;
import io.chronolayout.core.cluster.EventCluster;
import io.chronolayout.core.degrade.CardPlan;
import io.chronolayout.core.degrade.ClusterPlan;
import io.chronolayout.core.degrade.SidePlan;
import io.chronolayout.core.slot.SlotGrid;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CardAssemblerTest {

    private LayoutConfig config;
    private EventCluster cluster;

    @BeforeEach
    void setUp() {
        config = LayoutConfig.defaults();
        cluster = new EventCluster("cluster-0", new Anchor("anchor-0", 500, 0, List.of("e0", "e1", "e2", "e3"), 4), List.of());
    }

    private ClusterPlan plan(double centre, SidePlan... sides) {
        return new ClusterPlan(cluster, Side.ABOVE, centre, SlotGrid.create("cluster-0", 8, new double[]{centre}, 400, 44),
                List.of(sides));
    }

    private static CardPlan card(String id, CardType type, Side side, int column, int eventIndex) {
        return new CardPlan(id, type, List.of(TestEvents.daily(4).get(eventIndex)), side, column, type.footprint());
    }

    @Test
    void assemble_stacksAboveCardsUpwardFromMargin() {
        var above = new SidePlan(Side.ABOVE, TestEvents.daily(2), List.of(
                card("a0", CardType.FULL, Side.ABOVE, 0, 0),
                card("a1", CardType.COMPACT, Side.ABOVE, 0, 1)), CardType.FULL, false);

        var cards = new CardAssembler(config, new SingleColumnPositioner()).assemble(List.of(plan(500, above)), 400);

        assertThat(cards).extracting(PositionedCard::id).containsExactly("a0", "a1");
        assertThat(cards.get(0).x()).isEqualTo(370);
        assertThat(cards.get(0).bottom()).isEqualTo(400 - 48);
        assertThat(cards.get(0).y()).isEqualTo(400 - 48 - 169);
        assertThat(cards.get(1).bottom()).isEqualTo(cards.get(0).y() - 12);
        assertThat(cards.get(1).height()).isEqualTo(82);
        assertThat(cards.get(0).overlaps(cards.get(1))).isFalse();
    }

    @Test
    void assemble_stacksBelowCardsDownwardFromMargin() {
        var below = new SidePlan(Side.BELOW, TestEvents.daily(2), List.of(
                card("b0", CardType.TITLE_ONLY, Side.BELOW, 0, 2),
                card("b1", CardType.TITLE_ONLY, Side.BELOW, 0, 3)), CardType.TITLE_ONLY, false);

        var cards = new CardAssembler(config, new SingleColumnPositioner()).assemble(List.of(plan(500, below)), 400);

        assertThat(cards.get(0).y()).isEqualTo(455);
        assertThat(cards.get(1).y()).isEqualTo(455 + 32 + 12);
        assertThat(cards).allSatisfy(c -> {
            assertThat(c.clusterId()).isEqualTo("cluster-0");
            assertThat(c.side()).isEqualTo(Side.BELOW);
            assertThat(c.eventCount()).isEqualTo(1);
        });
    }

    @Test
    void assemble_dualColumnsStackIndependently() {
        var above = new SidePlan(Side.ABOVE, TestEvents.daily(2), List.of(
                card("l", CardType.COMPACT, Side.ABOVE, 0, 0),
                card("r", CardType.COMPACT, Side.ABOVE, 1, 1)), CardType.COMPACT, false);

        var cards = new CardAssembler(config, new DualColumnPositioner()).assemble(List.of(plan(500, above)), 400);

        assertThat(cards.get(0).x()).isEqualTo(500 - 140 - 130);
        assertThat(cards.get(1).x()).isEqualTo(500 + 140 - 130);
        assertThat(cards.get(0).y()).isEqualTo(cards.get(1).y());
        assertThat(cards.get(1).x() - cards.get(0).right()).isEqualTo(20);
    }
}
