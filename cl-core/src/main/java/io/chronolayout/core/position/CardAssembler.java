package io.chronolayout.core.position;

import io.chronolayout.core.LayoutConfig;
import io.chronolayout.core.PositionedCard;
import io.chronolayout.core.Side;
import io.chronolayout.core.degrade.CardPlan;
import io.chronolayout.core.degrade.ClusterPlan;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Turns card plans into pixel rectangles.
 *
 * Cards stack outward from the axis per column, each one its own height plus row spacing away
 * from the previous. Above-side stacks start {@code aboveAxisMargin} over the axis and grow
 * upward; below-side stacks start {@code belowAxisMargin} under it and grow downward.
 */
public final class CardAssembler {
    private final LayoutConfig config;
    private final Positioner positioner;

    public CardAssembler(LayoutConfig config, Positioner positioner) {
        this.config = Objects.requireNonNull(config);
        this.positioner = Objects.requireNonNull(positioner);
    }

    public List<PositionedCard> assemble(List<ClusterPlan> plans, double axisY) {
        var out = new ArrayList<PositionedCard>();
        for (var plan : plans) {
            for (var side : plan.sides()) {
                var cursors = new double[positioner.columns()];
                Arrays.fill(cursors, side.side() == Side.ABOVE
                        ? axisY - config.aboveAxisMargin()
                        : axisY + config.belowAxisMargin());
                for (var card : side.cards()) {
                    out.add(position(plan, card, cursors));
                }
            }
        }
        return out;
    }

    private PositionedCard position(ClusterPlan plan, CardPlan card, double[] cursors) {
        var size = config.cardConfig(card.type());
        int column = Math.max(0, Math.min(card.column(), cursors.length - 1));
        double x = plan.columnCenter() + positioner.columnOffset(column, config) - size.width() / 2;
        double y;
        if (card.side() == Side.ABOVE) {
            y = cursors[column] - size.height();
            cursors[column] = y - config.rowSpacing();
        } else {
            y = cursors[column];
            cursors[column] = y + size.height() + config.rowSpacing();
        }
        return new PositionedCard(card.cardId(), card.events(), x, y, size.width(), size.height(),
                card.type(), plan.cluster().id(), card.side(), card.column(), card.eventCount(), card.cells());
    }
}
