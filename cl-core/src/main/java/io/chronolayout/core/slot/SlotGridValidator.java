package io.chronolayout.core.slot;

import io.chronolayout.core.CardType;
import io.chronolayout.core.Side;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Consistency checks for a slot grid. Returns problems as text; an empty list means consistent. */
public final class SlotGridValidator {
    private SlotGridValidator() {}

    public static List<String> validate(SlotGrid grid) {
        var problems = new ArrayList<String>();
        int flagged = 0;
        var cellsPerCard = new HashMap<String, Integer>();
        var typeOfCard = new HashMap<String, CardType>();
        for (var s : grid.slots()) {
            if (!s.occupied()) continue;
            flagged++;
            if (s.cardId() == null || s.cardType() == null) {
                problems.add(grid.clusterId() + ": occupied slot without card at " + s.side() + "/" + s.column() + "/" + s.row());
                continue;
            }
            cellsPerCard.merge(s.cardId(), 1, Integer::sum);
            typeOfCard.put(s.cardId(), s.cardType());
        }
        if (flagged != grid.trackedUsedSlots()) {
            problems.add(grid.clusterId() + ": tracked " + grid.trackedUsedSlots() + " used slots but " + flagged + " are flagged");
        }
        for (var side : Side.values()) {
            for (int c = 0; c < grid.columns(); c++) {
                int used = grid.usedCells(side, c);
                if (used > grid.cellsPerSide()) {
                    problems.add(grid.clusterId() + ": " + side + " column " + c + " holds " + used + " of " + grid.cellsPerSide() + " cells");
                }
            }
        }
        for (Map.Entry<String, Integer> e : cellsPerCard.entrySet()) {
            var type = typeOfCard.get(e.getKey());
            if (e.getValue() != type.footprint()) {
                problems.add(grid.clusterId() + ": card " + e.getKey() + " holds " + e.getValue() + " cells, footprint is " + type.footprint());
            }
        }
        return problems;
    }
}
