package io.chronolayout.core.position;

import io.chronolayout.core.LayoutConfig;
import io.chronolayout.core.Side;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Set;

/**
 * Horizontal column centres for clusters.
 *
 * A cluster's columns start centred on its anchor; scanning left to right, a cluster is pushed
 * right until its footprint clears the previous footprint on every side it uses by the column
 * spacing. Clusters on opposite sides never push each other. Anchors are left untouched.
 */
public final class ColumnPlacement {
    private final double halfWidth;
    private final double spacing;

    public record Footprint(double anchorX, Set<Side> sides) {
        public Footprint {
            sides = Set.copyOf(sides);
        }
    }

    public ColumnPlacement(LayoutConfig config, int columns) {
        this.halfWidth = footprintWidth(config, columns) / 2;
        this.spacing = config.columnSpacing();
    }

    public static double footprintWidth(LayoutConfig config, int columns) {
        return columns * config.maxCardWidth() + Math.max(0, columns - 1) * config.columnSpacing();
    }

    /** Column centres, in input order. */
    public double[] place(List<Footprint> clusters) {
        var order = new ArrayList<Integer>(clusters.size());
        for (int i = 0; i < clusters.size(); i++) order.add(i);
        order.sort(Comparator.comparingDouble(i -> clusters.get(i).anchorX()));

        var lastRight = new EnumMap<Side, Double>(Side.class);
        var centres = new double[clusters.size()];
        for (int i : order) {
            var fp = clusters.get(i);
            double centre = fp.anchorX();
            for (var side : fp.sides()) {
                Double right = lastRight.get(side);
                if (right != null) centre = Math.max(centre, right + spacing + halfWidth);
            }
            for (var side : fp.sides()) lastRight.put(side, centre + halfWidth);
            centres[i] = centre;
        }
        return centres;
    }
}
