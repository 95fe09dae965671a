package io.chronolayout.core.position;

import io.chronolayout.core.LayoutConfig;

/** Two columns per side, left and right of the cluster centre, one column spacing apart. */
public final class DualColumnPositioner implements Positioner {
    @Override public int columns() { return 2; }

    @Override
    public double columnOffset(int column, LayoutConfig config) {
        double half = (config.maxCardWidth() + config.columnSpacing()) / 2;
        return column == 0 ? -half : half;
    }

    @Override public String name() { return "dual"; }
}
