package io.chronolayout.core.position;

import io.chronolayout.core.LayoutConfig;

public final class SingleColumnPositioner implements Positioner {
    @Override public int columns() { return 1; }
    @Override public double columnOffset(int column, LayoutConfig config) { return 0; }
    @Override public String name() { return "single"; }
}
