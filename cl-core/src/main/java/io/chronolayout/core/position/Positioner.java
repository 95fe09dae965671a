package io.chronolayout.core.position;

import io.chronolayout.core.LayoutConfig;

/** Column arrangement used for every cluster: how many columns, and where each sits. */
public interface Positioner {

    int columns();

    /** Horizontal offset of a column's centre from the cluster's column centre. */
    double columnOffset(int column, LayoutConfig config);

    String name();
}
