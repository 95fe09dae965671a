package io.chronolayout.core.distribution;

public record SpaceAllocation(int recommendedColumnCount, double columnWidth, double spacing, double utilizationTarget) {

    /** Minimum distance between neighbouring events when the spacing pass runs. */
    public double pitch() { return columnWidth + spacing; }
}
