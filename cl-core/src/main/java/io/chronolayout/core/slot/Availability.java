package io.chronolayout.core.slot;

/** Answer to a capacity query; {@code availableCells} counts every free cell on the side. */
public record Availability(boolean canFit, int requiredCells, int availableCells) {}
