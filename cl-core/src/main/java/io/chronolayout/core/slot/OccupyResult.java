package io.chronolayout.core.slot;

import java.util.List;

/**
 * Outcome of {@link SlotGrid#occupy}. On failure {@code grid} is the unchanged input grid and
 * {@code slots} is empty.
 */
public record OccupyResult(boolean success, SlotGrid grid, List<Slot> slots) {
    public OccupyResult {
        slots = List.copyOf(slots);
    }

    static OccupyResult failed(SlotGrid unchanged) {
        return new OccupyResult(false, unchanged, List.of());
    }

    /** Column holding the card, or -1 after a failure. */
    public int column() {
        return slots.isEmpty() ? -1 : slots.get(0).column();
    }
}
