package io.chronolayout.core.slot;

import io.chronolayout.core.CardType;
import io.chronolayout.core.Side;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable slot budget of one cluster: {@code cellsPerSide} cells per column on each side.
 *
 * Every operation returns a new grid (or an explicit result carrying one), so a grid value can
 * be shared, retried or discarded freely. A card takes {@link CardType#footprint()} contiguous
 * cells in a single column: the least used column that can hold it, lowest index on ties.
 */
public final class SlotGrid {
    private final String clusterId;
    private final int columns;
    private final int cellsPerSide;
    private final List<Slot> slots;
    private final int usedSlots;

    SlotGrid(String clusterId, int columns, int cellsPerSide, List<Slot> slots, int usedSlots) {
        this.clusterId = clusterId;
        this.columns = columns;
        this.cellsPerSide = cellsPerSide;
        this.slots = List.copyOf(slots);
        this.usedSlots = usedSlots;
    }

    /**
     * Fresh, empty grid. {@code columnXs} holds the centre x of each column; above-side rows
     * climb from {@code axisY} and below-side rows descend from it, one {@code cellPitch} apart.
     */
    public static SlotGrid create(String clusterId, int cellsPerSide, double[] columnXs, double axisY, double cellPitch) {
        Objects.requireNonNull(clusterId);
        if (cellsPerSide < 0) throw new IllegalArgumentException("cellsPerSide must be >= 0");
        if (columnXs.length == 0) throw new IllegalArgumentException("at least one column is required");
        var slots = new ArrayList<Slot>(2 * columnXs.length * cellsPerSide);
        for (var side : Side.values()) {
            for (int c = 0; c < columnXs.length; c++) {
                for (int r = 0; r < cellsPerSide; r++) {
                    double y = side == Side.ABOVE ? axisY - (r + 1) * cellPitch : axisY + r * cellPitch;
                    slots.add(new Slot(side, c, r, columnXs[c], y, false, null, null));
                }
            }
        }
        return new SlotGrid(clusterId, columnXs.length, cellsPerSide, slots, 0);
    }

    public String clusterId() { return clusterId; }
    public int columns() { return columns; }
    public int cellsPerSide() { return cellsPerSide; }
    public List<Slot> slots() { return slots; }

    /** Occupied count as tracked by the grid, independent of the per-slot flags. */
    public int trackedUsedSlots() { return usedSlots; }

    public List<Slot> slots(Side side) {
        return slots.stream().filter(s -> s.side() == side).toList();
    }

    public List<Slot> slotsOf(String cardId) {
        return slots.stream().filter(s -> cardId.equals(s.cardId())).toList();
    }

    /** Card ids on one side, in slot order. */
    public Set<String> cardIds(Side side) {
        var ids = new LinkedHashSet<String>();
        for (var s : slots) {
            if (s.side() == side && s.occupied()) ids.add(s.cardId());
        }
        return ids;
    }

    public int capacity(Side side) { return columns * cellsPerSide; }

    public int usedCells(Side side) {
        return (int) slots.stream().filter(s -> s.side() == side && s.occupied()).count();
    }

    public int usedCells(Side side, int column) {
        return (int) slots.stream().filter(s -> s.side() == side && s.column() == column && s.occupied()).count();
    }

    public int freeCells(Side side) { return capacity(side) - usedCells(side); }

    public Availability checkAvailability(CardType type, Side side) {
        int required = type.footprint();
        return new Availability(findRun(side, required) != null, required, freeCells(side));
    }

    public OccupyResult occupy(CardType type, String cardId, Side side) {
        Objects.requireNonNull(type);
        Objects.requireNonNull(cardId);
        Objects.requireNonNull(side);
        if (slots.stream().anyMatch(s -> cardId.equals(s.cardId()))) return OccupyResult.failed(this);

        int[] run = findRun(side, type.footprint());
        if (run == null) return OccupyResult.failed(this);

        var next = new ArrayList<>(slots);
        var taken = new ArrayList<Slot>(type.footprint());
        for (int r = run[1]; r < run[1] + type.footprint(); r++) {
            int i = index(side, run[0], r);
            var s = next.get(i).occupy(cardId, type);
            next.set(i, s);
            taken.add(s);
        }
        return new OccupyResult(true, new SlotGrid(clusterId, columns, cellsPerSide, next, usedSlots + taken.size()), taken);
    }

    /** Frees every cell held by {@code cardId}; unknown ids return this grid. */
    public SlotGrid release(String cardId) {
        var next = new ArrayList<Slot>(slots.size());
        int freed = 0;
        for (var s : slots) {
            if (cardId.equals(s.cardId())) {
                next.add(s.free());
                freed++;
            } else {
                next.add(s);
            }
        }
        return freed == 0 ? this : new SlotGrid(clusterId, columns, cellsPerSide, next, usedSlots - freed);
    }

    public Utilization utilization() {
        return Utilization.of(slots.size(), usedSlots);
    }

    /** {column, firstRow} of the preferred free run, or null. */
    private int[] findRun(Side side, int length) {
        if (length <= 0 || length > cellsPerSide) return null;
        int[] best = null;
        int bestUsed = Integer.MAX_VALUE;
        for (int c = 0; c < columns; c++) {
            int row = firstRun(side, c, length);
            if (row < 0) continue;
            int used = usedCells(side, c);
            if (used < bestUsed) {
                bestUsed = used;
                best = new int[]{c, row};
            }
        }
        return best;
    }

    private int firstRun(Side side, int column, int length) {
        int runStart = 0, runLength = 0;
        for (int r = 0; r < cellsPerSide; r++) {
            if (slots.get(index(side, column, r)).occupied()) {
                runStart = r + 1;
                runLength = 0;
            } else if (++runLength == length) {
                return runStart;
            }
        }
        return -1;
    }

    private int index(Side side, int column, int row) {
        return (side.ordinal() * columns + column) * cellsPerSide + row;
    }

    @Override public String toString() {
        return "SlotGrid[" + clusterId + ", " + utilization() + "]";
    }
}
