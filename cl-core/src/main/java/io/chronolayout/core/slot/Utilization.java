package io.chronolayout.core.slot;

/** Occupied share of a slot budget; {@code percentage} is 0 when there are no slots. */
public record Utilization(int totalSlots, int usedSlots, double percentage) {
    public static final Utilization EMPTY = new Utilization(0, 0, 0);

    public static Utilization of(int total, int used) {
        return new Utilization(total, used, total > 0 ? used * 100.0 / total : 0);
    }

    public Utilization plus(Utilization other) {
        return of(totalSlots + other.totalSlots, usedSlots + other.usedSlots);
    }
}
