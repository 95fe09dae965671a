package io.chronolayout.core;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/** Event fixtures shared by the core tests. */
public final class TestEvents {
    public static final LocalDate START = LocalDate.of(2024, 3, 1);

    private TestEvents() {}

    /** {@code count} events, one per day starting at {@link #START}, ids e0, e1, ... */
    public static List<TimelineEvent> daily(int count) {
        return spread(count, 1);
    }

    /** {@code count} events {@code stepDays} apart. */
    public static List<TimelineEvent> spread(int count, int stepDays) {
        var out = new ArrayList<TimelineEvent>(count);
        for (int i = 0; i < count; i++) {
            out.add(TimelineEvent.of("e" + i, START.plusDays((long) i * stepDays), "Event " + i));
        }
        return out;
    }

    /** {@code count} events all on {@link #START}. */
    public static List<TimelineEvent> sameDay(int count) {
        return spread(count, 0);
    }

    /** {@code count} events packed into {@code days} days, several per day. */
    public static List<TimelineEvent> packed(int count, int days) {
        var out = new ArrayList<TimelineEvent>(count);
        for (int i = 0; i < count; i++) {
            out.add(TimelineEvent.of("p" + i, START.plusDays(i % days), "Packed " + i));
        }
        return out;
    }
}
