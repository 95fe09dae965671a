package io.chronolayout.core;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Objects;

/**
 * Input event. Owned by the caller, never mutated by the engine.
 * A missing time of day means midnight UTC. The instant must fit in epoch milliseconds.
 */
public record TimelineEvent(
        String id,
        LocalDate date,
        LocalTime time,
        String title,
        String description,
        List<String> sources
) {
    public TimelineEvent {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(title, "title");
        if (id.isBlank()) throw new IllegalArgumentException("Event id must not be blank");
        sources = sources == null ? List.of() : List.copyOf(sources);
        try {
            date.atTime(time == null ? LocalTime.MIDNIGHT : time).toInstant(ZoneOffset.UTC).toEpochMilli();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Event " + id + " lies outside the epoch-millisecond range: " + date, e);
        }
    }

    public static TimelineEvent of(String id, LocalDate date, String title) {
        return new TimelineEvent(id, date, null, title, null, List.of());
    }

    public static TimelineEvent of(String id, LocalDate date, LocalTime time, String title) {
        return new TimelineEvent(id, date, time, title, null, List.of());
    }

    public Instant instant() {
        return date.atTime(time == null ? LocalTime.MIDNIGHT : time).toInstant(ZoneOffset.UTC);
    }

    public long epochMillis() { return instant().toEpochMilli(); }
}
