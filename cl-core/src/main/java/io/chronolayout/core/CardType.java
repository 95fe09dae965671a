package io.chronolayout.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Card detail levels in degradation order.
 *
 * The footprint is counted in cells, one cell being the height of a title-only card
 * plus row spacing: full = 4, compact = 2, title-only = 1, multi-event = 2, infinite = 1.
 */
public enum CardType {
    FULL("full", 4),
    COMPACT("compact", 2),
    TITLE_ONLY("title-only", 1),
    MULTI_EVENT("multi-event", 2),
    INFINITE("infinite", 1);

    private final String wireName;
    private final int footprint;

    CardType(String wireName, int footprint) {
        this.wireName = wireName;
        this.footprint = footprint;
    }

    @JsonValue public String wireName() { return wireName; }

    public int footprint() { return footprint; }

    /** Position in the cascade, 0 = full. */
    public int level() { return ordinal(); }

    /** Multi-event and infinite cards stand for more than one event. */
    public boolean isSummary() { return this == MULTI_EVENT || this == INFINITE; }

    /** One step up the single-event part of the cascade (title-only -> compact -> full). */
    public Optional<CardType> promoted() {
        return switch (this) {
            case COMPACT -> Optional.of(FULL);
            case TITLE_ONLY -> Optional.of(COMPACT);
            default -> Optional.empty();
        };
    }

    /** One step down the single-event part of the cascade. */
    public Optional<CardType> degraded() {
        return switch (this) {
            case FULL -> Optional.of(COMPACT);
            case COMPACT -> Optional.of(TITLE_ONLY);
            default -> Optional.empty();
        };
    }

    @JsonCreator
    public static CardType fromWire(String value) {
        for (var t : values()) {
            if (t.wireName.equalsIgnoreCase(value) || t.name().equalsIgnoreCase(value)) return t;
        }
        throw new IllegalArgumentException("Unknown card type: " + value);
    }

    @Override public String toString() { return wireName; }
}
