package io.chronolayout.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Half of the timeline a card hangs from. */
public enum Side {
    ABOVE("above"),
    BELOW("below");

    private final String wireName;

    Side(String wireName) { this.wireName = wireName; }

    @JsonValue public String wireName() { return wireName; }

    public Side opposite() { return this == ABOVE ? BELOW : ABOVE; }

    @JsonCreator
    public static Side fromWire(String value) {
        for (var s : values()) {
            if (s.wireName.equalsIgnoreCase(value)) return s;
        }
        throw new IllegalArgumentException("Unknown side: " + value);
    }

    @Override public String toString() { return wireName; }
}
