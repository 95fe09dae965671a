package io.chronolayout.core;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimelineEventTest {

    @Test
    void missingTimeMeansMidnightUtc() {
        var event = TimelineEvent.of("a", LocalDate.of(1970, 1, 2), "A");

        assertThat(event.epochMillis()).isEqualTo(86_400_000L);
        assertThat(event.sources()).isEmpty();
    }

    @Test
    void datesBeyondEpochMillisAreRejected() {
        assertThatThrownBy(() -> TimelineEvent.of("far", LocalDate.of(300_000_000, 1, 1), "Far"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("far");
        assertThatThrownBy(() -> TimelineEvent.of("early", LocalDate.of(-300_000_000, 1, 1), LocalTime.NOON, "Early"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void blankIdAndNullSourceEntriesAreRejected() {
        assertThatThrownBy(() -> TimelineEvent.of(" ", LocalDate.of(2024, 1, 1), "Blank"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TimelineEvent("a", LocalDate.of(2024, 1, 1), null, "A", null, Arrays.asList("x", null)))
                .isInstanceOf(NullPointerException.class);
    }
}
