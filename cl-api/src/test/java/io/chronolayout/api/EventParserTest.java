package io.chronolayout.api;

import io.chronolayout.api.LayoutRequest.EventPayload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EventParserTest {

    private EventParser parser;

    @BeforeEach
    void setUp() {
        parser = new EventParser();
    }

    private static EventPayload payload(String id, String date, String time) {
        return new EventPayload(id, date, time, "Title " + id, null, List.of("https://example.org/" + id));
    }

    @Test
    void parse_readsDateTimeAndSources() {
        var parsed = parser.parse(List.of(payload("a", "2024-03-01", "14:30")));

        assertThat(parsed.skipped()).isEmpty();
        assertThat(parsed.events()).singleElement().satisfies(e -> {
            assertThat(e.date()).isEqualTo(LocalDate.of(2024, 3, 1));
            assertThat(e.time()).isEqualTo(LocalTime.of(14, 30));
            assertThat(e.sources()).containsExactly("https://example.org/a");
        });
    }

    @Test
    void parse_skipsBadEntriesAndKeepsTheRest() {
        var parsed = parser.parse(Arrays.asList(
                payload("ok", "2024-03-01", null),
                payload("  ", "2024-03-01", null),
                payload("bad-date", "03/01/2024", null),
                payload("no-date", null, null),
                payload("bad-time", "2024-03-01", "25:99"),
                payload("ok", "2024-04-01", null),
                null));

        assertThat(parsed.events()).extracting(e -> e.id()).containsExactly("ok");
        assertThat(parsed.events().get(0).date()).isEqualTo(LocalDate.of(2024, 3, 1));
        assertThat(parsed.skipped()).containsExactly("#1", "bad-date", "no-date", "bad-time", "ok", "#6");
    }

    @Test
    void parse_skipsDatesOutsideTheEpochRange() {
        var parsed = parser.parse(List.of(payload("far", "+300000000-01-01", null), payload("ok", "2024-03-01", null)));

        assertThat(parsed.events()).extracting(e -> e.id()).containsExactly("ok");
        assertThat(parsed.skipped()).containsExactly("far");
    }

    @Test
    void parse_dropsNullSources() {
        var parsed = parser.parse(List.of(
                new EventPayload("a", "2024-03-01", null, "A", null, Arrays.asList(null, "https://example.org/a", null))));

        assertThat(parsed.skipped()).isEmpty();
        assertThat(parsed.events().get(0).sources()).containsExactly("https://example.org/a");
    }

    @Test
    void parse_missingTitleBecomesEmpty() {
        var parsed = parser.parse(List.of(new EventPayload("a", "2024-03-01", null, null, null, null)));

        assertThat(parsed.events().get(0).title()).isEmpty();
        assertThat(parsed.events().get(0).sources()).isEmpty();
    }

    @Test
    void parse_nullListIsEmpty() {
        assertThat(parser.parse(null).events()).isEmpty();
    }
}
