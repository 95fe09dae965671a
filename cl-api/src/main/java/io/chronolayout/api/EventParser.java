package io.chronolayout.api;

import io.chronolayout.core.TimelineEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * Turns raw payloads into timeline events. Events with a blank id, an unparseable or
 * unrepresentable date or time, or an id already seen are skipped and reported, never fatal.
 */
@Component
public class EventParser {
    private static final Logger log = LoggerFactory.getLogger(EventParser.class);

    public record Parsed(List<TimelineEvent> events, List<String> skipped) {
        public Parsed {
            events = List.copyOf(events);
            skipped = List.copyOf(skipped);
        }
    }

    public Parsed parse(List<LayoutRequest.EventPayload> payloads) {
        if (payloads == null) return new Parsed(List.of(), List.of());
        var events = new ArrayList<TimelineEvent>(payloads.size());
        var skipped = new ArrayList<String>();
        var seen = new HashSet<String>();
        for (int i = 0; i < payloads.size(); i++) {
            var p = payloads.get(i);
            if (p == null || p.id() == null || p.id().isBlank()) {
                log.warn("Skipping event #{}: missing id", i);
                skipped.add("#" + i);
                continue;
            }
            if (!seen.add(p.id())) {
                log.warn("Skipping event {}: duplicate id", p.id());
                skipped.add(p.id());
                continue;
            }
            try {
                var date = LocalDate.parse(requireText(p.date(), "date"));
                var time = p.time() == null || p.time().isBlank() ? null : LocalTime.parse(p.time().trim());
                events.add(new TimelineEvent(p.id(), date, time, p.title() == null ? "" : p.title(),
                        p.description(), sources(p.sources())));
            } catch (DateTimeParseException | IllegalArgumentException e) {
                log.warn("Skipping event {}: {}", p.id(), e.getMessage());
                skipped.add(p.id());
            }
        }
        return new Parsed(events, skipped);
    }

    /** Null entries in the source list carry nothing and are dropped. */
    private static List<String> sources(List<String> raw) {
        return raw == null ? List.of() : raw.stream().filter(Objects::nonNull).toList();
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) throw new IllegalArgumentException("missing " + field);
        return value.trim();
    }
}
