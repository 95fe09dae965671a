package io.chronolayout.api;

import io.chronolayout.core.Viewport;

import java.time.Instant;
import java.util.List;

/**
 * Body of the layout endpoints. Event dates stay strings here so that one bad event can be
 * skipped instead of failing the whole request. {@code now} pins the clock for an empty timeline.
 */
public record LayoutRequest(List<EventPayload> events, Viewport viewport, Double zoom, Instant now) {

    public record EventPayload(String id, String date, String time, String title,
                               String description, List<String> sources) {}

    public double zoomOrDefault() {
        return zoom == null ? 1.0 : zoom;
    }
}
