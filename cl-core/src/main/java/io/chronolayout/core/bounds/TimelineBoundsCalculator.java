package io.chronolayout.core.bounds;

import io.chronolayout.core.TimelineEvent;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.Objects;

/**
 * Derives the visible time window from the event set and a zoom factor.
 *
 * Padding is 10% of the event range, kept within [7 days, 1 year]. Zoom shrinks or grows the
 * padded range around its midpoint. With no events the window is one year centred on the
 * clock's current instant.
 */
public final class TimelineBoundsCalculator {
    static final double DAY_MS = Duration.ofDays(1).toMillis();
    static final double MIN_PADDING_MS = 7 * DAY_MS;
    static final double MAX_PADDING_MS = 365 * DAY_MS;
    static final double PADDING_FRACTION = 0.1;
    static final double DEFAULT_WINDOW_MS = 365 * DAY_MS;
    static final double MIN_DURATION_MS = DAY_MS;

    /** Navigation rail on the left. */
    public static final double LEFT_MARGIN = 56;
    public static final double RIGHT_MARGIN = 56;

    private final Clock clock;

    public TimelineBoundsCalculator(Clock clock) {
        this.clock = Objects.requireNonNull(clock);
    }

    public TimelineBounds calculateBounds(Collection<TimelineEvent> events, double zoomLevel) {
        double zoom = sanitizeZoom(zoomLevel);
        if (events == null || events.isEmpty()) return defaultBounds(zoom);

        long min = Long.MAX_VALUE, max = Long.MIN_VALUE;
        for (var e : events) {
            long t = e.epochMillis();
            min = Math.min(min, t);
            max = Math.max(max, t);
        }
        double base = (double) max - min;
        double padding = Math.max(MIN_PADDING_MS, Math.min(MAX_PADDING_MS, base * PADDING_FRACTION));
        double duration = Math.max(MIN_DURATION_MS, (base + 2 * padding) / zoom);
        double mid = min + base / 2;

        return new TimelineBounds(mid - duration / 2, mid + duration / 2, duration, (duration - base) / 2, zoom);
    }

    public ViewportMapping createViewportMapping(TimelineBounds bounds, double viewportWidth) {
        double width = Math.max(0, (Double.isFinite(viewportWidth) ? viewportWidth : 0) - LEFT_MARGIN - RIGHT_MARGIN);
        double duration = Math.max(MIN_DURATION_MS, bounds.duration());
        double pixelsPerMs = width / duration;
        double msPerPixel = width > 0 ? duration / width : 0;
        return new ViewportMapping(bounds.startTime(), width, msPerPixel, pixelsPerMs, LEFT_MARGIN);
    }

    /** Rescales the window for a new zoom level around {@code centerTime} (or the current centre). */
    public TimelineBounds updateBoundsForZoom(TimelineBounds current, double newZoomLevel, Double centerTime) {
        double zoom = sanitizeZoom(newZoomLevel);
        double ratio = current.zoomLevel() / zoom;
        double duration = Math.max(MIN_DURATION_MS, current.duration() * ratio);
        double center = centerTime != null ? centerTime : current.center();
        return new TimelineBounds(center - duration / 2, center + duration / 2, duration,
                current.padding() * ratio, zoom);
    }

    private TimelineBounds defaultBounds(double zoom) {
        double now = clock.millis();
        double duration = Math.max(MIN_DURATION_MS, DEFAULT_WINDOW_MS / zoom);
        return new TimelineBounds(now - duration / 2, now + duration / 2, duration, duration * PADDING_FRACTION, zoom);
    }

    private static double sanitizeZoom(double zoom) {
        return Double.isFinite(zoom) && zoom > 0 ? zoom : 1.0;
    }
}
