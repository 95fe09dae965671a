package io.chronolayout.core.bounds;

/**
 * Visible time window in epoch milliseconds.
 * {@code padding} is the distance added on each side of the event range after zoom.
 */
public record TimelineBounds(double startTime, double endTime, double duration, double padding, double zoomLevel) {

    public double center() { return (startTime + endTime) / 2; }

    public boolean contains(double timestamp) {
        return timestamp >= startTime && timestamp <= endTime;
    }
}
