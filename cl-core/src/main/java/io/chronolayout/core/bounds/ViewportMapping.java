package io.chronolayout.core.bounds;

/**
 * Time to pixel conversion for one bounds/viewport pair.
 * A zero-width timeline maps every instant to {@code leftOffset}.
 */
public record ViewportMapping(
        double startTime,
        double timelineWidth,
        double msPerPixel,
        double pixelsPerMs,
        double leftOffset
) {
    public double timeToX(double timestamp) {
        return (timestamp - startTime) * pixelsPerMs + leftOffset;
    }

    public double xToTime(double x) {
        return startTime + (x - leftOffset) * msPerPixel;
    }

    public double rightEdge() { return leftOffset + timelineWidth; }
}
