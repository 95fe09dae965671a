package io.chronolayout.core;

/** Pixel size of the drawing surface. Negative or non-finite sizes collapse to zero. */
public record Viewport(double width, double height) {
    public Viewport {
        width = sanitize(width);
        height = sanitize(height);
    }

    private static double sanitize(double v) {
        return Double.isFinite(v) && v > 0 ? v : 0;
    }
}
