package io.chronolayout.core;

/**
 * Pixel size of one card type. {@code maxEventsPerCard} only matters for multi-event cards.
 */
public record CardTypeConfig(double width, double height, Integer maxEventsPerCard) {
    public CardTypeConfig {
        if (!(width > 0) || !(height > 0)) {
            throw new IllegalArgumentException("Card size must be positive: " + width + "x" + height);
        }
        if (maxEventsPerCard != null && maxEventsPerCard < 1) {
            throw new IllegalArgumentException("maxEventsPerCard must be >= 1: " + maxEventsPerCard);
        }
    }

    public static CardTypeConfig of(double width, double height) {
        return new CardTypeConfig(width, height, null);
    }

    public CardTypeConfig scaled(double factor) {
        return new CardTypeConfig(
                Math.max(1, Math.round(width * factor)),
                Math.max(1, Math.round(height * factor)),
                maxEventsPerCard);
    }
}
