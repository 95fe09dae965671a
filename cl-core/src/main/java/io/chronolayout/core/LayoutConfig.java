package io.chronolayout.core;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Tunable layout parameters. Everything the engine measures in pixels or cells comes from here.
 *
 * {@code cellsPerSide} pins the per-side cell budget; when null it is derived from the
 * viewport height and clamped to [{@code minCellsPerSide}, {@code maxCellsPerSide}].
 */
public record LayoutConfig(
        Map<CardType, CardTypeConfig> cardConfigs,
        double clusterThreshold,
        double columnSpacing,
        double rowSpacing,
        double aboveAxisMargin,
        double belowAxisMargin,
        double headerSafeZone,
        double timelineMargin,
        int minCellsPerSide,
        int maxCellsPerSide,
        Integer cellsPerSide,
        boolean promotionEnabled,
        double promotionLowWater,
        Duration densityWindow
) {
    public static final int DEFAULT_MAX_EVENTS_PER_CARD = 5;

    public LayoutConfig {
        Objects.requireNonNull(cardConfigs, "cardConfigs");
        Objects.requireNonNull(densityWindow, "densityWindow");
        var copy = new EnumMap<CardType, CardTypeConfig>(CardType.class);
        copy.putAll(cardConfigs);
        for (var type : CardType.values()) {
            if (!copy.containsKey(type)) {
                throw new IllegalArgumentException("Missing card config for " + type);
            }
        }
        cardConfigs = Map.copyOf(copy);
        requireNonNegative("clusterThreshold", clusterThreshold);
        requireNonNegative("columnSpacing", columnSpacing);
        requireNonNegative("rowSpacing", rowSpacing);
        requireNonNegative("aboveAxisMargin", aboveAxisMargin);
        requireNonNegative("belowAxisMargin", belowAxisMargin);
        requireNonNegative("headerSafeZone", headerSafeZone);
        requireNonNegative("timelineMargin", timelineMargin);
        if (minCellsPerSide < 0 || maxCellsPerSide < minCellsPerSide) {
            throw new IllegalArgumentException(
                    "Invalid cell range [" + minCellsPerSide + ", " + maxCellsPerSide + "]");
        }
        if (cellsPerSide != null && cellsPerSide < 0) {
            throw new IllegalArgumentException("cellsPerSide must be >= 0: " + cellsPerSide);
        }
        if (!(promotionLowWater >= 0 && promotionLowWater <= 100)) {
            throw new IllegalArgumentException("promotionLowWater must be a percentage: " + promotionLowWater);
        }
        if (densityWindow.isNegative() || densityWindow.isZero()) {
            throw new IllegalArgumentException("densityWindow must be positive: " + densityWindow);
        }
    }

    private static void requireNonNegative(String name, double v) {
        if (!(v >= 0) || Double.isInfinite(v)) {
            throw new IllegalArgumentException(name + " must be a finite value >= 0: " + v);
        }
    }

    public static LayoutConfig defaults() { return builder().build(); }

    public static Builder builder() { return new Builder(); }

    public Builder toBuilder() {
        return new Builder()
                .cardConfigs(cardConfigs)
                .clusterThreshold(clusterThreshold)
                .columnSpacing(columnSpacing)
                .rowSpacing(rowSpacing)
                .aboveAxisMargin(aboveAxisMargin)
                .belowAxisMargin(belowAxisMargin)
                .headerSafeZone(headerSafeZone)
                .timelineMargin(timelineMargin)
                .cellRange(minCellsPerSide, maxCellsPerSide)
                .cellsPerSide(cellsPerSide)
                .promotion(promotionEnabled, promotionLowWater)
                .densityWindow(densityWindow);
    }

    /**
     * Preset tuned to the viewport category (mobile, tablet, desktop, ultrawide).
     * Small viewports get tighter spacing and scaled-down cards.
     */
    public static LayoutConfig forViewport(double width, double height) {
        var b = builder();
        switch (ViewportCategory.of(width)) {
            case MOBILE -> b.clusterThreshold(80).columnSpacing(12).rowSpacing(8)
                    .cardConfigs(adaptiveCardConfigs(width, height));
            case TABLET -> b.clusterThreshold(100).columnSpacing(16).rowSpacing(10)
                    .cardConfigs(adaptiveCardConfigs(width, height));
            case DESKTOP -> b.clusterThreshold(120).columnSpacing(20);
            case ULTRAWIDE -> b.clusterThreshold(140).columnSpacing(24);
        }
        return b.build();
    }

    static Map<CardType, CardTypeConfig> adaptiveCardConfigs(double width, double height) {
        double scale = Math.min(width / 1200.0, height / 800.0);
        double clamped = Math.max(0.7, Math.min(1.2, Double.isFinite(scale) ? scale : 1.0));
        var out = new EnumMap<CardType, CardTypeConfig>(CardType.class);
        Builder.DEFAULT_CARDS.forEach((type, cfg) -> out.put(type, cfg.scaled(clamped)));
        return out;
    }

    public CardTypeConfig cardConfig(CardType type) { return cardConfigs.get(type); }

    public int maxEventsPerCard() {
        Integer max = cardConfig(CardType.MULTI_EVENT).maxEventsPerCard();
        return max == null ? DEFAULT_MAX_EVENTS_PER_CARD : max;
    }

    /** Widest card of any type; used as the column width so every type fits its column. */
    public double maxCardWidth() {
        return cardConfigs.values().stream().mapToDouble(CardTypeConfig::width).max().orElse(0);
    }

    /** Vertical pitch of one cell: a title-only card plus row spacing. */
    public double cellPitch() {
        return cardConfig(CardType.TITLE_ONLY).height() + rowSpacing;
    }

    /** Axis position: centred in the space left under the header safe zone. */
    public double timelineY(double viewportHeight) {
        double h = Math.max(0, viewportHeight);
        if (h <= headerSafeZone) return h / 2;
        return headerSafeZone + (h - headerSafeZone) / 2;
    }

    public int resolveCellsPerSide(double viewportHeight) {
        if (cellsPerSide != null) return cellsPerSide;
        double available = Math.max(0, viewportHeight) / 2 - timelineMargin;
        int fit = (int) Math.floor(Math.max(0, available) / cellPitch());
        return Math.min(maxCellsPerSide, Math.max(minCellsPerSide, fit));
    }

    public enum ViewportCategory {
        MOBILE, TABLET, DESKTOP, ULTRAWIDE;

        public static ViewportCategory of(double width) {
            if (width >= 2560) return ULTRAWIDE;
            if (width >= 1440) return DESKTOP;
            if (width >= 1024) return TABLET;
            return MOBILE;
        }
    }

    public static final class Builder {
        static final Map<CardType, CardTypeConfig> DEFAULT_CARDS = Map.of(
                CardType.FULL, CardTypeConfig.of(260, 169),
                CardType.COMPACT, CardTypeConfig.of(260, 82),
                CardType.TITLE_ONLY, CardTypeConfig.of(260, 32),
                CardType.MULTI_EVENT, new CardTypeConfig(260, 82, DEFAULT_MAX_EVENTS_PER_CARD),
                CardType.INFINITE, CardTypeConfig.of(260, 32)
        );

        private final Map<CardType, CardTypeConfig> cards = new EnumMap<>(DEFAULT_CARDS);
        private double clusterThreshold = 120;
        private double columnSpacing = 20;
        private double rowSpacing = 12;
        private double aboveAxisMargin = 48;
        private double belowAxisMargin = 55;
        private double headerSafeZone = 100;
        private double timelineMargin = 100;
        private int minCellsPerSide = 4;
        private int maxCellsPerSide = 8;
        private Integer cellsPerSide;
        private boolean promotionEnabled = true;
        private double promotionLowWater = 40;
        private Duration densityWindow = Duration.ofDays(30);

        private Builder() {}

        public Builder cardConfigs(Map<CardType, CardTypeConfig> configs) {
            cards.putAll(configs);
            return this;
        }

        public Builder card(CardType type, CardTypeConfig config) {
            cards.put(type, config);
            return this;
        }

        public Builder clusterThreshold(double v) { clusterThreshold = v; return this; }
        public Builder columnSpacing(double v) { columnSpacing = v; return this; }
        public Builder rowSpacing(double v) { rowSpacing = v; return this; }
        public Builder aboveAxisMargin(double v) { aboveAxisMargin = v; return this; }
        public Builder belowAxisMargin(double v) { belowAxisMargin = v; return this; }
        public Builder headerSafeZone(double v) { headerSafeZone = v; return this; }
        public Builder timelineMargin(double v) { timelineMargin = v; return this; }

        public Builder cellRange(int min, int max) {
            minCellsPerSide = min;
            maxCellsPerSide = max;
            return this;
        }

        public Builder cellsPerSide(Integer v) { cellsPerSide = v; return this; }

        public Builder promotion(boolean enabled, double lowWaterPercent) {
            promotionEnabled = enabled;
            promotionLowWater = lowWaterPercent;
            return this;
        }

        public Builder promotionEnabled(boolean enabled) { promotionEnabled = enabled; return this; }

        public Builder densityWindow(Duration v) { densityWindow = v; return this; }

        public LayoutConfig build() {
            return new LayoutConfig(cards, clusterThreshold, columnSpacing, rowSpacing,
                    aboveAxisMargin, belowAxisMargin, headerSafeZone, timelineMargin,
                    minCellsPerSide, maxCellsPerSide, cellsPerSide,
                    promotionEnabled, promotionLowWater, densityWindow);
        }
    }
}
