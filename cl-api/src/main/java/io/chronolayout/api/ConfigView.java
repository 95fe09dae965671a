package io.chronolayout.api;

import io.chronolayout.core.CardType;
import io.chronolayout.core.CardTypeConfig;
import io.chronolayout.core.LayoutEngine;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/** Effective engine settings as served by {@code GET /api/layout/config}. Cards keyed by wire name. */
public record ConfigView(
        String strategy,
        String columns,
        Map<String, CardTypeConfig> cards,
        double clusterThreshold,
        double columnSpacing,
        double rowSpacing,
        int minCellsPerSide,
        int maxCellsPerSide,
        Integer cellsPerSide,
        boolean promotionEnabled,
        double promotionLowWater,
        long densityWindowDays
) {
    static ConfigView of(LayoutEngine engine) {
        var c = engine.config();
        var cards = new LinkedHashMap<String, CardTypeConfig>();
        for (var type : CardType.values()) cards.put(type.wireName(), c.cardConfig(type));
        return new ConfigView(engine.strategy().name().toLowerCase(Locale.ROOT), engine.positioner().name(),
                cards, c.clusterThreshold(), c.columnSpacing(), c.rowSpacing(), c.minCellsPerSide(),
                c.maxCellsPerSide(), c.cellsPerSide(), c.promotionEnabled(), c.promotionLowWater(),
                c.densityWindow().toDays());
    }
}
