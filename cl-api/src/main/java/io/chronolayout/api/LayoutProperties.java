package io.chronolayout.api;

import io.chronolayout.core.CardType;
import io.chronolayout.core.CardTypeConfig;
import io.chronolayout.core.LayoutConfig;
import io.chronolayout.core.degrade.DegradationStrategy;
import io.chronolayout.core.position.DualColumnPositioner;
import io.chronolayout.core.position.Positioner;
import io.chronolayout.core.position.SingleColumnPositioner;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * {@code chronolayout.*} settings. Unset values keep the engine defaults.
 */
@ConfigurationProperties("chronolayout")
public record LayoutProperties(
        DegradationStrategy strategy,
        ColumnMode columns,
        Double clusterThreshold,
        Double columnSpacing,
        Double rowSpacing,
        Integer cellsPerSide,
        Boolean promotionEnabled,
        Double promotionLowWater,
        Integer maxEventsPerCard
) {
    public enum ColumnMode { SINGLE, DUAL }

    public DegradationStrategy strategyOrDefault() {
        return strategy == null ? DegradationStrategy.UNIFORM : strategy;
    }

    public Positioner positioner() {
        return columns == ColumnMode.DUAL ? new DualColumnPositioner() : new SingleColumnPositioner();
    }

    public LayoutConfig toConfig() {
        var b = LayoutConfig.builder();
        if (clusterThreshold != null) b.clusterThreshold(clusterThreshold);
        if (columnSpacing != null) b.columnSpacing(columnSpacing);
        if (rowSpacing != null) b.rowSpacing(rowSpacing);
        if (cellsPerSide != null) b.cellsPerSide(cellsPerSide);
        if (promotionEnabled != null) b.promotionEnabled(promotionEnabled);
        if (promotionLowWater != null) b.promotion(promotionEnabled == null || promotionEnabled, promotionLowWater);
        if (maxEventsPerCard != null) {
            var multi = LayoutConfig.defaults().cardConfig(CardType.MULTI_EVENT);
            b.card(CardType.MULTI_EVENT, new CardTypeConfig(multi.width(), multi.height(), maxEventsPerCard));
        }
        return b.build();
    }
}
