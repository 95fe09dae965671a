package io.chronolayout.core.slot;

import io.chronolayout.core.CardType;
import io.chronolayout.core.Side;

/**
 * One cell of a cluster's slot grid. Row 0 touches the axis; rows grow outward.
 * {@code cardId} and {@code cardType} are null while the slot is free.
 */
public record Slot(Side side, int column, int row, double x, double y,
                   boolean occupied, String cardId, CardType cardType) {

    Slot occupy(String id, CardType type) {
        return new Slot(side, column, row, x, y, true, id, type);
    }

    Slot free() {
        return new Slot(side, column, row, x, y, false, null, null);
    }
}
