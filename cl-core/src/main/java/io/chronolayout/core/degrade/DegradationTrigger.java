package io.chronolayout.core.degrade;

import io.chronolayout.core.CardType;
import io.chronolayout.core.Side;

/** Records a side that ended below its preferred type, and how many cells that saved. */
public record DegradationTrigger(String clusterId, Side side, CardType from, CardType to,
                                 int eventCount, int availableCells, int spaceReclaimed) {}
