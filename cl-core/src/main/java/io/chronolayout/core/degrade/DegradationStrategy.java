package io.chronolayout.core.degrade;

/**
 * How a cluster side picks card types.
 *
 * UNIFORM gives every card on a side the same type. MIXED lets early events keep more detail
 * than later ones when the side has room, falling back to UNIFORM on overflow.
 */
public enum DegradationStrategy {
    UNIFORM,
    MIXED
}
