package io.chronolayout.core.degrade;

import io.chronolayout.core.CardType;
import io.chronolayout.core.LayoutConfig;
import io.chronolayout.core.Side;
import io.chronolayout.core.TimelineEvent;
import io.chronolayout.core.slot.SlotGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Picks card types for one side of one cluster and reserves their cells.
 *
 * The cascade runs full, compact, title-only, then multi-event cards mixed with title-only
 * cards, and finally an infinite card that absorbs whatever is left. Every event ends up in
 * exactly one card; running out of cells is never an error.
 */
public final class DegradationEngine {
    private static final Logger log = LoggerFactory.getLogger(DegradationEngine.class);

    private final LayoutConfig config;
    private final DegradationStrategy strategy;

    public DegradationEngine(LayoutConfig config, DegradationStrategy strategy) {
        this.config = Objects.requireNonNull(config);
        this.strategy = Objects.requireNonNull(strategy);
    }

    /** A side plan together with the grid holding its cells. */
    public record Placement(SidePlan plan, SlotGrid grid) {}

    private record Draft(CardType type, List<TimelineEvent> events) {}

    public DegradationStrategy strategy() { return strategy; }

    /** Type the event count asks for before capacity is considered. */
    public static CardType preferredType(int eventCount) {
        if (eventCount <= 2) return CardType.FULL;
        if (eventCount == 3) return CardType.COMPACT;
        return CardType.TITLE_ONLY;
    }

    public static String cardId(String clusterId, Side side, int index) {
        return clusterId + ":" + side.wireName() + ":" + index;
    }

    public Placement planSide(String clusterId, Side side, List<TimelineEvent> events, SlotGrid grid) {
        Objects.requireNonNull(clusterId);
        Objects.requireNonNull(side);
        Objects.requireNonNull(grid);
        if (events.isEmpty()) {
            return new Placement(new SidePlan(side, List.of(), List.of(), CardType.FULL, false), grid);
        }
        if (strategy == DegradationStrategy.MIXED) {
            var mixed = planMixed(clusterId, side, events, grid);
            if (mixed != null) return mixed;
        }
        return planUniform(clusterId, side, events, grid);
    }

    Placement planUniform(String clusterId, Side side, List<TimelineEvent> events, SlotGrid grid) {
        var preferred = preferredType(events.size());
        for (CardType type = preferred; type != null; type = type.degraded().orElse(null)) {
            var placed = place(clusterId, side, singles(events, type), grid);
            if (placed != null) return new Placement(new SidePlan(side, events, placed.plan().cards(), preferred, false), placed.grid());
        }

        var overflow = planOverflow(clusterId, side, events, grid);
        if (overflow != null) return new Placement(new SidePlan(side, events, overflow.plan().cards(), preferred, false), overflow.grid());

        var infinite = planInfinite(clusterId, side, events, grid);
        return new Placement(new SidePlan(side, events, infinite.plan().cards(), preferred, false), infinite.grid());
    }

    /**
     * Each event takes the richest type that still leaves one cell for every later event.
     * Returns null when the side overflows or the cards cannot be placed.
     */
    Placement planMixed(String clusterId, Side side, List<TimelineEvent> events, SlotGrid grid) {
        int n = events.size();
        int capacity = grid.freeCells(side);
        if (n > capacity) return null;

        var drafts = new ArrayList<Draft>(n);
        int used = 0;
        for (int i = 0; i < n; i++) {
            int budget = capacity - used - (n - 1 - i);
            CardType type = CardType.FULL;
            while (type.footprint() > budget && type.degraded().isPresent()) {
                type = type.degraded().get();
            }
            drafts.add(new Draft(type, List.of(events.get(i))));
            used += type.footprint();
        }
        var placed = place(clusterId, side, drafts, grid);
        if (placed == null) {
            log.debug("{} {}: mixed plan does not fit, using uniform", clusterId, side);
            return null;
        }
        return new Placement(new SidePlan(side, events, placed.plan().cards(), preferredType(n), false), placed.grid());
    }

    /** {@code t} title-only cards followed by {@code m} balanced multi-event cards. */
    private Placement planOverflow(String clusterId, Side side, List<TimelineEvent> events, SlotGrid grid) {
        int n = events.size();
        int capacity = grid.freeCells(side);
        int maxPerCard = config.maxEventsPerCard();
        if (maxPerCard <= 2 || capacity <= 0 || n <= capacity) return null;

        int multis = ceilDiv(n - capacity, maxPerCard - 2);
        int titles = capacity - 2 * multis;
        if (titles < 0) return null;

        var drafts = new ArrayList<Draft>(titles + multis);
        for (int i = 0; i < titles; i++) drafts.add(new Draft(CardType.TITLE_ONLY, List.of(events.get(i))));
        drafts.addAll(chunks(events.subList(titles, n), multis));
        var placed = place(clusterId, side, drafts, grid);
        if (placed != null) {
            log.debug("{} {}: {} events as {} title-only + {} multi-event cards", clusterId, side, n, titles, multis);
        }
        return placed;
    }

    /**
     * Reserves the infinite card first, then fits as many multi-event cards and at most one
     * title-only card as the rest of the side allows. The infinite card keeps the latest events.
     */
    private Placement planInfinite(String clusterId, Side side, List<TimelineEvent> events, SlotGrid grid) {
        int n = events.size();
        var trial = grid.occupy(CardType.INFINITE, "trial:infinite", side);
        if (!trial.success()) {
            log.debug("{} {}: no cells, {} events in an unslotted infinite card", clusterId, side, n);
            var card = new CardPlan(cardId(clusterId, side, 0), CardType.INFINITE, events, side, -1, 0);
            return new Placement(new SidePlan(side, events, List.of(card), preferredType(n), false), grid);
        }

        int maxPerCard = config.maxEventsPerCard();
        var scratch = trial.grid();
        int remaining = n;
        var multiSizes = new ArrayList<Integer>();
        while (remaining - 1 >= 2) {
            int size = Math.min(maxPerCard, remaining - 1);
            if (size < 2) break;
            var r = scratch.occupy(CardType.MULTI_EVENT, "trial:multi:" + multiSizes.size(), side);
            if (!r.success()) break;
            scratch = r.grid();
            multiSizes.add(size);
            remaining -= size;
        }
        boolean title = remaining >= 2 && scratch.occupy(CardType.TITLE_ONLY, "trial:title", side).success();

        var drafts = new ArrayList<Draft>();
        int next = 0;
        if (title) drafts.add(new Draft(CardType.TITLE_ONLY, List.of(events.get(next++))));
        for (int size : multiSizes) {
            drafts.add(new Draft(CardType.MULTI_EVENT, events.subList(next, next + size)));
            next += size;
        }
        drafts.add(new Draft(CardType.INFINITE, events.subList(next, n)));

        // same occupy order as the trial run: infinite, multis, title
        var order = new ArrayList<Integer>(drafts.size());
        order.add(drafts.size() - 1);
        for (int i = title ? 1 : 0; i < drafts.size() - 1; i++) order.add(i);
        if (title) order.add(0);

        log.debug("{} {}: {} events overflow into an infinite card holding {}", clusterId, side, n, n - next);
        return place(clusterId, side, drafts, grid, order);
    }

    /**
     * Re-plans a uniform compact or title-only side one step up the cascade.
     * Returns null when the side cannot be promoted or the promoted cards do not fit.
     */
    public Placement promote(String clusterId, SidePlan plan, SlotGrid grid) {
        if (plan.cards().isEmpty() || !plan.uniform()) return null;
        var up = plan.floorType().promoted();
        if (up.isEmpty()) return null;

        var released = grid;
        for (var card : plan.cards()) released = released.release(card.cardId());
        var placed = place(clusterId, plan.side(), singles(plan.events(), up.get()), released);
        if (placed == null) return null;
        return new Placement(plan.withCards(placed.plan().cards(), true), placed.grid());
    }

    /** Larger footprints are placed first so that small cards fill the gaps they leave. */
    private Placement place(String clusterId, Side side, List<Draft> drafts, SlotGrid grid) {
        var order = new ArrayList<Integer>(drafts.size());
        for (int i = 0; i < drafts.size(); i++) order.add(i);
        order.sort(Comparator.comparingInt((Integer i) -> drafts.get(i).type().footprint()).reversed());
        return place(clusterId, side, drafts, grid, order);
    }

    /** Occupies cells for every draft in {@code order}; null if any card does not fit. */
    private Placement place(String clusterId, Side side, List<Draft> drafts, SlotGrid grid, List<Integer> order) {
        var cards = new CardPlan[drafts.size()];
        var current = grid;
        for (int i : order) {
            var draft = drafts.get(i);
            var id = cardId(clusterId, side, i);
            var result = current.occupy(draft.type(), id, side);
            if (!result.success()) return null;
            current = result.grid();
            cards[i] = new CardPlan(id, draft.type(), draft.events(), side, result.column(), result.slots().size());
        }
        var all = List.of(cards);
        var events = all.stream().flatMap(c -> c.events().stream()).toList();
        return new Placement(new SidePlan(side, events, all, CardType.FULL, false), current);
    }

    private static List<Draft> singles(List<TimelineEvent> events, CardType type) {
        return events.stream().map(e -> new Draft(type, List.of(e))).toList();
    }

    /** Splits events into {@code count} consecutive multi-event chunks whose sizes differ by at most one. */
    private static List<Draft> chunks(List<TimelineEvent> events, int count) {
        var out = new ArrayList<Draft>(count);
        int base = events.size() / count, extra = events.size() % count, from = 0;
        for (int i = 0; i < count; i++) {
            int size = base + (i < extra ? 1 : 0);
            out.add(new Draft(CardType.MULTI_EVENT, events.subList(from, from + size)));
            from += size;
        }
        return out;
    }

    private static int ceilDiv(int a, int b) {
        return -Math.floorDiv(-a, b);
    }
}
