package io.chronolayout.core.validate;

import io.chronolayout.core.CardType;
import io.chronolayout.core.LayoutConfig;
import io.chronolayout.core.LayoutResult;
import io.chronolayout.core.PositionedCard;
import io.chronolayout.core.TimelineEvent;
import io.chronolayout.core.Viewport;
import io.chronolayout.core.degrade.DegradationStrategy;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Checks a finished layout against its guarantees: no overlap, full coverage, cell capacity and
 * monotonic card types per cluster side. Reports problems instead of throwing.
 *
 * Under {@link DegradationStrategy#MIXED} a non-monotonic side is reported as a warning, not an error.
 */
public final class LayoutValidator {
    private final LayoutConfig config;
    private final DegradationStrategy strategy;

    public LayoutValidator(LayoutConfig config) {
        this(config, DegradationStrategy.UNIFORM);
    }

    public LayoutValidator(LayoutConfig config, DegradationStrategy strategy) {
        this.config = Objects.requireNonNull(config);
        this.strategy = Objects.requireNonNull(strategy);
    }

    public ValidationReport validate(LayoutResult result, Collection<TimelineEvent> events, Viewport viewport) {
        var errors = new ArrayList<String>();
        var warnings = new ArrayList<String>();
        var cards = result == null ? List.<PositionedCard>of() : result.positionedCards();

        checkOverlaps(cards, errors);
        checkCoverage(cards, events, errors);
        checkCapacity(cards, config.resolveCellsPerSide(viewport.height()), errors);
        checkMonotonic(cards, strategy == DegradationStrategy.MIXED ? warnings : errors);
        checkViewport(cards, viewport, warnings);

        var counts = new LinkedHashMap<String, Integer>();
        for (var type : CardType.values()) counts.put(type.wireName(), 0);
        int level = 0;
        for (var card : cards) {
            counts.merge(card.cardType().wireName(), 1, Integer::sum);
            level = Math.max(level, card.cardType().level());
        }
        return new ValidationReport(errors.isEmpty(), errors, warnings, counts, level,
                counts.get(CardType.INFINITE.wireName()) > 0, counts.get(CardType.MULTI_EVENT.wireName()) > 0);
    }

    static void checkOverlaps(List<PositionedCard> cards, List<String> errors) {
        for (int i = 0; i < cards.size(); i++) {
            for (int j = i + 1; j < cards.size(); j++) {
                if (cards.get(i).overlaps(cards.get(j))) {
                    errors.add("Cards " + cards.get(i).id() + " and " + cards.get(j).id() + " overlap");
                }
            }
        }
    }

    static void checkCoverage(List<PositionedCard> cards, Collection<TimelineEvent> events, List<String> errors) {
        var expected = new LinkedHashSet<String>();
        if (events != null) {
            for (var e : events) if (e != null) expected.add(e.id());
        }
        var seen = new HashMap<String, Integer>();
        int total = 0;
        for (var card : cards) {
            if (card.eventCount() != card.events().size()) {
                errors.add("Card " + card.id() + " reports " + card.eventCount() + " events but holds " + card.events().size());
            }
            total += card.eventCount();
            for (var id : card.eventIds()) seen.merge(id, 1, Integer::sum);
        }
        if (total != expected.size()) {
            errors.add("Cards hold " + total + " events, expected " + expected.size());
        }
        for (var id : expected) {
            int n = seen.getOrDefault(id, 0);
            if (n == 0) errors.add("Event " + id + " is not on any card");
            else if (n > 1) errors.add("Event " + id + " appears on " + n + " cards");
        }
        for (var id : seen.keySet()) {
            if (!expected.contains(id)) errors.add("Card event " + id + " is not an input event");
        }
    }

    static void checkCapacity(List<PositionedCard> cards, int cellsPerSide, List<String> errors) {
        var used = new LinkedHashMap<String, Integer>();
        for (var card : cards) {
            if (card.column() < 0) {
                if (card.cells() != 0) errors.add("Card " + card.id() + " holds cells without a column");
                continue;
            }
            if (card.cells() != card.cardType().footprint()) {
                errors.add("Card " + card.id() + " holds " + card.cells() + " cells, footprint is " + card.cardType().footprint());
            }
            used.merge(card.clusterId() + "/" + card.side() + "/" + card.column(), card.cells(), Integer::sum);
        }
        used.forEach((key, cells) -> {
            if (cells > cellsPerSide) errors.add("Column " + key + " uses " + cells + " of " + cellsPerSide + " cells");
        });
    }

    /** Within a cluster side, later cards never carry more detail than earlier ones. */
    static void checkMonotonic(List<PositionedCard> cards, List<String> problems) {
        var last = new HashMap<String, PositionedCard>();
        for (var card : cards) {
            var key = card.clusterId() + "/" + card.side();
            var prev = last.put(key, card);
            if (prev != null && card.cardType().level() < prev.cardType().level()) {
                problems.add("Card " + card.id() + " (" + card.cardType() + ") follows " + prev.id() + " (" + prev.cardType() + ")");
            }
        }
    }

    static void checkViewport(List<PositionedCard> cards, Viewport viewport, List<String> warnings) {
        for (var card : cards) {
            if (card.x() < 0 || card.y() < 0 || card.right() > viewport.width() || card.bottom() > viewport.height()) {
                warnings.add("Card " + card.id() + " extends outside the viewport");
            }
        }
    }

    /** Counts per card type, for logging. */
    public static Map<CardType, Long> typeCounts(List<PositionedCard> cards) {
        var out = new EnumMap<CardType, Long>(CardType.class);
        for (var c : cards) out.merge(c.cardType(), 1L, Long::sum);
        return out;
    }
}
