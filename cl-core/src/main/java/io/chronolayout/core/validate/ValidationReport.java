package io.chronolayout.core.validate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Diagnostics for one layout. Errors break a layout guarantee; warnings (cards outside the
 * viewport) do not. {@code cardTypeCounts} is keyed by wire name in cascade order and
 * {@code degradationLevel} is the lowest-fidelity level present, 0 (full) to 4 (infinite).
 */
public record ValidationReport(
        boolean valid,
        List<String> errors,
        List<String> warnings,
        Map<String, Integer> cardTypeCounts,
        int degradationLevel,
        boolean hasInfiniteCards,
        boolean hasMultiEventCards
) {
    public ValidationReport {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        cardTypeCounts = Collections.unmodifiableMap(new LinkedHashMap<>(cardTypeCounts));
    }
}
