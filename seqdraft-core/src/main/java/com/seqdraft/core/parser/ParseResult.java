package com.seqdraft.core.parser;

import com.seqdraft.core.model.Diagram;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a successful parse: the diagram plus every line that was skipped.
 *
 * @param diagram parsed diagram
 * @param warnings skipped lines, in line order
 */
public record ParseResult(
    Diagram diagram,
    List<ParseWarning> warnings
) {
    /**
     * Compact constructor with validation.
     */
    public ParseResult {
        Objects.requireNonNull(diagram, "diagram must not be null");
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    /**
     * Returns the warnings of one category.
     *
     * @param type warning category
     * @return matching warnings, in line order
     */
    public List<ParseWarning> warningsOf(WarningType type) {
        return warnings.stream().filter(w -> w.type() == type).toList();
    }
}
