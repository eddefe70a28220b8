package com.diagramforge.core.validate;

import java.util.List;
import java.util.Objects;

/**
 * First structural problem found in a document.
 *
 * @param code violation code
 * @param message what is wrong
 * @param cellIds up to five offending ids; edge references read {@code id (source:x)}
 * @param hint instruction for fixing the document
 */
public record StructuralViolation(ViolationCode code, String message, List<String> cellIds, String hint) {

    public static final int MAX_REPORTED_IDS = 5;

    public StructuralViolation {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(message, "message must not be null");
        cellIds = cellIds == null
            ? List.of()
            : List.copyOf(cellIds.subList(0, Math.min(cellIds.size(), MAX_REPORTED_IDS)));
    }

    /**
     * Renders the violation as a single line, e.g.
     * {@code Invalid XML [DUPLICATE_ID]: Duplicate mxCell id. IDs: a. Hint: ...}.
     *
     * @return one-line description
     */
    public String describe() {
        StringBuilder text = new StringBuilder("Invalid XML [").append(code).append("]: ").append(message);
        if (!cellIds.isEmpty()) {
            text.append(" IDs: ").append(String.join(", ", cellIds)).append('.');
        }
        if (hint != null && !hint.isEmpty()) {
            text.append(" Hint: ").append(hint);
        }
        return text.toString();
    }

    @Override
    public String toString() {
        return describe();
    }
}
