package com.diagramforge.core.repair;

import com.diagramforge.core.validate.StructuralViolation;

import java.util.List;
import java.util.Optional;

/**
 * Result of validate-and-fix.
 *
 * @param valid whether the returned document (fixed or original) is structurally sound
 * @param error remaining violation, or {@code null} when valid
 * @param fixedXml repaired document when any rule fired, otherwise {@code null}
 * @param fixes applied fix descriptions, in order
 */
public record ValidationReport(boolean valid, StructuralViolation error, String fixedXml, List<String> fixes) {

    public ValidationReport {
        fixes = fixes == null ? List.of() : List.copyOf(fixes);
    }

    public static ValidationReport ofValid() {
        return new ValidationReport(true, null, null, List.of());
    }

    public Optional<StructuralViolation> violation() {
        return Optional.ofNullable(error);
    }

    public Optional<String> repairedXml() {
        return Optional.ofNullable(fixedXml);
    }

    /**
     * Returns the document callers should use: the repaired one if any, else the original.
     *
     * @param original the document that was validated
     * @return best available document
     */
    public String effectiveXml(String original) {
        return fixedXml != null ? fixedXml : original;
    }
}
