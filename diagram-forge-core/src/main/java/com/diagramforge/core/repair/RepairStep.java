package com.diagramforge.core.repair;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of applying one repair rule.
 *
 * @param xml text after the rule ran
 * @param fix description of the change, or empty when the rule changed nothing
 */
public record RepairStep(String xml, Optional<String> fix) {

    public RepairStep {
        Objects.requireNonNull(xml, "xml must not be null");
        fix = fix == null ? Optional.empty() : fix;
    }

    public static RepairStep unchanged(String xml) {
        return new RepairStep(xml, Optional.empty());
    }

    public static RepairStep fixed(String xml, String description) {
        return new RepairStep(xml, Optional.of(description));
    }

    public boolean changed() {
        return fix.isPresent();
    }
}
