package com.diagramforge.core.repair;

import java.util.List;
import java.util.Objects;

/**
 * Output of one run of the auto-fix pipeline.
 *
 * @param xml text after all rules ran
 * @param fixes descriptions of the rules that changed something, in order
 * @param parses whether the final text is well-formed XML
 */
public record RepairResult(String xml, List<String> fixes, boolean parses) {

    public RepairResult {
        Objects.requireNonNull(xml, "xml must not be null");
        fixes = fixes == null ? List.of() : List.copyOf(fixes);
    }

    public boolean changed() {
        return !fixes.isEmpty();
    }
}
