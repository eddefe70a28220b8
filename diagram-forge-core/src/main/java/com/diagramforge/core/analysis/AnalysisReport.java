package com.diagramforge.core.analysis;

import com.diagramforge.core.model.DiagramComponent;

import java.util.List;
import java.util.Objects;

/**
 * Everything the analyze entry point returns for a document.
 *
 * @param components typed components with container children resolved
 * @param summary count of components by kind
 * @param outline structural outline
 */
public record AnalysisReport(List<DiagramComponent> components, String summary, String outline) {

    public AnalysisReport {
        components = components == null ? List.of() : List.copyOf(components);
        Objects.requireNonNull(summary, "summary must not be null");
        Objects.requireNonNull(outline, "outline must not be null");
    }
}
