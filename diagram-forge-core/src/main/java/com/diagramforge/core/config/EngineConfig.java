package com.diagramforge.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root configuration for the diagram engine.
 *
 * <p>Loaded from {@code diagramforge.yaml}. Every section and key is optional; missing
 * values take the defaults shown below.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * repair:
 *   maxIterations: 10
 *
 * layout:
 *   defaultX: 100
 *   defaultY: 100
 *
 * analysis:
 *   maxListedNodes: 80
 *   maxListedEdges: 80
 *   maxCells: 20000
 *   maxDiffEntries: 10
 *
 * document:
 *   pageName: "Page-1"
 *   pageId: "page-1"
 * }</pre>
 *
 * @param repair auto-fix settings
 * @param layout default geometry settings
 * @param analysis analyzer and diff limits
 * @param document document envelope settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EngineConfig(
    @JsonProperty("repair") RepairSettings repair,
    @JsonProperty("layout") LayoutSettings layout,
    @JsonProperty("analysis") AnalysisSettings analysis,
    @JsonProperty("document") DocumentSettings document
) {
    public EngineConfig {
        if (repair == null) {
            repair = new RepairSettings(null);
        }
        if (layout == null) {
            layout = new LayoutSettings(null, null);
        }
        if (analysis == null) {
            analysis = new AnalysisSettings(null, null, null, null);
        }
        if (document == null) {
            document = new DocumentSettings(null, null);
        }
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static EngineConfig defaults() {
        return new EngineConfig(null, null, null, null);
    }

    /**
     * Auto-fix settings.
     *
     * @param maxIterations cap on the drop-offending-block loop
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RepairSettings(
        @JsonProperty("maxIterations") Integer maxIterations
    ) {
        public RepairSettings {
            if (maxIterations == null || maxIterations < 0) {
                maxIterations = 10;
            }
        }
    }

    /**
     * Position used for vertices without an explicit one.
     *
     * @param defaultX default left edge
     * @param defaultY default top edge
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LayoutSettings(
        @JsonProperty("defaultX") Double defaultX,
        @JsonProperty("defaultY") Double defaultY
    ) {
        public LayoutSettings {
            if (defaultX == null) {
                defaultX = 100.0;
            }
            if (defaultY == null) {
                defaultY = 100.0;
            }
        }
    }

    /**
     * Limits for textual analysis output.
     *
     * @param maxListedNodes vertices listed in an outline
     * @param maxListedEdges edges listed in an outline
     * @param maxCells only this many cells are analyzed
     * @param maxDiffEntries entries listed per diff section
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AnalysisSettings(
        @JsonProperty("maxListedNodes") Integer maxListedNodes,
        @JsonProperty("maxListedEdges") Integer maxListedEdges,
        @JsonProperty("maxCells") Integer maxCells,
        @JsonProperty("maxDiffEntries") Integer maxDiffEntries
    ) {
        public AnalysisSettings {
            if (maxListedNodes == null || maxListedNodes < 0) {
                maxListedNodes = 80;
            }
            if (maxListedEdges == null || maxListedEdges < 0) {
                maxListedEdges = 80;
            }
            if (maxCells == null || maxCells <= 0) {
                maxCells = 20000;
            }
            if (maxDiffEntries == null || maxDiffEntries < 0) {
                maxDiffEntries = 10;
            }
        }
    }

    /**
     * Envelope written around bare cell lists.
     *
     * @param pageName diagram page name
     * @param pageId diagram page id
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DocumentSettings(
        @JsonProperty("pageName") String pageName,
        @JsonProperty("pageId") String pageId
    ) {
        public DocumentSettings {
            if (pageName == null || pageName.isBlank()) {
                pageName = "Page-1";
            }
            if (pageId == null || pageId.isBlank()) {
                pageId = "page-1";
            }
        }
    }
}
