package com.diagramforge.core.repair;

import com.diagramforge.core.config.EngineConfig;
import com.diagramforge.core.xml.XmlDocumentCodec;
import com.diagramforge.core.xml.XmlParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs the repair rules over a document, then drops unparseable cell blocks.
 *
 * <p>After the rules, if the text still does not parse, the fixer takes the parser's
 * error location, finds the {@code mxCell} enclosing it, deletes that whole block and tries
 * again. This loop stops after {@code repair.maxIterations} attempts; the fixer never
 * throws on unrepairable input.
 */
public class XmlAutoFixer {

    private static final Logger log = LoggerFactory.getLogger(XmlAutoFixer.class);

    private static final String CELL_OPEN = "<mxCell";
    private static final String CELL_CLOSE = "</mxCell>";

    private final XmlDocumentCodec codec;
    private final List<RepairRule> rules;
    private final int maxIterations;

    public XmlAutoFixer(XmlDocumentCodec codec) {
        this(codec, RepairRules.defaults(), EngineConfig.defaults());
    }

    public XmlAutoFixer(XmlDocumentCodec codec, List<RepairRule> rules, EngineConfig config) {
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules must not be null"));
        this.maxIterations = config.repair().maxIterations();
    }

    /**
     * Applies every rule once in order, then the bounded drop-block loop.
     *
     * @param xml document text
     * @return repaired text and applied fixes
     */
    public RepairResult fix(String xml) {
        String current = xml == null ? "" : xml;
        List<String> fixes = new ArrayList<>();

        for (RepairRule rule : rules) {
            RepairStep step = rule.apply(current);
            if (step.changed()) {
                log.debug("Repair rule '{}' applied: {}", rule.name(), step.fix().orElse(""));
                fixes.add(step.fix().get());
                current = step.xml();
            }
        }

        boolean parses = false;
        for (int iteration = 0; iteration <= maxIterations; iteration++) {
            try {
                codec.parse(current);
                parses = true;
                break;
            } catch (XmlParseException e) {
                if (iteration == maxIterations || !e.hasLocation()) {
                    log.debug("Giving up on parse error after {} block removals: {}", iteration, e.getMessage());
                    break;
                }
                Optional<String> reduced = dropEnclosingCell(current, e.line(), e.column());
                if (reduced.isEmpty()) {
                    log.debug("No mxCell encloses parse error at line {}: {}", e.line(), e.getMessage());
                    break;
                }
                current = reduced.get();
                fixes.add("Removed unparseable mxCell block near line " + e.line());
            }
        }

        if (!parses) {
            log.warn("Auto-fix could not produce well-formed XML ({} fixes applied)", fixes.size());
        }
        return new RepairResult(current, fixes, parses);
    }

    /**
     * Deletes the {@code mxCell} block that encloses the given position.
     *
     * @param xml document text
     * @param line 1-based line
     * @param column 1-based column
     * @return text without the block, or empty when no cell precedes the position
     */
    static Optional<String> dropEnclosingCell(String xml, int line, int column) {
        int offset = offsetOf(xml, line, column);
        int start = lastCellOpen(xml, offset);
        if (start < 0) {
            return Optional.empty();
        }

        int tagEnd = xml.indexOf('>', start);
        int end;
        if (tagEnd < 0) {
            end = xml.length();
        } else if (xml.charAt(tagEnd - 1) == '/') {
            end = tagEnd + 1;
        } else {
            int close = xml.indexOf(CELL_CLOSE, tagEnd);
            int nextOpen = nextCellOpen(xml, tagEnd);
            if (close >= 0 && (nextOpen < 0 || close < nextOpen)) {
                end = close + CELL_CLOSE.length();
            } else if (nextOpen >= 0) {
                end = nextOpen;
            } else {
                end = close >= 0 ? close + CELL_CLOSE.length() : xml.length();
            }
        }
        int lineStart = xml.lastIndexOf('\n', start - 1) + 1;
        if (xml.substring(lineStart, start).isBlank()) {
            start = lineStart;
            if (end < xml.length() && xml.charAt(end) == '\n') {
                end++;
            }
        }
        return Optional.of(xml.substring(0, start) + xml.substring(end));
    }

    static int offsetOf(String xml, int line, int column) {
        int offset = 0;
        for (int current = 1; current < line; current++) {
            int newline = xml.indexOf('\n', offset);
            if (newline < 0) {
                return xml.length();
            }
            offset = newline + 1;
        }
        return Math.min(xml.length(), offset + Math.max(0, column - 1));
    }

    private static int lastCellOpen(String xml, int from) {
        int index = Math.min(from, xml.length() - 1);
        while (index >= 0) {
            int candidate = xml.lastIndexOf(CELL_OPEN, index);
            if (candidate < 0) {
                return -1;
            }
            if (isCellOpenAt(xml, candidate)) {
                return candidate;
            }
            index = candidate - 1;
        }
        return -1;
    }

    private static int nextCellOpen(String xml, int from) {
        int index = from;
        while (true) {
            int candidate = xml.indexOf(CELL_OPEN, index);
            if (candidate < 0 || isCellOpenAt(xml, candidate)) {
                return candidate;
            }
            index = candidate + 1;
        }
    }

    private static boolean isCellOpenAt(String xml, int index) {
        int after = index + CELL_OPEN.length();
        if (after >= xml.length()) {
            return true;
        }
        char c = xml.charAt(after);
        return Character.isWhitespace(c) || c == '>' || c == '/';
    }
}
