package com.diagramforge.core.repair;

import com.diagramforge.core.repair.MarkupTags.Tag;
import com.diagramforge.core.util.IdGenerator;
import com.diagramforge.core.xml.MxCells;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The auto-fix rules, in pipeline order.
 *
 * <p>Each rule is a narrow rewrite of the whole text and can be applied on its own. The
 * order matters: later rules assume earlier ones already ran (for example, tag-based rules
 * expect attribute quoting to be repaired).
 */
public final class RepairRules {

    static final Set<String> STRUCTURAL_ATTRIBUTES = Set.of("parent", "source", "target", "vertex", "edge", "connectable");

    static final Set<String> ALLOWED_TAGS = Set.of(
        "mxfile", "diagram", "mxGraphModel", "root", "mxCell", "mxGeometry", "mxPoint", "Array", "object", "mxRectangle");

    private static final Map<String, String> CANONICAL_TAG_NAMES = new HashMap<>();

    static {
        for (String name : ALLOWED_TAGS) {
            CANONICAL_TAG_NAMES.put(name.toLowerCase(Locale.ROOT), name);
        }
    }

    private static final Pattern ATTRIBUTE = Pattern.compile("(\\s+)([A-Za-z_:][-\\w:.]*)\\s*=\\s*(\"[^\"]*\"|'[^']*')");
    private static final Pattern ROOT_START = Pattern.compile("<(?:\\?xml|mxfile|diagram|mxGraphModel|root|mxCell)\\b");
    private static final Pattern CDATA_WRAPPER = Pattern.compile("^\\s*<!\\[CDATA\\[([\\s\\S]*)]]>\\s*$");
    private static final Pattern BARE_AMPERSAND = Pattern.compile("&(?!(?:amp|lt|gt|quot|apos);|#)");
    private static final Pattern DOUBLE_ESCAPED = Pattern.compile("&amp;((?:amp|lt|gt|quot|apos|#[0-9]+|#x[0-9A-Fa-f]+);)");
    private static final Pattern BROKEN_SELF_CLOSE = Pattern.compile("(?:/\\s+>|/{2,}\\s*>)");
    private static final Pattern MISSING_SPACE = Pattern.compile("(=\\s*\"[^\"<>]*\")(?=[A-Za-z_:][-\\w:.]*\\s*=)");
    private static final Pattern STYLE_ATTRIBUTE = Pattern.compile("(\\sstyle\\s*=\\s*\")([^\"]*)(\")");
    private static final Pattern QUOTED_COLOR = Pattern.compile(
        "([A-Za-z]*[Cc]olor=)(?:'|&quot;|&#39;|&apos;)(#[0-9A-Fa-f]{3,8}|[A-Za-z]+)(?:'|&quot;|&#39;|&apos;)");
    private static final Pattern CHAR_REFERENCE = Pattern.compile("&#([^;\\s<>\"']*);?");
    private static final Pattern COMMENT = Pattern.compile("<!--([\\s\\S]*?)-->");
    private static final Pattern TAG_NAME = Pattern.compile("<(/?)([A-Za-z][A-Za-z0-9]*)(?=[\\s/>])");
    private static final Pattern LAST_CLOSING = Pattern.compile("</(?:mxfile|diagram|mxGraphModel|root|mxCell)\\s*>");
    private static final Pattern ID_ATTRIBUTE = Pattern.compile("(\\sid\\s*=\\s*)(\"([^\"]*)\"|'([^']*)')");

    public static final RepairRule UNESCAPE_EMBEDDED_QUOTES = rule("unescape-embedded-quotes",
        "Removed backslash escaping from attribute quotes",
        xml -> xml.contains("\\\"") ? xml.replace("\\\"", "\"") : xml);

    public static final RepairRule STRIP_CDATA_WRAPPER = rule("strip-cdata-wrapper",
        "Removed CDATA block wrapping the document",
        xml -> {
            Matcher matcher = CDATA_WRAPPER.matcher(xml);
            return matcher.matches() ? matcher.group(1) : xml;
        });

    public static final RepairRule DROP_LEADING_PROSE = rule("drop-leading-prose",
        "Removed text before the first diagram tag",
        xml -> {
            Matcher matcher = ROOT_START.matcher(xml);
            if (matcher.find() && !xml.substring(0, matcher.start()).isBlank()) {
                return xml.substring(matcher.start());
            }
            return xml;
        });

    public static final RepairRule DEDUPE_STRUCTURAL_ATTRIBUTES = rule("dedupe-structural-attributes",
        "Removed duplicate parent/source/target/vertex/edge/connectable attributes",
        RepairRules::dedupeStructuralAttributes);

    public static final RepairRule ESCAPE_BARE_AMPERSANDS = rule("escape-bare-ampersands",
        "Escaped bare & characters",
        xml -> BARE_AMPERSAND.matcher(xml).replaceAll("&amp;"));

    public static final RepairRule UNMANGLE_DOUBLE_ESCAPES = rule("unmangle-double-escapes",
        "Collapsed double-escaped entities",
        xml -> {
            String previous;
            String current = xml;
            do {
                previous = current;
                current = DOUBLE_ESCAPED.matcher(current).replaceAll("&$1");
            } while (!current.equals(previous));
            return current;
        });

    public static final RepairRule FIX_ATTRIBUTE_QUOTING = rule("fix-attribute-quoting",
        "Fixed unquoted or doubly-quoted attribute values",
        xml -> MarkupTags.rewrite(xml, tag -> tag.tag().closing() ? tag.text() : fixQuoting(tag.text())));

    public static final RepairRule FIX_SELF_CLOSING_TAGS = rule("fix-self-closing-tags",
        "Fixed malformed self-closing tag endings",
        xml -> BROKEN_SELF_CLOSE.matcher(xml).replaceAll("/>"));

    public static final RepairRule INSERT_ATTRIBUTE_SPACES = rule("insert-attribute-spaces",
        "Inserted missing spaces between attributes",
        xml -> MISSING_SPACE.matcher(xml).replaceAll("$1 "));

    public static final RepairRule UNQUOTE_STYLE_COLORS = rule("unquote-style-colors",
        "Removed quotes around colour values in style attributes",
        xml -> replaceAll(STYLE_ATTRIBUTE, xml,
            m -> m.group(1) + QUOTED_COLOR.matcher(m.group(2)).replaceAll("$1$2") + m.group(3)));

    public static final RepairRule ESCAPE_LT_IN_ATTRIBUTES = rule("escape-lt-in-attributes",
        "Escaped < inside attribute values",
        xml -> MarkupTags.rewrite(xml, tag -> escapeLtInQuotes(tag.text())));

    public static final RepairRule DROP_INVALID_CHAR_REFERENCES = rule("drop-invalid-char-references",
        "Removed invalid numeric character references",
        xml -> replaceAll(CHAR_REFERENCE, xml, m -> isValidCharReference(m.group(0)) ? m.group(0) : ""));

    public static final RepairRule FIX_COMMENT_HYPHENS = rule("fix-comment-hyphens",
        "Removed double hyphens inside comments",
        xml -> replaceAll(COMMENT, xml, m -> {
            String body = m.group(1).replaceAll("-{2,}", "-");
            if (body.endsWith("-")) {
                body = body.substring(0, body.length() - 1);
            }
            return "<!--" + body + "-->";
        }));

    public static final RepairRule NORMALIZE_TAG_CASE = rule("normalize-tag-case",
        "Normalized tag name casing",
        xml -> replaceAll(TAG_NAME, xml, m -> {
            String canonical = CANONICAL_TAG_NAMES.get(m.group(2).toLowerCase(Locale.ROOT));
            return canonical == null ? m.group(0) : "<" + m.group(1) + canonical;
        }));

    public static final RepairRule STRIP_UNKNOWN_TAGS = rule("strip-unknown-tags",
        "Removed tags outside the diagram vocabulary",
        xml -> MarkupTags.rewrite(xml, tag -> ALLOWED_TAGS.contains(tag.tag().name()) ? tag.text() : ""));

    public static final RepairRule CLOSE_OPEN_TAGS = rule("close-open-tags",
        "Closed tags left open at end of document",
        RepairRules::closeOpenTags);

    public static final RepairRule REMOVE_EXCESS_CLOSING_TAGS = rule("remove-excess-closing-tags",
        "Removed unmatched closing tags",
        RepairRules::removeExcessClosingTags);

    public static final RepairRule TRIM_TRAILING_CONTENT = rule("trim-trailing-content",
        "Removed content after the last closing tag",
        xml -> {
            int end = -1;
            Matcher matcher = LAST_CLOSING.matcher(xml);
            while (matcher.find()) {
                end = matcher.end();
            }
            if (end < 0 || xml.substring(end).isBlank()) {
                return xml;
            }
            return xml.substring(0, end);
        });

    public static final RepairRule FLATTEN_DUPLICATE_NESTED_CELLS = rule("flatten-duplicate-nested-cells",
        "Merged consecutive mxCell open tags sharing an id",
        RepairRules::flattenDuplicateNestedCells);

    public static final RepairRule FLATTEN_NESTED_CELLS = rule("flatten-nested-cells",
        "Moved nested mxCell elements up to siblings",
        RepairRules::flattenNestedCells);

    public static final RepairRule RENAME_DUPLICATE_IDS = rule("rename-duplicate-ids",
        "Renamed duplicate cell ids",
        RepairRules::renameDuplicateIds);

    public static final RepairRule SYNTHESIZE_EMPTY_IDS = rule("synthesize-empty-ids",
        "Generated ids for cells with an empty id",
        RepairRules::synthesizeEmptyIds);

    private static final List<RepairRule> DEFAULTS = List.of(
        UNESCAPE_EMBEDDED_QUOTES,
        STRIP_CDATA_WRAPPER,
        DROP_LEADING_PROSE,
        DEDUPE_STRUCTURAL_ATTRIBUTES,
        ESCAPE_BARE_AMPERSANDS,
        UNMANGLE_DOUBLE_ESCAPES,
        FIX_ATTRIBUTE_QUOTING,
        FIX_SELF_CLOSING_TAGS,
        INSERT_ATTRIBUTE_SPACES,
        UNQUOTE_STYLE_COLORS,
        ESCAPE_LT_IN_ATTRIBUTES,
        DROP_INVALID_CHAR_REFERENCES,
        FIX_COMMENT_HYPHENS,
        NORMALIZE_TAG_CASE,
        STRIP_UNKNOWN_TAGS,
        CLOSE_OPEN_TAGS,
        REMOVE_EXCESS_CLOSING_TAGS,
        TRIM_TRAILING_CONTENT,
        FLATTEN_DUPLICATE_NESTED_CELLS,
        FLATTEN_NESTED_CELLS,
        RENAME_DUPLICATE_IDS,
        SYNTHESIZE_EMPTY_IDS
    );

    private RepairRules() {
    }

    /**
     * Returns the rules in the order the pipeline applies them.
     *
     * @return immutable ordered rule list
     */
    public static List<RepairRule> defaults() {
        return DEFAULTS;
    }

    /**
     * Rule that rewrites the text and reports a fixed description when the text changed.
     */
    record TextRule(String name, String description, UnaryOperator<String> rewrite) implements RepairRule {

        @Override
        public RepairStep apply(String xml) {
            String rewritten = rewrite.apply(xml);
            return rewritten.equals(xml) ? RepairStep.unchanged(xml) : RepairStep.fixed(rewritten, description);
        }
    }

    private static RepairRule rule(String name, String description, UnaryOperator<String> rewrite) {
        return new TextRule(name, description, rewrite);
    }

    private static String dedupeStructuralAttributes(String xml) {
        return MarkupTags.rewrite(xml, tag -> {
            if (tag.tag().closing()) {
                return tag.text();
            }
            Set<String> seen = new HashSet<>();
            StringBuilder out = new StringBuilder();
            Matcher matcher = ATTRIBUTE.matcher(tag.text());
            while (matcher.find()) {
                String name = matcher.group(2);
                boolean duplicate = STRUCTURAL_ATTRIBUTES.contains(name) && !seen.add(name);
                matcher.appendReplacement(out, duplicate ? "" : Matcher.quoteReplacement(matcher.group(0)));
            }
            matcher.appendTail(out);
            return out.toString();
        });
    }

    static String fixQuoting(String tag) {
        StringBuilder out = new StringBuilder(tag.length() + 8);
        char quote = 0;
        int lastClosed = -1;
        int i = 0;
        while (i < tag.length()) {
            char c = tag.charAt(i);
            if (quote != 0) {
                out.append(c);
                if (c == quote) {
                    quote = 0;
                    lastClosed = out.length();
                }
                i++;
            } else if (c == '"' || c == '\'') {
                if (lastClosed == out.length()) {
                    i++;
                    continue;
                }
                quote = c;
                out.append(c);
                i++;
            } else if (c == '=' && i + 1 < tag.length() && isUnquotedValueStart(tag.charAt(i + 1))) {
                int end = i + 1;
                while (end < tag.length() && !Character.isWhitespace(tag.charAt(end)) && tag.charAt(end) != '>'
                    && !tag.startsWith("/>", end)) {
                    end++;
                }
                out.append("=\"").append(tag, i + 1, end).append('"');
                lastClosed = out.length();
                i = end;
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    private static boolean isUnquotedValueStart(char c) {
        return c != '"' && c != '\'' && c != '>' && c != '/' && !Character.isWhitespace(c);
    }

    private static String escapeLtInQuotes(String tag) {
        StringBuilder out = new StringBuilder(tag.length());
        char quote = 0;
        for (int i = 0; i < tag.length(); i++) {
            char c = tag.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                    out.append(c);
                } else {
                    out.append(c == '<' ? "&lt;" : String.valueOf(c));
                }
            } else {
                if (c == '"' || c == '\'') {
                    quote = c;
                }
                out.append(c);
            }
        }
        return out.toString();
    }

    static boolean isValidCharReference(String reference) {
        if (!reference.endsWith(";")) {
            return false;
        }
        String body = reference.substring(2, reference.length() - 1);
        int codePoint;
        try {
            if (body.startsWith("x") || body.startsWith("X")) {
                if (body.length() == 1 || !body.substring(1).matches("[0-9A-Fa-f]+")) {
                    return false;
                }
                codePoint = Integer.parseInt(body.substring(1), 16);
            } else {
                if (!body.matches("[0-9]+")) {
                    return false;
                }
                codePoint = Integer.parseInt(body);
            }
        } catch (NumberFormatException e) {
            return false;
        }
        return codePoint == 0x9 || codePoint == 0xA || codePoint == 0xD
            || (codePoint >= 0x20 && codePoint <= 0xD7FF)
            || (codePoint >= 0xE000 && codePoint <= 0xFFFD)
            || (codePoint >= 0x10000 && codePoint <= 0x10FFFF);
    }

    private static String closeOpenTags(String xml) {
        List<Tag> tags = MarkupTags.scan(xml);
        String text = xml;
        if (!tags.isEmpty() && !tags.get(tags.size() - 1).complete()) {
            text = xml.substring(0, tags.get(tags.size() - 1).start());
        }

        List<String> open = new ArrayList<>();
        for (Tag tag : tags) {
            if (tag.opens()) {
                open.add(tag.name());
            } else if (tag.closing()) {
                int index = open.lastIndexOf(tag.name());
                if (index >= 0) {
                    open.remove(index);
                }
            }
        }
        if (open.isEmpty()) {
            return text;
        }
        StringBuilder out = new StringBuilder(text.stripTrailing());
        for (int i = open.size() - 1; i >= 0; i--) {
            out.append("</").append(open.get(i)).append('>');
        }
        return out.toString();
    }

    private static String removeExcessClosingTags(String xml) {
        List<Tag> tags = MarkupTags.scan(xml);
        Map<String, Integer> opens = new HashMap<>();
        Map<String, Integer> closes = new HashMap<>();
        for (Tag tag : tags) {
            if (tag.opens()) {
                opens.merge(tag.name(), 1, Integer::sum);
            } else if (tag.closing() && tag.complete()) {
                closes.merge(tag.name(), 1, Integer::sum);
            }
        }

        Map<String, Integer> excess = new HashMap<>();
        closes.forEach((name, count) -> {
            int extra = count - opens.getOrDefault(name, 0);
            if (extra > 0) {
                excess.put(name, extra);
            }
        });
        if (excess.isEmpty()) {
            return xml;
        }

        StringBuilder out = new StringBuilder(xml);
        for (int i = tags.size() - 1; i >= 0; i--) {
            Tag tag = tags.get(i);
            Integer remaining = excess.get(tag.name());
            if (tag.closing() && tag.complete() && remaining != null && remaining > 0) {
                out.delete(tag.start(), tag.end());
                excess.put(tag.name(), remaining - 1);
            }
        }
        return out.toString();
    }

    private static String flattenDuplicateNestedCells(String xml) {
        List<Tag> tags = MarkupTags.scan(xml);
        List<int[]> removals = new ArrayList<>();
        for (int i = 0; i + 1 < tags.size(); i++) {
            Tag outer = tags.get(i);
            Tag inner = tags.get(i + 1);
            if (!outer.opens() || !outer.is(MxCells.CELL) || !inner.is(MxCells.CELL) || inner.closing()
                || !inner.complete() || !xml.substring(outer.end(), inner.start()).isBlank()) {
                continue;
            }
            String outerId = idOf(outer.text(xml));
            if (outerId == null || !outerId.equals(idOf(inner.text(xml)))) {
                continue;
            }
            removals.add(new int[] {outer.end(), inner.end()});
            if (inner.opens()) {
                for (int j = i + 2; j < tags.size(); j++) {
                    Tag close = tags.get(j);
                    if (close.closing() && close.is(MxCells.CELL)) {
                        removals.add(new int[] {close.start(), close.end()});
                        break;
                    }
                }
            }
            i++;
        }
        return removeRanges(xml, removals);
    }

    private static String flattenNestedCells(String xml) {
        List<Tag> tags = MarkupTags.scan(xml);
        StringBuilder out = new StringBuilder(xml.length() + 32);
        Deque<Tag> openCells = new ArrayDeque<>();
        int suppressedCloses = 0;
        int last = 0;
        for (Tag tag : tags) {
            if (!tag.is(MxCells.CELL) || !tag.complete()) {
                continue;
            }
            if (tag.closing()) {
                if (!openCells.isEmpty()) {
                    openCells.pop();
                } else if (suppressedCloses > 0) {
                    out.append(xml, last, tag.start());
                    last = tag.end();
                    suppressedCloses--;
                }
                continue;
            }
            if (!openCells.isEmpty()) {
                out.append(xml, last, tag.start()).append("</mxCell>");
                last = tag.start();
                openCells.pop();
                suppressedCloses++;
            }
            if (tag.opens()) {
                openCells.push(tag);
            }
        }
        out.append(xml.substring(last));
        return out.toString();
    }

    private static String renameDuplicateIds(String xml) {
        List<Tag> cells = MarkupTags.scan(xml).stream()
            .filter(tag -> !tag.closing() && tag.complete() && (tag.is(MxCells.CELL) || tag.is("object")))
            .toList();
        Set<String> taken = new HashSet<>();
        for (Tag cell : cells) {
            String id = idOf(cell.text(xml));
            if (id != null) {
                taken.add(id);
            }
        }

        Set<String> seen = new HashSet<>();
        Map<String, Integer> counters = new HashMap<>();
        StringBuilder out = new StringBuilder(xml.length() + 16);
        int last = 0;
        for (Tag cell : cells) {
            String text = cell.text(xml);
            String id = idOf(text);
            if (id == null || id.isEmpty() || seen.add(id)) {
                continue;
            }
            String renamed;
            do {
                int n = counters.merge(id, 1, Integer::sum);
                renamed = id + "_dup" + n;
            } while (taken.contains(renamed));
            taken.add(renamed);
            out.append(xml, last, cell.start()).append(replaceId(text, renamed));
            last = cell.end();
        }
        out.append(xml.substring(last));
        return out.toString();
    }

    private static String synthesizeEmptyIds(String xml) {
        List<Tag> cells = MarkupTags.scan(xml).stream()
            .filter(tag -> !tag.closing() && tag.complete() && tag.is(MxCells.CELL))
            .toList();
        Set<String> taken = new HashSet<>();
        for (Tag cell : cells) {
            String id = idOf(cell.text(xml));
            if (id != null) {
                taken.add(id);
            }
        }

        StringBuilder out = new StringBuilder(xml.length() + 16);
        int last = 0;
        int counter = 0;
        for (Tag cell : cells) {
            String text = cell.text(xml);
            String id = idOf(text);
            if (id == null || !id.isBlank()) {
                continue;
            }
            String generated;
            do {
                generated = "cell-" + IdGenerator.generate(text, Integer.toString(++counter));
            } while (taken.contains(generated));
            taken.add(generated);
            out.append(xml, last, cell.start()).append(replaceId(text, generated));
            last = cell.end();
        }
        out.append(xml.substring(last));
        return out.toString();
    }

    static String idOf(String tagText) {
        Matcher matcher = ID_ATTRIBUTE.matcher(tagText);
        if (!matcher.find()) {
            return null;
        }
        return matcher.group(3) != null ? matcher.group(3) : matcher.group(4);
    }

    private static String replaceId(String tagText, String id) {
        Matcher matcher = ID_ATTRIBUTE.matcher(tagText);
        if (!matcher.find()) {
            return tagText;
        }
        return tagText.substring(0, matcher.start()) + matcher.group(1) + '"' + id + '"' + tagText.substring(matcher.end());
    }

    private static String removeRanges(String text, List<int[]> ranges) {
        if (ranges.isEmpty()) {
            return text;
        }
        List<int[]> sorted = new ArrayList<>(ranges);
        sorted.sort((a, b) -> Integer.compare(b[0], a[0]));
        StringBuilder out = new StringBuilder(text);
        for (int[] range : sorted) {
            out.delete(range[0], range[1]);
        }
        return out.toString();
    }

    private static String replaceAll(Pattern pattern, String text, Function<Matcher, String> replacement) {
        Matcher matcher = pattern.matcher(text);
        StringBuilder out = new StringBuilder(text.length());
        while (matcher.find()) {
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement.apply(matcher)));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
