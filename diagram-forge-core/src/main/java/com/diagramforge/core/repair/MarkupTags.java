package com.diagramforge.core.repair;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Lenient tag scanner for text that may not be well-formed.
 *
 * <p>Finds start, end and self-closing tags, honouring quotes inside tags so that a bare
 * {@code <} or {@code >} in an attribute value does not end the tag. Comments, processing
 * instructions and CDATA sections are skipped. When a quote is never closed the tag ends at
 * the first {@code >} instead.
 */
final class MarkupTags {

    /**
     * One scanned tag.
     *
     * @param start offset of {@code <}
     * @param end offset just past {@code >}, or the text length for an unterminated tag
     * @param name tag name as written
     * @param closing {@code true} for {@code </name>}
     * @param selfClosing {@code true} for {@code <name ... />}
     * @param complete {@code false} when the text ends inside the tag
     */
    record Tag(int start, int end, String name, boolean closing, boolean selfClosing, boolean complete) {

        boolean opens() {
            return !closing && !selfClosing && complete;
        }

        boolean is(String tagName) {
            return name.equals(tagName);
        }

        String text(String source) {
            return source.substring(start, end);
        }
    }

    private MarkupTags() {
    }

    static List<Tag> scan(String text) {
        List<Tag> tags = new ArrayList<>();
        int i = 0;
        int length = text.length();
        while (i < length) {
            int lt = text.indexOf('<', i);
            if (lt < 0 || lt + 1 >= length) {
                break;
            }
            if (text.startsWith("<!--", lt)) {
                i = skipPast(text, lt + 4, "-->");
                continue;
            }
            if (text.startsWith("<![CDATA[", lt)) {
                i = skipPast(text, lt + 9, "]]>");
                continue;
            }
            if (text.startsWith("<?", lt) || text.startsWith("<!", lt)) {
                i = skipPast(text, lt + 2, ">");
                continue;
            }

            boolean closing = text.charAt(lt + 1) == '/';
            int nameStart = closing ? lt + 2 : lt + 1;
            if (nameStart >= length || !Character.isLetter(text.charAt(nameStart))) {
                i = lt + 1;
                continue;
            }
            int nameEnd = nameStart;
            while (nameEnd < length && isNameChar(text.charAt(nameEnd))) {
                nameEnd++;
            }

            int end = findTagEnd(text, nameEnd);
            boolean complete = end > 0;
            if (!complete) {
                end = length;
            }
            String name = text.substring(nameStart, nameEnd);
            boolean selfClosing = complete && !closing && text.substring(lt, end - 1).stripTrailing().endsWith("/");
            tags.add(new Tag(lt, end, name, closing, selfClosing, complete));
            i = end;
        }
        return tags;
    }

    /**
     * Replaces every complete tag with the value returned by {@code rewrite}.
     *
     * @param text source text
     * @param rewrite returns replacement text for a tag, or the tag's own text
     * @return rewritten text
     */
    static String rewrite(String text, Function<TagText, String> rewrite) {
        StringBuilder out = new StringBuilder(text.length());
        int last = 0;
        for (Tag tag : scan(text)) {
            if (!tag.complete()) {
                continue;
            }
            out.append(text, last, tag.start());
            out.append(rewrite.apply(new TagText(tag, tag.text(text))));
            last = tag.end();
        }
        out.append(text.substring(last));
        return out.toString();
    }

    /**
     * Tag paired with its source text.
     *
     * @param tag scanned tag
     * @param text tag text including the angle brackets
     */
    record TagText(Tag tag, String text) {
    }

    static boolean isNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == ':' || c == '-' || c == '.';
    }

    private static int findTagEnd(String text, int from) {
        char quote = 0;
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '>') {
                return i + 1;
            }
        }
        int plain = text.indexOf('>', from);
        return plain < 0 ? -1 : plain + 1;
    }

    private static int skipPast(String text, int from, String terminator) {
        int index = text.indexOf(terminator, from);
        return index < 0 ? text.length() : index + terminator.length();
    }
}
