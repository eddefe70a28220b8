package com.diagramforge.core.ops;

import com.diagramforge.core.style.StyleMap;
import com.diagramforge.core.xml.MxCells;
import com.diagramforge.core.xml.XmlEscaper;
import org.w3c.dom.Element;

import java.util.regex.Pattern;

/**
 * Writes cell values so that markup is stored exactly once-escaped in the serialized
 * document.
 *
 * <p>A value has markup intent when it contains a tag, when the cell style already has
 * {@code html=1}, or when it contains an escaped {@code &lt;}. Such values get
 * {@code html=1} on the cell, newlines become {@code <br>}, and one layer of entity
 * escaping is removed before the value is stored. The serializer adds the single layer
 * back, so applying the same value twice never compounds escapes.
 */
final class MarkupText {

    private static final Pattern TAG = Pattern.compile("<\\s*/?\\s*[A-Za-z][A-Za-z0-9]*(\\s[^<>]*)?/?\\s*>");
    private static final Pattern NEWLINE = Pattern.compile("\\r?\\n");

    private MarkupText() {
    }

    /**
     * Stores {@code value} on the cell.
     *
     * @param cell target cell
     * @param value new value
     * @param preEscaped whether the value is already entity-escaped
     */
    static void assign(Element cell, String value, boolean preEscaped) {
        String text = value == null ? "" : value;
        StyleMap style = StyleMap.parse(MxCells.attribute(cell, MxCells.ATTR_STYLE));

        if (hasMarkupIntent(text, style)) {
            if (!style.is("html", "1")) {
                style.put("html", "1");
                cell.setAttribute(MxCells.ATTR_STYLE, style.serialize());
            }
            text = XmlEscaper.unescapeOnce(NEWLINE.matcher(text).replaceAll("<br>"));
        } else if (preEscaped) {
            text = XmlEscaper.unescapeOnce(text);
        }
        cell.setAttribute(MxCells.ATTR_VALUE, text);
    }

    static boolean hasMarkupIntent(String value, StyleMap style) {
        return TAG.matcher(value).find() || style.is("html", "1") || value.contains("&lt;");
    }
}
