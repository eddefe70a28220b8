package com.diagramforge.core.xml;

/**
 * Entity escaping for attribute values.
 */
public final class XmlEscaper {

    private XmlEscaper() {
    }

    /**
     * Escapes the five predefined XML entities.
     *
     * @param value raw text, may be {@code null}
     * @return escaped text, empty for {@code null}
     */
    public static String escape(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder(value.length() + 16);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '&' -> out.append("&amp;");
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                case '"' -> out.append("&quot;");
                case '\'' -> out.append("&apos;");
                default -> out.append(c);
            }
        }
        return out.toString();
    }

    /**
     * Reverses one level of escaping for the four common entities. {@code &amp;} is decoded
     * last so that {@code &amp;lt;} becomes {@code &lt;}, not {@code <}.
     *
     * @param value text, may be {@code null}
     * @return text with one level of escaping removed
     */
    public static String unescapeOnce(String value) {
        if (value == null || value.indexOf('&') < 0) {
            return value;
        }
        return value
            .replace("&lt;", "<")
            .replace("&gt;", ">")
            .replace("&quot;", "\"")
            .replace("&amp;", "&");
    }
}
