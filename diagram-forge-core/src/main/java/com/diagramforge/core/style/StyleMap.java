package com.diagramforge.core.style;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered property map over a dialect style string.
 *
 * <p>A style string is a semicolon-delimited list of tokens, each either a bare flag
 * ({@code ellipse}) or a {@code key=value} pair ({@code fillColor=#fff}). Flags are stored
 * with a {@code null} value. Token order is preserved; re-putting an existing key keeps its
 * original position.
 *
 * <pre>{@code
 * StyleMap style = StyleMap.parse("rounded=1;whiteSpace=wrap;html=1;");
 * style.put("fillColor", "#DAE8FC");
 * style.serialize(); // rounded=1;whiteSpace=wrap;html=1;fillColor=#DAE8FC;
 * }</pre>
 */
public final class StyleMap {

    private final LinkedHashMap<String, String> tokens = new LinkedHashMap<>();

    public StyleMap() {
    }

    /**
     * Parses a style string: split on {@code ;}, then on the first {@code =}.
     * Empty tokens are skipped; keys and values are trimmed.
     *
     * @param style style string, may be {@code null}
     * @return new map
     */
    public static StyleMap parse(String style) {
        StyleMap map = new StyleMap();
        if (style == null || style.isBlank()) {
            return map;
        }
        for (String token : style.split(";")) {
            String trimmed = token.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int eq = trimmed.indexOf('=');
            if (eq < 0) {
                map.tokens.put(trimmed, null);
            } else {
                String key = trimmed.substring(0, eq).trim();
                if (!key.isEmpty()) {
                    map.tokens.put(key, trimmed.substring(eq + 1).trim());
                }
            }
        }
        return map;
    }

    /**
     * Returns the value for a key, or {@code null} when absent or a bare flag.
     *
     * @param key token name
     * @return value or {@code null}
     */
    public String get(String key) {
        return tokens.get(key);
    }

    public boolean has(String key) {
        return tokens.containsKey(key);
    }

    /**
     * Returns whether the key is present with exactly the given value.
     *
     * @param key token name
     * @param value expected value
     * @return {@code true} on match
     */
    public boolean is(String key, String value) {
        return tokens.containsKey(key) && Objects.equals(tokens.get(key), value);
    }

    /**
     * Returns whether the token is a set flag: either a bare flag or {@code key=1}.
     *
     * @param key token name
     * @return {@code true} if enabled
     */
    public boolean isEnabled(String key) {
        return tokens.containsKey(key) && (tokens.get(key) == null || "1".equals(tokens.get(key)));
    }

    public Double getDouble(String key) {
        String value = tokens.get(key);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Double.valueOf(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public StyleMap put(String key, String value) {
        Objects.requireNonNull(key, "key must not be null");
        tokens.put(key, value);
        return this;
    }

    public StyleMap putFlag(String key) {
        return put(key, null);
    }

    public StyleMap remove(String key) {
        tokens.remove(key);
        return this;
    }

    /**
     * Adds all tokens from another map, overwriting existing keys in place.
     *
     * @param other source map
     * @return this map
     */
    public StyleMap putAll(StyleMap other) {
        tokens.putAll(other.tokens);
        return this;
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(tokens.keySet());
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(tokens);
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    public int size() {
        return tokens.size();
    }

    /**
     * Serializes back to the dialect form, each token followed by {@code ;}.
     *
     * @return style string; empty when the map is empty
     */
    public String serialize() {
        StringBuilder out = new StringBuilder();
        tokens.forEach((key, value) -> {
            out.append(key);
            if (value != null) {
                out.append('=').append(value);
            }
            out.append(';');
        });
        return out.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StyleMap other)) {
            return false;
        }
        return tokens.equals(other.tokens);
    }

    @Override
    public int hashCode() {
        return tokens.hashCode();
    }

    @Override
    public String toString() {
        return serialize();
    }
}
