package com.diagramforge.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Text style bag shared by all vertex kinds. Every field is optional.
 *
 * @param fontSize font size in points
 * @param fontFamily font family name
 * @param fontColor font colour
 * @param fontStyle weight/slant
 * @param align horizontal alignment
 * @param verticalAlign vertical alignment
 */
public record TextStyle(
    Double fontSize,
    String fontFamily,
    String fontColor,
    FontStyle fontStyle,
    Align align,
    VerticalAlign verticalAlign
) {
    private static final TextStyle EMPTY = new TextStyle(null, null, null, null, null, null);

    public static TextStyle empty() {
        return EMPTY;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return EMPTY.equals(this);
    }

    /**
     * Font weight and slant, encoded in the dialect as the bit field {@code fontStyle=0..3}.
     */
    public enum FontStyle {
        NORMAL("normal", 0),
        BOLD("bold", 1),
        ITALIC("italic", 2),
        BOLD_ITALIC("boldItalic", 3);

        private final String wireName;
        private final int code;

        FontStyle(String wireName, int code) {
            this.wireName = wireName;
            this.code = code;
        }

        @JsonValue
        public String wireName() {
            return wireName;
        }

        public int code() {
            return code;
        }

        public static Optional<FontStyle> fromCode(int code) {
            return Arrays.stream(values()).filter(s -> s.code == code).findFirst();
        }
    }

    public enum Align {
        LEFT, CENTER, RIGHT;

        @JsonValue
        public String wireName() {
            return name().toLowerCase();
        }
    }

    public enum VerticalAlign {
        TOP, MIDDLE, BOTTOM;

        @JsonValue
        public String wireName() {
            return name().toLowerCase();
        }
    }
}
