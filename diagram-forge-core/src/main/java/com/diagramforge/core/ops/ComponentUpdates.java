package com.diagramforge.core.ops;

import com.diagramforge.core.model.Position;
import com.diagramforge.core.model.Size;

/**
 * Fields an {@link UpdateComponentOp} may overwrite. {@code null} means unchanged.
 * {@code label}, {@code title} and {@code text} all target the cell value; the first
 * non-null one in that order wins.
 *
 * @param position new position
 * @param size new size
 * @param label new label
 * @param title new title
 * @param text new text
 * @param fill fill colour
 * @param stroke stroke colour
 * @param strokeWidth stroke width
 * @param opacity opacity
 * @param fontSize font size
 * @param fontColor font colour
 * @param shadow shadow on/off
 * @param dashed dashed outline on/off
 */
public record ComponentUpdates(
    Position position,
    Size size,
    String label,
    String title,
    String text,
    String fill,
    String stroke,
    Double strokeWidth,
    Double opacity,
    Double fontSize,
    String fontColor,
    Boolean shadow,
    Boolean dashed
) {
    /**
     * Returns the new cell value, if any of the text fields is set.
     *
     * @return label, title or text, or {@code null}
     */
    public String valueUpdate() {
        if (label != null) {
            return label;
        }
        if (title != null) {
            return title;
        }
        return text;
    }
}
