package com.diagramforge.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Table container. Only the title is rendered into the cell itself; header and row cells
 * are separate child cells in the dialect.
 *
 * @param id unique cell id
 * @param parent containing cell id
 * @param position top-left corner
 * @param size explicit size
 * @param style shape style bag
 * @param textStyle text style bag
 * @param title table title
 * @param headers column headers
 * @param rows row values
 */
public record TableComponent(
    String id,
    String parent,
    Position position,
    Size size,
    ShapeStyle style,
    TextStyle textStyle,
    String title,
    List<String> headers,
    List<List<String>> rows
) implements VertexComponent {

    public TableComponent {
        Objects.requireNonNull(id, "id must not be null");
        if (style == null) {
            style = ShapeStyle.empty();
        }
        if (textStyle == null) {
            textStyle = TextStyle.empty();
        }
        headers = headers == null ? List.of() : List.copyOf(headers);
        rows = rows == null ? List.of() : rows.stream().map(List::copyOf).toList();
    }

    @Override
    public ComponentKind kind() {
        return ComponentKind.TABLE;
    }
}
