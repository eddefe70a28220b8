package com.diagramforge.core.model;

/**
 * Style record for connectors.
 *
 * <p>Arrowheads are free-form dialect tokens ({@code classic}, {@code block}, {@code open},
 * {@code none}, ...). Exit/entry anchors are fractions of the source/target bounds in
 * {@code [0, 1]}.
 *
 * @param lineType routing kind; {@code null} routes orthogonally
 * @param startArrow arrowhead at the source end, {@code none} when absent
 * @param endArrow arrowhead at the target end, {@code classic} when absent
 * @param strokeColor line colour
 * @param strokeWidth line width
 * @param dashed dashed line
 * @param animated animated flow
 * @param exitX fractional exit anchor x
 * @param exitY fractional exit anchor y
 * @param entryX fractional entry anchor x
 * @param entryY fractional entry anchor y
 */
public record ConnectorStyle(
    LineType lineType,
    String startArrow,
    String endArrow,
    String strokeColor,
    Double strokeWidth,
    Boolean dashed,
    Boolean animated,
    Double exitX,
    Double exitY,
    Double entryX,
    Double entryY
) {
    public static final String DEFAULT_END_ARROW = "classic";
    public static final String DEFAULT_START_ARROW = "none";

    private static final ConnectorStyle EMPTY =
        new ConnectorStyle(null, null, null, null, null, null, null, null, null, null, null);

    public static ConnectorStyle empty() {
        return EMPTY;
    }

    public static ConnectorStyle of(LineType lineType) {
        return new ConnectorStyle(lineType, null, null, null, null, null, null, null, null, null, null);
    }

    public LineType lineTypeOrDefault() {
        return lineType != null ? lineType : LineType.ORTHOGONAL;
    }

    public String endArrowOrDefault() {
        return endArrow != null && !endArrow.isBlank() ? endArrow : DEFAULT_END_ARROW;
    }

    public String startArrowOrDefault() {
        return startArrow != null && !startArrow.isBlank() ? startArrow : DEFAULT_START_ARROW;
    }
}
