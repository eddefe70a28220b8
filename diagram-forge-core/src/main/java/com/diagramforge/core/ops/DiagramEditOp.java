package com.diagramforge.core.ops;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One structured edit against an existing diagram document.
 *
 * <p>In JSON the {@code type} property selects the variant. Unknown types decode to
 * {@link UnsupportedOp} so that the executor, not the JSON layer, reports them.
 *
 * <pre>{@code
 * [
 *   {"type": "updateComponent", "id": "api", "updates": {"fill": "#FFE0B2"}},
 *   {"type": "connectComponents", "id": "e9", "source": "api", "target": "db"}
 * ]
 * }</pre>
 *
 * @see DiagramOpsExecutor
 */
@JsonTypeInfo(
    use = JsonTypeInfo.Id.NAME,
    include = JsonTypeInfo.As.EXISTING_PROPERTY,
    property = "type",
    visible = true,
    defaultImpl = UnsupportedOp.class
)
@JsonSubTypes({
    @JsonSubTypes.Type(value = SetEdgePointsOp.class, name = SetEdgePointsOp.TYPE),
    @JsonSubTypes.Type(value = SetCellValueOp.class, name = SetCellValueOp.TYPE),
    @JsonSubTypes.Type(value = UpdateCellOp.class, name = UpdateCellOp.TYPE),
    @JsonSubTypes.Type(value = AddCellOp.class, name = AddCellOp.TYPE),
    @JsonSubTypes.Type(value = DeleteCellOp.class, name = DeleteCellOp.TYPE),
    @JsonSubTypes.Type(value = AddComponentOp.class, name = AddComponentOp.TYPE),
    @JsonSubTypes.Type(value = UpdateComponentOp.class, name = UpdateComponentOp.TYPE),
    @JsonSubTypes.Type(value = ConnectComponentsOp.class, name = ConnectComponentsOp.TYPE)
})
@JsonIgnoreProperties(ignoreUnknown = true)
public sealed interface DiagramEditOp
    permits SetEdgePointsOp, SetCellValueOp, UpdateCellOp, AddCellOp, DeleteCellOp, AddComponentOp,
        UpdateComponentOp, ConnectComponentsOp, UnsupportedOp {

    /**
     * Returns the wire discriminator of this operation.
     *
     * @return operation type, e.g. {@code "setCellValue"}
     */
    @JsonProperty("type")
    String type();
}
