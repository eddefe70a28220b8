package com.diagramforge.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A typed, kind-discriminated view over one diagram cell.
 *
 * <p>Components are ephemeral projections: the converter turns them into XML, the parser
 * decodes them back, and the XML document stays the source of truth. Shared visual fields
 * are composed via {@link ShapeStyle} and {@link TextStyle} rather than inherited.
 *
 * <p>In JSON the {@code kind} property selects the variant:
 * <pre>{@code
 * [
 *   {"kind": "Rectangle", "id": "a", "label": "API", "position": {"x": 40, "y": 40}},
 *   {"kind": "AWSIcon", "id": "b", "service": "Lambda"},
 *   {"kind": "Connector", "id": "e1", "source": "a", "target": "b"}
 * ]
 * }</pre>
 *
 * @see ComponentKind
 */
@JsonTypeInfo(
    use = JsonTypeInfo.Id.NAME,
    include = JsonTypeInfo.As.EXISTING_PROPERTY,
    property = "kind",
    visible = true
)
@JsonSubTypes({
    @JsonSubTypes.Type(value = ShapeComponent.class, names = {
        "Rectangle", "Ellipse", "Diamond", "Hexagon", "Cylinder", "Parallelogram", "Step", "Note",
        "Server", "Desktop", "Laptop", "Router", "Switch", "Firewall", "Internet", "Database",
        "Actor", "Document", "Cloud"
    }),
    @JsonSubTypes.Type(value = RoundedRectComponent.class, name = "RoundedRect"),
    @JsonSubTypes.Type(value = TriangleComponent.class, name = "Triangle"),
    @JsonSubTypes.Type(value = TextComponent.class, name = "Text"),
    @JsonSubTypes.Type(value = ImageComponent.class, name = "Image"),
    @JsonSubTypes.Type(value = Connector.class, name = "Connector"),
    @JsonSubTypes.Type(value = SwimlaneComponent.class, name = "Swimlane"),
    @JsonSubTypes.Type(value = GroupComponent.class, name = "Group"),
    @JsonSubTypes.Type(value = CloudIconComponent.class, names = {"AWSIcon", "AzureIcon", "GCPIcon"}),
    @JsonSubTypes.Type(value = UmlClassComponent.class, name = "UMLClass"),
    @JsonSubTypes.Type(value = UmlInterfaceComponent.class, name = "UMLInterface"),
    @JsonSubTypes.Type(value = UmlPackageComponent.class, name = "UMLPackage"),
    @JsonSubTypes.Type(value = CardComponent.class, name = "Card"),
    @JsonSubTypes.Type(value = ListComponent.class, name = "List"),
    @JsonSubTypes.Type(value = TimelineComponent.class, name = "Timeline"),
    @JsonSubTypes.Type(value = TableComponent.class, name = "Table"),
    @JsonSubTypes.Type(value = ProcessComponent.class, name = "Process"),
    @JsonSubTypes.Type(value = CalloutComponent.class, name = "Callout")
})
@JsonIgnoreProperties(ignoreUnknown = true)
public sealed interface DiagramComponent permits VertexComponent, Connector {

    /** Id of the default layer cell every top-level element belongs to. */
    String DEFAULT_LAYER_ID = "1";

    /** Id of the invisible root cell. */
    String ROOT_ID = "0";

    String id();

    /**
     * Returns the containing cell id as given, or {@code null} for the default layer.
     *
     * @return parent id or {@code null}
     */
    String parent();

    @JsonProperty("kind")
    ComponentKind kind();

    /**
     * Returns the parent id with the default layer substituted for an absent value.
     *
     * @return parent id, never {@code null}
     */
    default String effectiveParent() {
        String parent = parent();
        return parent == null || parent.isBlank() ? DEFAULT_LAYER_ID : parent;
    }
}
