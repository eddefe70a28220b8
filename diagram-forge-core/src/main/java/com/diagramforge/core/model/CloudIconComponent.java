package com.diagramforge.core.model;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Icon for a cloud-provider service. The {@code kind} selects the provider
 * ({@code AWSIcon}, {@code AzureIcon} or {@code GCPIcon}); {@code service} is an open-ended
 * service name such as {@code Lambda} or {@code CosmosDB}.
 *
 * @param kind provider icon kind
 * @param id unique cell id
 * @param parent containing cell id
 * @param position top-left corner
 * @param size explicit size
 * @param style shape style bag
 * @param textStyle text style bag
 * @param service provider service name
 * @param label caption
 */
public record CloudIconComponent(
    ComponentKind kind,
    String id,
    String parent,
    Position position,
    Size size,
    ShapeStyle style,
    TextStyle textStyle,
    String service,
    String label
) implements VertexComponent {

    public static final Set<ComponentKind> SUPPORTED_KINDS =
        EnumSet.of(ComponentKind.AWS_ICON, ComponentKind.AZURE_ICON, ComponentKind.GCP_ICON);

    public CloudIconComponent {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(service, "service must not be null");
        if (!SUPPORTED_KINDS.contains(kind)) {
            throw new IllegalArgumentException("Kind " + kind + " is not a cloud icon");
        }
        if (style == null) {
            style = ShapeStyle.empty();
        }
        if (textStyle == null) {
            textStyle = TextStyle.empty();
        }
    }

    public static CloudIconComponent of(ComponentKind kind, String id, String service, String label) {
        return new CloudIconComponent(kind, id, null, null, null, null, null, service, label);
    }
}
