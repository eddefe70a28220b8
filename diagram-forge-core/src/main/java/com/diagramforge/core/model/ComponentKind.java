package com.diagramforge.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of component kinds understood by the engine.
 *
 * <p>Each kind carries the wire name used as the {@code kind} discriminator in component JSON
 * (e.g. {@code "RoundedRect"}, {@code "AWSIcon"}) and the {@link Category} it belongs to.
 */
public enum ComponentKind {
    RECTANGLE("Rectangle", Category.BASIC_SHAPE),
    ROUNDED_RECT("RoundedRect", Category.BASIC_SHAPE),
    ELLIPSE("Ellipse", Category.BASIC_SHAPE),
    DIAMOND("Diamond", Category.BASIC_SHAPE),
    HEXAGON("Hexagon", Category.BASIC_SHAPE),
    TRIANGLE("Triangle", Category.BASIC_SHAPE),
    CYLINDER("Cylinder", Category.BASIC_SHAPE),
    PARALLELOGRAM("Parallelogram", Category.BASIC_SHAPE),
    STEP("Step", Category.BASIC_SHAPE),
    NOTE("Note", Category.BASIC_SHAPE),
    TEXT("Text", Category.BASIC_SHAPE),
    IMAGE("Image", Category.BASIC_SHAPE),

    CONNECTOR("Connector", Category.CONNECTOR),

    SWIMLANE("Swimlane", Category.CONTAINER),
    GROUP("Group", Category.CONTAINER),

    AWS_ICON("AWSIcon", Category.CLOUD_ICON),
    AZURE_ICON("AzureIcon", Category.CLOUD_ICON),
    GCP_ICON("GCPIcon", Category.CLOUD_ICON),

    UML_CLASS("UMLClass", Category.UML),
    UML_INTERFACE("UMLInterface", Category.UML),
    UML_PACKAGE("UMLPackage", Category.UML),

    SERVER("Server", Category.NETWORK),
    DESKTOP("Desktop", Category.NETWORK),
    LAPTOP("Laptop", Category.NETWORK),
    ROUTER("Router", Category.NETWORK),
    SWITCH("Switch", Category.NETWORK),
    FIREWALL("Firewall", Category.NETWORK),
    INTERNET("Internet", Category.NETWORK),
    DATABASE("Database", Category.NETWORK),

    CARD("Card", Category.COMPOSITE),
    LIST("List", Category.COMPOSITE),
    TIMELINE("Timeline", Category.COMPOSITE),
    TABLE("Table", Category.COMPOSITE),
    PROCESS("Process", Category.COMPOSITE),
    CALLOUT("Callout", Category.COMPOSITE),
    ACTOR("Actor", Category.COMPOSITE),
    DOCUMENT("Document", Category.COMPOSITE),
    CLOUD("Cloud", Category.COMPOSITE);

    /**
     * Grouping of kinds as presented to model authors.
     */
    public enum Category {
        BASIC_SHAPE,
        CONNECTOR,
        CONTAINER,
        CLOUD_ICON,
        UML,
        NETWORK,
        COMPOSITE
    }

    private final String wireName;
    private final Category category;

    ComponentKind(String wireName, Category category) {
        this.wireName = wireName;
        this.category = category;
    }

    /**
     * Returns the discriminator value used in component JSON.
     *
     * @return wire name, e.g. {@code "UMLClass"}
     */
    @JsonValue
    public String wireName() {
        return wireName;
    }

    public Category category() {
        return category;
    }

    /**
     * Looks up a kind by its wire name (case-sensitive).
     *
     * @param wireName discriminator value
     * @return matching kind, or empty if the name is unknown
     */
    public static Optional<ComponentKind> fromWireName(String wireName) {
        return Arrays.stream(values())
            .filter(kind -> kind.wireName.equals(wireName))
            .findFirst();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
