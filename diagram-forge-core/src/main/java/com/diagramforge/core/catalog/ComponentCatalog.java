package com.diagramforge.core.catalog;

import com.diagramforge.core.model.ComponentKind;
import com.diagramforge.core.model.Size;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Static catalog of default sizes, base style fragments and edge/container flags for every
 * {@link ComponentKind}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Size size = ComponentCatalog.defaultSize(ComponentKind.SWIMLANE);   // 200x300
 * boolean holdsChildren = ComponentCatalog.isContainer(ComponentKind.GROUP); // true
 * }</pre>
 */
public final class ComponentCatalog {

    /** Size used for any kind without a registered default. */
    public static final Size FALLBACK_SIZE = new Size(120, 60);

    /**
     * Style key naming the kind of composites whose rendered shape is shared with another kind.
     * Draw.io ignores unknown keys, so the token survives a round trip through the editor.
     */
    public static final String KIND_MARKER = "componentKind";

    private static final Map<ComponentKind, ComponentMetadata> CATALOG = buildCatalog();

    private ComponentCatalog() {
    }

    /**
     * Returns metadata for a kind.
     *
     * @param kind component kind
     * @return metadata, never {@code null}
     */
    public static ComponentMetadata metadata(ComponentKind kind) {
        ComponentMetadata metadata = CATALOG.get(kind);
        return metadata != null ? metadata : new ComponentMetadata(kind, FALLBACK_SIZE, "", false, false);
    }

    public static Size defaultSize(ComponentKind kind) {
        return metadata(kind).defaultSize();
    }

    public static String baseStyle(ComponentKind kind) {
        return metadata(kind).baseStyle();
    }

    public static boolean isEdge(ComponentKind kind) {
        return metadata(kind).edge();
    }

    public static boolean isContainer(ComponentKind kind) {
        return metadata(kind).container();
    }

    /**
     * Returns all registered metadata in kind declaration order.
     *
     * @return unmodifiable view of the catalog entries
     */
    public static Collection<ComponentMetadata> all() {
        return Collections.unmodifiableCollection(CATALOG.values());
    }

    private static Map<ComponentKind, ComponentMetadata> buildCatalog() {
        Map<ComponentKind, ComponentMetadata> catalog = new EnumMap<>(ComponentKind.class);

        vertex(catalog, ComponentKind.RECTANGLE, 120, 60, "rounded=0");
        vertex(catalog, ComponentKind.ROUNDED_RECT, 120, 60, "rounded=1");
        vertex(catalog, ComponentKind.ELLIPSE, 80, 80, "ellipse");
        vertex(catalog, ComponentKind.DIAMOND, 80, 80, "rhombus");
        vertex(catalog, ComponentKind.HEXAGON, 120, 80, "shape=hexagon;perimeter=hexagonPerimeter2");
        vertex(catalog, ComponentKind.TRIANGLE, 60, 80, "triangle");
        vertex(catalog, ComponentKind.CYLINDER, 60, 80, "shape=cylinder3;boundedLbl=1;backgroundOutline=1;size=15");
        vertex(catalog, ComponentKind.PARALLELOGRAM, 120, 60, "shape=parallelogram;perimeter=parallelogramPerimeter");
        vertex(catalog, ComponentKind.STEP, 120, 60, "shape=step;perimeter=stepPerimeter;fixedSize=1");
        vertex(catalog, ComponentKind.NOTE, 100, 80, "shape=note;size=14");
        vertex(catalog, ComponentKind.TEXT, 100, 40, "text;strokeColor=none;fillColor=none");
        vertex(catalog, ComponentKind.IMAGE, 80, 80, "shape=image");

        catalog.put(ComponentKind.CONNECTOR,
            new ComponentMetadata(ComponentKind.CONNECTOR, new Size(0, 0), "", true, false));

        container(catalog, ComponentKind.SWIMLANE, 200, 300, "swimlane");
        container(catalog, ComponentKind.GROUP, 200, 200, "group");

        vertex(catalog, ComponentKind.AWS_ICON, 78, 78, "sketch=0;outlineConnect=0;fontColor=#232F3E;gradientColor=none");
        vertex(catalog, ComponentKind.AZURE_ICON, 68, 68, "sketch=0;aspect=fixed");
        vertex(catalog, ComponentKind.GCP_ICON, 68, 68, "sketch=0;aspect=fixed");

        vertex(catalog, ComponentKind.UML_CLASS, 160, 100,
            "swimlane;fontStyle=1;childLayout=stackLayout;horizontal=1;startSize=30;horizontalStack=0;"
                + "resizeParent=1;resizeParentMax=0;resizeLast=0;collapsible=1;marginBottom=0");
        vertex(catalog, ComponentKind.UML_INTERFACE, 140, 80, "swimlane;fontStyle=1;startSize=30");
        container(catalog, ComponentKind.UML_PACKAGE, 200, 150, "shape=umlFrame;pointerEvents=0");

        vertex(catalog, ComponentKind.SERVER, 50, 60, "shape=mxgraph.cisco.servers.standard_host;sketch=0");
        vertex(catalog, ComponentKind.DESKTOP, 50, 50, "shape=mxgraph.cisco.computers_and_peripherals.pc;sketch=0");
        vertex(catalog, ComponentKind.LAPTOP, 50, 35, "shape=mxgraph.cisco.computers_and_peripherals.laptop;sketch=0");
        vertex(catalog, ComponentKind.ROUTER, 50, 30, "shape=mxgraph.cisco.routers.router;sketch=0");
        vertex(catalog, ComponentKind.SWITCH, 50, 15, "shape=mxgraph.cisco.switches.workgroup_switch;sketch=0");
        vertex(catalog, ComponentKind.FIREWALL, 40, 50, "shape=mxgraph.cisco.security.firewall;sketch=0");
        vertex(catalog, ComponentKind.INTERNET, 60, 40, "shape=mxgraph.cisco.misc.cloud;sketch=0");
        vertex(catalog, ComponentKind.DATABASE, 40, 50, "shape=mxgraph.cisco.storage.database;sketch=0");

        vertex(catalog, ComponentKind.CARD, 160, 120, "swimlane;startSize=40;horizontal=1;" + KIND_MARKER + "=Card");
        vertex(catalog, ComponentKind.LIST, 140, 100, "swimlane;fontStyle=0;startSize=26;horizontal=1;" + KIND_MARKER + "=List");
        vertex(catalog, ComponentKind.TIMELINE, 400, 100, "rounded=1;" + KIND_MARKER + "=Timeline");
        vertex(catalog, ComponentKind.TABLE, 200, 120,
            "shape=table;startSize=30;container=1;collapsible=0;childLayout=tableLayout");
        vertex(catalog, ComponentKind.PROCESS, 400, 60, "rounded=1;" + KIND_MARKER + "=Process");
        vertex(catalog, ComponentKind.CALLOUT, 120, 80, "shape=callout;perimeter=calloutPerimeter");
        vertex(catalog, ComponentKind.ACTOR, 40, 80, "shape=umlActor;verticalLabelPosition=bottom;verticalAlign=top");
        vertex(catalog, ComponentKind.DOCUMENT, 80, 100, "shape=document;boundedLbl=1");
        vertex(catalog, ComponentKind.CLOUD, 120, 80, "ellipse;shape=cloud");

        return catalog;
    }

    private static void vertex(Map<ComponentKind, ComponentMetadata> catalog, ComponentKind kind,
                               double width, double height, String baseStyle) {
        catalog.put(kind, new ComponentMetadata(kind, new Size(width, height), baseStyle, false, false));
    }

    private static void container(Map<ComponentKind, ComponentMetadata> catalog, ComponentKind kind,
                                  double width, double height, String baseStyle) {
        catalog.put(kind, new ComponentMetadata(kind, new Size(width, height), baseStyle, false, true));
    }
}
