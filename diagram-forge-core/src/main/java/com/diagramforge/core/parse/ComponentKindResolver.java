package com.diagramforge.core.parse;

import com.diagramforge.core.catalog.CloudProvider;
import com.diagramforge.core.catalog.ComponentCatalog;
import com.diagramforge.core.model.ComponentKind;
import com.diagramforge.core.style.StyleMap;

import java.util.List;
import java.util.Objects;
import java.util.function.BiPredicate;

/**
 * Infers a vertex kind from a cell's style and value.
 *
 * <p>Signatures are tested in declaration order and the first match wins. Order matters
 * because the signatures overlap: a cloud is an {@code ellipse} with {@code shape=cloud},
 * a UML class and a swimlane are both {@code swimlane}s, and so on. Cards, lists, timelines
 * and processes render as plain swimlanes or rounded rectangles, so they are only recognised
 * by their {@link ComponentCatalog#KIND_MARKER} token. Cells matching nothing fall back to
 * {@link ComponentKind#RECTANGLE}.
 */
public final class ComponentKindResolver {

    private static final String INTERFACE_STEREOTYPE = "«interface»";

    /**
     * One entry of the ordered signature list.
     *
     * @param kind kind reported on match
     * @param matcher predicate over the parsed style and the decoded cell value
     */
    public record KindSignature(ComponentKind kind, BiPredicate<StyleMap, String> matcher) {
        public KindSignature {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(matcher, "matcher must not be null");
        }
    }

    private static final List<KindSignature> SIGNATURES = List.of(
        marked(ComponentKind.CARD),
        marked(ComponentKind.LIST),
        marked(ComponentKind.TIMELINE),
        marked(ComponentKind.PROCESS),

        new KindSignature(ComponentKind.CLOUD, (s, v) -> isEllipse(s) && s.is("shape", "cloud")),
        new KindSignature(ComponentKind.ELLIPSE, (s, v) -> isEllipse(s)),
        new KindSignature(ComponentKind.DIAMOND, (s, v) -> s.has("rhombus") || s.is("shape", "rhombus")),

        new KindSignature(ComponentKind.UML_CLASS, (s, v) -> s.has("swimlane") && s.is("childLayout", "stackLayout")),
        new KindSignature(ComponentKind.UML_INTERFACE, (s, v) -> s.has("swimlane") && v.startsWith(INTERFACE_STEREOTYPE)),
        new KindSignature(ComponentKind.SWIMLANE, (s, v) -> s.has("swimlane") || s.is("shape", "swimlane")),
        new KindSignature(ComponentKind.GROUP, (s, v) -> s.has("group")),

        new KindSignature(ComponentKind.TABLE, (s, v) -> s.is("shape", "table")),
        new KindSignature(ComponentKind.CYLINDER, (s, v) -> shapeStartsWith(s, "cylinder")),
        new KindSignature(ComponentKind.HEXAGON, (s, v) -> s.is("shape", "hexagon")),
        new KindSignature(ComponentKind.DOCUMENT, (s, v) -> s.is("shape", "document")),
        new KindSignature(ComponentKind.CALLOUT, (s, v) -> s.is("shape", "callout")),
        new KindSignature(ComponentKind.ACTOR, (s, v) -> s.is("shape", "umlActor")),
        new KindSignature(ComponentKind.UML_PACKAGE, (s, v) -> s.is("shape", "umlFrame")),
        new KindSignature(ComponentKind.PARALLELOGRAM, (s, v) -> s.is("shape", "parallelogram")),
        new KindSignature(ComponentKind.STEP, (s, v) -> s.is("shape", "step")),
        new KindSignature(ComponentKind.NOTE, (s, v) -> s.is("shape", "note")),
        new KindSignature(ComponentKind.IMAGE, (s, v) -> s.is("shape", "image")),
        new KindSignature(ComponentKind.TRIANGLE, (s, v) -> s.has("triangle") || s.is("shape", "triangle")),
        new KindSignature(ComponentKind.TEXT, (s, v) -> s.has("text")),

        new KindSignature(ComponentKind.AWS_ICON, (s, v) -> shapeStartsWith(s, CloudProvider.AWS.prefix())),
        new KindSignature(ComponentKind.AZURE_ICON, (s, v) -> shapeStartsWith(s, CloudProvider.AZURE.prefix())),
        new KindSignature(ComponentKind.GCP_ICON, (s, v) -> shapeStartsWith(s, CloudProvider.GCP.prefix())),

        new KindSignature(ComponentKind.SERVER, (s, v) -> s.is("shape", "mxgraph.cisco.servers.standard_host")),
        new KindSignature(ComponentKind.DESKTOP, (s, v) -> s.is("shape", "mxgraph.cisco.computers_and_peripherals.pc")),
        new KindSignature(ComponentKind.LAPTOP, (s, v) -> s.is("shape", "mxgraph.cisco.computers_and_peripherals.laptop")),
        new KindSignature(ComponentKind.ROUTER, (s, v) -> s.is("shape", "mxgraph.cisco.routers.router")),
        new KindSignature(ComponentKind.SWITCH, (s, v) -> s.is("shape", "mxgraph.cisco.switches.workgroup_switch")),
        new KindSignature(ComponentKind.FIREWALL, (s, v) -> s.is("shape", "mxgraph.cisco.security.firewall")),
        new KindSignature(ComponentKind.INTERNET, (s, v) -> s.is("shape", "mxgraph.cisco.misc.cloud")),
        new KindSignature(ComponentKind.DATABASE, (s, v) -> s.is("shape", "mxgraph.cisco.storage.database")),

        new KindSignature(ComponentKind.ROUNDED_RECT, (s, v) -> s.is("rounded", "1"))
    );

    private ComponentKindResolver() {
    }

    /**
     * Resolves the kind of a vertex cell.
     *
     * @param style parsed style
     * @param value decoded cell value, may be {@code null}
     * @return inferred kind, {@link ComponentKind#RECTANGLE} when nothing matches
     */
    public static ComponentKind resolve(StyleMap style, String value) {
        String safeValue = value != null ? value : "";
        for (KindSignature signature : SIGNATURES) {
            if (signature.matcher().test(style, safeValue)) {
                return signature.kind();
            }
        }
        return ComponentKind.RECTANGLE;
    }

    /**
     * Returns the signatures in evaluation order.
     *
     * @return immutable signature list
     */
    public static List<KindSignature> signatures() {
        return SIGNATURES;
    }

    private static KindSignature marked(ComponentKind kind) {
        return new KindSignature(kind, (s, v) -> s.is(ComponentCatalog.KIND_MARKER, kind.wireName()));
    }

    private static boolean isEllipse(StyleMap style) {
        return style.has("ellipse") || style.is("shape", "ellipse");
    }

    private static boolean shapeStartsWith(StyleMap style, String prefix) {
        String shape = style.get("shape");
        return shape != null && shape.startsWith(prefix);
    }
}
