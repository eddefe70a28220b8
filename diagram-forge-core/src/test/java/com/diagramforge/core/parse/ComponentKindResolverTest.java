package com.diagramforge.core.parse;

import com.diagramforge.core.catalog.ComponentCatalog;
import com.diagramforge.core.model.ComponentKind;
import com.diagramforge.core.style.StyleMap;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ComponentKindResolver}.
 */
class ComponentKindResolverTest {

    @ParameterizedTest
    @EnumSource(value = ComponentKind.class, names = {
        "RECTANGLE", "ROUNDED_RECT", "ELLIPSE", "DIAMOND", "HEXAGON", "TRIANGLE", "CYLINDER", "PARALLELOGRAM",
        "STEP", "NOTE", "TEXT", "IMAGE", "SWIMLANE", "GROUP", "UML_CLASS", "UML_PACKAGE", "SERVER", "DESKTOP",
        "LAPTOP", "ROUTER", "SWITCH", "FIREWALL", "INTERNET", "DATABASE", "CARD", "LIST", "TABLE", "CALLOUT",
        "ACTOR", "DOCUMENT", "CLOUD", "TIMELINE", "PROCESS"
    })
    void resolve_withCatalogBaseStyle_returnsSameKind(ComponentKind kind) {
        StyleMap style = StyleMap.parse(ComponentCatalog.baseStyle(kind));

        assertThat(ComponentKindResolver.resolve(style, "label")).isEqualTo(kind);
    }

    @Test
    void resolve_withInterfaceStereotype_returnsUmlInterface() {
        StyleMap style = StyleMap.parse(ComponentCatalog.baseStyle(ComponentKind.UML_INTERFACE));

        assertThat(ComponentKindResolver.resolve(style, "«interface»<br>Repo")).isEqualTo(ComponentKind.UML_INTERFACE);
    }

    @Test
    void resolve_withRoundedStepArrowsAndNoMarker_returnsRoundedRect() {
        assertThat(ComponentKindResolver.resolve(StyleMap.parse("rounded=1"), "Client → Server"))
            .isEqualTo(ComponentKind.ROUNDED_RECT);
    }

    @Test
    void resolve_withCardGeometryAndNoMarker_returnsSwimlane() {
        StyleMap style = StyleMap.parse("swimlane;startSize=40;horizontal=1");

        assertThat(ComponentKindResolver.resolve(style, "Backend")).isEqualTo(ComponentKind.SWIMLANE);
    }

    @Test
    void resolve_withListMarkerAndBoldFont_returnsList() {
        StyleMap style = StyleMap.parse(ComponentCatalog.baseStyle(ComponentKind.LIST));
        style.put("fontStyle", "1");

        assertThat(ComponentKindResolver.resolve(style, "<b>Steps</b><hr>• build")).isEqualTo(ComponentKind.LIST);
    }

    @ParameterizedTest
    @CsvSource({
        "shape=mxgraph.aws4.s3, AWS_ICON",
        "shape=mxgraph.azure.compute.vm, AZURE_ICON",
        "shape=mxgraph.gcp2.bigquery, GCP_ICON"
    })
    void resolve_withCloudShape_returnsProviderKind(String style, ComponentKind expected) {
        assertThat(ComponentKindResolver.resolve(StyleMap.parse(style), null)).isEqualTo(expected);
    }

    @Test
    void resolve_withUnknownStyle_fallsBackToRectangle() {
        assertThat(ComponentKindResolver.resolve(StyleMap.parse("shape=mystery;fillColor=#fff"), ""))
            .isEqualTo(ComponentKind.RECTANGLE);
    }

    @Test
    void signatures_listsMarkedKindsFirstAndCloudBeforeEllipse() {
        List<ComponentKind> order = ComponentKindResolver.signatures().stream()
            .map(ComponentKindResolver.KindSignature::kind)
            .toList();

        assertThat(order.subList(0, 4)).containsExactly(
            ComponentKind.CARD, ComponentKind.LIST, ComponentKind.TIMELINE, ComponentKind.PROCESS);
        assertThat(order.indexOf(ComponentKind.CLOUD)).isLessThan(order.indexOf(ComponentKind.ELLIPSE));
    }
}
