package com.diagramforge.core.model;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for JSON decoding of {@link DiagramComponent} variants.
 */
class DiagramComponentJsonTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void readValue_selectsVariantByKind() throws Exception {
        String json = """
            [
              {"kind": "Rectangle", "id": "a", "label": "API", "position": {"x": 40, "y": 40}},
              {"kind": "AWSIcon", "id": "b", "service": "Lambda"},
              {"kind": "Connector", "id": "e1", "source": "a", "target": "b",
               "style": {"lineType": "curved", "dashed": true}}
            ]
            """;

        List<DiagramComponent> components = mapper.readValue(json, new TypeReference<>() {
        });

        assertThat(components).hasSize(3);
        assertThat(components.get(0)).isInstanceOfSatisfying(ShapeComponent.class, shape -> {
            assertThat(shape.kind()).isEqualTo(ComponentKind.RECTANGLE);
            assertThat(shape.position()).isEqualTo(new Position(40, 40));
        });
        assertThat(components.get(1)).isInstanceOfSatisfying(CloudIconComponent.class, icon -> {
            assertThat(icon.kind()).isEqualTo(ComponentKind.AWS_ICON);
            assertThat(icon.service()).isEqualTo("Lambda");
        });
        assertThat(components.get(2)).isInstanceOfSatisfying(Connector.class, connector -> {
            assertThat(connector.style().lineType()).isEqualTo(LineType.CURVED);
            assertThat(connector.style().dashed()).isTrue();
            assertThat(connector.waypoints()).isEmpty();
        });
    }

    @Test
    void readValue_withUnknownProperty_ignoresIt() throws Exception {
        DiagramComponent component = mapper.readValue(
            "{\"kind\": \"Text\", \"id\": \"t\", \"text\": \"Hello\", \"extra\": 1}", DiagramComponent.class);

        assertThat(component).isInstanceOf(TextComponent.class);
        assertThat(component.effectiveParent()).isEqualTo(DiagramComponent.DEFAULT_LAYER_ID);
    }

    @Test
    void readValue_withUnknownKind_fails() {
        assertThatThrownBy(() -> mapper.readValue("{\"kind\": \"Blob\", \"id\": \"x\"}", DiagramComponent.class))
            .isInstanceOf(Exception.class);
    }

    @Test
    void fromWireName_resolvesDiscriminator() {
        assertThat(ComponentKind.fromWireName("UMLClass")).contains(ComponentKind.UML_CLASS);
        assertThat(ComponentKind.fromWireName("umlclass")).isEmpty();
    }

    @Test
    void shapeComponent_withUnsupportedKind_isRejected() {
        assertThatThrownBy(() -> ShapeComponent.of(ComponentKind.SWIMLANE, "s", "S"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
