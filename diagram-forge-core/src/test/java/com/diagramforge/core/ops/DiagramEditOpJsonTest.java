package com.diagramforge.core.ops;

import com.diagramforge.core.model.ShapeComponent;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for JSON decoding of {@link DiagramEditOp} variants.
 */
class DiagramEditOpJsonTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void readValue_selectsVariantByType() throws Exception {
        String json = """
            [
              {"type": "updateComponent", "id": "api", "updates": {"fill": "#FFE0B2", "label": "Gateway"}},
              {"type": "connectComponents", "id": "e9", "source": "api", "target": "db"},
              {"type": "addComponent", "component": {"kind": "Ellipse", "id": "c", "label": "Cache"}},
              {"type": "setEdgePoints", "id": "e1", "sourcePoint": {"x": 1, "y": 2}},
              {"type": "deleteCell", "id": "old"}
            ]
            """;

        List<DiagramEditOp> ops = mapper.readValue(json, new TypeReference<>() {
        });

        assertThat(ops).extracting(DiagramEditOp::type)
            .containsExactly("updateComponent", "connectComponents", "addComponent", "setEdgePoints", "deleteCell");
        assertThat(((UpdateComponentOp) ops.get(0)).updates().valueUpdate()).isEqualTo("Gateway");
        assertThat(((AddComponentOp) ops.get(2)).component()).isInstanceOf(ShapeComponent.class);
        assertThat(((SetEdgePointsOp) ops.get(3)).targetPoint()).isNull();
    }

    @Test
    void readValue_connectComponentsWithoutId_decodesBlankId() throws Exception {
        DiagramEditOp op = mapper.readValue(
            "{\"type\": \"connectComponents\", \"source\": \"api\", \"target\": \"db\"}", DiagramEditOp.class);

        assertThat(op).isInstanceOfSatisfying(ConnectComponentsOp.class, connect -> {
            assertThat(connect.id()).isEmpty();
            assertThat(connect.source()).isEqualTo("api");
        });
    }

    @Test
    void readValue_withUnknownType_decodesToUnsupportedOp() throws Exception {
        DiagramEditOp op = mapper.readValue("{\"type\": \"explode\", \"id\": \"x\"}", DiagramEditOp.class);

        assertThat(op).isInstanceOf(UnsupportedOp.class);
        assertThat(op.type()).isEqualTo("explode");
    }

    @Test
    void valueUpdate_prefersLabelThenTitleThenText() {
        ComponentUpdates titleAndText = new ComponentUpdates(null, null, null, "Title", "Text",
            null, null, null, null, null, null, null, null);

        assertThat(titleAndText.valueUpdate()).isEqualTo("Title");
    }
}
