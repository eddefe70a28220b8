package com.diagramforge.core.parse;

import com.diagramforge.core.convert.ComponentXmlConverter;
import com.diagramforge.core.model.CalloutComponent;
import com.diagramforge.core.model.CardComponent;
import com.diagramforge.core.model.ComponentKind;
import com.diagramforge.core.model.DiagramComponent;
import com.diagramforge.core.model.ImageComponent;
import com.diagramforge.core.model.ListComponent;
import com.diagramforge.core.model.ProcessComponent;
import com.diagramforge.core.model.ProcessStep;
import com.diagramforge.core.model.RoundedRectComponent;
import com.diagramforge.core.model.SwimlaneComponent;
import com.diagramforge.core.model.TextStyle;
import com.diagramforge.core.model.TimelineComponent;
import com.diagramforge.core.model.TriangleComponent;
import com.diagramforge.core.model.UmlInterfaceComponent;
import com.diagramforge.core.xml.DomXmlCodec;
import com.diagramforge.core.xml.XmlParseException;
import org.junit.jupiter.api.Named;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link XmlComponentParser} decoding what {@link ComponentXmlConverter} encodes, with
 * non-default fields on kinds whose rendered styles overlap.
 */
class ComponentRoundTripTest {

    private final ComponentXmlConverter converter = new ComponentXmlConverter();
    private final XmlComponentParser parser = new XmlComponentParser(new DomXmlCodec());

    static Stream<Arguments> components() {
        TextStyle bold = new TextStyle(null, null, null, TextStyle.FontStyle.BOLD, null, null);
        return Stream.of(
            roundTrip("swimlane with tall horizontal header",
                new SwimlaneComponent("lane", null, null, null, null, null, "Backend", 40.0, true, List.of(),
                    null, null, null),
                SwimlaneComponent.class, lane -> {
                    assertThat(lane.title()).isEqualTo("Backend");
                    assertThat(lane.titleHeight()).isEqualTo(40.0);
                    assertThat(lane.horizontal()).isTrue();
                }),
            roundTrip("bold list",
                new ListComponent("list", null, null, null, null, bold, "Steps", List.of("build", "test"), null),
                ListComponent.class, list -> {
                    assertThat(list.title()).isEqualTo("Steps");
                    assertThat(list.items()).containsExactly("build", "test");
                    assertThat(list.textStyle().fontStyle()).isEqualTo(TextStyle.FontStyle.BOLD);
                }),
            roundTrip("rounded rectangle labelled with an arrow",
                new RoundedRectComponent("rr", null, null, null, null, null, "Client → Server", 12.0),
                RoundedRectComponent.class, rounded -> {
                    assertThat(rounded.label()).isEqualTo("Client → Server");
                    assertThat(rounded.cornerRadius()).isEqualTo(12.0);
                }),
            roundTrip("image with base64 data uri",
                new ImageComponent("img", null, null, null, null, null, "data:image/png;base64,iVBORw0KGgo=", true,
                    "Logo"),
                ImageComponent.class, image -> {
                    assertThat(image.src()).isEqualTo("data:image/png;base64,iVBORw0KGgo=");
                    assertThat(image.preserveAspect()).isTrue();
                    assertThat(image.label()).isEqualTo("Logo");
                }),
            roundTrip("card with subtitle and header color",
                new CardComponent("card", null, null, null, null, null, "Orders", "v2 API", null, "#ffcc00"),
                CardComponent.class, card -> {
                    assertThat(card.title()).isEqualTo("Orders");
                    assertThat(card.subtitle()).isEqualTo("v2 API");
                    assertThat(card.headerColor()).isEqualTo("#ffcc00");
                }),
            roundTrip("process with steps",
                new ProcessComponent("proc", null, null, null, null, null,
                    List.of(new ProcessStep("Plan", null), new ProcessStep("Build", null)), null),
                ProcessComponent.class, process -> assertThat(process.steps())
                    .extracting(ProcessStep::label).containsExactly("Plan", "Build")),
            roundTrip("timeline with title",
                new TimelineComponent("tl", null, null, null, null, null, "Roadmap", List.of(), null),
                TimelineComponent.class, timeline -> assertThat(timeline.title()).isEqualTo("Roadmap")),
            roundTrip("uml interface with methods",
                new UmlInterfaceComponent("repo", null, null, null, null, null, "Repository", List.of("+find()")),
                UmlInterfaceComponent.class, umlInterface -> {
                    assertThat(umlInterface.name()).isEqualTo("Repository");
                    assertThat(umlInterface.methods()).containsExactly("+find()");
                }),
            roundTrip("triangle pointing north",
                new TriangleComponent("tri", null, null, null, null, null, "Up", TriangleComponent.Direction.NORTH),
                TriangleComponent.class, triangle -> assertThat(triangle.direction())
                    .isEqualTo(TriangleComponent.Direction.NORTH)),
            roundTrip("warning callout pointing up",
                new CalloutComponent("co", null, null, null, null, null, "Careful",
                    CalloutComponent.Tone.WARNING, CalloutComponent.PointerDirection.TOP),
                CalloutComponent.class, callout -> {
                    assertThat(callout.calloutStyle()).isEqualTo(CalloutComponent.Tone.WARNING);
                    assertThat(callout.pointerDirection()).isEqualTo(CalloutComponent.PointerDirection.TOP);
                })
        );
    }

    @ParameterizedTest
    @MethodSource("components")
    void xmlToComponents_afterComponentsToXml_keepsKindAndFields(DiagramComponent original,
                                                                 Consumer<DiagramComponent> fieldCheck)
        throws XmlParseException {
        List<DiagramComponent> decoded = parser.xmlToComponents(converter.componentsToXml(List.of(original)));

        assertThat(decoded).singleElement().satisfies(component -> {
            assertThat(component.kind()).isEqualTo(original.kind());
            assertThat(component.id()).isEqualTo(original.id());
            fieldCheck.accept(component);
        });
    }

    private static <T extends DiagramComponent> Arguments roundTrip(String name, T component, Class<T> type,
                                                                    Consumer<T> fieldCheck) {
        Consumer<DiagramComponent> check = decoded -> assertThat(decoded).isInstanceOfSatisfying(type, fieldCheck);
        return Arguments.of(Named.of(name, component), check);
    }
}
