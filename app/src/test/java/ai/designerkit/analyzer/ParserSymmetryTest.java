package ai.designerkit.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import ai.designerkit.analyzer.csharp.CSharpDesignerParser;
import ai.designerkit.analyzer.vb.VbDesignerParser;
import ai.designerkit.model.ControlNode;
import ai.designerkit.model.EventBinding;
import ai.designerkit.model.FormDocument;
import ai.designerkit.testutil.DesignerFixtures;
import java.io.IOException;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

/** The C# and VB versions of the same form must produce equivalent models. */
public final class ParserSymmetryTest {

    @Test
    void testEquivalentFormsProduceEquivalentModels() throws IOException {
        var cs = new CSharpDesignerParser().parse(DesignerFixtures.path(DesignerFixtures.SAMPLE_CS));
        var vb = new VbDesignerParser().parse(DesignerFixtures.path(DesignerFixtures.SAMPLE_VB));

        assertEquals(cs.getAllNodes().size(), vb.getAllNodes().size());
        assertEquals(cs.getRootNodes().size(), vb.getRootNodes().size());
        assertEquals(lowerNames(cs), lowerNames(vb));

        for (var csNode : cs.getAllNodes()) {
            var vbNode = vb.findNode(csNode.getName()).orElseThrow(() -> new AssertionError(csNode.getName()));
            assertEquals(csNode.getTypeName(), vbNode.getTypeName());
            assertEquals(
                    lower(csNode.getProperties().keySet()), lower(vbNode.getProperties().keySet()), csNode.getName());
            assertEquals(eventNames(csNode), eventNames(vbNode), csNode.getName());
            assertEquals(csNode.getChildren().size(), vbNode.getChildren().size());
        }
        assertEquals(cs.getFormProperties().keySet(), vb.getFormProperties().keySet());
        assertEquals(
                cs.getFormEvents().stream().map(EventBinding::eventName).toList(),
                vb.getFormEvents().stream().map(EventBinding::eventName).toList());
    }

    @Test
    void testNonFieldConstructionsAreFormPropertiesInBothDialects() throws IOException {
        var cs = new CSharpDesignerParser().parse(DesignerFixtures.path(DesignerFixtures.SAMPLE_CS));
        var vb = new VbDesignerParser().parse(DesignerFixtures.path(DesignerFixtures.SAMPLE_VB));

        for (var document : new FormDocument[] {cs, vb}) {
            assertTrue(document.findNode("AutoScaleDimensions").isEmpty());
            assertTrue(document.findNode("ClientSize").isEmpty());
            assertTrue(document.getFormProperties().containsKey("AutoScaleDimensions"));
            assertTrue(document.getFormProperties().containsKey("ClientSize"));
            assertTrue(document.findNode("panel1").orElseThrow().getProperties().containsKey("Size"));
        }
    }

    private static Set<String> lowerNames(FormDocument document) {
        return document.getAllNodes().stream()
                .map(ControlNode::getName)
                .map(ParserSymmetryTest::lower)
                .collect(Collectors.toSet());
    }

    private static Set<String> lower(Set<String> names) {
        return names.stream().map(ParserSymmetryTest::lower).collect(Collectors.toSet());
    }

    private static String lower(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    private static Set<String> eventNames(ControlNode node) {
        return node.getEvents().stream().map(EventBinding::eventName).collect(Collectors.toSet());
    }
}
