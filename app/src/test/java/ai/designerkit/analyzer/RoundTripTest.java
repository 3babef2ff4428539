package ai.designerkit.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import ai.designerkit.analyzer.csharp.CSharpDesignerParser;
import ai.designerkit.analyzer.csharp.CSharpDesignerWriter;
import ai.designerkit.analyzer.vb.VbDesignerParser;
import ai.designerkit.analyzer.vb.VbDesignerWriter;
import ai.designerkit.model.ControlNode;
import ai.designerkit.model.FormDocument;
import ai.designerkit.testutil.DesignerFixtures;
import java.io.IOException;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

/** Parse followed by render must reproduce canonical designer files exactly and preserve the model for any file. */
public final class RoundTripTest {
    private final CSharpDesignerParser csParser = new CSharpDesignerParser();
    private final CSharpDesignerWriter csWriter = new CSharpDesignerWriter();
    private final VbDesignerParser vbParser = new VbDesignerParser();
    private final VbDesignerWriter vbWriter = new VbDesignerWriter();

    @Test
    void testCanonicalCSharpFileIsReproducedExactly() throws IOException {
        var text = DesignerFixtures.read(DesignerFixtures.SAMPLE_CS);
        var document = csParser.parse(text, null);

        assertEquals(text, csWriter.render(text, document));
    }

    @Test
    void testCanonicalVbFileIsReproducedExactly() throws IOException {
        var text = DesignerFixtures.read(DesignerFixtures.SAMPLE_VB);
        var document = vbParser.parse(text, null);

        assertEquals(text, vbWriter.render(text, document));
    }

    @Test
    void testCrlfFilesAreReproducedExactly() throws IOException {
        var cs = DesignerFixtures.read(DesignerFixtures.SAMPLE_CS).replace("\n", "\r\n");
        assertEquals(cs, csWriter.render(cs, csParser.parse(cs, null)));

        var vb = DesignerFixtures.read(DesignerFixtures.SAMPLE_VB).replace("\n", "\r\n");
        assertEquals(vb, vbWriter.render(vb, vbParser.parse(vb, null)));
    }

    @Test
    void testFullGenerationMatchesDesignerLayout() throws IOException {
        var cs = DesignerFixtures.read(DesignerFixtures.SAMPLE_CS);
        assertEquals(cs, csWriter.render(null, csParser.parse(cs, null)));

        var vb = DesignerFixtures.read(DesignerFixtures.SAMPLE_VB);
        assertEquals(vb, vbWriter.render(null, vbParser.parse(vb, null)));
    }

    @Test
    void testRenderedLegacyFormParsesToTheSameModel() throws IOException {
        var text = DesignerFixtures.read(DesignerFixtures.LEGACY_CS);
        var original = csParser.parse(text, null);
        var reparsed = csParser.parse(csWriter.render(text, original), null);

        assertSameModel(original, reparsed);
    }

    @Test
    void testModelSurvivesGenerationFromScratch() throws IOException {
        var original = vbParser.parse(DesignerFixtures.read(DesignerFixtures.SAMPLE_VB), null);
        var reparsed = vbParser.parse(vbWriter.render(null, original), null);

        assertSameModel(original, reparsed);
        assertEquals(original.getFormProperties(), reparsed.getFormProperties());
    }

    @Test
    void testContainerKeepsItsChildren() throws IOException {
        var text = DesignerFixtures.read(DesignerFixtures.SAMPLE_CS);
        var document = csParser.parse(text, null);
        var panel = document.findNode("panel1").orElseThrow();
        document.attach(panel, document.findNode("label1").orElseThrow());

        var reparsed = csParser.parse(csWriter.render(text, document), null);
        var children = reparsed.findNode("panel1").orElseThrow().getChildren().stream()
                .map(ControlNode::getName)
                .collect(Collectors.toSet());
        assertEquals(Set.of("button1", "textBox1", "label1"), children);
        assertEquals(List.of("dataGridView1", "panel1"), names(reparsed.getRootNodes()));
    }

    @Test
    void testEmittedStatementOrder() throws IOException {
        var document = csParser.parse(DesignerFixtures.read(DesignerFixtures.SAMPLE_CS), null);
        var lines = csWriter.statementLines(document);

        assertEquals("this.panel1 = new System.Windows.Forms.Panel();", lines.get(0));
        assertEquals("this.panel1.SuspendLayout();", lines.get(5));
        assertEquals("this.SuspendLayout();", lines.get(6));
        assertEquals("this.PerformLayout();", lines.get(lines.size() - 1));
        assertEquals("this.ResumeLayout(false);", lines.get(lines.size() - 2));
        assertEquals("this.panel1.ResumeLayout(false);", lines.get(lines.size() - 3));
        assertTrue(lines.indexOf("this.button1.Click += this.button1_Click;")
                > lines.indexOf("this.button1.UseVisualStyleBackColor = true;"));
        assertTrue(lines.indexOf("this.Controls.Add(this.panel1);") > lines.indexOf("this.Text = \"Sample Form\";"));
    }

    private static void assertSameModel(FormDocument expected, FormDocument actual) {
        assertEquals(expected.getFormName(), actual.getFormName());
        assertEquals(expected.getNamespace(), actual.getNamespace());
        assertEquals(lowerNames(expected.getAllNodes()), lowerNames(actual.getAllNodes()));
        assertEquals(lowerNames(expected.getRootNodes()), lowerNames(actual.getRootNodes()));
        for (var node : expected.getAllNodes()) {
            var other = actual.findNode(node.getName()).orElseThrow();
            assertEquals(node.getTypeName(), other.getTypeName());
            assertEquals(node.getConstructorArguments(), other.getConstructorArguments());
            assertEquals(node.getProperties(), other.getProperties(), node.getName());
            assertEquals(node.getEvents(), other.getEvents(), node.getName());
            assertEquals(new HashSet<>(lowerNames(node.getChildren())), new HashSet<>(lowerNames(other.getChildren())));
        }
        assertEquals(expected.getFormEvents(), actual.getFormEvents());
    }

    private static List<String> names(List<ControlNode> nodes) {
        return nodes.stream().map(ControlNode::getName).toList();
    }

    private static List<String> lowerNames(List<ControlNode> nodes) {
        return nodes.stream().map(n -> n.getName().toLowerCase(Locale.ROOT)).toList();
    }
}
