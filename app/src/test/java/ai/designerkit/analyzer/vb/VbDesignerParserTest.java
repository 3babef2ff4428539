package ai.designerkit.analyzer.vb;

import static org.junit.jupiter.api.Assertions.*;

import ai.designerkit.analyzer.DesignerParseException;
import ai.designerkit.analyzer.DesignerParseException.MissingAnchor;
import ai.designerkit.analyzer.Dialect;
import ai.designerkit.model.ControlNode;
import ai.designerkit.model.EventBinding;
import ai.designerkit.testutil.DesignerFixtures;
import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.Test;

public final class VbDesignerParserTest {
    private final VbDesignerParser parser = new VbDesignerParser();

    @Test
    void testSampleFormStructure() throws IOException {
        var document = parser.parse(DesignerFixtures.path(DesignerFixtures.SAMPLE_VB));

        assertEquals(Dialect.VISUAL_BASIC, document.getDialect());
        assertEquals("Form1", document.getFormName());
        assertEquals("SampleApp", document.getNamespace());
        assertEquals(
                List.of("Panel1", "Button1", "TextBox1", "Label1", "DataGridView1"),
                document.getAllNodes().stream().map(ControlNode::getName).toList());
        assertEquals(
                List.of("DataGridView1", "Label1", "Panel1"),
                document.getRootNodes().stream().map(ControlNode::getName).toList());
        assertEquals(
                List.of("Button1", "TextBox1"),
                document.findNode("Panel1").orElseThrow().getChildren().stream()
                        .map(ControlNode::getName)
                        .toList());
    }

    @Test
    void testPropertiesAndEvents() throws IOException {
        var document = parser.parse(DesignerFixtures.path(DesignerFixtures.SAMPLE_VB));
        var button = document.findNode("Button1").orElseThrow();

        assertEquals("New System.Drawing.Point(170, 18)", button.getProperty("Location"));
        assertEquals("True", button.getProperty("UseVisualStyleBackColor"));
        assertEquals(List.of(new EventBinding("Click", "Button1_Click")), button.getEvents());

        assertEquals("New System.Drawing.SizeF(7.0!, 15.0!)", document.getFormProperties().get("AutoScaleDimensions"));
        assertEquals(List.of(new EventBinding("Load", "Form1_Load")), document.getFormEvents());
    }

    @Test
    void testLookupsIgnoreCase() throws IOException {
        var source =
                """
                Partial Class Main
                    Private Sub InitializeComponent()
                        me.okButton = new System.Windows.Forms.Button()
                        Me.OKBUTTON.Text = "OK"
                        ME.Controls.Add(Me.OkButton)
                    End Sub
                    Friend WithEvents OkButton As System.Windows.Forms.Button
                End Class
                """;
        var document = parser.parse(source, null);

        assertNull(document.getNamespace());
        var ok = document.findNode("okbutton").orElseThrow();
        assertEquals("\"OK\"", ok.getProperty("Text"));
        assertEquals(List.of(ok), document.getRootNodes());
    }

    @Test
    void testWithEventsTimerAndHandlerForms() {
        var source =
                """
                Namespace Outer
                    Namespace Inner
                        Partial Class Clock
                            Private components As System.ComponentModel.IContainer
                            Friend WithEvents Tick1 As System.Windows.Forms.Timer

                            Private Sub InitializeComponent()
                                Me.components = New System.ComponentModel.Container()
                                Me.Tick1 = New System.Windows.Forms.Timer(Me.components)
                                Me.Tick1.Interval = 1000
                                AddHandler Me.Tick1.Tick, New System.EventHandler(AddressOf Me.OnTick)
                                Me.Ghost.Visible = False
                            End Sub
                        End Class
                    End Namespace
                End Namespace
                """;
        var document = parser.parse(source, null);

        assertEquals("Outer.Inner", document.getNamespace());
        assertEquals(
                List.of("components", "Tick1"),
                document.getAllNodes().stream().map(ControlNode::getName).toList());
        var timer = document.findNode("Tick1").orElseThrow();
        assertEquals("Me.components", timer.getConstructorArguments());
        assertEquals("1000", timer.getProperty("Interval"));
        assertEquals(List.of(new EventBinding("Tick", "OnTick")), timer.getEvents());
        assertTrue(document.findNode("Ghost").isEmpty());
    }

    @Test
    void testContinuationLinesAndComments() {
        var source =
                """
                Partial Class Wrapped
                    Private Sub InitializeComponent()
                        ' Label1
                        Me.Label1 = _
                            New System.Windows.Forms.Label()
                        Me.Label1.Text = "a ' not a comment" ' a comment
                    End Sub
                    Friend WithEvents Label1 As System.Windows.Forms.Label
                End Class
                """;
        var document = parser.parse(source, null);

        assertEquals("\"a ' not a comment\"", document.findNode("Label1").orElseThrow().getProperty("Text"));
    }

    @Test
    void testMissingAnchors() {
        var noClass = assertThrows(DesignerParseException.class, () -> parser.parse("Module M\nEnd Module\n", null));
        assertEquals(MissingAnchor.TYPE_DECLARATION, noClass.getMissingAnchor());

        var noMethod = assertThrows(
                DesignerParseException.class,
                () -> parser.parse("Partial Class F\n    Private Sub Setup()\n    End Sub\nEnd Class\n", null));
        assertEquals(MissingAnchor.INITIALIZE_COMPONENT, noMethod.getMissingAnchor());
    }
}
