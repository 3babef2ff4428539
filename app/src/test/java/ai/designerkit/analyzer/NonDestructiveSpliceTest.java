package ai.designerkit.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import ai.designerkit.analyzer.csharp.CSharpDesignerParser;
import ai.designerkit.analyzer.csharp.CSharpDesignerWriter;
import ai.designerkit.analyzer.vb.VbDesignerParser;
import ai.designerkit.analyzer.vb.VbDesignerWriter;
import ai.designerkit.model.ControlNode;
import ai.designerkit.testutil.DesignerFixtures;
import java.io.IOException;
import org.junit.jupiter.api.Test;

/** Writes must leave everything outside {@code InitializeComponent} and the control field block untouched. */
public final class NonDestructiveSpliceTest {
    private static final String METHOD_OPEN = "private void InitializeComponent()\n        {";
    private static final String USER_FIELDS = "        private readonly System.Collections.Generic.Dictionary";

    private final CSharpDesignerParser parser = new CSharpDesignerParser();
    private final CSharpDesignerWriter writer = new CSharpDesignerWriter();

    @Test
    void testCustomCodeSurvivesPropertyChange() throws IOException {
        var text = DesignerFixtures.read(DesignerFixtures.LEGACY_CS);
        var document = parser.parse(text, null);
        document.findNode("okButton").orElseThrow().setProperty("Text", "\"Cancel\"");

        var written = writer.render(text, document);

        int methodOpen = text.indexOf(METHOD_OPEN) + METHOD_OPEN.length();
        assertEquals(text.substring(0, methodOpen), written.substring(0, methodOpen));
        assertTrue(written.endsWith(text.substring(text.indexOf(USER_FIELDS))));
        assertTrue(written.contains("this.okButton.Text = \"Cancel\";"));
        assertFalse(written.contains("\"O{K}\""));
    }

    @Test
    void testComponentsFieldIsNotRedeclared() throws IOException {
        var text = DesignerFixtures.read(DesignerFixtures.LEGACY_CS);
        var written = writer.render(text, parser.parse(text, null));

        assertEquals(written.indexOf("IContainer components"), written.lastIndexOf("IContainer components"));
        assertFalse(written.contains("private System.ComponentModel.Container components;"));
        assertTrue(written.contains("this.refreshTimer = new System.Windows.Forms.Timer(this.components);"));
        assertTrue(written.contains("        private System.Windows.Forms.Timer refreshTimer;\n"));
    }

    @Test
    void testUnmodelledStatementsAreDropped() throws IOException {
        var text = DesignerFixtures.read(DesignerFixtures.LEGACY_CS);
        var written = writer.render(text, parser.parse(text, null));

        assertFalse(written.contains("BeginInit"));
        assertFalse(written.contains("ghost"));
        assertTrue(written.contains("this.okButton.Click += this.okButton_Click;"));
        assertTrue(written.contains("this.Font = new System.Drawing.Font(\"Segoe UI\", 9F);"));
    }

    @Test
    void testNewControlIsDeclaredInFieldBlock() throws IOException {
        var text = DesignerFixtures.read(DesignerFixtures.LEGACY_CS);
        var document = parser.parse(text, null);
        var status = document.addNode(new ControlNode("statusLabel", "System.Windows.Forms.Label"));
        status.setProperty("Text", "\"Ready\"");
        document.attach(null, status);

        var written = writer.render(text, document);

        assertTrue(written.contains(
                "        private System.Windows.Forms.DataGridView grid;\n"
                        + "        private System.Windows.Forms.Label statusLabel;\n"
                        + "\n"
                        + USER_FIELDS));
        assertTrue(written.contains("this.Controls.Add(this.statusLabel);"));
    }

    @Test
    void testCrlfIsKeptThroughout() throws IOException {
        var text = DesignerFixtures.read(DesignerFixtures.LEGACY_CS).replace("\n", "\r\n");
        var document = parser.parse(text, null);
        document.setFormProperty("Text", "\"Renamed\"");

        var written = writer.render(text, document);

        assertFalse(written.replace("\r\n", "").contains("\n"), "bare LF in output");
        assertTrue(written.contains("this.Text = \"Renamed\";\r\n"));
        assertTrue(written.endsWith(text.substring(text.indexOf(USER_FIELDS))));
    }

    @Test
    void testVbUserCodeOutsideRegionSurvives() {
        var text =
                """
                Partial Class Tool
                    Private Sub InitializeComponent()
                        Me.Go = New System.Windows.Forms.Button()
                        Me.Go.Text = "Go"
                        Me.Controls.Add(Me.Go)
                    End Sub
                    Friend WithEvents Go As System.Windows.Forms.Button

                    Private clicks As Integer = 0

                    Private Sub Go_Click(sender As Object, e As EventArgs) Handles Go.Click
                        clicks += 1
                    End Sub
                End Class
                """;
        var parser = new VbDesignerParser();
        var writer = new VbDesignerWriter();
        var document = parser.parse(text, null);
        document.findNode("Go").orElseThrow().setProperty("Text", "\"Run\"");

        var written = writer.render(text, document);

        var userCode = text.substring(text.indexOf("\n    Private clicks"));
        assertTrue(written.endsWith(userCode), written);
        assertTrue(written.startsWith("Partial Class Tool\n    Private Sub InitializeComponent()\n"));
        assertTrue(written.contains("        Me.Go.Text = \"Run\"\n"));
        assertEquals(1, written.split("Friend WithEvents Go As", -1).length - 1);
    }
}
