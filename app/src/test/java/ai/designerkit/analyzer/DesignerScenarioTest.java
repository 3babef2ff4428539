package ai.designerkit.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import ai.designerkit.DesignerFileService;
import ai.designerkit.model.ControlNode;
import ai.designerkit.testutil.DesignerFixtures;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** A form with a single panel: parse it, remove the panel, write, parse again. */
public final class DesignerScenarioTest {
    private static final String CSHARP =
            """
            namespace Demo
            {
                partial class Form1
                {
                    private void InitializeComponent()
                    {
                        this.panel1 = new System.Windows.Forms.Panel();
                        this.SuspendLayout();
                        this.panel1.Location = new System.Drawing.Point(12, 12);
                        this.panel1.Size = new System.Drawing.Size(200, 100);
                        this.panel1.Text = "Submit";
                        this.ClientSize = new System.Drawing.Size(284, 261);
                        this.Controls.Add(this.panel1);
                        this.ResumeLayout(false);
                    }

                    private System.Windows.Forms.Panel panel1;
                }
            }
            """;

    private static final String VB =
            """
            Partial Class Form1
                Private Sub InitializeComponent()
                    Me.panel1 = New System.Windows.Forms.Panel()
                    Me.SuspendLayout()
                    Me.panel1.Location = New System.Drawing.Point(12, 12)
                    Me.panel1.Text = "Submit"
                    Me.Controls.Add(Me.panel1)
                    Me.ResumeLayout(False)
                End Sub

                Friend WithEvents panel1 As System.Windows.Forms.Panel
            End Class
            """;

    private final DesignerFileService service = new DesignerFileService();

    @Test
    void testSinglePanelFormCSharp(@TempDir Path tempDir) throws IOException {
        runScenario(DesignerFixtures.write(tempDir, "Form1.Designer.cs", CSHARP));
    }

    @Test
    void testSinglePanelFormVb(@TempDir Path tempDir) throws IOException {
        runScenario(DesignerFixtures.write(tempDir, "Form1.Designer.vb", VB));
    }

    private void runScenario(Path file) throws IOException {
        var document = service.parse(file);
        assertEquals("Form1", document.getFormName());
        assertEquals(1, document.getAllNodes().size());
        assertEquals(List.of("panel1"), document.getRootNodes().stream().map(ControlNode::getName).toList());
        var panel = document.findNode("panel1").orElseThrow();
        assertEquals("\"Submit\"", panel.getProperties().get("Text"));
        assertTrue(panel.getProperties().containsKey("Location"));

        assertEquals(Set.of("panel1"), document.removeNode("panel1"));
        service.write(file, document);

        var reparsed = service.parse(file);
        assertEquals(0, reparsed.getAllNodes().size());
        assertEquals(0, reparsed.getRootNodes().size());
        assertFalse(DesignerFixtures.readFile(file).contains("panel1"));
    }
}
