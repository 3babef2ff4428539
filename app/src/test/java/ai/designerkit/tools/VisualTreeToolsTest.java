package ai.designerkit.tools;

import static org.junit.jupiter.api.Assertions.*;

import ai.designerkit.DesignerFileService;
import ai.designerkit.testutil.DesignerFixtures;
import ai.designerkit.util.Json;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public final class VisualTreeToolsTest {
    private final VisualTreeTools tools = new VisualTreeTools(new DesignerFileService());

    private static JsonNode json(String text) throws IOException {
        return Json.getMapper().readTree(text);
    }

    @Test
    void testListControlsNestsChildren() throws IOException {
        var result = json(tools.listControls(DesignerFixtures.path(DesignerFixtures.SAMPLE_CS)));

        assertEquals("Form1", result.get("formName").asText());
        assertEquals("C#", result.get("language").asText());
        assertEquals("SampleApp", result.get("namespace").asText());

        var controls = result.get("controls");
        assertEquals(3, controls.size());
        var panel = controls.get(2);
        assertEquals("panel1", panel.get("name").asText());
        assertEquals("System.Windows.Forms.Panel", panel.get("type").asText());
        assertEquals(4, panel.get("propertyCount").asInt());
        assertEquals(2, panel.get("children").size());
        var button = panel.get("children").get(0);
        assertEquals("button1", button.get("name").asText());
        assertEquals(1, button.get("eventCount").asInt());
        assertEquals(0, button.get("children").size());
    }

    @Test
    void testNamespaceIsOmittedWhenAbsent(@TempDir Path tempDir) throws IOException {
        var source = "partial class Bare\n{\n    private void InitializeComponent()\n    {\n    }\n}\n";
        var file = DesignerFixtures.write(tempDir, "Bare.Designer.cs", source);

        var result = json(tools.listControls(file));
        assertFalse(result.has("namespace"));
        assertEquals(0, result.get("controls").size());
    }

    @Test
    void testGetControlProperties() throws IOException {
        var text = tools.getControlProperties(DesignerFixtures.path(DesignerFixtures.SAMPLE_VB), "button1");
        var result = json(text);

        assertFalse(Json.isError(text));
        assertEquals("Button1", result.get("name").asText());
        assertEquals("\"Submit\"", result.get("properties").get("Text").asText());
        assertEquals("Click", result.get("events").get(0).get("eventName").asText());
        assertEquals("Button1_Click", result.get("events").get(0).get("handlerName").asText());
        assertEquals(0, result.get("childCount").asInt());
    }

    @Test
    void testGetControlPropertiesOfTheForm() throws IOException {
        var byKeyword = json(tools.getControlProperties(DesignerFixtures.path(DesignerFixtures.SAMPLE_CS), "form"));
        assertEquals("Form1", byKeyword.get("name").asText());
        assertEquals("Form", byKeyword.get("type").asText());
        assertEquals(3, byKeyword.get("childCount").asInt());
        assertEquals("\"Sample Form\"", byKeyword.get("properties").get("Text").asText());

        var byName = json(tools.getControlProperties(DesignerFixtures.path(DesignerFixtures.SAMPLE_CS), "FORM1"));
        assertEquals(byKeyword, byName);
    }

    @Test
    void testUnknownControlIsAnError() throws IOException {
        var text = tools.getControlProperties(DesignerFixtures.path(DesignerFixtures.SAMPLE_CS), "nothing");

        assertTrue(Json.isError(text));
        assertEquals("Control 'nothing' not found.", json(text).get("error").asText());
    }

    @Test
    void testParseDesignerFile() throws IOException {
        var path = DesignerFixtures.path(DesignerFixtures.LEGACY_CS);
        var result = json(tools.parseDesignerFile(path));

        assertEquals(path.toString(), result.get("filePath").asText());
        assertEquals("LegacyForm", result.get("formName").asText());
        assertEquals("Legacy.Tools", result.get("namespace").asText());
        assertEquals(2, result.get("rootControls").size());
        assertEquals("FormClosing", result.get("formEvents").get(0).get("eventName").asText());

        var controls = result.get("controls");
        assertEquals(4, controls.size());
        assertEquals("components", controls.get(0).get("name").asText());
        assertFalse(controls.get(0).has("constructorArguments"));
        assertEquals("this.components", controls.get(2).get("constructorArguments").asText());
    }
}
