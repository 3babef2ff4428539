package ai.designerkit.tools;

import static org.junit.jupiter.api.Assertions.*;

import ai.designerkit.DesignerFileService;
import ai.designerkit.analyzer.Dialect;
import ai.designerkit.model.ControlNode;
import ai.designerkit.model.FormDocument;
import ai.designerkit.testutil.DesignerFixtures;
import ai.designerkit.tools.ValidationTools.Issue;
import ai.designerkit.tools.ValidationTools.Severity;
import ai.designerkit.util.Json;
import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.Test;

public final class ValidationToolsTest {

    private static ControlNode add(FormDocument document, String name, String type) {
        var node = document.addNode(new ControlNode(name, "System.Windows.Forms." + type));
        document.attach(null, node);
        return node;
    }

    private static List<String> rules(List<Issue> issues) {
        return issues.stream().map(Issue::rule).toList();
    }

    @Test
    void testSampleFormReport() throws IOException {
        var tools = new ValidationTools(new DesignerFileService());
        var result = Json.getMapper()
                .readTree(tools.checkAccessibility(DesignerFixtures.path(DesignerFixtures.SAMPLE_CS)));

        assertEquals("Form1", result.get("formName").asText());
        assertEquals(5, result.get("totalControls").asInt());
        assertEquals(5, result.get("issueCount").asInt());
        assertEquals(2, result.get("warnings").asInt());
        assertEquals(3, result.get("informational").asInt());
        assertFalse(result.get("passed").asBoolean());

        var first = result.get("issues").get(0);
        assertEquals("button1", first.get("control").asText());
        assertEquals("warning", first.get("severity").asText());
        assertEquals("MissingAccessibleName", first.get("rule").asText());
    }

    @Test
    void testInformationalFindingsDoNotFailTheReport() {
        var document = new FormDocument(Dialect.CSHARP, null, "Ok", null);
        document.setFormProperty("Text", "\"Settings\"");
        var box = add(document, "nameBox", "TextBox");
        box.setProperty("AccessibleName", "\"Name\"");
        box.setProperty("TabIndex", "0");

        var issues = ValidationTools.findIssues(document);

        assertEquals(List.of("MissingAccessibleDescription"), rules(issues));
        assertEquals(Severity.INFO, issues.get(0).severity());
    }

    @Test
    void testCaptionAndTabStopRules() {
        var document = new FormDocument(Dialect.VISUAL_BASIC, null, "Prefs", null);
        document.setFormProperty("Text", "\"\"");
        var label = add(document, "Caption", "Label");
        label.setProperty("TabIndex", "1");
        var check = add(document, "Enabled", "CheckBox");
        check.setProperty("AccessibleName", "\"Enabled\"");
        check.setProperty("AccessibleDescription", "\"Turns it on\"");
        check.setProperty("Text", "\"Enabled\"");
        check.setProperty("TabIndex", "1");
        add(document, "Picker", "DateTimePicker");

        var issues = ValidationTools.findIssues(document);

        assertTrue(issues.contains(new Issue("Caption", "Label", Severity.WARNING, "MissingText",
                "'Caption' (Label) has no Text property set.")));
        assertTrue(rules(issues).contains("MissingTabIndex"));
        var duplicate = issues.stream().filter(i -> i.rule().equals("DuplicateTabIndex")).findFirst().orElseThrow();
        assertEquals("Caption, Enabled", duplicate.control());
        assertEquals("", duplicate.controlType());
        assertEquals("MissingFormText", issues.get(issues.size() - 1).rule());
    }

    @Test
    void testTypeNamesAreMatchedIgnoringCase() {
        var document = new FormDocument(Dialect.CSHARP, null, "F", null);
        document.setFormProperty("Text", "\"F\"");
        document.attach(null, document.addNode(new ControlNode("go", "MyControls.BUTTON")));

        assertTrue(rules(ValidationTools.findIssues(document)).contains("MissingAccessibleName"));
    }
}
