package ai.designerkit.tools;

import ai.designerkit.DesignerFileService;
import ai.designerkit.model.ControlNode;
import ai.designerkit.model.FormDocument;
import ai.designerkit.util.Json;
import ai.designerkit.util.ValueExpressions;
import com.fasterxml.jackson.annotation.JsonValue;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/** Static accessibility checks over a parsed form. */
public final class ValidationTools {
    /** Controls a keyboard or screen-reader user interacts with directly. */
    private static final Set<String> INTERACTIVE_TYPES = caseInsensitive(
            "Button", "TextBox", "ComboBox", "ListBox", "CheckBox", "RadioButton", "NumericUpDown", "DateTimePicker",
            "DataGridView", "ListView", "TreeView", "RichTextBox", "PictureBox", "TrackBar", "ProgressBar");

    /** Controls whose caption is their accessible label. */
    private static final Set<String> CAPTIONED_TYPES =
            caseInsensitive("Button", "CheckBox", "RadioButton", "GroupBox", "Label");

    public enum Severity {
        WARNING,
        INFO;

        @JsonValue
        public String jsonName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public record Issue(String control, String controlType, Severity severity, String rule, String message) {}

    private final DesignerFileService service;

    public ValidationTools(DesignerFileService service) {
        this.service = service;
    }

    /**
     * Scans every control for missing accessible names, descriptions, captions and tab stops, plus duplicate tab
     * indexes and a missing form caption. The report passes when there are no warnings; informational findings do
     * not fail it.
     */
    public String checkAccessibility(Path file) throws IOException {
        var document = service.parse(file);
        var issues = findIssues(document);

        long warnings = issues.stream().filter(i -> i.severity() == Severity.WARNING).count();
        var result = new LinkedHashMap<String, Object>();
        result.put("filePath", file);
        result.put("formName", document.getFormName());
        result.put("totalControls", document.getAllNodes().size());
        result.put("issueCount", issues.size());
        result.put("warnings", warnings);
        result.put("informational", issues.size() - warnings);
        result.put("passed", warnings == 0);
        result.put("issues", issues);
        return Json.toJson(result);
    }

    static List<Issue> findIssues(FormDocument document) {
        var issues = new ArrayList<Issue>();
        for (var control : document.getAllNodes()) {
            checkControl(control, issues);
        }
        checkTabOrder(document, issues);

        var formText = document.getFormProperties().get("Text");
        if (formText == null || formText.isBlank() || isEmptyLiteral(document, formText)) {
            issues.add(new Issue(document.getFormName(), "Form", Severity.WARNING, "MissingFormText",
                    "The form has no Text (title bar caption). This is used as the accessible name of the window."));
        }
        return issues;
    }

    private static void checkControl(ControlNode control, List<Issue> issues) {
        var name = control.getName();
        var type = control.getShortTypeName();
        boolean interactive = INTERACTIVE_TYPES.contains(type);

        if (interactive && control.getProperty("AccessibleName") == null) {
            issues.add(new Issue(name, type, Severity.WARNING, "MissingAccessibleName",
                    "'%s' (%s) is missing AccessibleName. Screen readers need this to identify the control."
                            .formatted(name, type)));
        }
        if (interactive && control.getProperty("AccessibleDescription") == null) {
            issues.add(new Issue(name, type, Severity.INFO, "MissingAccessibleDescription",
                    "'%s' (%s) has no AccessibleDescription. Consider adding one for better screen reader support."
                            .formatted(name, type)));
        }
        if (CAPTIONED_TYPES.contains(type) && control.getProperty("Text") == null) {
            issues.add(new Issue(name, type, Severity.WARNING, "MissingText",
                    "'%s' (%s) has no Text property set.".formatted(name, type)));
        }
        if (interactive && control.getProperty("TabIndex") == null) {
            issues.add(new Issue(name, type, Severity.WARNING, "MissingTabIndex",
                    "'%s' (%s) has no TabIndex set. Keyboard navigation order may be unexpected."
                            .formatted(name, type)));
        }
    }

    private static void checkTabOrder(FormDocument document, List<Issue> issues) {
        Map<Integer, List<String>> byIndex = new TreeMap<>();
        for (var control : document.getAllNodes()) {
            var raw = control.getProperty("TabIndex");
            if (raw == null) {
                continue;
            }
            var index = ValueExpressions.parseInt(raw);
            if (index.isPresent() && index.getAsInt() >= 0) {
                byIndex.computeIfAbsent(index.getAsInt(), k -> new ArrayList<>()).add(control.getName());
            }
        }
        byIndex.forEach((index, names) -> {
            if (names.size() > 1) {
                var joined = String.join(", ", names);
                issues.add(new Issue(joined, "", Severity.WARNING, "DuplicateTabIndex",
                        "Controls [%s] share TabIndex %d. Tab order will be ambiguous.".formatted(joined, index)));
            }
        });
    }

    private static boolean isEmptyLiteral(FormDocument document, String raw) {
        return ValueExpressions.unquote(raw, document.getDialect())
                .map(String::isBlank)
                .orElse(false);
    }

    private static Set<String> caseInsensitive(String... names) {
        var set = new TreeSet<String>(String.CASE_INSENSITIVE_ORDER);
        set.addAll(List.of(names));
        return set;
    }
}
