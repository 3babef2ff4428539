package ai.designerkit.tools;

import ai.designerkit.DesignerFileService;
import ai.designerkit.model.ControlNode;
import ai.designerkit.model.FormDocument;
import ai.designerkit.util.Json;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Read-only views of a designer file's control tree, rendered as JSON. */
public final class VisualTreeTools {
    private final DesignerFileService service;

    public VisualTreeTools(DesignerFileService service) {
        this.service = service;
    }

    /** The form's root controls, each nested with its children, plus form name, language and namespace. */
    public String listControls(Path file) throws IOException {
        var document = service.parse(file);
        var result = new LinkedHashMap<String, Object>();
        result.put("formName", document.getFormName());
        result.put("language", document.getDialect().displayName());
        result.put("namespace", document.getNamespace());
        result.put("controls", document.getRootNodes().stream().map(VisualTreeTools::hierarchy).toList());
        return Json.toJson(result);
    }

    /**
     * The property bag, events and direct children of one control. The form itself answers to its own name and to
     * {@code form}.
     */
    public String getControlProperties(Path file, String controlName) throws IOException {
        var document = service.parse(file);
        var control = document.findNode(controlName);
        if (control.isEmpty()) {
            if (document.isFormReference(controlName)) {
                return Json.toJson(formView(document));
            }
            return Json.error("Control '%s' not found.".formatted(controlName));
        }

        var node = control.get();
        var result = new LinkedHashMap<String, Object>();
        result.put("name", node.getName());
        result.put("type", node.getTypeName());
        result.put("properties", node.getProperties());
        result.put("events", node.getEvents());
        result.put("childCount", node.getChildren().size());
        result.put("children", childNames(node));
        return Json.toJson(result);
    }

    /** The whole document. Children are listed by name so every node appears exactly once. */
    public String parseDesignerFile(Path file) throws IOException {
        var document = service.parse(file);
        var result = new LinkedHashMap<String, Object>();
        result.put("filePath", document.getFilePath());
        result.put("language", document.getDialect().displayName());
        result.put("formName", document.getFormName());
        result.put("namespace", document.getNamespace());
        result.put("formProperties", document.getFormProperties());
        result.put("formEvents", document.getFormEvents());
        result.put("rootControls", document.getRootNodes().stream().map(ControlNode::getName).toList());
        result.put("controls", document.getAllNodes().stream().map(VisualTreeTools::flat).toList());
        return Json.toJson(result);
    }

    private static Map<String, Object> formView(FormDocument document) {
        var result = new LinkedHashMap<String, Object>();
        result.put("name", document.getFormName());
        result.put("type", "Form");
        result.put("properties", document.getFormProperties());
        result.put("events", document.getFormEvents());
        result.put("childCount", document.getRootNodes().size());
        return result;
    }

    private static Map<String, Object> hierarchy(ControlNode node) {
        var result = new LinkedHashMap<String, Object>();
        result.put("name", node.getName());
        result.put("type", node.getTypeName());
        result.put("propertyCount", node.getProperties().size());
        result.put("eventCount", node.getEvents().size());
        result.put("children", node.getChildren().stream().map(VisualTreeTools::hierarchy).toList());
        return result;
    }

    private static Map<String, Object> flat(ControlNode node) {
        var result = new LinkedHashMap<String, Object>();
        result.put("name", node.getName());
        result.put("type", node.getTypeName());
        result.put("constructorArguments", node.getConstructorArguments());
        result.put("properties", node.getProperties());
        result.put("events", node.getEvents());
        result.put("children", childNames(node));
        return result;
    }

    private static List<String> childNames(ControlNode node) {
        return node.getChildren().stream().map(ControlNode::getName).toList();
    }
}
