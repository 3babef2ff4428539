package ai.designerkit.tools;

import ai.designerkit.DesignerFileService;
import ai.designerkit.analyzer.Dialect;
import ai.designerkit.model.ControlNode;
import ai.designerkit.model.EventBinding;
import ai.designerkit.model.FormDocument;
import ai.designerkit.util.Json;
import ai.designerkit.util.SourceFiles;
import ai.designerkit.util.ValueExpressions.IntPair;
import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Renders a form as a self-contained HTML page: controls become native HTML elements placed at their designer
 * coordinates, next to a collapsible control tree and a property inspector.
 *
 * <p>Controls are emitted as one flat list with absolute positions. Nested controls are offset by their containers,
 * and painting order goes back to front, so a container always sits below its children.
 */
public final class RenderFormHtmlTools {
    private static final Logger logger = LogManager.getLogger(RenderFormHtmlTools.class);

    static final String TEMPLATE = "templates/form-preview.html.mustache";
    private static final int DEFAULT_FORM_SIZE = 300;
    private static final IntPair ORIGIN = new IntPair(0, 0);
    private static final IntPair DEFAULT_CONTROL_SIZE = new IntPair(75, 23);
    private static final int TREE_INDENT = 16;
    private static final Set<String> CONTAINER_TYPES =
            Set.of("Panel", "SplitContainer", "FlowLayoutPanel", "TableLayoutPanel", "TabPage");

    private final DesignerFileService service;
    private final Mustache template;

    public RenderFormHtmlTools(DesignerFileService service) {
        this.service = service;
        MustacheFactory mf = new DefaultMustacheFactory();
        this.template = mf.compile(TEMPLATE);
    }

    /** Renders the preview of {@code file} and saves it to {@code outputPath}. */
    public String renderHtml(Path file, Path outputPath) throws IOException {
        var document = service.parse(file);
        var page = render(document, String.valueOf(file.getFileName()));
        SourceFiles.write(outputPath, page.content(), false);
        logger.debug("Wrote HTML preview of {} to {}", document.getFormName(), outputPath);

        var dimensions = new LinkedHashMap<String, Object>();
        dimensions.put("width", page.width());
        dimensions.put("height", page.height());

        var result = new LinkedHashMap<String, Object>();
        result.put("success", true);
        result.put("format", "html");
        result.put("outputPath", outputPath);
        result.put("formName", document.getFormName());
        result.put("dimensions", dimensions);
        result.put("controlCount", document.getAllNodes().size());
        result.put("message", "Interactive HTML preview saved to " + outputPath + ". Open in a browser to inspect.");
        return Json.toJson(result);
    }

    /** A rendered page and the client size of the form it shows. */
    public record Page(String content, int width, int height) {}

    public Page render(FormDocument document, String fileName) {
        var clientSize = RenderFormTools.pair(document.getFormProperties().get("ClientSize"));
        int width = clientSize.map(IntPair::first).orElse(DEFAULT_FORM_SIZE);
        int height = clientSize.map(IntPair::second).orElse(DEFAULT_FORM_SIZE);
        var title = RenderFormTools.caption(document.getDialect(), document.getFormProperties().get("Text"));

        var treeNodes = new ArrayList<Map<String, Object>>();
        addTreeNodes(treeNodes, document.getRootNodes(), List.of());

        var controls = new ArrayList<Map<String, Object>>();
        new Layout(document.getDialect(), controls).place(document.getRootNodes(), 0, 0, List.of(), false, false);

        Map<String, Object> context = new HashMap<>();
        context.put("formTitle", title.isEmpty() ? document.getFormName() : title);
        context.put("formWidth", width);
        context.put("formHeight", height);
        context.put("controlCount", document.getAllNodes().size());
        context.put("language", document.getDialect().displayName());
        context.put("fileName", fileName);
        context.put("treeNodes", treeNodes);
        context.put("controls", controls);
        context.put("controlDataJson", controlDataJson(document));

        var writer = new StringWriter();
        template.execute(writer, context);
        return new Page(writer.toString(), width, height);
    }

    private static void addTreeNodes(List<Map<String, Object>> into, List<ControlNode> nodes, List<String> ancestors) {
        for (var node : nodes) {
            var item = new HashMap<String, Object>();
            item.put("name", node.getName());
            item.put("type", node.getShortTypeName());
            item.put("indent", ancestors.size() * TREE_INDENT);
            item.put("ancestors", String.join(" ", ancestors));
            item.put("hasChildren", node.hasChildren());
            into.add(item);
            if (node.hasChildren()) {
                var path = new ArrayList<>(ancestors);
                path.add(node.getName());
                addTreeNodes(into, node.getChildren(), path);
            }
        }
    }

    /** Properties, events and type of every control, keyed by name, plus {@code $form}; read by the inspector. */
    static String controlDataJson(FormDocument document) {
        var data = new LinkedHashMap<String, Map<String, String>>();
        var form = new LinkedHashMap<>(document.getFormProperties());
        addEvents(form, document.getFormEvents());
        data.put("$form", form);
        for (var node : document.getAllNodes()) {
            var entry = new LinkedHashMap<String, String>();
            entry.put("Type", node.getTypeName());
            entry.putAll(node.getProperties());
            addEvents(entry, node.getEvents());
            data.put(node.getName(), entry);
        }
        // keeps a "</script>" inside a property value from closing the script block
        return Json.toJson(data).replace("</", "<\\/");
    }

    private static void addEvents(Map<String, String> into, List<EventBinding> events) {
        for (var event : events) {
            into.put("Event:" + event.eventName(), event.handlerName());
        }
    }

    /** Walks the tree back to front and turns every control into a positioned template item. */
    private static final class Layout {
        private final Dialect dialect;
        private final List<Map<String, Object>> items;
        private int paintOrder;

        Layout(Dialect dialect, List<Map<String, Object>> items) {
            this.dialect = dialect;
            this.items = items;
        }

        /**
         * @param pages names of the tab pages enclosing {@code controls}, so switching tabs can show or hide them
         */
        void place(
                List<ControlNode> controls,
                int parentX,
                int parentY,
                List<String> pages,
                boolean parentHidden,
                boolean inTabControl) {
            for (int i = controls.size() - 1; i >= 0; i--) {
                var control = controls.get(i);
                var location = RenderFormTools.pair(control.getProperty("Location")).orElse(ORIGIN);
                var size = RenderFormTools.pair(control.getProperty("Size")).orElse(DEFAULT_CONTROL_SIZE);
                int x = parentX + location.first();
                int y = parentY + location.second();
                var type = control.getShortTypeName();
                // only the first page of a tab control is showing
                boolean hidden = parentHidden || (inTabControl && type.equals("TabPage") && i != 0);

                var item = new HashMap<String, Object>();
                item.put("name", control.getName());
                item.put("type", type);
                item.put("typeClass", type.toLowerCase(Locale.ROOT));
                item.put("x", x);
                item.put("y", y);
                item.put("w", size.first());
                item.put("h", size.second());
                item.put("z", ++paintOrder);
                item.put("hidden", hidden);
                item.put("pages", String.join(" ", pages));
                var visible = control.getProperty("Visible");
                item.put("invisible", visible != null && visible.strip().equalsIgnoreCase("false"));
                describe(item, control, type, size);
                items.add(item);

                if (control.hasChildren()) {
                    var childPages = pages;
                    if (type.equals("TabPage")) {
                        childPages = new ArrayList<>(pages);
                        childPages.add(control.getName());
                    }
                    place(control.getChildren(), x, y, childPages, hidden, type.equals("TabControl"));
                }
            }
        }

        /** Adds the flag and values that pick the control's native element in the template. */
        private void describe(Map<String, Object> item, ControlNode control, String type, IntPair size) {
            var text = text(control, "Text");
            var name = control.getName();
            switch (type) {
                case "Button" -> {
                    item.put("isButton", true);
                    item.put("caption", text.isEmpty() ? name : text);
                }
                case "TextBox" -> {
                    item.put("isTextBox", true);
                    item.put("caption", text);
                    item.put("placeholder", text(control, "PlaceholderText"));
                }
                case "RichTextBox" -> {
                    item.put("isTextArea", true);
                    item.put("caption", text);
                }
                case "Label" -> {
                    item.put("isLabel", true);
                    item.put("caption", text);
                }
                case "ComboBox" -> {
                    item.put("isComboBox", true);
                    item.put("caption", text.isEmpty() ? name : text);
                }
                case "ListBox" -> {
                    item.put("isListBox", true);
                    item.put("rows", Math.max(2, size.second() / 18));
                }
                case "CheckBox" -> {
                    item.put("isCheckBox", true);
                    item.put("caption", text);
                }
                case "RadioButton" -> {
                    item.put("isRadioButton", true);
                    item.put("caption", text);
                }
                case "NumericUpDown" -> item.put("isNumber", true);
                case "DateTimePicker" -> item.put("isDate", true);
                case "ProgressBar" -> item.put("isProgress", true);
                case "DataGridView" -> {
                    item.put("isGrid", true);
                    item.put("columns", gridColumns(size.first()));
                    item.put("gridRows", gridRows(size.first()));
                }
                case "TreeView" -> item.put("isTreeView", true);
                case "ListView" -> item.put("isListView", true);
                case "PictureBox" -> item.put("isPicture", true);
                case "GroupBox" -> {
                    item.put("isGroupBox", true);
                    item.put("caption", text);
                }
                case "TabControl" -> {
                    item.put("isTabControl", true);
                    item.put("tabs", tabs(control));
                }
                case "MenuStrip" -> item.put("isMenuStrip", true);
                case "ToolStrip" -> item.put("isToolStrip", true);
                case "StatusStrip" -> item.put("isStatusStrip", true);
                default -> {
                    if (CONTAINER_TYPES.contains(type)) {
                        // children are separate items; an empty container shows its name
                        if (!control.hasChildren()) {
                            item.put("containerLabel", name);
                        }
                    } else if (control.hasChildren()) {
                        item.put("containerLabel", name + " (" + type + ")");
                    } else {
                        item.put("isGeneric", true);
                    }
                }
            }
        }

        private List<Map<String, Object>> tabs(ControlNode tabControl) {
            var tabs = new ArrayList<Map<String, Object>>();
            var pages = tabControl.getChildren();
            for (int i = 0; i < pages.size(); i++) {
                var page = pages.get(i);
                var caption = text(page, "Text");
                var tab = new HashMap<String, Object>();
                tab.put("target", page.getName());
                tab.put("tabText", caption.isEmpty() ? page.getName() : caption);
                tab.put("active", i == 0);
                tabs.add(tab);
            }
            return tabs;
        }

        private String text(ControlNode control, String property) {
            return RenderFormTools.caption(dialect, control.getProperty(property));
        }
    }

    private static int gridColumnCount(int width) {
        return Math.max(2, Math.min(5, width / 80));
    }

    private static List<Map<String, Object>> gridColumns(int width) {
        var columns = new ArrayList<Map<String, Object>>();
        for (int c = 1; c <= gridColumnCount(width); c++) {
            columns.add(Map.of("column", c));
        }
        return columns;
    }

    private static List<Map<String, Object>> gridRows(int width) {
        var cells = new ArrayList<Map<String, Object>>();
        for (int c = 0; c < gridColumnCount(width); c++) {
            cells.add(Map.of("cell", true));
        }
        var rows = new ArrayList<Map<String, Object>>();
        for (int r = 0; r < 3; r++) {
            rows.add(Map.of("cells", cells));
        }
        return rows;
    }
}
