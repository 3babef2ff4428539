package ai.designerkit.tools;

import ai.designerkit.DesignerFileService;
import ai.designerkit.analyzer.Dialect;
import ai.designerkit.model.ControlNode;
import ai.designerkit.model.FormDocument;
import ai.designerkit.util.Json;
import ai.designerkit.util.ValueExpressions;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Edits that add, change and remove controls. Each edit is one read-modify-write through
 * {@link DesignerFileService#update}, so an edit that fails leaves the file untouched.
 *
 * <p>Values are dialect source text. Defaults the tools synthesise themselves ({@code new}/{@code New},
 * {@code true}/{@code True}, string quoting) are rendered in the dialect of the file being edited; values supplied by
 * the caller are stored as given.
 */
public final class LayoutTools {
    private static final Logger logger = LogManager.getLogger(LayoutTools.class);

    static final String FORMS_NAMESPACE = "System.Windows.Forms.";
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern TYPE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)*");

    /** Properties a freshly placed control gets before any overrides, keyed by short type name. */
    private static final Map<String, Map<String, Function<Dialect, String>>> SMART_DEFAULTS = smartDefaults();

    private final DesignerFileService service;

    public LayoutTools(DesignerFileService service) {
        this.service = service;
    }

    /**
     * Adds a control with smart defaults for its type, a {@code Name}, a default {@code Location} and the next free
     * {@code TabIndex}; {@code propertiesJson} entries override any of those.
     *
     * @param controlType short ({@code Button}) or qualified type name
     * @param name explicit control name, or null to generate one such as {@code button3}
     * @param parentName container to add to, or null for the form itself
     * @param propertiesJson flat JSON object mapping property names to value expressions, or null
     * @throws IllegalArgumentException on malformed names or overrides, or when {@code name} is already taken
     */
    public String placeControl(
            Path file,
            String controlType,
            @Nullable String name,
            @Nullable String parentName,
            @Nullable String propertiesJson)
            throws IOException {
        var fullType = resolveFullTypeName(controlType);
        if (name != null) {
            requireIdentifier(name, "control name");
        }
        Map<String, String> overrides =
                propertiesJson == null || propertiesJson.isBlank() ? Map.of() : Json.stringMap(propertiesJson);
        overrides.keySet().forEach(p -> requireIdentifier(p, "property name"));

        try {
            return service.update(file, document -> {
                var dialect = document.getDialect();
                ControlNode parent = null;
                if (parentName != null && !parentName.isBlank() && !document.isFormReference(parentName)) {
                    parent = document.findNode(parentName).orElseThrow(() -> new ControlNotFoundException(parentName));
                }

                var shortType = shortTypeName(fullType);
                var controlName = name != null ? name : generateControlName(shortType, document);
                var node = new ControlNode(controlName, fullType);
                SMART_DEFAULTS.getOrDefault(shortType, Map.of())
                        .forEach((property, value) -> node.setProperty(property, value.apply(dialect)));
                node.setProperty("Name", dialect.stringLiteral(controlName));
                if (node.getProperty("Location") == null) {
                    node.setProperty("Location", dialect.newExpression("System.Drawing.Point", "12, 12"));
                }
                node.setProperty("TabIndex", Integer.toString(nextTabIndex(document)));
                overrides.forEach(node::setProperty);

                document.addNode(node);
                document.attach(parent, node);

                var target = parent == null ? document.getFormName() : parent.getName();
                logger.debug("Placed {} {} under {} in {}", shortType, controlName, target, file);
                var result = new LinkedHashMap<String, Object>();
                result.put("success", true);
                result.put("controlName", controlName);
                result.put("controlType", fullType);
                result.put("appliedProperties", new LinkedHashMap<>(node.getProperties()));
                result.put("parentName", target);
                result.put("message", "Added %s '%s' to %s.".formatted(shortType, controlName, target));
                return Json.toJson(result);
            });
        } catch (ControlNotFoundException e) {
            return Json.error(e.getMessage());
        }
    }

    /**
     * Sets one property to a value expression. Targets the form's own properties when {@code controlName} is the form
     * name or {@code form}.
     */
    public String modifyControlProperty(Path file, String controlName, String propertyName, String value)
            throws IOException {
        requireIdentifier(propertyName, "property name");
        if (value.isBlank()) {
            throw new IllegalArgumentException("A value expression is required for " + propertyName);
        }
        var expression = value.strip();
        try {
            return service.update(file, document -> {
                String target;
                if (document.findNode(controlName).isEmpty() && document.isFormReference(controlName)) {
                    document.setFormProperty(propertyName, expression);
                    target = document.getFormName();
                } else {
                    var node = document.findNode(controlName)
                            .orElseThrow(() -> new ControlNotFoundException(controlName));
                    node.setProperty(propertyName, expression);
                    target = node.getName();
                }
                logger.debug("Set {}.{} in {}", target, propertyName, file);
                var result = new LinkedHashMap<String, Object>();
                result.put("success", true);
                result.put("target", target);
                result.put("property", propertyName);
                result.put("value", expression);
                result.put("message", "Set %s.%s = %s".formatted(target, propertyName, expression));
                return Json.toJson(result);
            });
        } catch (ControlNotFoundException e) {
            return Json.error(e.getMessage());
        }
    }

    /** Removes a control together with every control nested inside it. */
    public String removeControl(Path file, String controlName) throws IOException {
        try {
            return service.update(file, document -> {
                var removed = document.removeNode(controlName);
                if (removed.isEmpty()) {
                    throw new ControlNotFoundException(controlName);
                }
                logger.debug("Removed {} from {}", removed, file);
                var result = new LinkedHashMap<String, Object>();
                result.put("success", true);
                result.put("removedControls", new ArrayList<>(removed));
                result.put("message", "Removed '%s' and %d child control(s)."
                        .formatted(removed.iterator().next(), removed.size() - 1));
                return Json.toJson(result);
            });
        } catch (ControlNotFoundException e) {
            return Json.error(e.getMessage());
        }
    }

    static String resolveFullTypeName(String controlType) {
        var type = controlType.strip();
        if (!TYPE_NAME.matcher(type).matches()) {
            throw new IllegalArgumentException("Not a valid control type: '" + controlType + "'");
        }
        return type.contains(".") ? type : FORMS_NAMESPACE + type;
    }

    private static String shortTypeName(String fullTypeName) {
        int dot = fullTypeName.lastIndexOf('.');
        return dot < 0 ? fullTypeName : fullTypeName.substring(dot + 1);
    }

    /**
     * {@code button3} in C#, {@code Button3} in VB, one past the highest numeric suffix already used with that prefix.
     */
    static String generateControlName(String shortType, FormDocument document) {
        var prefix = document.getDialect() == Dialect.CSHARP
                ? Character.toLowerCase(shortType.charAt(0)) + shortType.substring(1)
                : shortType;
        var lowerPrefix = prefix.toLowerCase(Locale.ROOT);
        int highest = 0;
        for (var node : document.getAllNodes()) {
            var lowerName = node.getName().toLowerCase(Locale.ROOT);
            if (lowerName.startsWith(lowerPrefix)) {
                var suffix = ValueExpressions.parseInt(lowerName.substring(lowerPrefix.length()));
                if (suffix.isPresent()) {
                    highest = Math.max(highest, suffix.getAsInt());
                }
            }
        }
        return prefix + (highest + 1);
    }

    private static int nextTabIndex(FormDocument document) {
        int highest = -1;
        for (var node : document.getAllNodes()) {
            var tabIndex = node.getProperty("TabIndex");
            if (tabIndex != null) {
                var parsed = ValueExpressions.parseInt(tabIndex);
                if (parsed.isPresent()) {
                    highest = Math.max(highest, parsed.getAsInt());
                }
            }
        }
        return highest + 1;
    }

    private static void requireIdentifier(String text, String what) {
        if (!IDENTIFIER.matcher(text).matches()) {
            throw new IllegalArgumentException("Not a valid %s: '%s'".formatted(what, text));
        }
    }

    private static Map<String, Map<String, Function<Dialect, String>>> smartDefaults() {
        var defaults = new TreeMap<String, Map<String, Function<Dialect, String>>>(String.CASE_INSENSITIVE_ORDER);
        defaults.put("Button", new Defaults().size(75, 23).flag("UseVisualStyleBackColor").build());
        defaults.put("TextBox", new Defaults().size(100, 23).build());
        defaults.put("Label", new Defaults().flag("AutoSize").build());
        defaults.put("ComboBox", new Defaults()
                .constant("DropDownStyle", "System.Windows.Forms.ComboBoxStyle.DropDownList")
                .size(121, 23)
                .build());
        defaults.put("CheckBox", new Defaults().flag("AutoSize").flag("UseVisualStyleBackColor").build());
        defaults.put("RadioButton", new Defaults().flag("AutoSize").flag("UseVisualStyleBackColor").build());
        defaults.put("ListBox", new Defaults().size(120, 96).build());
        defaults.put("DataGridView", new Defaults()
                .size(240, 150)
                .constant("ColumnHeadersHeightSizeMode",
                        "System.Windows.Forms.DataGridViewColumnHeadersHeightSizeMode.AutoSize")
                .build());
        defaults.put("Panel", new Defaults().size(200, 100).build());
        defaults.put("GroupBox", new Defaults().size(200, 100).build());
        defaults.put("TabControl", new Defaults().size(200, 100).build());
        defaults.put("PictureBox", new Defaults()
                .size(100, 50)
                .constant("SizeMode", "System.Windows.Forms.PictureBoxSizeMode.Zoom")
                .build());
        defaults.put("ProgressBar", new Defaults().size(100, 23).build());
        defaults.put("NumericUpDown", new Defaults().size(120, 23).build());
        defaults.put("DateTimePicker", new Defaults().size(200, 23).build());
        defaults.put("RichTextBox", new Defaults().size(100, 96).build());
        defaults.put("TreeView", new Defaults().size(121, 97).build());
        defaults.put("ListView", new Defaults().size(121, 97).build());
        defaults.put("MenuStrip", new Defaults().constant("Dock", "System.Windows.Forms.DockStyle.Top").build());
        defaults.put("StatusStrip", new Defaults().constant("Dock", "System.Windows.Forms.DockStyle.Bottom").build());
        defaults.put("ToolStrip", new Defaults().constant("Dock", "System.Windows.Forms.DockStyle.Top").build());
        return defaults;
    }

    /** Ordered property defaults whose values are rendered once the target dialect is known. */
    private static final class Defaults {
        private final Map<String, Function<Dialect, String>> values = new LinkedHashMap<>();

        Defaults size(int width, int height) {
            values.put("Size", dialect -> dialect.newExpression("System.Drawing.Size", width + ", " + height));
            return this;
        }

        Defaults flag(String property) {
            values.put(property, dialect -> dialect.booleanLiteral(true));
            return this;
        }

        Defaults constant(String property, String expression) {
            values.put(property, dialect -> expression);
            return this;
        }

        Map<String, Function<Dialect, String>> build() {
            return values;
        }
    }
}
