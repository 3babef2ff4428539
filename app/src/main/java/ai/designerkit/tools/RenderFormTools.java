package ai.designerkit.tools;

import ai.designerkit.DesignerFileService;
import ai.designerkit.analyzer.Dialect;
import ai.designerkit.model.ControlNode;
import ai.designerkit.model.FormDocument;
import ai.designerkit.util.Json;
import ai.designerkit.util.SourceFiles;
import ai.designerkit.util.ValueExpressions;
import ai.designerkit.util.ValueExpressions.IntPair;
import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Draws a form as an SVG wireframe: a window frame sized from {@code ClientSize}, and every control as a box at its
 * {@code Location} and {@code Size}, nested controls offset by their container. Nothing is evaluated, so values that
 * are not literal constructor calls fall back to defaults.
 */
public final class RenderFormTools {
    private static final Logger logger = LogManager.getLogger(RenderFormTools.class);

    static final String TEMPLATE = "templates/wireframe.svg.mustache";
    static final int DEFAULT_PADDING = 20;
    private static final int TITLE_BAR_HEIGHT = 30;
    private static final int DEFAULT_FORM_SIZE = 300;
    private static final IntPair ORIGIN = new IntPair(0, 0);
    private static final IntPair DEFAULT_CONTROL_SIZE = new IntPair(75, 23);
    private static final int MAX_CAPTION_LENGTH = 30;

    private record Style(String fill, String stroke, String icon) {}

    private static final Style DEFAULT_STYLE = new Style("#F5F5F5", "#757575", "");
    private static final Map<String, Style> STYLES = styles();
    private static final Set<String> CONTAINER_TYPES =
            Set.of("Panel", "GroupBox", "TabControl", "SplitContainer", "FlowLayoutPanel", "TableLayoutPanel");

    private final DesignerFileService service;
    private final Mustache template;

    public RenderFormTools(DesignerFileService service) {
        this.service = service;
        MustacheFactory mf = new DefaultMustacheFactory();
        this.template = mf.compile(TEMPLATE);
    }

    /**
     * Renders the wireframe and either saves it to {@code outputPath} or returns it base64-encoded in the result.
     *
     * @param padding blank margin around the window frame, in pixels
     */
    public String renderSvg(Path file, @Nullable Path outputPath, int padding) throws IOException {
        if (padding < 0) {
            throw new IllegalArgumentException("Padding must not be negative: " + padding);
        }
        var document = service.parse(file);
        var svg = render(document, padding);
        var dimensions = new LinkedHashMap<String, Object>();
        dimensions.put("width", svg.width());
        dimensions.put("height", svg.height());

        var result = new LinkedHashMap<String, Object>();
        result.put("success", true);
        result.put("format", "svg");
        if (outputPath != null) {
            SourceFiles.write(outputPath, svg.content(), false);
            logger.debug("Wrote wireframe of {} to {}", document.getFormName(), outputPath);
            result.put("outputPath", outputPath);
            result.put("formName", document.getFormName());
            result.put("dimensions", dimensions);
            result.put("controlCount", document.getAllNodes().size());
            result.put("message", "SVG wireframe saved to " + outputPath);
        } else {
            result.put("mimeType", "image/svg+xml");
            result.put("formName", document.getFormName());
            result.put("dimensions", dimensions);
            result.put("controlCount", document.getAllNodes().size());
            result.put("base64Content",
                    Base64.getEncoder().encodeToString(svg.content().getBytes(StandardCharsets.UTF_8)));
            result.put("message", "SVG wireframe rendered successfully.");
        }
        return Json.toJson(result);
    }

    /** A rendered wireframe and its outer dimensions. */
    public record Svg(String content, int width, int height) {}

    public Svg render(FormDocument document, int padding) {
        var clientSize = pair(document.getFormProperties().get("ClientSize"));
        int formWidth = clientSize.map(IntPair::first).orElse(DEFAULT_FORM_SIZE);
        int formHeight = clientSize.map(IntPair::second).orElse(DEFAULT_FORM_SIZE);
        int svgWidth = formWidth + padding * 2;
        int svgHeight = formHeight + TITLE_BAR_HEIGHT + padding * 2;

        var canvas = new Canvas();
        canvas.rect(padding, padding, formWidth, formHeight + TITLE_BAR_HEIGHT)
                .put("cls", "form-border")
                .put("rx", 4);
        canvas.rect(padding, padding, formWidth, TITLE_BAR_HEIGHT).put("cls", "title-bar").put("rx", 4);
        canvas.rect(padding, padding + TITLE_BAR_HEIGHT - 4, formWidth, 4).put("cls", "title-bar");
        var title = caption(document.getDialect(), document.getFormProperties().get("Text"));
        canvas.text(padding + 10, padding + 20, "title-text", title.isEmpty() ? document.getFormName() : title);

        // decorative window buttons
        int buttonY = padding + 10;
        int buttonX = padding + formWidth - 20;
        canvas.rect(buttonX, buttonY, 10, 10).put("fill", "#EF5350").put("rx", 2);
        canvas.rect(buttonX - 16, buttonY, 10, 10).put("fill", "#FFC107").put("rx", 2);
        canvas.rect(buttonX - 32, buttonY, 10, 10).put("fill", "#4CAF50").put("rx", 2);

        drawControls(canvas, document.getDialect(), document.getRootNodes(), padding, padding + TITLE_BAR_HEIGHT);

        Map<String, Object> context = new HashMap<>();
        context.put("svgWidth", svgWidth);
        context.put("svgHeight", svgHeight);
        context.put("elements", canvas.elements);
        var writer = new StringWriter();
        template.execute(writer, context);
        return new Svg(writer.toString(), svgWidth, svgHeight);
    }

    /**
     * Draws back to front: the first control in a container is topmost in the designer, and later SVG elements paint
     * over earlier ones.
     */
    private static void drawControls(
            Canvas canvas, Dialect dialect, List<ControlNode> controls, int parentX, int parentY) {
        for (int i = controls.size() - 1; i >= 0; i--) {
            var control = controls.get(i);
            var location = pair(control.getProperty("Location")).orElse(ORIGIN);
            var size = pair(control.getProperty("Size")).orElse(DEFAULT_CONTROL_SIZE);
            int x = parentX + location.first();
            int y = parentY + location.second();
            int w = size.first();
            int h = size.second();

            var type = control.getShortTypeName();
            var style = STYLES.getOrDefault(type, DEFAULT_STYLE);
            var text = caption(dialect, control.getProperty("Text"));
            var name = control.getName();
            boolean container = CONTAINER_TYPES.contains(type);

            canvas.rect(x, y, w, h)
                    .put("fill", style.fill())
                    .put("stroke", style.stroke())
                    .put("strokeWidth", "1.5")
                    .put("rx", 3);
            if (container) {
                canvas.rect(x + 1, y + 1, w - 2, h - 2)
                        .put("fill", "none")
                        .put("stroke", style.stroke())
                        .put("strokeWidth", "0.5")
                        .put("dash", "4,2")
                        .put("rx", 2);
            }

            if (container && control.hasChildren()) {
                // only a name tag, so the children drawn on top stay readable
                if (type.equals("GroupBox") && !text.isEmpty()) {
                    canvas.text(x + 10, y - 2, "control-label", text).put("bold", true);
                } else {
                    canvas.text(x + 3, y + 9, "control-type", name).put("opacity", "0.5");
                }
                drawControls(canvas, dialect, control.getChildren(), x, y);
                continue;
            }

            if (type.equals("GroupBox") && !text.isEmpty()) {
                canvas.text(x + 10, y - 2, "control-label", text).put("bold", true);
            } else if (type.equals("Label") && !text.isEmpty()) {
                canvas.text(x + 3, y + h / 2 + 4, "control-text", text);
            } else if (type.equals("Button")) {
                canvas.text(x + w / 2, y + h / 2 + 4, "control-text", text.isEmpty() ? name : text)
                        .put("anchor", "middle");
            } else if (h > 20) {
                var icon = style.icon().isEmpty() ? "" : style.icon() + " ";
                canvas.text(x + 4, y + 12, "control-label", icon + name);
                if (!text.isEmpty() && !type.equals("GroupBox")) {
                    canvas.text(x + 4, y + 25, "control-type", truncate(text));
                }
            } else {
                canvas.text(x + 4, y + h / 2 + 4, "control-label", name);
            }

            if (w > 60 && h > 25 && !type.equals("Label") && !type.equals("Button")) {
                canvas.text(x + w - 4, y + h - 4, "control-type", type).put("anchor", "end");
            }
            if (control.hasChildren()) {
                drawControls(canvas, dialect, control.getChildren(), x, y);
            }
        }
    }

    /**
     * The two leading numbers of a {@code Point}/{@code Size} construction. Accepts VB single suffixes ({@code 12!})
     * and fractional values, which are truncated.
     */
    static Optional<IntPair> pair(@Nullable String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        var args = ValueExpressions.arguments(raw);
        if (args.isEmpty() || args.get().size() < 2) {
            return Optional.empty();
        }
        var first = number(args.get().get(0));
        var second = number(args.get().get(1));
        if (first.isEmpty() || second.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new IntPair(first.getAsInt(), second.getAsInt()));
    }

    private static OptionalInt number(String part) {
        var text = part.strip();
        if (text.endsWith("!")) {
            text = text.substring(0, text.length() - 1);
        }
        var asInt = ValueExpressions.parseInt(text);
        if (asInt.isPresent()) {
            return asInt;
        }
        try {
            return OptionalInt.of((int) Double.parseDouble(text));
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }

    static String caption(Dialect dialect, @Nullable String raw) {
        if (raw == null) {
            return "";
        }
        return ValueExpressions.unquote(raw, dialect).orElse(raw.strip());
    }

    private static String truncate(String text) {
        return text.length() <= MAX_CAPTION_LENGTH ? text : text.substring(0, MAX_CAPTION_LENGTH - 1) + "\u2026";
    }

    /** Ordered drawing commands handed to the template; each element holds either a rect or a text. */
    private static final class Canvas {
        private final List<Map<String, Object>> elements = new ArrayList<>();

        Attributes rect(int x, int y, int w, int h) {
            var attributes = new Attributes();
            attributes.put("x", x).put("y", y).put("w", w).put("h", h);
            elements.add(Map.of("rect", attributes.values));
            return attributes;
        }

        Attributes text(int x, int y, String cssClass, String content) {
            var attributes = new Attributes();
            attributes.put("x", x).put("y", y).put("cls", cssClass).put("content", content);
            elements.add(Map.of("text", attributes.values));
            return attributes;
        }
    }

    private static final class Attributes {
        private final Map<String, Object> values = new HashMap<>();

        Attributes put(String key, Object value) {
            values.put(key, value);
            return this;
        }
    }

    private static Map<String, Style> styles() {
        var styles = new TreeMap<String, Style>(String.CASE_INSENSITIVE_ORDER);
        styles.put("Button", new Style("#E3F2FD", "#1565C0", "\uD83D\uDD32"));
        styles.put("TextBox", new Style("#FFF3E0", "#E65100", "\u270F"));
        styles.put("RichTextBox", new Style("#FFF3E0", "#E65100", "\uD83D\uDCDD"));
        styles.put("Label", new Style("#F3E5F5", "#6A1B9A", "A"));
        styles.put("ComboBox", new Style("#E8F5E9", "#2E7D32", "\u25BE"));
        styles.put("ListBox", new Style("#E8F5E9", "#2E7D32", "\u2630"));
        styles.put("CheckBox", new Style("#FCE4EC", "#AD1457", "\u2611"));
        styles.put("RadioButton", new Style("#FCE4EC", "#AD1457", "\u25C9"));
        styles.put("DataGridView", new Style("#E0F7FA", "#00695C", "\u2637"));
        styles.put("Panel", new Style("#ECEFF1", "#37474F", ""));
        styles.put("GroupBox", new Style("#ECEFF1", "#37474F", ""));
        styles.put("TabControl", new Style("#ECEFF1", "#37474F", "\uD83D\uDCC1"));
        styles.put("SplitContainer", new Style("#ECEFF1", "#37474F", "\u2194"));
        styles.put("FlowLayoutPanel", new Style("#ECEFF1", "#37474F", "\u2192"));
        styles.put("TableLayoutPanel", new Style("#ECEFF1", "#37474F", "\u2637"));
        styles.put("PictureBox", new Style("#F1F8E9", "#33691E", "\uD83D\uDDBC"));
        styles.put("ProgressBar", new Style("#E8EAF6", "#283593", "\u2587"));
        styles.put("NumericUpDown", new Style("#FFF3E0", "#E65100", "#"));
        styles.put("DateTimePicker", new Style("#FFF3E0", "#E65100", "\uD83D\uDCC5"));
        styles.put("TreeView", new Style("#E0F7FA", "#00695C", "\uD83C\uDF33"));
        styles.put("ListView", new Style("#E0F7FA", "#00695C", "\u2630"));
        styles.put("MenuStrip", new Style("#EFEBE9", "#3E2723", "\u2630"));
        styles.put("ToolStrip", new Style("#EFEBE9", "#3E2723", "\uD83D\uDD27"));
        styles.put("StatusStrip", new Style("#EFEBE9", "#3E2723", "\u2500"));
        return styles;
    }
}
