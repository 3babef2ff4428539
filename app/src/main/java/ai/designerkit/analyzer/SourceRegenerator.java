package ai.designerkit.analyzer;

import ai.designerkit.model.ControlNode;
import ai.designerkit.model.EventBinding;
import ai.designerkit.model.FormDocument;
import ai.designerkit.util.SourceFiles;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Renders a {@link FormDocument} back into designer source.
 *
 * <p>When the managed region of the existing text can be located, only the {@code InitializeComponent} body and the
 * control field block are replaced and every other character is kept. Otherwise a complete file is produced by
 * splicing into the dialect's skeleton. Statements always come out in the same order:
 *
 * <ol>
 *   <li>control declarations
 *   <li>suspend layout on each container, then on the form
 *   <li>per control: properties, child additions, event wiring
 *   <li>form properties
 *   <li>root controls added to the form
 *   <li>form event wiring
 *   <li>resume layout on each container and the form, then perform layout
 * </ol>
 */
public abstract class SourceRegenerator implements DesignerFileWriter {
    private static final Logger logger = LogManager.getLogger(SourceRegenerator.class);

    private final RegionLocator locator;

    protected SourceRegenerator(RegionLocator locator) {
        this.locator = locator;
    }

    @Override
    public final void write(Path file, FormDocument document) throws IOException {
        if (Files.exists(file)) {
            var existing = SourceFiles.read(file);
            SourceFiles.write(file, render(existing.text(), document), existing.hadBom());
        } else {
            SourceFiles.write(file, render(null, document), false);
        }
    }

    @Override
    public final String render(@Nullable String existingSource, FormDocument document) {
        if (existingSource == null || existingSource.isBlank()) {
            logger.debug("Generating a new {} designer file for {}", dialect().displayName(), document.getFormName());
            return generate(document);
        }
        var regions = locator.locate(existingSource);
        if (regions.isEmpty()) {
            logger.warn("Managed region not found in {}; regenerating the whole file",
                    document.getFilePath() == null ? document.getFormName() : document.getFilePath());
            return generate(document);
        }
        return splice(existingSource, regions.get(), document);
    }

    private String generate(FormDocument document) {
        var skeleton = skeleton(document);
        var regions = locator.locate(skeleton)
                .orElseThrow(() -> new IllegalStateException("Generated skeleton has no managed region"));
        return splice(skeleton, regions, document);
    }

    private String splice(String source, ManagedRegions regions, FormDocument document) {
        var nl = regions.lineSeparator();
        var body = regions.methodBody();
        var fields = regions.fieldBlock();
        if (body.end() > fields.start() && fields.end() > body.start()) {
            throw new IllegalStateException("Method body " + body + " overlaps field block " + fields);
        }

        var bodyText = renderBody(statementLines(document), regions);

        var outside = outsideOf(source, body, fields);
        var fieldLines = new ArrayList<String>();
        for (var node : document.getAllNodes()) {
            if (declaresField(outside, node.getName())) {
                logger.trace("{} is declared outside the field block; not redeclaring it", node.getName());
                continue;
            }
            fieldLines.add(fieldDeclaration(node));
        }
        var fieldText = new StringBuilder();
        if (!fieldLines.isEmpty()) {
            fieldText.append(nl);
            for (var line : fieldLines) {
                fieldText.append(regions.fieldIndent()).append(line).append(nl);
            }
        }

        var sb = new StringBuilder(source);
        if (body.start() > fields.start()) {
            sb.replace(body.start(), body.end(), bodyText);
            sb.replace(fields.start(), fields.end(), fieldText.toString());
        } else {
            sb.replace(fields.start(), fields.end(), fieldText.toString());
            sb.replace(body.start(), body.end(), bodyText);
        }
        logger.debug("Spliced {} statements and {} fields into {}", document.getAllNodes().size(), fieldLines.size(),
                document.getFormName());
        return sb.toString();
    }

    private static String outsideOf(String source, TextRange body, TextRange fields) {
        var first = body.start() < fields.start() ? body : fields;
        var second = first == body ? fields : body;
        return source.substring(0, first.start()) + source.substring(first.end(), second.start())
                + source.substring(second.end());
    }

    /** Indents each line and wraps them the way the dialect's method body expects. */
    private String renderBody(List<String> lines, ManagedRegions regions) {
        var nl = regions.lineSeparator();
        var sb = new StringBuilder();
        sb.append(bodyPrefix(regions));
        for (var line : lines) {
            if (!line.isEmpty()) {
                sb.append(regions.statementIndent()).append(line);
            }
            sb.append(nl);
        }
        sb.append(nl);
        sb.append(regions.closingIndent());
        return sb.toString();
    }

    /** The statements of {@code InitializeComponent}, unindented, in emission order. */
    public final List<String> statementLines(FormDocument document) {
        var nodes = document.getAllNodes();
        var lines = new ArrayList<String>();
        for (var node : nodes) {
            lines.add(declaration(node));
        }
        for (var node : nodes) {
            if (node.hasChildren()) {
                lines.add(suspendLayout(node.getName()));
            }
        }
        lines.add(suspendLayout(null));
        for (var node : nodes) {
            lines.addAll(banner(node.getName()));
            node.getProperties()
                    .forEach((property, value) -> lines.add(propertyAssignment(node.getName(), property, value)));
            for (var child : node.getChildren()) {
                lines.add(childAdd(node.getName(), child.getName()));
            }
            for (var event : node.getEvents()) {
                lines.add(eventWiring(node.getName(), event));
            }
        }
        lines.addAll(banner(document.getFormName()));
        document.getFormProperties().forEach((property, value) -> lines.add(propertyAssignment(null, property, value)));
        for (var root : document.getRootNodes()) {
            lines.add(childAdd(null, root.getName()));
        }
        for (var event : document.getFormEvents()) {
            lines.add(eventWiring(null, event));
        }
        for (var node : nodes) {
            if (node.hasChildren()) {
                lines.add(resumeLayout(node.getName()));
            }
        }
        lines.add(resumeLayout(null));
        lines.add(performLayout());
        return lines;
    }

    // Statement syntax; a null target stands for the form itself.

    protected abstract String declaration(ControlNode node);

    protected abstract String suspendLayout(@Nullable String target);

    protected abstract String resumeLayout(@Nullable String target);

    protected abstract String performLayout();

    protected abstract String propertyAssignment(@Nullable String target, String property, String rawValue);

    protected abstract String childAdd(@Nullable String parent, String child);

    protected abstract String eventWiring(@Nullable String target, EventBinding binding);

    /** Comment lines introducing the statements of one control or the form. */
    protected abstract List<String> banner(String name);

    protected abstract String fieldDeclaration(ControlNode node);

    /** Text inserted at the start of the method body span, before the first statement. */
    protected abstract String bodyPrefix(ManagedRegions regions);

    /** True when {@code text} already declares a field called {@code name}. */
    protected abstract boolean declaresField(String text, String name);

    /** A complete file for the document's form with an empty managed region. */
    protected abstract String skeleton(FormDocument document);
}
