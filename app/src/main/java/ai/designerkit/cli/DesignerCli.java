package ai.designerkit.cli;

import ai.designerkit.DesignerFileService;
import ai.designerkit.analyzer.DesignerParseException;
import ai.designerkit.tools.LayoutTools;
import ai.designerkit.tools.MetadataTools;
import ai.designerkit.tools.RenderFormHtmlTools;
import ai.designerkit.tools.RenderFormTools;
import ai.designerkit.tools.ValidationTools;
import ai.designerkit.tools.VisualTreeTools;
import ai.designerkit.util.Json;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

/**
 * Command line front end. Every subcommand prints the JSON result of one tool to stdout; logging goes to stderr.
 * The exit code is 0 on success and 1 when the tool reports a failure or the input is rejected.
 */
@CommandLine.Command(
        name = "designerkit",
        mixinStandardHelpOptions = true,
        version = "designerkit 0.1.0",
        description = "Inspect and edit WinForms designer files (.Designer.cs and .Designer.vb).",
        subcommands = {
            DesignerCli.ListControls.class,
            DesignerCli.GetControlProperties.class,
            DesignerCli.Parse.class,
            DesignerCli.PlaceControl.class,
            DesignerCli.ModifyProperty.class,
            DesignerCli.RemoveControl.class,
            DesignerCli.ControlTypes.class,
            DesignerCli.ControlTypeInfo.class,
            DesignerCli.RenderSvg.class,
            DesignerCli.RenderHtml.class,
            DesignerCli.CheckAccessibility.class
        })
public final class DesignerCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(DesignerCli.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private final DesignerFileService service;

    public DesignerCli() {
        this(new DesignerFileService());
    }

    public DesignerCli(DesignerFileService service) {
        this.service = service;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new DesignerCli()).execute(args);
        System.exit(exitCode);
    }

    /** Without a subcommand, print usage. */
    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    /** Runs one tool and maps its outcome to an exit code. */
    abstract static class ToolCommand implements Callable<Integer> {
        @CommandLine.ParentCommand
        DesignerCli parent;

        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        abstract String run(DesignerFileService service) throws IOException;

        @Override
        public Integer call() {
            var out = spec.commandLine().getOut();
            var err = spec.commandLine().getErr();
            try {
                var json = run(parent.service);
                out.println(json);
                out.flush();
                return Json.isError(json) ? 1 : 0;
            } catch (IOException | UncheckedIOException e) {
                logger.debug("{} failed", spec.name(), e);
                err.println("Error: cannot access file: " + e.getMessage());
                return 1;
            } catch (IllegalArgumentException | DesignerParseException e) {
                logger.debug("{} rejected its input", spec.name(), e);
                err.println("Error: " + e.getMessage());
                return 1;
            }
        }
    }

    @CommandLine.Command(name = "list-controls", description = "List the control hierarchy of a form.")
    static final class ListControls extends ToolCommand {
        @CommandLine.Parameters(index = "0", paramLabel = "FILE", description = "The .Designer.cs or .Designer.vb file.")
        Path file;

        @Override
        String run(DesignerFileService service) throws IOException {
            return new VisualTreeTools(service).listControls(file);
        }
    }

    @CommandLine.Command(
            name = "get-control-properties",
            description = "Show the properties, events and children of one control, or of the form.")
    static final class GetControlProperties extends ToolCommand {
        @CommandLine.Parameters(index = "0", paramLabel = "FILE")
        Path file;

        @CommandLine.Parameters(index = "1", paramLabel = "CONTROL", description = "Control name, or 'form'.")
        String controlName;

        @Override
        String run(DesignerFileService service) throws IOException {
            return new VisualTreeTools(service).getControlProperties(file, controlName);
        }
    }

    @CommandLine.Command(name = "parse", description = "Dump the complete parsed form as JSON.")
    static final class Parse extends ToolCommand {
        @CommandLine.Parameters(index = "0", paramLabel = "FILE")
        Path file;

        @Override
        String run(DesignerFileService service) throws IOException {
            return new VisualTreeTools(service).parseDesignerFile(file);
        }
    }

    @CommandLine.Command(name = "place-control", description = "Add a control with sensible defaults.")
    static final class PlaceControl extends ToolCommand {
        @CommandLine.Parameters(index = "0", paramLabel = "FILE")
        Path file;

        @CommandLine.Parameters(index = "1", paramLabel = "TYPE", description = "Control type, e.g. Button.")
        String controlType;

        @CommandLine.Option(names = "--name", description = "Control name; generated when omitted.")
        @Nullable
        String name;

        @CommandLine.Option(names = "--parent", description = "Container to add the control to; the form by default.")
        @Nullable
        String parentName;

        @CommandLine.Option(
                names = "--properties",
                description = "JSON object of property overrides, e.g. {\"Text\": \"\\\"OK\\\"\"}.")
        @Nullable
        String properties;

        @Override
        String run(DesignerFileService service) throws IOException {
            return new LayoutTools(service).placeControl(file, controlType, name, parentName, properties);
        }
    }

    @CommandLine.Command(name = "modify-property", description = "Set one property to a value expression.")
    static final class ModifyProperty extends ToolCommand {
        @CommandLine.Parameters(index = "0", paramLabel = "FILE")
        Path file;

        @CommandLine.Parameters(index = "1", paramLabel = "CONTROL", description = "Control name, or 'form'.")
        String controlName;

        @CommandLine.Parameters(index = "2", paramLabel = "PROPERTY")
        String property;

        @CommandLine.Parameters(
                index = "3",
                paramLabel = "VALUE",
                description = "Value expression in the file's language, e.g. '\"OK\"' or 'true'.")
        String value;

        @Override
        String run(DesignerFileService service) throws IOException {
            return new LayoutTools(service).modifyControlProperty(file, controlName, property, value);
        }
    }

    @CommandLine.Command(name = "remove-control", description = "Remove a control and everything inside it.")
    static final class RemoveControl extends ToolCommand {
        @CommandLine.Parameters(index = "0", paramLabel = "FILE")
        Path file;

        @CommandLine.Parameters(index = "1", paramLabel = "CONTROL")
        String controlName;

        @Override
        String run(DesignerFileService service) throws IOException {
            return new LayoutTools(service).removeControl(file, controlName);
        }
    }

    @CommandLine.Command(name = "control-types", description = "List the catalogued control types.")
    static final class ControlTypes extends ToolCommand {
        @Override
        String run(DesignerFileService service) {
            return new MetadataTools().availableControlTypes();
        }
    }

    @CommandLine.Command(name = "control-type-info", description = "Show common properties and events of a type.")
    static final class ControlTypeInfo extends ToolCommand {
        @CommandLine.Parameters(index = "0", paramLabel = "TYPE")
        String controlType;

        @Override
        String run(DesignerFileService service) {
            return new MetadataTools().controlTypeInfo(controlType);
        }
    }

    @CommandLine.Command(name = "render-svg", description = "Render the form as an SVG wireframe.")
    static final class RenderSvg extends ToolCommand {
        @CommandLine.Parameters(index = "0", paramLabel = "FILE")
        Path file;

        @CommandLine.Option(
                names = {"-o", "--output"},
                description = "Write the SVG here instead of returning it base64-encoded.")
        @Nullable
        Path output;

        @CommandLine.Option(names = "--padding", defaultValue = "20", description = "Margin in pixels.")
        int padding = 20;

        @Override
        String run(DesignerFileService service) throws IOException {
            return new RenderFormTools(service).renderSvg(file, output, padding);
        }
    }

    @CommandLine.Command(
            name = "render-html",
            description = "Render the form as an interactive HTML page with control tree and property inspector.")
    static final class RenderHtml extends ToolCommand {
        @CommandLine.Parameters(index = "0", paramLabel = "FILE")
        Path file;

        @CommandLine.Option(
                names = {"-o", "--output"},
                required = true,
                description = "Where to write the HTML file.")
        Path output;

        @Override
        String run(DesignerFileService service) throws IOException {
            return new RenderFormHtmlTools(service).renderHtml(file, output);
        }
    }

    @CommandLine.Command(name = "check-accessibility", description = "Report accessibility problems in a form.")
    static final class CheckAccessibility extends ToolCommand {
        @CommandLine.Parameters(index = "0", paramLabel = "FILE")
        Path file;

        @Override
        String run(DesignerFileService service) throws IOException {
            return new ValidationTools(service).checkAccessibility(file);
        }
    }
}
