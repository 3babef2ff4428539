package ai.designerkit.analyzer.csharp;

import ai.designerkit.analyzer.Dialect;
import ai.designerkit.analyzer.ManagedRegions;
import ai.designerkit.analyzer.SourceRegenerator;
import ai.designerkit.model.ControlNode;
import ai.designerkit.model.EventBinding;
import ai.designerkit.model.FormDocument;
import java.util.List;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;

/** C# statement syntax for {@link SourceRegenerator}. Handlers are attached in method-group form. */
public final class CSharpDesignerWriter extends SourceRegenerator {

    public CSharpDesignerWriter() {
        super(new CSharpRegionLocator());
    }

    @Override
    public Dialect dialect() {
        return Dialect.CSHARP;
    }

    @Override
    protected String declaration(ControlNode node) {
        var args = node.getConstructorArguments();
        return "this." + node.getName() + " = new " + node.getTypeName() + "(" + (args == null ? "" : args) + ");";
    }

    @Override
    protected String suspendLayout(@Nullable String target) {
        return self(target) + ".SuspendLayout();";
    }

    @Override
    protected String resumeLayout(@Nullable String target) {
        return self(target) + ".ResumeLayout(false);";
    }

    @Override
    protected String performLayout() {
        return "this.PerformLayout();";
    }

    @Override
    protected String propertyAssignment(@Nullable String target, String property, String rawValue) {
        return self(target) + "." + property + " = " + rawValue + ";";
    }

    @Override
    protected String childAdd(@Nullable String parent, String child) {
        return self(parent) + ".Controls.Add(this." + child + ");";
    }

    @Override
    protected String eventWiring(@Nullable String target, EventBinding binding) {
        return self(target) + "." + binding.eventName() + " += this." + binding.handlerName() + ";";
    }

    @Override
    protected List<String> banner(String name) {
        return List.of("// ", "// " + name, "// ");
    }

    @Override
    protected String fieldDeclaration(ControlNode node) {
        return "private " + node.getTypeName() + " " + node.getName() + ";";
    }

    @Override
    protected String bodyPrefix(ManagedRegions regions) {
        return regions.lineSeparator();
    }

    @Override
    protected boolean declaresField(String text, String name) {
        var pattern = Pattern.compile("(?m)^[ \\t]*(?:\\[[^\\]]*\\][ \\t]*)*"
                + "(?:(?:private|protected|internal|public|readonly|static|new|volatile)\\s+)*"
                + "(?!return\\b|throw\\b|else\\b|await\\b|goto\\b|yield\\b|using\\b)"
                + "[\\w.]+(?:<[^;=()]*>)?(?:\\[\\s*\\])*\\??\\s+(?:\\w+\\s*,\\s*)*"
                + Pattern.quote(name) + "\\b\\s*(?:=[^;]*)?[,;]");
        return pattern.matcher(text).find();
    }

    @Override
    protected String skeleton(FormDocument document) {
        var ns = document.getNamespace();
        var i1 = ns == null ? "" : "    ";
        var i2 = i1 + "    ";
        var i3 = i2 + "    ";
        var sb = new StringBuilder();
        if (ns != null) {
            sb.append("namespace ").append(ns).append('\n').append("{\n");
        }
        sb.append(i1).append("partial class ").append(document.getFormName()).append('\n');
        sb.append(i1).append("{\n");
        sb.append(i2).append("/// <summary>\n");
        sb.append(i2).append("/// Required designer variable.\n");
        sb.append(i2).append("/// </summary>\n");
        sb.append(i2).append("private System.ComponentModel.IContainer components = null;\n\n");
        sb.append(i2).append("/// <summary>\n");
        sb.append(i2).append("/// Clean up any resources being used.\n");
        sb.append(i2).append("/// </summary>\n");
        sb.append(i2).append("/// <param name=\"disposing\">true if managed resources should be disposed; otherwise, false.</param>\n");
        sb.append(i2).append("protected override void Dispose(bool disposing)\n");
        sb.append(i2).append("{\n");
        sb.append(i3).append("if (disposing && (components != null))\n");
        sb.append(i3).append("{\n");
        sb.append(i3).append("    components.Dispose();\n");
        sb.append(i3).append("}\n");
        sb.append(i3).append("base.Dispose(disposing);\n");
        sb.append(i2).append("}\n\n");
        sb.append(i2).append("#region Windows Form Designer generated code\n\n");
        sb.append(i2).append("/// <summary>\n");
        sb.append(i2).append("/// Required method for Designer support - do not modify\n");
        sb.append(i2).append("/// the contents of this method with the code editor.\n");
        sb.append(i2).append("/// </summary>\n");
        sb.append(i2).append("private void InitializeComponent()\n");
        sb.append(i2).append("{\n");
        sb.append(i2).append("}\n\n");
        sb.append(i2).append("#endregion\n");
        sb.append(i1).append("}\n");
        if (ns != null) {
            sb.append("}\n");
        }
        return sb.toString();
    }

    private static String self(@Nullable String target) {
        return target == null ? "this" : "this." + target;
    }
}
