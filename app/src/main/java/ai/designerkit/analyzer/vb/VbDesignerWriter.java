package ai.designerkit.analyzer.vb;

import ai.designerkit.analyzer.Dialect;
import ai.designerkit.analyzer.ManagedRegions;
import ai.designerkit.analyzer.SourceRegenerator;
import ai.designerkit.model.ControlNode;
import ai.designerkit.model.EventBinding;
import ai.designerkit.model.FormDocument;
import java.util.List;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;

/** VB statement syntax for {@link SourceRegenerator}. Handlers are attached with {@code AddHandler}. */
public final class VbDesignerWriter extends SourceRegenerator {

    public VbDesignerWriter() {
        super(new VbRegionLocator());
    }

    @Override
    public Dialect dialect() {
        return Dialect.VISUAL_BASIC;
    }

    @Override
    protected String declaration(ControlNode node) {
        var args = node.getConstructorArguments();
        return "Me." + node.getName() + " = New " + node.getTypeName() + "(" + (args == null ? "" : args) + ")";
    }

    @Override
    protected String suspendLayout(@Nullable String target) {
        return self(target) + ".SuspendLayout()";
    }

    @Override
    protected String resumeLayout(@Nullable String target) {
        return self(target) + ".ResumeLayout(False)";
    }

    @Override
    protected String performLayout() {
        return "Me.PerformLayout()";
    }

    @Override
    protected String propertyAssignment(@Nullable String target, String property, String rawValue) {
        return self(target) + "." + property + " = " + rawValue;
    }

    @Override
    protected String childAdd(@Nullable String parent, String child) {
        return self(parent) + ".Controls.Add(Me." + child + ")";
    }

    @Override
    protected String eventWiring(@Nullable String target, EventBinding binding) {
        return "AddHandler " + self(target) + "." + binding.eventName() + ", AddressOf Me." + binding.handlerName();
    }

    @Override
    protected List<String> banner(String name) {
        return List.of("'", "'" + name, "'");
    }

    @Override
    protected String fieldDeclaration(ControlNode node) {
        return "Friend WithEvents " + node.getName() + " As " + node.getTypeName();
    }

    @Override
    protected String bodyPrefix(ManagedRegions regions) {
        return "";
    }

    @Override
    protected boolean declaresField(String text, String name) {
        var pattern = Pattern.compile("(?im)^[ \\t]*(?:<[^>]*>\\s*)*"
                + "(?:(?:Private|Friend|Protected|Public|Dim|Shared|ReadOnly|WithEvents|Const)\\s+)+"
                + "(?:\\[?\\w+\\]?\\s*,\\s*)*\\[?" + Pattern.quote(name) + "\\]?\\s+As\\b");
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
            sb.append("Namespace ").append(ns).append("\n\n");
        }
        sb.append(i1).append("<Global.Microsoft.VisualBasic.CompilerServices.DesignerGenerated()> _\n");
        sb.append(i1).append("Partial Class ").append(document.getFormName()).append('\n');
        sb.append(i2).append("Inherits System.Windows.Forms.Form\n\n");
        sb.append(i2).append("'Form overrides dispose to clean up the component list.\n");
        sb.append(i2).append("<System.Diagnostics.DebuggerNonUserCode()> _\n");
        sb.append(i2).append("Protected Overrides Sub Dispose(ByVal disposing As Boolean)\n");
        sb.append(i3).append("Try\n");
        sb.append(i3).append("    If disposing AndAlso components IsNot Nothing Then\n");
        sb.append(i3).append("        components.Dispose()\n");
        sb.append(i3).append("    End If\n");
        sb.append(i3).append("Finally\n");
        sb.append(i3).append("    MyBase.Dispose(disposing)\n");
        sb.append(i3).append("End Try\n");
        sb.append(i2).append("End Sub\n\n");
        sb.append(i2).append("'Required by the Windows Form Designer\n");
        sb.append(i2).append("Private components As System.ComponentModel.IContainer\n\n");
        sb.append(i2).append("'NOTE: The following procedure is required by the Windows Form Designer\n");
        sb.append(i2).append("'It can be modified using the Windows Form Designer.\n");
        sb.append(i2).append("'Do not modify it using the code editor.\n");
        sb.append(i2).append("<System.Diagnostics.DebuggerStepThrough()> _\n");
        sb.append(i2).append("Private Sub InitializeComponent()\n");
        sb.append(i2).append("End Sub\n");
        sb.append(i1).append("End Class\n");
        if (ns != null) {
            sb.append("\nEnd Namespace\n");
        }
        return sb.toString();
    }

    private static String self(@Nullable String target) {
        return target == null ? "Me" : "Me." + target;
    }
}
