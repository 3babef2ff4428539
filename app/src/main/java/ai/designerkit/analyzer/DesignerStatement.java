package ai.designerkit.analyzer;

import org.jetbrains.annotations.Nullable;

/**
 * What one statement of {@code InitializeComponent} means to the form model. A null target, parent or owner stands
 * for the form itself.
 */
public sealed interface DesignerStatement {

    /** {@code this.button1 = new Button();} where {@code button1} is a field of the form. */
    record Declaration(String name, String typeName, String arguments) implements DesignerStatement {}

    /** {@code this.button1.Text = "Submit";}; the value is kept as written. */
    record PropertyAssignment(@Nullable String target, String property, String rawValue) implements DesignerStatement {}

    /** {@code this.panel1.Controls.Add(this.button1);} */
    record ChildAdd(@Nullable String parent, String child) implements DesignerStatement {}

    /** {@code this.button1.Click += ...} or {@code AddHandler Me.Button1.Click, ...}. */
    record EventWiring(@Nullable String target, String event, String handler) implements DesignerStatement {}

    /** Anything else; ignored by the model. */
    enum Unrecognized implements DesignerStatement {
        INSTANCE
    }
}
