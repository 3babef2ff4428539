package ai.designerkit.analyzer;

import ai.designerkit.model.FormDocument;
import java.io.IOException;
import java.nio.file.Path;
import org.jetbrains.annotations.Nullable;

/** Regenerates the managed region of a designer file from a {@link FormDocument}. */
public interface DesignerFileWriter {
    Dialect dialect();

    /**
     * Rewrites {@code file}. When the file exists and its managed region can be located, only the
     * {@code InitializeComponent} body and the control field block change; otherwise a complete file is generated.
     */
    void write(Path file, FormDocument document) throws IOException;

    /**
     * Produces the new file content without touching the disk.
     *
     * @param existingSource current file text, or null when there is none
     */
    String render(@Nullable String existingSource, FormDocument document);
}
