package ai.designerkit.analyzer;

import ai.designerkit.model.FormDocument;
import java.io.IOException;
import java.nio.file.Path;
import org.jetbrains.annotations.Nullable;

/**
 * Reads one designer file into a fresh {@link FormDocument}. Implementations hold no state between calls and may be
 * shared across threads.
 */
public interface DesignerFileParser {
    Dialect dialect();

    /**
     * Reads and parses a file. A leading UTF-8 byte order mark is ignored.
     *
     * @throws DesignerParseException if the type declaration or {@code InitializeComponent} is missing
     * @throws java.util.concurrent.CancellationException if the calling thread was interrupted before parsing began
     */
    FormDocument parse(Path file) throws IOException;

    /**
     * Parses already-loaded source text.
     *
     * @param origin recorded on the document; null for in-memory sources
     */
    FormDocument parse(String source, @Nullable Path origin);
}
