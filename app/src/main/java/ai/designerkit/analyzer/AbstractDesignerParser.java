package ai.designerkit.analyzer;

import ai.designerkit.model.FormDocument;
import ai.designerkit.util.SourceFiles;
import java.io.IOException;
import java.nio.file.Path;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Shared parse pipeline: read, extract the {@link DesignerSource} with the dialect's syntax tree, then classify and
 * build. Subclasses only supply the structural extraction and the grammar adapter.
 */
public abstract class AbstractDesignerParser<N> implements DesignerFileParser {
    private static final Logger logger = LogManager.getLogger(AbstractDesignerParser.class);

    @Override
    public final FormDocument parse(Path file) throws IOException {
        var source = SourceFiles.read(file);
        return parse(source.text(), file);
    }

    @Override
    public final FormDocument parse(String source, @Nullable Path origin) {
        var text = SourceFiles.stripUtf8Bom(source);
        var parsed = readStructure(text, origin);
        var document = ModelBuilder.build(parsed.source(), new StatementClassifier<>(parsed.grammar()));
        logger.debug("Parsed {} form {} from {}: {} controls",
                dialect().displayName(), document.getFormName(), origin == null ? "<memory>" : origin,
                document.getAllNodes().size());
        return document;
    }

    /** A dialect's structural extraction together with the grammar that can answer questions about its nodes. */
    public record Parsed<N>(DesignerSource<N> source, DesignerGrammar<N> grammar) {}

    /**
     * Locates the form type, its fields and the {@code InitializeComponent} statements.
     *
     * @throws DesignerParseException when the type or the method is missing
     */
    protected abstract Parsed<N> readStructure(String source, @Nullable Path origin);
}
