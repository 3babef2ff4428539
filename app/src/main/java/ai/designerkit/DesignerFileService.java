package ai.designerkit;

import ai.designerkit.analyzer.DesignerFileParser;
import ai.designerkit.analyzer.DesignerFileWriter;
import ai.designerkit.analyzer.Dialect;
import ai.designerkit.analyzer.csharp.CSharpDesignerParser;
import ai.designerkit.analyzer.csharp.CSharpDesignerWriter;
import ai.designerkit.analyzer.vb.VbDesignerParser;
import ai.designerkit.analyzer.vb.VbDesignerWriter;
import ai.designerkit.model.FormDocument;
import com.google.common.util.concurrent.Striped;
import java.io.IOException;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.function.Function;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Entry point used by the tools and the command line: picks the dialect from the file name and routes to the matching
 * parser and writer. Read-modify-write cycles on one path are serialised through {@link #update}; the parsers and
 * writers themselves are stateless.
 */
public final class DesignerFileService {
    private static final Logger logger = LogManager.getLogger(DesignerFileService.class);

    private final Map<Dialect, DesignerFileParser> parsers = new EnumMap<>(Dialect.class);
    private final Map<Dialect, DesignerFileWriter> writers = new EnumMap<>(Dialect.class);
    private final Striped<Lock> pathLocks = Striped.lazyWeakLock(64);

    public DesignerFileService() {
        this(List.of(new CSharpDesignerParser(), new VbDesignerParser()),
                List.of(new CSharpDesignerWriter(), new VbDesignerWriter()));
    }

    public DesignerFileService(List<? extends DesignerFileParser> parsers, List<? extends DesignerFileWriter> writers) {
        parsers.forEach(p -> this.parsers.put(p.dialect(), p));
        writers.forEach(w -> this.writers.put(w.dialect(), w));
    }

    /**
     * @throws IllegalArgumentException for anything but {@code .cs} and {@code .vb} files
     */
    public Dialect detectDialect(Path file) {
        return Dialect.forPath(file)
                .orElseThrow(() -> new IllegalArgumentException("Unsupported designer file extension: " + file
                        + ". Expected .Designer.cs or .Designer.vb"));
    }

    public DesignerFileParser parserFor(Dialect dialect) {
        var parser = parsers.get(dialect);
        if (parser == null) {
            throw new IllegalStateException("No parser registered for " + dialect.displayName());
        }
        return parser;
    }

    public DesignerFileWriter writerFor(Dialect dialect) {
        var writer = writers.get(dialect);
        if (writer == null) {
            throw new IllegalStateException("No writer registered for " + dialect.displayName());
        }
        return writer;
    }

    public FormDocument parse(Path file) throws IOException {
        return parserFor(detectDialect(file)).parse(file);
    }

    /**
     * Writes the document to {@code file}. The document's dialect must match the file's, since property values are
     * kept as dialect source text.
     */
    public void write(Path file, FormDocument document) throws IOException {
        var dialect = detectDialect(file);
        if (dialect != document.getDialect()) {
            throw new IllegalArgumentException("Cannot write a %s form to %s file %s"
                    .formatted(document.getDialect().displayName(), dialect.displayName(), file));
        }
        writerFor(dialect).write(file, document);
    }

    /**
     * Parses {@code file}, applies {@code edit} and writes the result back while holding the file's lock. Nothing is
     * written when {@code edit} throws.
     *
     * @return whatever {@code edit} returns
     */
    public <T> T update(Path file, Function<FormDocument, T> edit) throws IOException {
        var lock = pathLocks.get(file.toAbsolutePath().normalize());
        lock.lock();
        try {
            var document = parse(file);
            var result = edit.apply(document);
            write(file, document);
            logger.debug("Updated {}", file);
            return result;
        } finally {
            lock.unlock();
        }
    }
}
