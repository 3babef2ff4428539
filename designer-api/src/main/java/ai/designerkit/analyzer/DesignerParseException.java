package ai.designerkit.analyzer;

import java.nio.file.Path;
import org.jetbrains.annotations.Nullable;

/** Raised when a file lacks one of the structural anchors every designer file must have. */
public class DesignerParseException extends RuntimeException {
    public enum MissingAnchor {
        TYPE_DECLARATION("class declaration"),
        INITIALIZE_COMPONENT("InitializeComponent method");

        private final String description;

        MissingAnchor(String description) {
            this.description = description;
        }

        public String description() {
            return description;
        }
    }

    private final MissingAnchor missingAnchor;
    private final @Nullable Path file;

    public DesignerParseException(MissingAnchor missingAnchor, @Nullable Path file) {
        this(missingAnchor, file, "No " + missingAnchor.description() + " found");
    }

    public DesignerParseException(MissingAnchor missingAnchor, @Nullable Path file, String detail) {
        super(file == null ? detail : detail + " in " + file);
        this.missingAnchor = missingAnchor;
        this.file = file;
    }

    public MissingAnchor getMissingAnchor() {
        return missingAnchor;
    }

    public @Nullable Path getFile() {
        return file;
    }
}
