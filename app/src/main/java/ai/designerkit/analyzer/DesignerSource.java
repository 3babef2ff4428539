package ai.designerkit.analyzer;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * The structural facts a dialect parser extracts before modelling: the form type, its fields and the statements of
 * {@code InitializeComponent} in source order.
 */
public record DesignerSource<N>(
        Dialect dialect,
        @Nullable Path path,
        String formName,
        @Nullable String namespace,
        Set<String> memberNames,
        List<N> statements) {}
