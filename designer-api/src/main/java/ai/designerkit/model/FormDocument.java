package ai.designerkit.model;

import ai.designerkit.analyzer.Dialect;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * The parsed model of one designer file.
 *
 * <p>{@code allNodes} owns every node, in declaration order. {@code rootNodes} and each node's children are
 * reference relations into it: a node sits in at most one container, and moving it through {@link #attach} detaches
 * it from the previous one. Node names are unique ignoring case.
 */
public final class FormDocument {
    private final Dialect dialect;
    private final @Nullable Path filePath;
    private final String formName;
    private final @Nullable String namespace;
    private final Map<String, String> formProperties = new LinkedHashMap<>();
    private final List<EventBinding> formEvents = new ArrayList<>();
    private final List<ControlNode> allNodes = new ArrayList<>();
    private final List<ControlNode> rootNodes = new ArrayList<>();

    public FormDocument(Dialect dialect, @Nullable Path filePath, String formName, @Nullable String namespace) {
        this.dialect = Objects.requireNonNull(dialect, "dialect");
        this.filePath = filePath;
        this.formName = Objects.requireNonNull(formName, "formName");
        this.namespace = namespace == null || namespace.isBlank() ? null : namespace;
    }

    public Dialect getDialect() {
        return dialect;
    }

    public @Nullable Path getFilePath() {
        return filePath;
    }

    public String getFormName() {
        return formName;
    }

    /** Enclosing namespace, or null when the type is declared at top level. */
    public @Nullable String getNamespace() {
        return namespace;
    }

    /** Live, insertion-ordered map of form-level properties. */
    public Map<String, String> getFormProperties() {
        return formProperties;
    }

    public void setFormProperty(String propertyName, String rawValue) {
        formProperties.put(propertyName, rawValue);
    }

    /** Live list of events wired on the form itself. */
    public List<EventBinding> getFormEvents() {
        return formEvents;
    }

    public List<ControlNode> getAllNodes() {
        return Collections.unmodifiableList(allNodes);
    }

    public List<ControlNode> getRootNodes() {
        return Collections.unmodifiableList(rootNodes);
    }

    public Optional<ControlNode> findNode(String name) {
        for (var node : allNodes) {
            if (node.getName().equalsIgnoreCase(name)) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }

    /** True when {@code name} refers to the form rather than a control. */
    public boolean isFormReference(String name) {
        return name.equalsIgnoreCase(formName) || name.equalsIgnoreCase("form");
    }

    /**
     * Registers a new, unattached node at the end of {@code allNodes}.
     *
     * @throws IllegalArgumentException if a node with the same name (ignoring case) already exists
     */
    public ControlNode addNode(ControlNode node) {
        if (findNode(node.getName()).isPresent()) {
            throw new IllegalArgumentException("A control named '%s' already exists in %s"
                    .formatted(node.getName(), formName));
        }
        allNodes.add(node);
        return node;
    }

    /**
     * Appends {@code child} to {@code parent}'s children, or to {@code rootNodes} when parent is null. A child already
     * sitting in another container is moved; re-attaching to the same container is a no-op.
     *
     * @throws IllegalArgumentException if either node is not owned by this document, or the attachment would make a
     *     node its own ancestor
     */
    public void attach(@Nullable ControlNode parent, ControlNode child) {
        requireOwned(child);
        if (parent != null) {
            requireOwned(parent);
            if (child.contains(parent)) {
                throw new IllegalArgumentException(
                        "Cannot add %s under %s: it would contain itself".formatted(child.getName(), parent.getName()));
            }
        }
        List<ControlNode> target = parent == null ? rootNodes : parent.mutableChildren();
        if (target.contains(child)) {
            return;
        }
        detach(child);
        target.add(child);
    }

    /** The container currently holding {@code node}: its parent node, or empty for roots and unattached nodes. */
    public Optional<ControlNode> parentOf(ControlNode node) {
        for (var candidate : allNodes) {
            if (candidate.mutableChildren().contains(node)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Removes the named node together with everything below it.
     *
     * @return names of the removed nodes, the named node first; empty when no such node exists
     */
    public Set<String> removeNode(String name) {
        var found = findNode(name);
        if (found.isEmpty()) {
            return Set.of();
        }
        var doomed = new LinkedHashSet<ControlNode>();
        collect(found.get(), doomed);
        allNodes.removeAll(doomed);
        rootNodes.removeAll(doomed);
        for (var node : allNodes) {
            node.mutableChildren().removeAll(doomed);
        }
        var names = new LinkedHashSet<String>();
        doomed.forEach(n -> names.add(n.getName()));
        return names;
    }

    private static void collect(ControlNode node, Set<ControlNode> into) {
        if (into.add(node)) {
            for (var child : node.mutableChildren()) {
                collect(child, into);
            }
        }
    }

    private void detach(ControlNode child) {
        rootNodes.remove(child);
        for (var node : allNodes) {
            node.mutableChildren().remove(child);
        }
    }

    private void requireOwned(ControlNode node) {
        for (var owned : allNodes) {
            if (owned == node) {
                return;
            }
        }
        throw new IllegalArgumentException("Control %s is not part of form %s".formatted(node.getName(), formName));
    }

    @Override
    public String toString() {
        return "FormDocument{" + formName + ", dialect=" + dialect + ", nodes=" + allNodes.size() + ", roots="
                + rootNodes.size() + '}';
    }
}
