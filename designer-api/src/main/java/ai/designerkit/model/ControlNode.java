package ai.designerkit.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * One declared control or component of a form.
 *
 * <p>Property values are the verbatim source text of the assigned expression, quotes included for string literals.
 * They are never evaluated. The children list holds references to nodes owned by the enclosing {@link FormDocument};
 * it can only be changed through {@link FormDocument#attach(ControlNode, ControlNode)} and
 * {@link FormDocument#removeNode(String)}.
 */
public final class ControlNode {
    private final String name;
    private final String typeName;
    private final @Nullable String constructorArguments;
    private final Map<String, String> properties = new LinkedHashMap<>();
    private final List<ControlNode> children = new ArrayList<>();
    private final List<EventBinding> events = new ArrayList<>();

    public ControlNode(String name, String typeName) {
        this(name, typeName, null);
    }

    /**
     * @param constructorArguments raw text between the parentheses of the declaring construction, e.g.
     *     {@code this.components} for a timer; null or blank when the constructor takes none
     */
    public ControlNode(String name, String typeName, @Nullable String constructorArguments) {
        this.name = Objects.requireNonNull(name, "name");
        this.typeName = Objects.requireNonNull(typeName, "typeName");
        this.constructorArguments =
                constructorArguments == null || constructorArguments.isBlank() ? null : constructorArguments.strip();
    }

    public String getName() {
        return name;
    }

    public String getTypeName() {
        return typeName;
    }

    /** The type name without its namespace qualifier, {@code Button} for {@code System.Windows.Forms.Button}. */
    public String getShortTypeName() {
        int dot = typeName.lastIndexOf('.');
        return dot < 0 ? typeName : typeName.substring(dot + 1);
    }

    public @Nullable String getConstructorArguments() {
        return constructorArguments;
    }

    /** Live, insertion-ordered property map. */
    public Map<String, String> getProperties() {
        return properties;
    }

    public @Nullable String getProperty(String propertyName) {
        return properties.get(propertyName);
    }

    /** Sets a property; a repeated name keeps its first position and takes the new value. */
    public void setProperty(String propertyName, String rawValue) {
        properties.put(propertyName, rawValue);
    }

    public List<ControlNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    /** Live event list in source order. */
    public List<EventBinding> getEvents() {
        return events;
    }

    public void addEvent(EventBinding binding) {
        events.add(binding);
    }

    /** True when {@code other} is this node or sits anywhere below it. */
    public boolean contains(ControlNode other) {
        if (other == this) {
            return true;
        }
        for (var child : children) {
            if (child.contains(other)) {
                return true;
            }
        }
        return false;
    }

    List<ControlNode> mutableChildren() {
        return children;
    }

    @Override
    public String toString() {
        return "ControlNode{" + name + ": " + typeName + ", properties=" + properties.size() + ", children="
                + children.size() + ", events=" + events.size() + '}';
    }
}
