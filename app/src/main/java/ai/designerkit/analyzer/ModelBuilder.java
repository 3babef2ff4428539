package ai.designerkit.analyzer;

import ai.designerkit.analyzer.DesignerStatement.ChildAdd;
import ai.designerkit.analyzer.DesignerStatement.Declaration;
import ai.designerkit.analyzer.DesignerStatement.EventWiring;
import ai.designerkit.analyzer.DesignerStatement.PropertyAssignment;
import ai.designerkit.model.ControlNode;
import ai.designerkit.model.EventBinding;
import ai.designerkit.model.FormDocument;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Turns classified statements into a {@link FormDocument} in three passes: declarations, then property, child and
 * event statements, then the control hierarchy. Statements naming a control that was never declared are dropped; such
 * drops only show up at TRACE.
 */
public final class ModelBuilder {
    private static final Logger logger = LogManager.getLogger(ModelBuilder.class);

    /** Parent key used for controls added straight to the form. */
    static final String FORM_KEY = "$form";

    private ModelBuilder() {}

    public static <N> FormDocument build(DesignerSource<N> source, StatementClassifier<N> classifier) {
        var members = new TreeSet<String>(String.CASE_INSENSITIVE_ORDER);
        members.addAll(source.memberNames());

        var classified = new ArrayList<DesignerStatement>(source.statements().size());
        for (N statement : source.statements()) {
            classified.add(classifier.classify(statement, members));
        }

        var document = new FormDocument(source.dialect(), source.path(), source.formName(), source.namespace());
        int dropped = 0;

        // declarations
        for (var statement : classified) {
            if (statement instanceof Declaration declaration && members.contains(declaration.name())) {
                if (document.findNode(declaration.name()).isPresent()) {
                    logger.trace("{} is declared twice; keeping the first declaration", declaration.name());
                    continue;
                }
                document.addNode(new ControlNode(declaration.name(), declaration.typeName(), declaration.arguments()));
            }
        }

        // properties, child additions, events
        Map<String, List<String>> childrenByParent = new LinkedHashMap<>();
        childrenByParent.put(FORM_KEY, new ArrayList<>());
        for (var statement : classified) {
            if (statement instanceof PropertyAssignment assignment) {
                if (assignment.target() == null) {
                    document.setFormProperty(assignment.property(), assignment.rawValue());
                } else {
                    var node = document.findNode(assignment.target());
                    if (node.isPresent()) {
                        node.get().setProperty(assignment.property(), assignment.rawValue());
                    } else {
                        logger.trace("Dropping {}.{}: no such control", assignment.target(), assignment.property());
                        dropped++;
                    }
                }
            } else if (statement instanceof ChildAdd add) {
                var key = add.parent() == null ? FORM_KEY : add.parent().toLowerCase(Locale.ROOT);
                childrenByParent.computeIfAbsent(key, k -> new ArrayList<>()).add(add.child());
            } else if (statement instanceof EventWiring wiring) {
                var binding = new EventBinding(wiring.event(), wiring.handler());
                if (wiring.target() == null) {
                    document.getFormEvents().add(binding);
                } else {
                    var node = document.findNode(wiring.target());
                    if (node.isPresent()) {
                        node.get().addEvent(binding);
                    } else {
                        logger.trace("Dropping {}.{} handler: no such control", wiring.target(), wiring.event());
                        dropped++;
                    }
                }
            }
        }

        // hierarchy
        for (var entry : childrenByParent.entrySet()) {
            ControlNode parent = null;
            if (!entry.getKey().equals(FORM_KEY)) {
                var found = document.findNode(entry.getKey());
                if (found.isEmpty()) {
                    logger.trace("Dropping children of {}: no such control", entry.getKey());
                    dropped += entry.getValue().size();
                    continue;
                }
                parent = found.get();
            }
            for (var childName : entry.getValue()) {
                var child = document.findNode(childName);
                if (child.isEmpty() || (parent != null && child.get().contains(parent))) {
                    logger.trace("Dropping child {} of {}", childName, entry.getKey());
                    dropped++;
                    continue;
                }
                document.attach(parent, child.get());
            }
        }

        logger.trace("Built {} from {} statements: {} controls, {} roots, {} unresolved references dropped",
                document.getFormName(), classified.size(), document.getAllNodes().size(),
                document.getRootNodes().size(), dropped);
        return document;
    }
}
