package ai.designerkit.model;

import java.util.Objects;

/** One event-to-handler wiring, either on a control or on the form itself. */
public record EventBinding(String eventName, String handlerName) {
    public EventBinding {
        Objects.requireNonNull(eventName, "eventName");
        Objects.requireNonNull(handlerName, "handlerName");
    }

    @Override
    public String toString() {
        return eventName + " -> " + handlerName;
    }
}
