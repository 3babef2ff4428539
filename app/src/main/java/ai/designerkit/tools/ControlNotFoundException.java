package ai.designerkit.tools;

/** Raised inside an edit when a named control does not exist; the edit is abandoned and nothing is written. */
final class ControlNotFoundException extends RuntimeException {
    ControlNotFoundException(String controlName) {
        super("Control '%s' not found.".formatted(controlName));
    }
}
