package work.taskrun.core.nodes;

/**
 * Raised when a resource reference cannot be put into canonical (absolute) form.
 */
public final class InvalidReferenceException extends IllegalArgumentException {
    private final Object reference;

    public InvalidReferenceException(Object reference, String message) {
        super(message);
        this.reference = reference;
    }

    public Object reference() {
        return reference;
    }
}
