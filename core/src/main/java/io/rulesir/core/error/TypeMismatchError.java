package io.rulesir.core.error;

/**
 * Thrown when a node lacks the value type an operation requires, e.g. snapshot navigation on
 * an expression that was never cast to {@code Snapshot}.
 */
public final class TypeMismatchError extends RulesIrException {

    private static final long serialVersionUID = 1L;

    private final String expectedType;
    private final String actualType;

    public TypeMismatchError(String expectedType, String actualType) {
        super("Unexpected type: expected " + expectedType, Phase.CONSTRUCTION);
        this.expectedType = expectedType;
        this.actualType = actualType;
    }

    public String expectedType() {
        return expectedType;
    }

    /** The value type the node actually carried, or {@code null} if it was untyped. */
    public String actualType() {
        return actualType;
    }
}
