package io.rulesir.core.error;

/**
 * Abstract base for all rules-ir exceptions. Never thrown directly; use the concrete
 * subclasses. Every subclass signals a contract violation by the caller (the parser driving
 * construction), not a recoverable condition in the rules source.
 */
public abstract class RulesIrException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        CONSTRUCTION,
        REGISTRATION
    }

    private final Phase phase;

    protected RulesIrException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
