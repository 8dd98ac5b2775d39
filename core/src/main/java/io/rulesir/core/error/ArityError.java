package io.rulesir.core.error;

/** Thrown when an operator node is built with a different argument count than it declares. */
public final class ArityError extends RulesIrException {

    private static final long serialVersionUID = 1L;

    private final String operator;
    private final int expected;
    private final int actual;

    public ArityError(String operator, int expected, int actual) {
        super(
                "Operator " + operator + " has " + actual + " arguments (expecting " + expected + ").",
                Phase.CONSTRUCTION);
        this.operator = operator;
        this.expected = expected;
        this.actual = actual;
    }

    /** The operator symbol, e.g. {@code "&&"}. */
    public String operator() {
        return operator;
    }

    public int expected() {
        return expected;
    }

    public int actual() {
        return actual;
    }
}
