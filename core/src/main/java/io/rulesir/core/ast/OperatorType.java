package io.rulesir.core.ast;

import io.rulesir.core.error.ArityError;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Operators of the rules expression language with their declared arity.
 *
 * <p>
 * {@link #apply(ExpNode...)} is the runtime-checked constructor for callers holding a dynamic
 * argument list; the fixed-parameter methods in {@link Ast} are checked by the compiler.
 */
public enum OperatorType {
    NEG("neg", 1),
    NOT("!", 1),
    MULT("*", 2),
    DIV("/", 2),
    MOD("%", 2),
    ADD("+", 2),
    SUB("-", 2),
    LT("<", 2),
    LTE("<=", 2),
    GT(">", 2),
    GTE(">=", 2),
    EQ("==", 2),
    NE("!=", 2),
    AND("&&", 2),
    OR("||", 2),
    TERNARY("?:", 3),
    NOP("nop", 1),
    VALUE("value", 1);

    private static final Map<String, OperatorType> BY_SYMBOL = new HashMap<>();

    static {
        for (OperatorType type : values()) {
            BY_SYMBOL.put(type.symbol, type);
        }
    }

    private final String symbol;
    private final int arity;

    OperatorType(String symbol, int arity) {
        this.symbol = symbol;
        this.arity = arity;
    }

    /** The operator symbol stored in {@link ExpNode.Operator#op()}, e.g. {@code "&&"}. */
    public String symbol() {
        return symbol;
    }

    /** Number of operands the operator requires. */
    public int arity() {
        return arity;
    }

    /**
     * Builds an operator node from the given arguments.
     *
     * @param args operands, in order
     * @return a new untyped operator node holding exactly {@code args}
     * @throws ArityError if {@code args.length} differs from {@link #arity()}
     */
    public ExpNode.Operator apply(ExpNode... args) {
        if (args.length != arity) {
            throw new ArityError(symbol, arity, args.length);
        }
        return new ExpNode.Operator(symbol, List.of(args));
    }

    /**
     * Looks up an operator by symbol.
     *
     * @param symbol the operator symbol, e.g. {@code "<="}
     * @return the operator, or empty if the symbol is unknown
     */
    public static Optional<OperatorType> fromSymbol(String symbol) {
        return Optional.ofNullable(BY_SYMBOL.get(symbol));
    }
}
