package io.rulesir.core.ast;

import java.util.List;

/**
 * Factory for rules expression trees. One constructor per {@link ExpNode} variant, plus one
 * fixed-arity constructor per {@link OperatorType}.
 *
 * <p>
 * Thread-safe and stateless: all methods are static.
 */
public final class Ast {

    private Ast() {}

    public static ExpNode.Variable variable(String name) {
        return new ExpNode.Variable(name);
    }

    public static ExpNode.NullLiteral nullType() {
        return new ExpNode.NullLiteral();
    }

    public static ExpNode.Reference reference(ExpNode base, String accessor) {
        return new ExpNode.Reference(base, accessor);
    }

    /** Call with no arguments. */
    public static ExpNode.Call call(ExpNode.Reference ref) {
        return new ExpNode.Call(ref, List.of());
    }

    public static ExpNode.Call call(ExpNode.Reference ref, List<ExpNode> args) {
        return new ExpNode.Call(ref, args);
    }

    public static ExpNode.Method method(List<String> params, ExpNode body) {
        return new ExpNode.Method(params, body);
    }

    // --- Literals ---

    public static ExpNode.Literal string(String value) {
        return new ExpNode.Literal(LiteralKind.STRING, value);
    }

    public static ExpNode.Literal number(double value) {
        return new ExpNode.Literal(LiteralKind.NUMBER, value);
    }

    public static ExpNode.Literal bool(boolean value) {
        return new ExpNode.Literal(LiteralKind.BOOLEAN, value);
    }

    public static ExpNode.Literal array(List<ExpNode> elements) {
        return new ExpNode.Literal(LiteralKind.ARRAY, elements);
    }

    // --- Operators ---

    /**
     * Generic operator constructor. Performs no arity check; prefer the typed constructors or
     * {@link OperatorType#apply(ExpNode...)}.
     */
    public static ExpNode.Operator op(String symbol, List<ExpNode> args) {
        return new ExpNode.Operator(symbol, args);
    }

    /**
     * Builds an operator node from a dynamic argument list.
     *
     * @throws io.rulesir.core.error.ArityError if the argument count differs from the
     *     operator's arity
     */
    public static ExpNode.Operator op(OperatorType type, ExpNode... args) {
        return type.apply(args);
    }

    public static ExpNode.Operator neg(ExpNode a) {
        return OperatorType.NEG.apply(a);
    }

    public static ExpNode.Operator not(ExpNode a) {
        return OperatorType.NOT.apply(a);
    }

    public static ExpNode.Operator mult(ExpNode a, ExpNode b) {
        return OperatorType.MULT.apply(a, b);
    }

    public static ExpNode.Operator div(ExpNode a, ExpNode b) {
        return OperatorType.DIV.apply(a, b);
    }

    public static ExpNode.Operator mod(ExpNode a, ExpNode b) {
        return OperatorType.MOD.apply(a, b);
    }

    public static ExpNode.Operator add(ExpNode a, ExpNode b) {
        return OperatorType.ADD.apply(a, b);
    }

    public static ExpNode.Operator sub(ExpNode a, ExpNode b) {
        return OperatorType.SUB.apply(a, b);
    }

    public static ExpNode.Operator lt(ExpNode a, ExpNode b) {
        return OperatorType.LT.apply(a, b);
    }

    public static ExpNode.Operator lte(ExpNode a, ExpNode b) {
        return OperatorType.LTE.apply(a, b);
    }

    public static ExpNode.Operator gt(ExpNode a, ExpNode b) {
        return OperatorType.GT.apply(a, b);
    }

    public static ExpNode.Operator gte(ExpNode a, ExpNode b) {
        return OperatorType.GTE.apply(a, b);
    }

    public static ExpNode.Operator eq(ExpNode a, ExpNode b) {
        return OperatorType.EQ.apply(a, b);
    }

    public static ExpNode.Operator ne(ExpNode a, ExpNode b) {
        return OperatorType.NE.apply(a, b);
    }

    public static ExpNode.Operator and(ExpNode a, ExpNode b) {
        return OperatorType.AND.apply(a, b);
    }

    public static ExpNode.Operator or(ExpNode a, ExpNode b) {
        return OperatorType.OR.apply(a, b);
    }

    public static ExpNode.Operator ternary(ExpNode condition, ExpNode ifTrue, ExpNode ifFalse) {
        return OperatorType.TERNARY.apply(condition, ifTrue, ifFalse);
    }

    public static ExpNode.Operator nop(ExpNode a) {
        return OperatorType.NOP.apply(a);
    }

    public static ExpNode.Operator value(ExpNode a) {
        return OperatorType.VALUE.apply(a);
    }

    // --- Type annotation ---

    /** Wraps {@code base} in an untyped {@code nop} operator. */
    public static ExpNode.Operator cast(ExpNode base) {
        return cast(base, null);
    }

    /**
     * Wraps {@code base} in a {@code nop} operator annotated with {@code valueType}. This is the
     * only way a value type enters a tree.
     *
     * @param base      the expression to annotate
     * @param valueType the annotation, or {@code null} or empty to leave the wrapper untyped
     */
    public static ExpNode.Operator cast(ExpNode base, String valueType) {
        String annotation = valueType == null || valueType.isEmpty() ? null : valueType;
        return new ExpNode.Operator(OperatorType.NOP.symbol(), List.of(base), annotation);
    }

    // --- Left-associative folds ---

    /** Folds {@code exps} with {@code &&}, eliding {@code true}. */
    public static ExpNode andArray(List<? extends ExpNode> exps) {
        return leftAssociate(OperatorType.AND, bool(true), exps);
    }

    /** Folds {@code exps} with {@code ||}, eliding {@code false}. */
    public static ExpNode orArray(List<? extends ExpNode> exps) {
        return leftAssociate(OperatorType.OR, bool(false), exps);
    }

    /**
     * Reduces {@code exps} into nested binary applications of {@code type}, left to right.
     * Elements structurally equal to {@code identity} are skipped.
     *
     * @param type     a binary operator
     * @param identity the operator's identity value
     * @param exps     the operands, in order
     * @return {@code identity} for an empty list (or one holding only identities), the single
     *     remaining element, or a left-nested operator tree
     */
    public static ExpNode leftAssociate(OperatorType type, ExpNode identity, List<? extends ExpNode> exps) {
        ExpNode result = null;
        for (ExpNode current : exps) {
            if (current.equals(identity)) {
                continue;
            }
            result = result == null ? current : type.apply(result, current);
        }
        return result == null ? identity : result;
    }
}
