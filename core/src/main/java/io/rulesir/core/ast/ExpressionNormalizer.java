package io.rulesir.core.ast;

import io.rulesir.core.error.TypeMismatchError;
import java.util.List;

/**
 * Snapshot navigation and value coercion over {@link ExpNode} trees.
 *
 * <p>
 * A {@code Snapshot}-typed node stands for a lazily read data reference. It can be navigated
 * with {@link #snapshotChild} and {@link #snapshotParent}; it must be unwrapped with
 * {@link #ensureValue} before it is used as a value. Apply the unwrap at most once per
 * navigation chain: it does not collapse an existing {@code val()} call.
 *
 * <p>
 * Thread-safe and stateless: all methods are static.
 */
public final class ExpressionNormalizer {

    static final String CHILD = "child";
    static final String PARENT = "parent";
    static final String VAL = "val";

    private ExpressionNormalizer() {}

    /** A variable bound to a snapshot, e.g. {@code data} or {@code newData}. */
    public static ExpNode.Operator snapshotVariable(String name) {
        return Ast.cast(Ast.variable(name), ExpNode.SNAPSHOT);
    }

    /**
     * Navigates to the named child of a snapshot.
     *
     * @param base     a {@code Snapshot}-typed expression
     * @param accessor the property name, promoted to a string literal
     * @return a {@code Snapshot}-typed {@code child} call on {@code base}
     * @throws TypeMismatchError if {@code base} is not {@code Snapshot}-typed
     */
    public static ExpNode.Operator snapshotChild(ExpNode base, String accessor) {
        return snapshotChild(base, Ast.string(accessor));
    }

    /**
     * Navigates to a child of a snapshot selected by an expression.
     *
     * @throws TypeMismatchError if {@code base} is not {@code Snapshot}-typed
     */
    public static ExpNode.Operator snapshotChild(ExpNode base, ExpNode accessor) {
        requireSnapshot(base);
        return Ast.cast(Ast.call(Ast.reference(Ast.cast(base), CHILD), List.of(accessor)), ExpNode.SNAPSHOT);
    }

    /**
     * Navigates to the parent of a snapshot.
     *
     * @throws TypeMismatchError if {@code base} is not {@code Snapshot}-typed
     */
    public static ExpNode.Operator snapshotParent(ExpNode base) {
        requireSnapshot(base);
        return Ast.cast(Ast.reference(Ast.cast(base), PARENT), ExpNode.SNAPSHOT);
    }

    /** Unwraps {@code exp} with a {@code val()} call, regardless of its value type. */
    public static ExpNode.Call snapshotValue(ExpNode exp) {
        return Ast.call(Ast.reference(Ast.cast(exp), VAL));
    }

    /**
     * Returns {@code exp} as a value: {@code Snapshot}-typed nodes are unwrapped with
     * {@code val()}, anything else is returned unchanged.
     */
    public static ExpNode ensureValue(ExpNode exp) {
        if (exp.isSnapshot()) {
            return snapshotValue(exp);
        }
        return exp;
    }

    /**
     * Returns {@code exp} in a form the target language reads as a boolean. An unwrapped
     * snapshot value is compared against {@code true}.
     */
    public static ExpNode ensureBoolean(ExpNode exp) {
        ExpNode value = ensureValue(exp);
        if (isCall(value, VAL)) {
            return Ast.eq(value, Ast.bool(true));
        }
        return value;
    }

    /** Returns {@code true} if {@code exp} is a call to a member named {@code methodName}. */
    public static boolean isCall(ExpNode exp, String methodName) {
        return exp instanceof ExpNode.Call call && call.ref().accessor().equals(methodName);
    }

    private static void requireSnapshot(ExpNode base) {
        if (!base.isSnapshot()) {
            throw new TypeMismatchError(ExpNode.SNAPSHOT, base.valueType());
        }
    }
}
