package io.rulesir.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * Node of a rules expression tree. Trees are built by {@link Ast} and
 * {@link ExpressionNormalizer} while the parser walks the source program, and are read by the
 * code generator afterwards.
 *
 * <p>
 * Implementations are a sealed hierarchy of records: nodes are immutable, compare
 * structurally, and never share children outside strict tree containment.
 *
 * <p>
 * Thread-safe and immutable.
 */
public sealed interface ExpNode {

    /** Value type annotation used by {@code Snapshot}-typed navigation. */
    String SNAPSHOT = "Snapshot";

    /**
     * Returns the value type annotation of this node, or {@code null} if the node is untyped.
     * Only operator nodes created through {@link Ast#cast(ExpNode, String)} carry one.
     */
    default String valueType() {
        return null;
    }

    /** Returns {@code true} if this node is annotated with the {@code Snapshot} value type. */
    default boolean isSnapshot() {
        return SNAPSHOT.equals(valueType());
    }

    // ── Implementations ──

    /** Reference to a named identifier in scope. */
    record Variable(String name) implements ExpNode {
        public Variable {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    /** The null value. */
    record NullLiteral() implements ExpNode {}

    /**
     * A literal of a known kind. {@code value} is a {@link String}, {@link Double},
     * {@link Boolean} or an immutable {@code List<ExpNode>}, matching {@code kind}.
     */
    record Literal(LiteralKind kind, Object value) implements ExpNode {
        public Literal {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(value, "value must not be null");
            switch (kind) {
                case STRING -> requireValue(kind, value instanceof String, "a String");
                case NUMBER -> {
                    requireValue(kind, value instanceof Number, "a Number");
                    value = ((Number) value).doubleValue();
                }
                case BOOLEAN -> requireValue(kind, value instanceof Boolean, "a Boolean");
                case ARRAY -> {
                    requireValue(kind, value instanceof List, "a List");
                    value = List.copyOf((List<?>) value);
                }
            }
        }

        private static void requireValue(LiteralKind kind, boolean matches, String expected) {
            if (!matches) {
                throw new IllegalArgumentException(kind.typeName() + " literal value must be " + expected);
            }
        }

        /**
         * Returns the elements of an {@code Array} literal.
         *
         * @throws IllegalStateException if this is not an array literal
         */
        @SuppressWarnings("unchecked")
        public List<ExpNode> elements() {
            if (kind != LiteralKind.ARRAY) {
                throw new IllegalStateException("Not an array literal: " + kind.typeName());
            }
            return (List<ExpNode>) value;
        }
    }

    /** Property or member access on {@code base}. */
    record Reference(ExpNode base, String accessor) implements ExpNode {
        public Reference {
            Objects.requireNonNull(base, "base must not be null");
            Objects.requireNonNull(accessor, "accessor must not be null");
        }
    }

    /** Invocation of the member named by {@code ref}. */
    record Call(Reference ref, List<ExpNode> args) implements ExpNode {
        public Call {
            Objects.requireNonNull(ref, "ref must not be null");
            args = args == null ? List.of() : List.copyOf(args);
        }
    }

    /**
     * Operator application. The argument count is checked against the operator's declared
     * arity by the typed constructors in {@link Ast} and by {@link OperatorType#apply}.
     */
    record Operator(String op, List<ExpNode> args, String valueType) implements ExpNode {
        public Operator {
            Objects.requireNonNull(op, "op must not be null");
            args = List.copyOf(args);
        }

        public Operator(String op, List<ExpNode> args) {
            this(op, args, null);
        }
    }

    /** Method body with named parameters, attached to paths and schemas. */
    record Method(List<String> params, ExpNode body) implements ExpNode {
        public Method {
            params = params == null ? List.of() : List.copyOf(params);
            Objects.requireNonNull(body, "body must not be null");
        }
    }
}
