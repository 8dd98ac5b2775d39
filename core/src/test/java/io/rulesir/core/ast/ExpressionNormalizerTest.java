package io.rulesir.core.ast;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.rulesir.core.error.TypeMismatchError;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link ExpressionNormalizer}. */
@DisplayName("ExpressionNormalizer")
class ExpressionNormalizerTest {

    private static final ExpNode.Operator DATA = ExpressionNormalizer.snapshotVariable("data");

    @Test
    @DisplayName("snapshotVariable is a Snapshot-typed cast of the variable")
    void snapshotVariable() {
        assertThat(DATA).isEqualTo(Ast.cast(Ast.variable("data"), "Snapshot"));
        assertThat(DATA.isSnapshot()).isTrue();
    }

    @Nested
    @DisplayName("snapshotChild")
    class SnapshotChild {

        @Test
        @DisplayName("promotes a property name to a string literal")
        void childByName() {
            ExpNode.Operator child = ExpressionNormalizer.snapshotChild(DATA, "x");

            assertThat(child.valueType()).isEqualTo("Snapshot");
            assertThat(child.op()).isEqualTo("nop");
            ExpNode.Call call = (ExpNode.Call) child.args().get(0);
            assertThat(call.ref().accessor()).isEqualTo("child");
            assertThat(call.ref().base()).isEqualTo(Ast.cast(DATA));
            assertThat(call.args()).containsExactly(Ast.string("x"));
        }

        @Test
        @DisplayName("accepts an expression accessor")
        void childByExpression() {
            ExpNode key = Ast.variable("$uid");

            ExpNode.Operator child = ExpressionNormalizer.snapshotChild(DATA, key);

            ExpNode.Call call = (ExpNode.Call) child.args().get(0);
            assertThat(call.args()).containsExactly(key);
        }

        @Test
        @DisplayName("chains through Snapshot-typed results")
        void chained() {
            ExpNode.Operator grandchild =
                    ExpressionNormalizer.snapshotChild(ExpressionNormalizer.snapshotChild(DATA, "a"), "b");

            assertThat(grandchild.isSnapshot()).isTrue();
        }

        @Test
        @DisplayName("rejects an untyped base")
        void rejectsUntyped() {
            assertThatThrownBy(() -> ExpressionNormalizer.snapshotChild(Ast.variable("data"), "x"))
                    .isInstanceOfSatisfying(TypeMismatchError.class, e -> {
                        assertThat(e.expectedType()).isEqualTo("Snapshot");
                        assertThat(e.actualType()).isNull();
                    })
                    .hasMessage("Unexpected type: expected Snapshot");
        }

        @Test
        @DisplayName("rejects a base with another value type")
        void rejectsOtherType() {
            assertThatThrownBy(() -> ExpressionNormalizer.snapshotChild(Ast.cast(Ast.variable("v"), "String"), "x"))
                    .isInstanceOf(TypeMismatchError.class);
        }
    }

    @Nested
    @DisplayName("snapshotParent")
    class SnapshotParent {

        @Test
        @DisplayName("returns a Snapshot-typed parent reference")
        void parent() {
            ExpNode.Operator parent = ExpressionNormalizer.snapshotParent(DATA);

            assertThat(parent.isSnapshot()).isTrue();
            assertThat(parent.args()).containsExactly(Ast.reference(Ast.cast(DATA), "parent"));
        }

        @Test
        @DisplayName("rejects an untyped base")
        void rejectsUntyped() {
            assertThatThrownBy(() -> ExpressionNormalizer.snapshotParent(Ast.variable("data")))
                    .isInstanceOf(TypeMismatchError.class);
        }
    }

    @Nested
    @DisplayName("ensureValue")
    class EnsureValue {

        @Test
        @DisplayName("unwraps a snapshot with val()")
        void unwrapsSnapshot() {
            ExpNode value = ExpressionNormalizer.ensureValue(DATA);

            assertThat(value).isEqualTo(Ast.call(Ast.reference(Ast.cast(DATA), "val")));
            assertThat(value.valueType()).isNull();
        }

        @Test
        @DisplayName("returns other nodes unchanged")
        void leavesValuesAlone() {
            ExpNode exp = Ast.add(Ast.number(1), Ast.number(2));

            assertThat(ExpressionNormalizer.ensureValue(exp)).isSameAs(exp);
        }

        @Test
        @DisplayName("is idempotent on unwrapped values")
        void idempotentOnValues() {
            ExpNode once = ExpressionNormalizer.ensureValue(DATA);

            assertThat(ExpressionNormalizer.ensureValue(once)).isSameAs(once);
        }
    }

    @Nested
    @DisplayName("ensureBoolean")
    class EnsureBoolean {

        @Test
        @DisplayName("compares an unwrapped snapshot against true")
        void snapshotBecomesComparison() {
            ExpNode exp = ExpressionNormalizer.ensureBoolean(DATA);

            assertThat(exp).isEqualTo(Ast.eq(ExpressionNormalizer.snapshotValue(DATA), Ast.bool(true)));
        }

        @Test
        @DisplayName("returns a non-call expression unchanged")
        void leavesExpressionsAlone() {
            ExpNode exp = Ast.and(Ast.variable("a"), Ast.variable("b"));

            assertThat(ExpressionNormalizer.ensureBoolean(exp)).isSameAs(exp);
        }

        @Test
        @DisplayName("an explicit val() call is compared against true")
        void explicitValCall() {
            ExpNode call = Ast.call(Ast.reference(Ast.variable("x"), "val"));

            assertThat(ExpressionNormalizer.ensureBoolean(call)).isEqualTo(Ast.eq(call, Ast.bool(true)));
        }

        @Test
        @DisplayName("other calls are left alone")
        void otherCalls() {
            ExpNode call = Ast.call(Ast.reference(Ast.variable("x"), "exists"));

            assertThat(ExpressionNormalizer.ensureBoolean(call)).isSameAs(call);
        }
    }

    @Test
    @DisplayName("isCall matches on the referenced member name")
    void isCall() {
        ExpNode call = Ast.call(Ast.reference(Ast.variable("s"), "hasChildren"), List.of());

        assertThat(ExpressionNormalizer.isCall(call, "hasChildren")).isTrue();
        assertThat(ExpressionNormalizer.isCall(call, "val")).isFalse();
        assertThat(ExpressionNormalizer.isCall(Ast.variable("val"), "val")).isFalse();
    }
}
