package io.rulesir.core.symbols;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

/** Tests for {@link TypeDerivation}. */
@DisplayName("TypeDerivation")
class TypeDerivationTest {

    private static TypeDerivation graph(String... edges) {
        Map<String, SchemaDef> schemas = new LinkedHashMap<>();
        for (int i = 0; i < edges.length; i += 2) {
            schemas.put(edges[i], SchemaDef.of(edges[i + 1], null, null));
        }
        return new TypeDerivation(schemas);
    }

    @Nested
    @DisplayName("isDerivedFrom")
    class IsDerivedFrom {

        @Test
        @DisplayName("a name derives from itself even if unregistered")
        void reflexive() {
            assertThat(graph().isDerivedFrom("A", "A")).isTrue();
        }

        @Test
        @DisplayName("an unregistered name derives from nothing else")
        void unregistered() {
            assertThat(graph("B", "Any").isDerivedFrom("A", "B")).isFalse();
        }

        @Test
        @DisplayName("follows a derivation chain")
        void chain() {
            TypeDerivation types = graph("Admin", "User", "User", "Object", "Object", "Any");

            assertThat(types.isDerivedFrom("Admin", "User")).isTrue();
            assertThat(types.isDerivedFrom("Admin", "Object")).isTrue();
            assertThat(types.isDerivedFrom("Admin", "Any")).isTrue();
            assertThat(types.isDerivedFrom("User", "Admin")).isFalse();
        }

        @Test
        @DisplayName("reaches an unregistered parent by name")
        void unregisteredParent() {
            TypeDerivation types = graph("User", "Object");

            assertThat(types.isDerivedFrom("User", "Object")).isTrue();
            assertThat(types.isDerivedFrom("User", "Any")).isFalse();
        }

        @Test
        @Timeout(5)
        @DisplayName("terminates on a cycle and answers false for unrelated names")
        void cycle() {
            TypeDerivation types = graph("A", "B", "B", "A");

            assertThat(types.isDerivedFrom("A", "C")).isFalse();
            assertThat(types.isDerivedFrom("A", "B")).isTrue();
            assertThat(types.isDerivedFrom("B", "A")).isTrue();
        }

        @Test
        @Timeout(5)
        @DisplayName("terminates on a self loop")
        void selfLoop() {
            assertThat(graph("A", "A").isDerivedFrom("A", "Any")).isFalse();
        }

        @Test
        @DisplayName("a null descendant yields false instead of failing")
        void nullDescendant() {
            TypeDerivation types = graph("A", "B");

            assertThat(types.isDerivedFrom(null, "A")).isFalse();
            assertThat(types.ancestors(null)).isEmpty();
        }

        @Test
        @DisplayName("registry changes are visible to an existing engine")
        void readsLiveRegistry() {
            Map<String, SchemaDef> schemas = new LinkedHashMap<>();
            TypeDerivation types = new TypeDerivation(schemas);
            assertThat(types.isDerivedFrom("A", "B")).isFalse();

            schemas.put("A", SchemaDef.of("B", null, null));

            assertThat(types.isDerivedFrom("A", "B")).isTrue();
        }
    }

    @Nested
    @DisplayName("ancestors")
    class Ancestors {

        @Test
        @DisplayName("lists the chain nearest first, ending at the first unregistered name")
        void chain() {
            TypeDerivation types = graph("Admin", "User", "User", "Object");

            assertThat(types.ancestors("Admin")).containsExactly("User", "Object");
        }

        @Test
        @DisplayName("is empty for an unregistered name")
        void unregistered() {
            assertThat(graph().ancestors("Nope")).isEmpty();
        }

        @Test
        @Timeout(5)
        @DisplayName("stops before revisiting a name")
        void cycle() {
            TypeDerivation types = graph("A", "B", "B", "C", "C", "A");

            assertThat(types.ancestors("A")).containsExactly("B", "C");
        }
    }
}
