package io.rulesir.core.symbols;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Answers ancestor queries over the {@code derivedFrom} graph of a schema registry.
 *
 * <p>
 * The graph is not validated: parents may be unregistered and chains may loop. Every walk
 * keeps a visited set of schema names, so it visits each name at most once and terminates.
 *
 * <p>
 * Pure. Safe for concurrent use once the underlying registry is no longer mutated.
 */
public final class TypeDerivation {

    private final Map<String, SchemaDef> schemas;

    /**
     * @param schemas schema registry by name; read, never copied or modified
     */
    public TypeDerivation(Map<String, SchemaDef> schemas) {
        this.schemas = Objects.requireNonNull(schemas, "schemas must not be null");
    }

    /**
     * Returns {@code true} if {@code descendant} names the same schema as {@code ancestor} or
     * derives from it through a chain of {@code derivedFrom} links.
     *
     * <p>
     * An unregistered {@code descendant} is derived only from itself. A cycle that does not
     * pass through {@code ancestor} yields {@code false}.
     */
    public boolean isDerivedFrom(String descendant, String ancestor) {
        return isDerivedFrom(descendant, ancestor, new HashSet<>());
    }

    private boolean isDerivedFrom(String descendant, String ancestor, Set<String> visited) {
        if (!visited.add(descendant)) {
            return false;
        }
        if (Objects.equals(descendant, ancestor)) {
            return true;
        }
        SchemaDef schema = schemas.get(descendant);
        if (schema == null) {
            return false;
        }
        return isDerivedFrom(schema.derivedFrom(), ancestor, visited);
    }

    /**
     * Returns the names reached by following {@code derivedFrom} from {@code name}, nearest
     * first, excluding {@code name} itself. The walk ends after the first unregistered name, or
     * before a name it has already visited.
     *
     * @param name schema name to start from
     * @return ancestor names in order; empty if {@code name} is not registered
     */
    public List<String> ancestors(String name) {
        List<String> chain = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        visited.add(name);
        SchemaDef schema = schemas.get(name);
        while (schema != null) {
            String parent = schema.derivedFrom();
            if (!visited.add(parent)) {
                break;
            }
            chain.add(parent);
            schema = schemas.get(parent);
        }
        return chain;
    }
}
