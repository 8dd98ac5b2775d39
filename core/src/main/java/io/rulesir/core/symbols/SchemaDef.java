package io.rulesir.core.symbols;

import io.rulesir.core.ast.ExpNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A named type definition. {@code derivedFrom} names the parent schema and is resolved lazily
 * by {@link TypeDerivation}; it may name a schema that is never registered. {@code properties}
 * maps property names to type references as written in the source, e.g. {@code "String"} or
 * {@code "Number | Null"}.
 *
 * <p>
 * Immutable and thread-safe.
 */
public record SchemaDef(String derivedFrom, Map<String, String> properties, Map<String, ExpNode.Method> methods)
        implements SymbolRecord {

    /** Parent of a schema that declares properties but no explicit parent. */
    public static final String OBJECT = "Object";

    /** Parent of a schema that declares neither properties nor an explicit parent. */
    public static final String ANY = "Any";

    public SchemaDef {
        Objects.requireNonNull(derivedFrom, "derivedFrom must not be null");
        properties = properties == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        methods = methods == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(methods));
    }

    /**
     * Creates a schema, applying the defaults: absent maps are empty, and an absent (null or
     * empty) parent is
     * {@value #OBJECT} if there are properties, {@value #ANY} otherwise.
     */
    public static SchemaDef of(
            String derivedFrom, Map<String, String> properties, Map<String, ExpNode.Method> methods) {
        if (derivedFrom == null || derivedFrom.isEmpty()) {
            derivedFrom = properties != null && !properties.isEmpty() ? OBJECT : ANY;
        }
        return new SchemaDef(derivedFrom, properties, methods);
    }
}
