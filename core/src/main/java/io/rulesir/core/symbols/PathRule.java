package io.rulesir.core.symbols;

import io.rulesir.core.ast.ExpNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Rules attached to a location pattern in the data tree. {@code parts} are the path segments;
 * wildcard segments (e.g. {@code $uid}) are kept verbatim. {@code isType} names the schema the
 * data at this location must satisfy.
 *
 * <p>
 * Immutable and thread-safe.
 */
public record PathRule(List<String> parts, String isType, Map<String, ExpNode.Method> methods)
        implements SymbolRecord {

    /** Schema name used when a path declares no type. */
    public static final String DEFAULT_TYPE = "Any";

    public PathRule {
        parts = List.copyOf(parts);
        Objects.requireNonNull(isType, "isType must not be null");
        methods = methods == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(methods));
    }

    /**
     * Creates a path rule, applying the defaults for an absent type or method map.
     *
     * @param parts   path segments
     * @param isType  schema name, or {@code null} or empty for {@value #DEFAULT_TYPE}
     * @param methods methods by name, or {@code null} for none
     */
    public static PathRule of(List<String> parts, String isType, Map<String, ExpNode.Method> methods) {
        return new PathRule(parts, isType == null || isType.isEmpty() ? DEFAULT_TYPE : isType, methods);
    }

    /** The registry key: the segments joined with {@code /}, with a leading {@code /}. */
    public String key() {
        return keyOf(parts);
    }

    static String keyOf(List<String> parts) {
        return "/" + String.join("/", parts);
    }
}
