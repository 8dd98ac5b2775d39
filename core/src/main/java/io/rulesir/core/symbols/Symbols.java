package io.rulesir.core.symbols;

import io.rulesir.core.ast.ExpNode;
import io.rulesir.core.diagnostics.LoggingDiagnosticSink;
import io.rulesir.core.error.InvalidCategoryError;
import io.rulesir.core.spi.DiagnosticSink;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Symbol table of one compilation run: the functions, path rules and schemas declared by the
 * program, each keyed by name and kept in declaration order.
 *
 * <p>
 * A table is created per run and filled while the parser walks the source. Registration
 * never overwrites: the first definition of a name wins, and each later one is reported to
 * the {@link DiagnosticSink} as a duplicate so that a single pass can collect every duplicate.
 * Once the parser is done the table is read-only; the code generator looks up declarations
 * and queries {@link #isDerivedFrom}.
 *
 * <p>
 * Not thread-safe. Callers must finish registration before sharing the table with readers.
 */
public final class Symbols {

    private static final Logger LOG = LoggerFactory.getLogger(Symbols.class);

    private final Map<String, FunctionDef> functions = new LinkedHashMap<>();
    private final Map<String, PathRule> paths = new LinkedHashMap<>();
    private final Map<String, SchemaDef> schemas = new LinkedHashMap<>();

    private DiagnosticSink sink;

    /** Creates an empty table reporting diagnostics through {@link LoggingDiagnosticSink}. */
    public Symbols() {
        this(new LoggingDiagnosticSink());
    }

    /**
     * Creates an empty table reporting diagnostics to {@code sink}.
     *
     * @throws NullPointerException if sink is null
     */
    public Symbols(DiagnosticSink sink) {
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
    }

    /**
     * Replaces the diagnostic sink. Call before registration begins.
     *
     * @throws NullPointerException if sink is null
     */
    public void setDiagnosticSink(DiagnosticSink sink) {
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
    }

    public DiagnosticSink diagnosticSink() {
        return sink;
    }

    // --- Registration ---

    /**
     * Registers {@code record} under {@code name} in the registry selected by the category
     * key.
     *
     * @param categoryKey one of {@code functions}, {@code paths}, {@code schema}
     * @throws InvalidCategoryError if the key names no category, or the record does not belong
     *     to it
     */
    public void register(String categoryKey, String name, SymbolRecord record) {
        register(Category.fromKey(categoryKey), name, record);
    }

    /**
     * Registers {@code record} under {@code name}. If the name is already taken in that
     * category, reports a duplicate definition and keeps the existing record.
     *
     * @throws InvalidCategoryError if category is null or the record does not belong to it
     * @throws NullPointerException if name or record is null
     */
    public void register(Category category, String name, SymbolRecord record) {
        if (category == null) {
            throw new InvalidCategoryError("null");
        }
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(record, "record must not be null");
        if (!category.recordType().isInstance(record)) {
            throw new InvalidCategoryError(category.key(), record.getClass().getSimpleName());
        }
        switch (category) {
            case FUNCTIONS -> put(category, functions, name, (FunctionDef) record);
            case PATHS -> put(category, paths, name, (PathRule) record);
            case SCHEMA -> put(category, schemas, name, (SchemaDef) record);
        }
    }

    /**
     * Registers a function.
     *
     * @param params parameter names, or {@code null} for none
     */
    public void registerFunction(String name, List<String> params, ExpNode body) {
        register(Category.FUNCTIONS, name, new FunctionDef(params, body));
    }

    /**
     * Registers a path rule under its joined path, e.g. {@code /users/$uid}.
     *
     * @param isType  schema name, or {@code null} for {@code Any}
     * @param methods methods by name, or {@code null} for none
     */
    public void registerPath(List<String> parts, String isType, Map<String, ExpNode.Method> methods) {
        PathRule rule = PathRule.of(parts, isType, methods);
        register(Category.PATHS, rule.key(), rule);
    }

    /**
     * Registers a schema.
     *
     * @param derivedFrom parent schema name, or {@code null} to default to {@code Object} when
     *     there are properties and {@code Any} otherwise
     * @param properties  property types by name, or {@code null} for none
     * @param methods     methods by name, or {@code null} for none
     */
    public void registerSchema(
            String name, String derivedFrom, Map<String, String> properties, Map<String, ExpNode.Method> methods) {
        register(Category.SCHEMA, name, SchemaDef.of(derivedFrom, properties, methods));
    }

    private <T extends SymbolRecord> void put(Category category, Map<String, T> registry, String name, T record) {
        if (registry.containsKey(name)) {
            reportError("Duplicated " + category.key() + " definition: " + name + ".");
            return;
        }
        registry.put(name, record);
        LOG.debug("Registered {} '{}'", category.key(), name);
    }

    private void reportError(String message) {
        try {
            sink.reportError(message);
        } catch (RuntimeException e) {
            LOG.warn("DiagnosticSink.reportError failed", e);
        }
    }

    // --- Queries ---

    /** Functions by name, in declaration order. Unmodifiable. */
    public Map<String, FunctionDef> functions() {
        return Collections.unmodifiableMap(functions);
    }

    /** Path rules by joined path, in declaration order. Unmodifiable. */
    public Map<String, PathRule> paths() {
        return Collections.unmodifiableMap(paths);
    }

    /** Schemas by name, in declaration order. Unmodifiable. */
    public Map<String, SchemaDef> schemas() {
        return Collections.unmodifiableMap(schemas);
    }

    public Optional<FunctionDef> function(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    /**
     * Looks up a path rule by its joined path.
     *
     * @param key the path key, e.g. {@code /users/$uid}
     */
    public Optional<PathRule> path(String key) {
        return Optional.ofNullable(paths.get(key));
    }

    public Optional<SchemaDef> schema(String name) {
        return Optional.ofNullable(schemas.get(name));
    }

    /** Returns the number of entries in the given registry. */
    public int size(Category category) {
        return switch (category) {
            case FUNCTIONS -> functions.size();
            case PATHS -> paths.size();
            case SCHEMA -> schemas.size();
        };
    }

    /** Returns a derivation engine over this table's schemas. */
    public TypeDerivation typeDerivation() {
        return new TypeDerivation(schemas());
    }

    /** See {@link TypeDerivation#isDerivedFrom(String, String)}. */
    public boolean isDerivedFrom(String descendant, String ancestor) {
        return typeDerivation().isDerivedFrom(descendant, ancestor);
    }
}
