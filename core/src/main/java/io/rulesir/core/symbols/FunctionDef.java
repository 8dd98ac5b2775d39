package io.rulesir.core.symbols;

import io.rulesir.core.ast.ExpNode;
import java.util.List;
import java.util.Objects;

/**
 * A user-defined function: named parameters and an expression body.
 *
 * <p>
 * Immutable and thread-safe.
 */
public record FunctionDef(List<String> params, ExpNode body) implements SymbolRecord {

    public FunctionDef {
        params = params == null ? List.of() : List.copyOf(params);
        Objects.requireNonNull(body, "body must not be null");
    }
}
