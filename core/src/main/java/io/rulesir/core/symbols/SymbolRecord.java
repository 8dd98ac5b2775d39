package io.rulesir.core.symbols;

/** A declaration held by {@link Symbols}: a function, a path rule or a schema. */
public sealed interface SymbolRecord permits FunctionDef, PathRule, SchemaDef {}
