package io.rulesir.core.symbols;

import io.rulesir.core.error.InvalidCategoryError;

/** The three registries of a {@link Symbols} table. */
public enum Category {
    FUNCTIONS("functions", FunctionDef.class),
    PATHS("paths", PathRule.class),
    SCHEMA("schema", SchemaDef.class);

    private final String key;
    private final Class<? extends SymbolRecord> recordType;

    Category(String key, Class<? extends SymbolRecord> recordType) {
        this.key = key;
        this.recordType = recordType;
    }

    /** The category name used in diagnostics, e.g. {@code "schema"}. */
    public String key() {
        return key;
    }

    /** The record type this category holds. */
    public Class<? extends SymbolRecord> recordType() {
        return recordType;
    }

    /**
     * Resolves a category by key.
     *
     * @param key one of {@code functions}, {@code paths}, {@code schema}
     * @throws InvalidCategoryError if the key names no category
     */
    public static Category fromKey(String key) {
        for (Category category : values()) {
            if (category.key.equals(key)) {
                return category;
            }
        }
        throw new InvalidCategoryError(String.valueOf(key));
    }
}
