package io.rulesir.core.error;

/**
 * Thrown when a symbol is registered under a category the symbol table does not know, or with
 * a record that does not belong to the named category.
 */
public final class InvalidCategoryError extends RulesIrException {

    private static final long serialVersionUID = 1L;

    private final String category;

    public InvalidCategoryError(String category) {
        super("Invalid registration type: " + category, Phase.REGISTRATION);
        this.category = category;
    }

    public InvalidCategoryError(String category, String recordType) {
        super("Invalid registration type: " + category + " cannot hold a " + recordType, Phase.REGISTRATION);
        this.category = category;
    }

    /** The rejected category key, or {@code "null"} if none was given. */
    public String category() {
        return category;
    }
}
