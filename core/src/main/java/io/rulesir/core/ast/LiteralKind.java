package io.rulesir.core.ast;

/**
 * Kind of a {@link ExpNode.Literal}. The type name is the spelling used by the rules language
 * for the corresponding built-in type.
 */
public enum LiteralKind {
    STRING("String"),
    NUMBER("Number"),
    BOOLEAN("Boolean"),
    ARRAY("Array");

    private final String typeName;

    LiteralKind(String typeName) {
        this.typeName = typeName;
    }

    /** The rules-language type name, e.g. {@code "Boolean"}. */
    public String typeName() {
        return typeName;
    }
}
