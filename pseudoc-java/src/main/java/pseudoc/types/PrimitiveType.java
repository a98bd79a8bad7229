package pseudoc.types;

/**
 * Scalar types of the language. {@link #VOID} is only the "return type" of a
 * procedure, never the type of a variable.
 */
public enum PrimitiveType implements Type {
    INT("ENTIER"),
    FLOAT("REEL"),
    STRING("CHAINE"),
    BOOL("BOOLEEN"),
    VOID("VOID");

    private final String keyword;

    PrimitiveType(String keyword) { this.keyword = keyword; }

    @Override
    public String toString() { return keyword; }
}
