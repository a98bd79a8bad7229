package pseudoc.sema;

/** A function body tried to modify a program-level variable. Functions only read globals. */
public final class GlobalWriteException extends SemanticException {
    private final String name;

    public GlobalWriteException(String name, int line) {
        super(line, "Function cannot modify global variable '" + name + "'");
        this.name = name;
    }

    public String name() { return name; }
}
