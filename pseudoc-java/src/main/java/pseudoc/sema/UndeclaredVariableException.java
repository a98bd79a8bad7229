package pseudoc.sema;

public final class UndeclaredVariableException extends SemanticException {
    private final String name;

    public UndeclaredVariableException(String name, int line) {
        super(line, "Variable '" + name + "' is used without being declared");
        this.name = name;
    }

    public String name() { return name; }
}
