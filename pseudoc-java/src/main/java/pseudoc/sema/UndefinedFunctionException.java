package pseudoc.sema;

public final class UndefinedFunctionException extends SemanticException {
    private final String name;

    public UndefinedFunctionException(String name, int line) {
        super(line, "Function '" + name + "' is not defined");
        this.name = name;
    }

    public String name() { return name; }
}
