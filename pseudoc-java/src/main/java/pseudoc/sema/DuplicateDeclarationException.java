package pseudoc.sema;

public final class DuplicateDeclarationException extends SemanticException {
    private final String name;
    private final int firstLine;

    public DuplicateDeclarationException(String what, String name, int firstLine, int secondLine) {
        super(secondLine, what + " '" + name + "' is already declared at line " + firstLine);
        this.name = name;
        this.firstLine = firstLine;
    }

    public String name() { return name; }

    public int firstLine() { return firstLine; }

    public int secondLine() { return line(); }
}
