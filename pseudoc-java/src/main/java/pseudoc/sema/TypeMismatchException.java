package pseudoc.sema;

public final class TypeMismatchException extends SemanticException {
    public TypeMismatchException(int line, String description) {
        super(line, description);
    }
}
