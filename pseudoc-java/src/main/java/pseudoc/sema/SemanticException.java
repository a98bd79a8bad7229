package pseudoc.sema;

import pseudoc.CompilationException;

public class SemanticException extends CompilationException {
    public SemanticException(int line, String description) {
        super(Stage.SEMANTIC, line, description);
    }
}
