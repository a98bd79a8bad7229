package pseudoc;

/**
 * Base of every error a compilation phase can report.
 * The message always reads {@code <Stage> Error (line <n>): <description>}.
 */
public abstract class CompilationException extends RuntimeException {

    public enum Stage {
        LEXICAL("Lexical"),
        SYNTAX("Syntax"),
        SEMANTIC("Semantic");

        private final String label;

        Stage(String label) { this.label = label; }

        public String label() { return label; }
    }

    private final Stage stage;
    private final int line;
    private final String description;

    protected CompilationException(Stage stage, int line, String description) {
        super(stage.label() + " Error (line " + line + "): " + description);
        this.stage = stage;
        this.line = line;
        this.description = description;
    }

    public Stage stage() { return stage; }

    public int line() { return line; }

    public String description() { return description; }
}
