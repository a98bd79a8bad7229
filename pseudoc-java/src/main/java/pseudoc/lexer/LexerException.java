package pseudoc.lexer;

import pseudoc.CompilationException;

public final class LexerException extends CompilationException {

    private final Character offending;

    private LexerException(int line, String description, Character offending) {
        super(Stage.LEXICAL, line, description);
        this.offending = offending;
    }

    static LexerException unexpectedCharacter(char c, int line) {
        return new LexerException(line, "Unexpected character '" + c + "'", c);
    }

    static LexerException at(int line, String description) {
        return new LexerException(line, description, null);
    }

    /** The character that could not start any token, or null for other lexical errors. */
    public Character offending() { return offending; }
}
