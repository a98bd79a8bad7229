package pseudoc.parser;

import pseudoc.CompilationException;
import pseudoc.lexer.Token;
import pseudoc.lexer.TokenType;

import java.util.Set;

public final class ParserException extends CompilationException {

    private final Set<TokenType> expected;
    private final Token actual;

    ParserException(String message, Set<TokenType> expected, Token actual) {
        super(Stage.SYNTAX, actual.line(), message + " (expected " + describe(expected) + ", got " + describe(actual) + ")");
        this.expected = Set.copyOf(expected);
        this.actual = actual;
    }

    public Set<TokenType> expected() { return expected; }

    public Token actual() { return actual; }

    private static String describe(Set<TokenType> kinds) {
        if (kinds.isEmpty()) return "nothing";
        return kinds.stream()
                .sorted()
                .map(TokenType::name)
                .reduce((a, b) -> a + " or " + b)
                .orElseThrow();
    }

    private static String describe(Token t) {
        if (t.type() == TokenType.EOF) return "end of input";
        return t.type() + " '" + t.lexeme() + "'";
    }
}
