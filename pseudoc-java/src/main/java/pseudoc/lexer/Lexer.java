package pseudoc.lexer;

import java.util.*;

public class Lexer {

    private final String source;
    private final List<Token> tokens = new ArrayList<>();

    private int pos = 0;
    private int line = 1;
    private int col = 1;

    private static final Map<String, TokenType> keywords = Map.ofEntries(
            Map.entry("ALGORITHME", TokenType.ALGORITHME),
            Map.entry("VAR", TokenType.VAR),
            Map.entry("DEBUT", TokenType.DEBUT),
            Map.entry("FIN", TokenType.FIN),
            Map.entry("SI", TokenType.SI),
            Map.entry("ALORS", TokenType.ALORS),
            Map.entry("SINON", TokenType.SINON),
            Map.entry("FIN_SI", TokenType.FIN_SI),
            Map.entry("POUR", TokenType.POUR),
            Map.entry("DE", TokenType.DE),
            Map.entry("A", TokenType.A),
            Map.entry("FAIRE", TokenType.FAIRE),
            Map.entry("FIN_POUR", TokenType.FIN_POUR),
            Map.entry("TANT_QUE", TokenType.TANT_QUE),
            Map.entry("FIN_TANT_QUE", TokenType.FIN_TANT_QUE),
            Map.entry("FONCTION", TokenType.FONCTION),
            Map.entry("FIN_FONCTION", TokenType.FIN_FONCTION),
            Map.entry("RETOURNER", TokenType.RETOURNER),
            Map.entry("ECRIRE", TokenType.ECRIRE),
            Map.entry("LIRE", TokenType.LIRE),
            Map.entry("ET", TokenType.ET),
            Map.entry("OU", TokenType.OU),
            Map.entry("NON", TokenType.NON),
            Map.entry("TABLEAU", TokenType.TABLEAU),
            Map.entry("ENTIER", TokenType.ENTIER),
            Map.entry("REEL", TokenType.REEL),
            Map.entry("CHAINE", TokenType.CHAINE),
            Map.entry("BOOLEEN", TokenType.BOOLEEN),
            Map.entry("VRAI", TokenType.BOOL_LITERAL),
            Map.entry("FAUX", TokenType.BOOL_LITERAL)
    );

    public Lexer(String source) {
        this.source = source;
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            skipWhitespace();
            int startCol = col;
            int startLine = line;

            if (isAtEnd()) break;

            char c = advance();

            switch (c) {
                case '+' -> add(TokenType.PLUS, "+", startLine, startCol);
                case '-' -> add(TokenType.MINUS, "-", startLine, startCol);
                case '*' -> add(TokenType.STAR, "*", startLine, startCol);
                case '=' -> add(TokenType.EQ, "=", startLine, startCol);
                case '←' -> add(TokenType.ASSIGN, "←", startLine, startCol);
                case '≠' -> add(TokenType.NEQ, "≠", startLine, startCol);

                case '<' -> {
                    if (match('-')) add(TokenType.ASSIGN, "<-", startLine, startCol);
                    else if (match('>')) add(TokenType.NEQ, "<>", startLine, startCol);
                    else if (match('=')) add(TokenType.LE, "<=", startLine, startCol);
                    else add(TokenType.LT, "<", startLine, startCol);
                }

                case '>' -> {
                    boolean ge = match('=');
                    add(ge ? TokenType.GE : TokenType.GT, ge ? ">=" : ">", startLine, startCol);
                }

                case '/' -> {
                    if (match('/')) {
                        skipComment();
                    } else {
                        add(TokenType.SLASH, "/", startLine, startCol);
                    }
                }

                case '(' -> add(TokenType.LPAREN, "(", startLine, startCol);
                case ')' -> add(TokenType.RPAREN, ")", startLine, startCol);
                case '[' -> add(TokenType.LBRACKET, "[", startLine, startCol);
                case ']' -> add(TokenType.RBRACKET, "]", startLine, startCol);
                case ':' -> add(TokenType.COLON, ":", startLine, startCol);
                case ',' -> add(TokenType.COMMA, ",", startLine, startCol);

                case '"' -> stringLiteral(startLine, startCol);

                default -> {
                    if (isDigit(c)) numberLiteral(c, startLine, startCol);
                    else if (isAlpha(c)) identifier(c, startLine, startCol);
                    else throw LexerException.unexpectedCharacter(c, startLine);
                }
            }
        }

        tokens.add(new Token(TokenType.EOF, "", line, col));
        return tokens;
    }

    // ================= helpers =================

    private void numberLiteral(char first, int line, int col) {
        StringBuilder sb = new StringBuilder();
        sb.append(first);

        boolean isFloat = false;

        while (!isAtEnd() && isDigit(peek())) {
            sb.append(advance());
        }

        if (peek() == '.') {
            if (!isDigit(peekNext())) {
                throw LexerException.at(line, "Malformed number '" + sb + ".': digits expected after '.'");
            }
            isFloat = true;
            sb.append(advance());
            while (!isAtEnd() && isDigit(peek())) {
                sb.append(advance());
            }
            if (peek() == '.') {
                throw LexerException.at(line, "Malformed number '" + sb + ".': more than one decimal point");
            }
        }

        if (peek() == 'e' || peek() == 'E') {
            isFloat = true;
            sb.append(advance());
            if (peek() == '+' || peek() == '-') sb.append(advance());
            if (!isDigit(peek())) {
                throw LexerException.at(line, "Malformed exponent in number '" + sb + "'");
            }
            while (!isAtEnd() && isDigit(peek())) {
                sb.append(advance());
            }
        }

        String text = sb.toString();
        if (isFloat) {
            if (Double.isInfinite(Double.parseDouble(text))) {
                throw LexerException.at(line, "Real literal out of range: " + text);
            }
        } else {
            try {
                Long.parseLong(text);
            } catch (NumberFormatException e) {
                throw LexerException.at(line, "Integer literal out of range: " + text);
            }
        }

        add(isFloat ? TokenType.FLOAT_LITERAL : TokenType.INT_LITERAL, text, line, col);
    }

    private void identifier(char first, int line, int col) {
        StringBuilder sb = new StringBuilder();
        sb.append(first);

        while (!isAtEnd() && isAlphaNumeric(peek())) {
            sb.append(advance());
        }

        String text = sb.toString();
        TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);

        add(type, text, line, col);
    }

    private void stringLiteral(int line, int col) {
        StringBuilder sb = new StringBuilder();

        while (!isAtEnd() && peek() != '"') {
            char c = advance();
            if (c == '\n') throw LexerException.at(line, "Unterminated string");
            sb.append(c);
        }

        if (isAtEnd()) throw LexerException.at(line, "Unterminated string");

        advance(); // closing "
        add(TokenType.STRING_LITERAL, sb.toString(), line, col);
    }

    private void skipWhitespace() {
        while (!isAtEnd()) {
            char c = peek();
            switch (c) {
                case ' ', '\t', '\r', '\uFEFF' -> advance();
                case '\n' -> {
                    advance();
                    line++;
                    col = 1;
                }
                default -> { return; }
            }
        }
    }

    private void skipComment() {
        while (!isAtEnd() && peek() != '\n') advance();
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(pos) != expected) return false;
        advance();
        return true;
    }

    private char advance() {
        char c = source.charAt(pos++);
        col++;
        return c;
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(pos);
    }

    private char peekNext() {
        return pos + 1 >= source.length() ? '\0' : source.charAt(pos + 1);
    }

    private boolean isAtEnd() {
        return pos >= source.length();
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private void add(TokenType type, String lexeme, int line, int col) {
        tokens.add(new Token(type, lexeme, line, col));
    }
}
