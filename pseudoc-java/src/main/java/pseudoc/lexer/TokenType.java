package pseudoc.lexer;

public enum TokenType {

    // literals
    IDENTIFIER,
    INT_LITERAL,
    FLOAT_LITERAL,
    STRING_LITERAL,
    BOOL_LITERAL,

    // keywords
    ALGORITHME,
    VAR,
    DEBUT,
    FIN,
    SI, ALORS, SINON, FIN_SI,
    POUR, DE, A, FAIRE, FIN_POUR,
    TANT_QUE, FIN_TANT_QUE,
    FONCTION, FIN_FONCTION, RETOURNER,
    ECRIRE, LIRE,
    ET, OU, NON,
    TABLEAU,

    // types
    ENTIER,
    REEL,
    CHAINE,
    BOOLEEN,

    // operators
    ASSIGN,
    PLUS, MINUS, STAR, SLASH,
    EQ, NEQ,
    LT, LE,
    GT, GE,

    // symbols
    LPAREN, RPAREN,
    LBRACKET, RBRACKET,
    COLON, COMMA,

    EOF
}
