package pseudoc.parser;

import pseudoc.ast.Program;
import pseudoc.ast.decl.ArrayDeclaration;
import pseudoc.ast.decl.Declaration;
import pseudoc.ast.decl.FunctionDef;
import pseudoc.ast.decl.VarDecl;
import pseudoc.ast.expr.*;
import pseudoc.ast.stmt.ArrayAssignStmt;
import pseudoc.ast.stmt.AssignStmt;
import pseudoc.ast.stmt.CallStmt;
import pseudoc.ast.stmt.ForStmt;
import pseudoc.ast.stmt.IfStmt;
import pseudoc.ast.stmt.PrintStmt;
import pseudoc.ast.stmt.ReadStmt;
import pseudoc.ast.stmt.ReturnStmt;
import pseudoc.ast.stmt.Stmt;
import pseudoc.ast.stmt.WhileStmt;
import pseudoc.lexer.Token;
import pseudoc.lexer.TokenType;
import pseudoc.types.PrimitiveType;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

public final class Parser {

    private static final Set<TokenType> TYPE_NAMES =
            EnumSet.of(TokenType.ENTIER, TokenType.REEL, TokenType.CHAINE, TokenType.BOOLEEN);

    private static final Set<TokenType> STATEMENT_STARTS = EnumSet.of(
            TokenType.IDENTIFIER, TokenType.ECRIRE, TokenType.LIRE, TokenType.SI,
            TokenType.TANT_QUE, TokenType.POUR, TokenType.RETOURNER);

    // tokens that close a block; a bare RETOURNER is recognised by one of these following it
    private static final Set<TokenType> BLOCK_ENDS = EnumSet.of(
            TokenType.FIN, TokenType.FIN_FONCTION, TokenType.FIN_SI, TokenType.SINON,
            TokenType.FIN_TANT_QUE, TokenType.FIN_POUR, TokenType.EOF);

    private static final Set<TokenType> COMPARISONS = EnumSet.of(
            TokenType.EQ, TokenType.NEQ, TokenType.LT, TokenType.LE, TokenType.GT, TokenType.GE);

    private final List<Token> tokens;
    private int pos = 0;
    // true while parsing the body of a function without a return type
    private boolean inProcedure = false;

    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    // ---------- entry ----------
    public Program parseProgram() {
        consume(TokenType.ALGORITHME, "Program must start with 'ALGORITHME'");
        Token name = consume(TokenType.IDENTIFIER, "Expected algorithm name");

        List<VarDecl> declarations = new ArrayList<>();
        while (check(TokenType.VAR)) declarations.add(parseDeclaration());

        List<FunctionDef> functions = new ArrayList<>();
        while (check(TokenType.FONCTION)) functions.add(parseFunctionDef());

        if (check(TokenType.VAR)) {
            throw error(peek(), "Declarations must come before function definitions", TokenType.FONCTION, TokenType.DEBUT);
        }
        if (functions.isEmpty()) {
            consume(TokenType.DEBUT, "Expected 'DEBUT' before the main block", TokenType.VAR, TokenType.FONCTION);
        } else {
            consume(TokenType.DEBUT, "Expected 'DEBUT' before the main block", TokenType.FONCTION);
        }

        List<Stmt> statements = parseStatementsUntil("FIN", TokenType.FIN);
        consume(TokenType.FIN, "Expected 'FIN'");
        consume(TokenType.EOF, "Unexpected input after 'FIN'");

        return new Program(name.lexeme(), declarations, functions, statements);
    }

    // ---------- declarations ----------
    private VarDecl parseDeclaration() {
        Token var = consume(TokenType.VAR, "Expected 'VAR'");
        Token name = consume(TokenType.IDENTIFIER, "Expected variable name after 'VAR'");
        consume(TokenType.COLON, "Expected ':' after variable name");

        if (match(TokenType.TABLEAU)) {
            consume(TokenType.LBRACKET, "Expected '[' after 'TABLEAU'");
            Expr size = parseExpr();
            consume(TokenType.RBRACKET, "Expected ']' after array size");
            consume(TokenType.DE, "Expected 'DE' before array element type");
            PrimitiveType element = parseType();
            return new ArrayDeclaration(name.lexeme(), size, element, var.line());
        }
        return new Declaration(name.lexeme(), parseType(), var.line());
    }

    // ---------- function ----------
    private FunctionDef parseFunctionDef() {
        Token kw = consume(TokenType.FONCTION, "Expected 'FONCTION'");
        Token name = consume(TokenType.IDENTIFIER, "Expected function name");

        consume(TokenType.LPAREN, "Expected '(' after function name");
        List<FunctionDef.Param> params = parseParamsOpt();
        consume(TokenType.RPAREN, "Expected ')' after parameters", TokenType.COMMA);

        PrimitiveType returnType = PrimitiveType.VOID;
        if (match(TokenType.COLON)) returnType = parseType();

        List<VarDecl> locals = new ArrayList<>();
        while (check(TokenType.VAR)) locals.add(parseDeclaration());

        inProcedure = returnType == PrimitiveType.VOID;
        List<Stmt> body = parseStatementsUntil("FIN_FONCTION", TokenType.FIN_FONCTION);
        inProcedure = false;
        consume(TokenType.FIN_FONCTION, "Expected 'FIN_FONCTION'");
        return new FunctionDef(name.lexeme(), params, returnType, locals, body, kw.line());
    }

    private List<FunctionDef.Param> parseParamsOpt() {
        if (check(TokenType.RPAREN)) return List.of();
        List<FunctionDef.Param> ps = new ArrayList<>();
        do {
            Token n = consume(TokenType.IDENTIFIER, "Expected parameter name");
            consume(TokenType.COLON, "Expected ':' after parameter name");
            ps.add(new FunctionDef.Param(n.lexeme(), parseType()));
        } while (match(TokenType.COMMA));
        return ps;
    }

    private PrimitiveType parseType() {
        Token t = peek();
        PrimitiveType type = switch (t.type()) {
            case ENTIER -> PrimitiveType.INT;
            case REEL -> PrimitiveType.FLOAT;
            case CHAINE -> PrimitiveType.STRING;
            case BOOLEEN -> PrimitiveType.BOOL;
            default -> throw error(t, "Expected type name", TYPE_NAMES);
        };
        advance();
        return type;
    }

    // ---------- statements ----------
    private List<Stmt> parseStatementsUntil(String closer, TokenType... terminators) {
        Set<TokenType> ends = EnumSet.of(terminators[0], terminators);
        List<Stmt> stmts = new ArrayList<>();
        while (!ends.contains(peek().type())) {
            // a closer of some other block, or end of input
            if (BLOCK_ENDS.contains(peek().type())) {
                throw error(peek(), "Missing '" + closer + "'", ends);
            }
            stmts.add(parseStmt());
        }
        return stmts;
    }

    private Stmt parseStmt() {
        if (check(TokenType.IDENTIFIER)) {
            if (checkNext(TokenType.LPAREN)) return new CallStmt(parseCall(advance()));
            if (checkNext(TokenType.LBRACKET)) return parseArrayAssign();
            return parseAssign();
        }

        if (match(TokenType.ECRIRE)) return parsePrint();
        if (match(TokenType.LIRE)) return parseRead();
        if (match(TokenType.SI)) return parseIf();
        if (match(TokenType.TANT_QUE)) return parseWhile();
        if (match(TokenType.POUR)) return parseFor();
        if (match(TokenType.RETOURNER)) return parseReturn();

        if (check(TokenType.FONCTION)) {
            throw error(peek(), "Functions must be defined before 'DEBUT' and cannot be nested", STATEMENT_STARTS);
        }
        throw error(peek(), "Expected a statement", STATEMENT_STARTS);
    }

    private AssignStmt parseAssign() {
        Token target = consume(TokenType.IDENTIFIER, "Expected variable name");
        consume(TokenType.ASSIGN, "Expected '←' after '" + target.lexeme() + "'", TokenType.LPAREN, TokenType.LBRACKET);
        return new AssignStmt(target.lexeme(), parseExpr(), target.line());
    }

    private ArrayAssignStmt parseArrayAssign() {
        Token target = consume(TokenType.IDENTIFIER, "Expected array name");
        consume(TokenType.LBRACKET, "Expected '['");
        Expr index = parseExpr();
        consume(TokenType.RBRACKET, "Expected ']' after index");
        consume(TokenType.ASSIGN, "Expected '←' after array element");
        return new ArrayAssignStmt(target.lexeme(), index, parseExpr(), target.line());
    }

    private PrintStmt parsePrint() {
        int line = previous().line();
        consume(TokenType.LPAREN, "Expected '(' after 'ECRIRE'");
        List<Expr> values = new ArrayList<>();
        do {
            values.add(parseExpr());
        } while (match(TokenType.COMMA));
        consume(TokenType.RPAREN, "Expected ')' after 'ECRIRE' arguments", TokenType.COMMA);
        return new PrintStmt(values, line);
    }

    private ReadStmt parseRead() {
        int line = previous().line();
        consume(TokenType.LPAREN, "Expected '(' after 'LIRE'");
        Token target = consume(TokenType.IDENTIFIER, "Expected variable name in 'LIRE'");
        consume(TokenType.RPAREN, "Expected ')' after 'LIRE' target");
        return new ReadStmt(target.lexeme(), line);
    }

    private IfStmt parseIf() {
        int line = previous().line();
        Expr cond = parseExpr();
        consume(TokenType.ALORS, "Expected 'ALORS' after condition");
        List<Stmt> thenB = parseStatementsUntil("FIN_SI", TokenType.SINON, TokenType.FIN_SI);

        List<Stmt> elseB = List.of();
        if (match(TokenType.SINON)) {
            elseB = parseStatementsUntil("FIN_SI", TokenType.FIN_SI);
        }
        consume(TokenType.FIN_SI, "Expected 'FIN_SI'");
        return new IfStmt(cond, thenB, elseB, line);
    }

    private WhileStmt parseWhile() {
        int line = previous().line();
        Expr cond = parseExpr();
        consume(TokenType.FAIRE, "Expected 'FAIRE' after condition");
        List<Stmt> body = parseStatementsUntil("FIN_TANT_QUE", TokenType.FIN_TANT_QUE);
        consume(TokenType.FIN_TANT_QUE, "Expected 'FIN_TANT_QUE'");
        return new WhileStmt(cond, body, line);
    }

    private ForStmt parseFor() {
        int line = previous().line();
        Token var = consume(TokenType.IDENTIFIER, "Expected loop variable after 'POUR'");
        consume(TokenType.DE, "Expected 'DE' after loop variable");
        Expr from = parseExpr();
        consume(TokenType.A, "Expected 'A' after start value");
        Expr to = parseExpr();
        consume(TokenType.FAIRE, "Expected 'FAIRE' after end value");
        List<Stmt> body = parseStatementsUntil("FIN_POUR", TokenType.FIN_POUR);
        consume(TokenType.FIN_POUR, "Expected 'FIN_POUR'");
        return new ForStmt(var.lexeme(), from, to, body, line);
    }

    private ReturnStmt parseReturn() {
        int line = previous().line();
        if (BLOCK_ENDS.contains(peek().type())
                || (STATEMENT_STARTS.contains(peek().type()) && !check(TokenType.IDENTIFIER))
                || startsIdentifierStatement()) {
            return new ReturnStmt(null, line);
        }
        return new ReturnStmt(parseExpr(), line);
    }

    /**
     * {@code x ←} can only start an assignment. In a procedure, which has no value to
     * return, {@code t[...]} and {@code f(...)} are read as statements as well.
     */
    private boolean startsIdentifierStatement() {
        if (!check(TokenType.IDENTIFIER)) return false;
        if (checkNext(TokenType.ASSIGN)) return true;
        return inProcedure && (checkNext(TokenType.LBRACKET) || checkNext(TokenType.LPAREN));
    }

    // ---------- expressions (precedence climbing) ----------
    private Expr parseExpr() { return parseOr(); }

    private Expr parseOr() {
        Expr e = parseAnd();
        while (match(TokenType.OU)) {
            Token op = previous();
            Expr r = parseAnd();
            e = new BinaryExpr(e, BinaryExpr.Operator.OR, r, op.line());
        }
        return e;
    }

    private Expr parseAnd() {
        Expr e = parseCompare();
        while (match(TokenType.ET)) {
            Token op = previous();
            Expr r = parseCompare();
            e = new BinaryExpr(e, BinaryExpr.Operator.AND, r, op.line());
        }
        return e;
    }

    // non-associative: at most one comparison per level
    private Expr parseCompare() {
        Expr e = parseAdd();
        if (COMPARISONS.contains(peek().type())) {
            Token op = advance();
            Expr r = parseAdd();
            e = new BinaryExpr(e, toBinOp(op.type()), r, op.line());
        }
        return e;
    }

    private Expr parseAdd() {
        Expr e = parseMul();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token op = previous();
            Expr r = parseMul();
            e = new BinaryExpr(e, toBinOp(op.type()), r, op.line());
        }
        return e;
    }

    private Expr parseMul() {
        Expr e = parseUnary();
        while (match(TokenType.STAR, TokenType.SLASH)) {
            Token op = previous();
            Expr r = parseUnary();
            e = new BinaryExpr(e, toBinOp(op.type()), r, op.line());
        }
        return e;
    }

    private Expr parseUnary() {
        if (match(TokenType.NON)) {
            int line = previous().line();
            return new UnaryExpr(UnaryExpr.Operator.NOT, parseUnary(), line);
        }
        if (match(TokenType.MINUS)) {
            int line = previous().line();
            return new UnaryExpr(UnaryExpr.Operator.NEG, parseUnary(), line);
        }
        return parsePrimary();
    }

    private Expr parsePrimary() {
        if (match(TokenType.INT_LITERAL)) {
            return new NumberLiteral(Long.parseLong(previous().lexeme()), false, previous().line());
        }
        if (match(TokenType.FLOAT_LITERAL)) {
            return new NumberLiteral(Double.parseDouble(previous().lexeme()), true, previous().line());
        }
        if (match(TokenType.STRING_LITERAL)) return new StringLiteral(previous().lexeme(), previous().line());
        if (match(TokenType.BOOL_LITERAL)) return new BoolLiteral("VRAI".equals(previous().lexeme()), previous().line());
        if (match(TokenType.IDENTIFIER)) {
            Token name = previous();
            if (check(TokenType.LPAREN)) return parseCall(name);
            if (match(TokenType.LBRACKET)) {
                Expr idx = parseExpr();
                consume(TokenType.RBRACKET, "Expected ']' after index");
                return new ArrayAccessExpr(name.lexeme(), idx, name.line());
            }
            return new VarExpr(name.lexeme(), name.line());
        }
        if (match(TokenType.LPAREN)) {
            Expr e = parseExpr();
            consume(TokenType.RPAREN, "Expected ')'");
            return e;
        }
        throw error(peek(), "Expected expression", EnumSet.of(
                TokenType.INT_LITERAL, TokenType.FLOAT_LITERAL, TokenType.STRING_LITERAL,
                TokenType.BOOL_LITERAL, TokenType.IDENTIFIER, TokenType.LPAREN,
                TokenType.MINUS, TokenType.NON));
    }

    /** Parses the argument list; {@code name} has already been consumed. */
    private CallExpr parseCall(Token name) {
        consume(TokenType.LPAREN, "Expected '(' after function name");
        List<Expr> args = new ArrayList<>();
        if (!check(TokenType.RPAREN)) {
            do { args.add(parseExpr()); } while (match(TokenType.COMMA));
        }
        consume(TokenType.RPAREN, "Expected ')' after arguments", TokenType.COMMA);
        return new CallExpr(name.lexeme(), args, name.line());
    }

    // ---------- helpers ----------
    private boolean match(TokenType... types) {
        for (TokenType t : types) {
            if (check(t)) { advance(); return true; }
        }
        return false;
    }

    /** Consumes a token of type {@code t}; {@code alsoValid} only widens the expected set in the error. */
    private Token consume(TokenType t, String msg, TokenType... alsoValid) {
        if (check(t)) return advance();
        throw error(peek(), msg, EnumSet.of(t, alsoValid));
    }

    private boolean check(TokenType t) {
        return peek().type() == t;
    }

    private boolean checkNext(TokenType t) {
        if (pos + 1 >= tokens.size()) return false;
        return tokens.get(pos + 1).type() == t;
    }

    private Token advance() {
        if (!check(TokenType.EOF)) pos++;
        return previous();
    }

    private Token peek() { return tokens.get(pos); }
    private Token previous() { return tokens.get(pos - 1); }

    private ParserException error(Token at, String msg, TokenType first, TokenType... rest) {
        return error(at, msg, EnumSet.of(first, rest));
    }

    private ParserException error(Token at, String msg, Set<TokenType> expected) {
        return new ParserException(msg, expected, at);
    }

    private static BinaryExpr.Operator toBinOp(TokenType t) {
        return switch (t) {
            case PLUS  -> BinaryExpr.Operator.ADD;
            case MINUS -> BinaryExpr.Operator.SUB;
            case STAR  -> BinaryExpr.Operator.MUL;
            case SLASH -> BinaryExpr.Operator.DIV;

            case EQ  -> BinaryExpr.Operator.EQ;
            case NEQ -> BinaryExpr.Operator.NE;
            case LT  -> BinaryExpr.Operator.LT;
            case GT  -> BinaryExpr.Operator.GT;
            case LE  -> BinaryExpr.Operator.LE;
            case GE  -> BinaryExpr.Operator.GE;

            default -> throw new IllegalArgumentException("Not a binary operator token: " + t);
        };
    }
}
