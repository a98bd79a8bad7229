package pseudoc.codegen;

import pseudoc.ast.expr.*;
import pseudoc.sema.AnalyzedProgram;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders expressions as Python source. Parentheses are only added where Python's
 * precedence or associativity would otherwise read the tree differently.
 */
final class PythonExpressions implements Expr.Visitor<PythonExpressions.Fragment> {

    // Python binding strength, loosest first
    static final int PREC_OR = 1;
    static final int PREC_AND = 2;
    static final int PREC_NOT = 3;
    static final int PREC_COMPARE = 4;
    static final int PREC_ADD = 5;
    static final int PREC_MUL = 6;
    static final int PREC_UNARY = 7;
    static final int PREC_ATOM = 8;

    record Fragment(String code, int precedence) {}

    private final PythonNames names;
    private final AnalyzedProgram analyzed;

    PythonExpressions(PythonNames names, AnalyzedProgram analyzed) {
        this.names = names;
        this.analyzed = analyzed;
    }

    String render(Expr e) {
        return e.accept(this).code();
    }

    /**
     * Renders a value that is assigned, passed or returned. An {@code ENTIER} value
     * headed for a {@code REEL} slot is converted, so it prints as a real.
     */
    String value(Expr e) {
        if (!analyzed.widensToReal(e)) return render(e);
        if (e instanceof NumberLiteral lit) return lit.value() + ".0";
        return "float(" + render(e) + ")";
    }

    /** Renders {@code e} so it can sit where at least {@code minPrecedence} is required. */
    String render(Expr e, int minPrecedence) {
        return wrap(e.accept(this), minPrecedence);
    }

    private static String wrap(Fragment f, int minPrecedence) {
        return f.precedence() < minPrecedence ? "(" + f.code() + ")" : f.code();
    }

    @Override
    public Fragment visitNumber(NumberLiteral e) {
        return new Fragment(e.value().toString(), PREC_ATOM);
    }

    @Override
    public Fragment visitBool(BoolLiteral e) {
        return new Fragment(e.value() ? "True" : "False", PREC_ATOM);
    }

    @Override
    public Fragment visitString(StringLiteral e) {
        return new Fragment(quote(e.text()), PREC_ATOM);
    }

    @Override
    public Fragment visitVar(VarExpr e) {
        return new Fragment(names.variable(e.name()), PREC_ATOM);
    }

    @Override
    public Fragment visitArrayAccess(ArrayAccessExpr e) {
        return new Fragment(names.variable(e.array()) + "[" + render(e.index()) + "]", PREC_ATOM);
    }

    @Override
    public Fragment visitBinary(BinaryExpr e) {
        int p = precedenceOf(e.op());
        // comparisons must not chain, so both sides bind tighter; otherwise left-associative
        int leftMin = e.op().isComparison() ? p + 1 : p;
        String code = render(e.left(), leftMin) + " " + operator(e.op()) + " " + render(e.right(), p + 1);
        return new Fragment(code, p);
    }

    @Override
    public Fragment visitUnary(UnaryExpr e) {
        return switch (e.op()) {
            case NEG -> new Fragment("-" + render(e.operand(), PREC_UNARY), PREC_UNARY);
            case NOT -> new Fragment("not " + render(e.operand(), PREC_NOT), PREC_NOT);
        };
    }

    @Override
    public Fragment visitCall(CallExpr e) {
        return new Fragment(call(e), PREC_ATOM);
    }

    String call(CallExpr e) {
        List<String> args = new ArrayList<>();
        for (Expr a : e.args()) args.add(value(a));
        return names.function(e.name()) + "(" + String.join(", ", args) + ")";
    }

    /** Python string literal for {@code text}; control characters are escaped. */
    static String quote(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 2).append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20 || c == 0x7f) sb.append(String.format("\\x%02x", (int) c));
                    else sb.append(c);
                }
            }
        }
        return sb.append('"').toString();
    }

    private static int precedenceOf(BinaryExpr.Operator op) {
        return switch (op) {
            case OR -> PREC_OR;
            case AND -> PREC_AND;
            case EQ, NE, LT, GT, LE, GE -> PREC_COMPARE;
            case ADD, SUB -> PREC_ADD;
            case MUL, DIV -> PREC_MUL;
        };
    }

    private static String operator(BinaryExpr.Operator op) {
        return switch (op) {
            case ADD -> "+";
            case SUB -> "-";
            case MUL -> "*";
            case DIV -> "/";
            case EQ -> "==";
            case NE -> "!=";
            case LT -> "<";
            case GT -> ">";
            case LE -> "<=";
            case GE -> ">=";
            case AND -> "and";
            case OR -> "or";
        };
    }
}
