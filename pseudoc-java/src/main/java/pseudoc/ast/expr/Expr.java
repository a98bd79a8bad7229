package pseudoc.ast.expr;

public sealed interface Expr
        permits NumberLiteral, BoolLiteral, StringLiteral,
        VarExpr, ArrayAccessExpr, BinaryExpr, UnaryExpr, CallExpr {

    int line();

    <R> R accept(Visitor<R> v);

    interface Visitor<R> {
        R visitNumber(NumberLiteral e);

        R visitBool(BoolLiteral e);

        R visitString(StringLiteral e);

        R visitVar(VarExpr e);

        R visitArrayAccess(ArrayAccessExpr e);

        R visitBinary(BinaryExpr e);

        R visitUnary(UnaryExpr e);

        R visitCall(CallExpr e);
    }
}
