package pseudoc.ast.expr;

public record UnaryExpr(
        Operator op,
        Expr operand,
        int line
) implements Expr {
    public enum Operator {
        NEG, NOT
    }

    @Override
    public <R> R accept(Visitor<R> v) { return v.visitUnary(this); }
}
