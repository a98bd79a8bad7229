package pseudoc.ast.expr;

public record ArrayAccessExpr(
        String array,
        Expr index,
        int line
) implements Expr {
    @Override
    public <R> R accept(Visitor<R> v) { return v.visitArrayAccess(this); }
}
