package pseudoc.ast.expr;

public record VarExpr(String name, int line) implements Expr {
    @Override
    public <R> R accept(Visitor<R> v) { return v.visitVar(this); }
}
