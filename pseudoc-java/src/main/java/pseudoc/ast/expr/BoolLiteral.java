package pseudoc.ast.expr;

public record BoolLiteral(boolean value, int line) implements Expr {
    @Override
    public <R> R accept(Visitor<R> v) { return v.visitBool(this); }
}
