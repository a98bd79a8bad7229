package pseudoc.ast.expr;

public record StringLiteral(String text, int line) implements Expr {
    @Override
    public <R> R accept(Visitor<R> v) { return v.visitString(this); }
}
