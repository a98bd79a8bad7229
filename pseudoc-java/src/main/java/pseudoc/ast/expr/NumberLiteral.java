package pseudoc.ast.expr;

/** Integer literals carry a {@link Long}, real literals a {@link Double}. */
public record NumberLiteral(
        Number value,
        boolean isFloat,
        int line
) implements Expr {
    @Override
    public <R> R accept(Visitor<R> v) { return v.visitNumber(this); }
}
