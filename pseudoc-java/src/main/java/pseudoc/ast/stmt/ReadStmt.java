package pseudoc.ast.stmt;

public record ReadStmt(
        String target,
        int line
) implements Stmt {
    @Override
    public <R> R accept(Visitor<R> v) { return v.visitRead(this); }
}
