package pseudoc.ast.stmt;

import pseudoc.ast.expr.Expr;

public record AssignStmt(
        String target,
        Expr value,
        int line
) implements Stmt {
    @Override
    public <R> R accept(Visitor<R> v) { return v.visitAssign(this); }
}
