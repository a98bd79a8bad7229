package pseudoc.ast.stmt;

import pseudoc.ast.expr.Expr;

public record ReturnStmt(
        Expr value,      // null in a procedure
        int line
) implements Stmt {
    @Override
    public <R> R accept(Visitor<R> v) { return v.visitReturn(this); }
}
