package pseudoc.ast.stmt;

import pseudoc.ast.expr.Expr;

public record ArrayAssignStmt(
        String target,
        Expr index,
        Expr value,
        int line
) implements Stmt {
    @Override
    public <R> R accept(Visitor<R> v) { return v.visitArrayAssign(this); }
}
