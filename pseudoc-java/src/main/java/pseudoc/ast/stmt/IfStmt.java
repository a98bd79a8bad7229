package pseudoc.ast.stmt;

import pseudoc.ast.expr.Expr;

import java.util.List;

public record IfStmt(
        Expr condition,
        List<Stmt> thenBranch,
        List<Stmt> elseBranch,   // empty when there is no SINON
        int line
) implements Stmt {
    public IfStmt {
        thenBranch = List.copyOf(thenBranch);
        elseBranch = List.copyOf(elseBranch);
    }

    @Override
    public <R> R accept(Visitor<R> v) { return v.visitIf(this); }
}
