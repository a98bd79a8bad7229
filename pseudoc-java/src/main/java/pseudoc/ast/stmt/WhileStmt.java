package pseudoc.ast.stmt;

import pseudoc.ast.expr.Expr;

import java.util.List;

public record WhileStmt(
        Expr condition,
        List<Stmt> body,
        int line
) implements Stmt {
    public WhileStmt {
        body = List.copyOf(body);
    }

    @Override
    public <R> R accept(Visitor<R> v) { return v.visitWhile(this); }
}
