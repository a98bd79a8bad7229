package pseudoc.ast.stmt;

import pseudoc.ast.expr.Expr;

import java.util.List;

public record ForStmt(
        String variable,
        Expr start,
        Expr end,        // inclusive
        List<Stmt> body,
        int line
) implements Stmt {
    public ForStmt {
        body = List.copyOf(body);
    }

    @Override
    public <R> R accept(Visitor<R> v) { return v.visitFor(this); }
}
