package pseudoc.ast.stmt;

import pseudoc.ast.expr.Expr;

import java.util.List;

public record PrintStmt(
        List<Expr> values,
        int line
) implements Stmt {
    public PrintStmt {
        values = List.copyOf(values);
    }

    @Override
    public <R> R accept(Visitor<R> v) { return v.visitPrint(this); }
}
