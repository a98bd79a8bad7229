package pseudoc.ast.expr;

import java.util.List;

public record CallExpr(
        String name,
        List<Expr> args,
        int line
) implements Expr {
    public CallExpr {
        args = List.copyOf(args);
    }

    @Override
    public <R> R accept(Visitor<R> v) { return v.visitCall(this); }
}
