package pseudoc.ast.stmt;

import pseudoc.ast.expr.CallExpr;

/** A function or procedure call used as a statement; its result, if any, is discarded. */
public record CallStmt(CallExpr call) implements Stmt {

    @Override
    public int line() { return call.line(); }

    @Override
    public <R> R accept(Visitor<R> v) { return v.visitCall(this); }
}
