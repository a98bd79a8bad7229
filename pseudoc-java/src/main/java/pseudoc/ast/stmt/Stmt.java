package pseudoc.ast.stmt;

public sealed interface Stmt
        permits AssignStmt, ArrayAssignStmt, PrintStmt, ReadStmt,
        IfStmt, WhileStmt, ForStmt, ReturnStmt, CallStmt {

    int line();

    <R> R accept(Visitor<R> v);

    interface Visitor<R> {
        R visitAssign(AssignStmt s);

        R visitArrayAssign(ArrayAssignStmt s);

        R visitPrint(PrintStmt s);

        R visitRead(ReadStmt s);

        R visitIf(IfStmt s);

        R visitWhile(WhileStmt s);

        R visitFor(ForStmt s);

        R visitReturn(ReturnStmt s);

        R visitCall(CallStmt s);
    }
}
