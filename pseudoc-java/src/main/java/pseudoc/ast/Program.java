package pseudoc.ast;

import pseudoc.ast.decl.FunctionDef;
import pseudoc.ast.decl.VarDecl;
import pseudoc.ast.stmt.Stmt;

import java.util.List;

public record Program(
        String name,
        List<VarDecl> declarations,
        List<FunctionDef> functions,
        List<Stmt> statements
) {
    public Program {
        declarations = List.copyOf(declarations);
        functions = List.copyOf(functions);
        statements = List.copyOf(statements);
    }
}
