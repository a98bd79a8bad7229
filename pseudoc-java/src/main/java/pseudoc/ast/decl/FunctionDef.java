package pseudoc.ast.decl;

import pseudoc.ast.stmt.Stmt;
import pseudoc.types.PrimitiveType;

import java.util.List;

/**
 * {@code FONCTION name(params) : type ... FIN_FONCTION}.
 * A function declared without a return type is a procedure and gets {@link PrimitiveType#VOID}.
 */
public record FunctionDef(
        String name,
        List<Param> params,
        PrimitiveType returnType,
        List<VarDecl> declarations,
        List<Stmt> body,
        int line
) {
    public FunctionDef {
        params = List.copyOf(params);
        declarations = List.copyOf(declarations);
        body = List.copyOf(body);
    }

    public boolean isProcedure() {
        return returnType == PrimitiveType.VOID;
    }

    public record Param(String name, PrimitiveType type) {}
}
