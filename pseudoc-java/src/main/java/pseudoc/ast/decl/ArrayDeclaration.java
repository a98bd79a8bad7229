package pseudoc.ast.decl;

import pseudoc.ast.expr.Expr;
import pseudoc.types.PrimitiveType;

public record ArrayDeclaration(
        String name,
        Expr size,
        PrimitiveType elementType,
        int line
) implements VarDecl {
    @Override
    public <R> R accept(Visitor<R> v) { return v.visitArrayDeclaration(this); }
}
