package pseudoc.ast.decl;

import pseudoc.types.PrimitiveType;

public record Declaration(
        String name,
        PrimitiveType type,
        int line
) implements VarDecl {
    @Override
    public <R> R accept(Visitor<R> v) { return v.visitDeclaration(this); }
}
