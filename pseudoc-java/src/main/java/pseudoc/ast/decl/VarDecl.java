package pseudoc.ast.decl;

/** A {@code VAR} line, at program level or inside a function. */
public sealed interface VarDecl permits Declaration, ArrayDeclaration {

    String name();

    int line();

    <R> R accept(Visitor<R> v);

    interface Visitor<R> {
        R visitDeclaration(Declaration d);

        R visitArrayDeclaration(ArrayDeclaration d);
    }
}
