package pseudoc.sema;

import pseudoc.types.PrimitiveType;

import java.util.List;

public record FuncSymbol(String name, List<PrimitiveType> paramTypes, PrimitiveType returnType, int line) {

    public boolean isProcedure() {
        return returnType == PrimitiveType.VOID;
    }
}
