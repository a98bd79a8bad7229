package pseudoc.sema;

import java.util.LinkedHashMap;
import java.util.Map;

public final class Scope {
    private final Map<String, VarSymbol> symbols = new LinkedHashMap<>();

    public void define(VarSymbol sym) {
        VarSymbol existing = symbols.get(sym.name());
        if (existing != null) {
            throw new DuplicateDeclarationException("Variable", sym.name(), existing.line(), sym.line());
        }
        symbols.put(sym.name(), sym);
    }

    public VarSymbol getLocal(String name) {
        return symbols.get(name);
    }

    public int size() {
        return symbols.size();
    }
}
