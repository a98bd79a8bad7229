package pseudoc.sema;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Stack of scopes. The bottom frame is the program scope; a function body pushes one
 * frame for its parameters and locals. Lookups walk from the innermost frame outwards.
 */
public final class SymbolTable {
    private final Deque<Scope> scopes = new ArrayDeque<>();
    private final Scope global = new Scope();

    public SymbolTable() { scopes.push(global); }

    public void push() { scopes.push(new Scope()); }

    public void pop() {
        if (scopes.peek() == global) throw new IllegalStateException("Cannot pop the global scope");
        scopes.pop();
    }

    public void define(VarSymbol sym) { scopes.peek().define(sym); }

    public VarSymbol lookup(String name) {
        for (Scope s : scopes) {
            VarSymbol sym = s.getLocal(name);
            if (sym != null) return sym;
        }
        return null;
    }

    public boolean inFunction() {
        return scopes.peek() != global;
    }

    /** True when {@code name} resolves to the program scope from inside a function. */
    public boolean resolvesToGlobal(String name) {
        if (!inFunction()) return false;
        for (Scope s : scopes) {
            if (s.getLocal(name) != null) return s == global;
        }
        return false;
    }

    public Scope global() { return global; }
}
