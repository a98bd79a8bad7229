package pseudoc.sema;

import pseudoc.types.Type;

public record VarSymbol(String name, Type type, int line) {}
