package pseudoc.codegen;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Maps pseudocode identifiers to Python ones. Python keywords and the builtins the
 * generated code relies on are renamed. Variables and functions live in separate
 * namespaces in the pseudocode but share one in Python, so a variable named like a
 * function is renamed too ({@code _var} suffix).
 *
 * <p>Every identifier that keeps its own spelling is claimed first; a renamed one
 * then takes the first candidate, extended with {@code _} as often as needed, that
 * nobody else owns. Each name therefore has exactly one Python spelling.
 */
final class PythonNames {

    private static final Set<String> RESERVED = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await",
            "break", "class", "continue", "def", "del", "elif", "else", "except",
            "finally", "for", "from", "global", "if", "import", "in", "is",
            "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try",
            "while", "with", "yield",
            // builtins used by generated code
            "print", "input", "int", "float", "str", "bool", "list", "range");

    private final Map<String, String> functions = new HashMap<>();
    private final Map<String, String> variables = new HashMap<>();
    private final Set<String> taken = new HashSet<>();

    /**
     * @param functionNames every function name, in declaration order
     * @param variableNames every variable name (globals, parameters, locals), in declaration order
     */
    PythonNames(Set<String> functionNames, Set<String> variableNames) {
        for (String f : functionNames) {
            if (!RESERVED.contains(f)) claim(functions, f, f);
        }
        for (String v : variableNames) {
            if (!RESERVED.contains(v) && !functionNames.contains(v)) claim(variables, v, v);
        }
        for (String f : functionNames) {
            if (!functions.containsKey(f)) claim(functions, f, fresh(f + "_"));
        }
        for (String v : variableNames) {
            if (variables.containsKey(v)) continue;
            String candidate = functionNames.contains(v) ? v + "_var" : v + "_";
            claim(variables, v, fresh(candidate));
        }
    }

    String function(String name) {
        return lookup(functions, name, "function");
    }

    String variable(String name) {
        return lookup(variables, name, "variable");
    }

    private String fresh(String candidate) {
        String name = candidate;
        while (taken.contains(name) || RESERVED.contains(name)) name += "_";
        return name;
    }

    private void claim(Map<String, String> into, String name, String python) {
        into.put(name, python);
        taken.add(python);
    }

    private static String lookup(Map<String, String> names, String name, String kind) {
        String python = names.get(name);
        if (python == null) throw new IllegalArgumentException("Unknown " + kind + " '" + name + "'");
        return python;
    }
}
