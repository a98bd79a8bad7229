package pseudoc.sema;

import pseudoc.ast.Program;
import pseudoc.ast.expr.Expr;
import pseudoc.ast.stmt.ReadStmt;
import pseudoc.types.PrimitiveType;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A program that passed semantic analysis. The tree is the parser's, untouched;
 * the analyzer only attaches the declared type of every {@code LIRE} target and
 * marks the {@code ENTIER} expressions that flow into a {@code REEL} slot.
 */
public final class AnalyzedProgram {
    private final Program program;
    private final Map<ReadStmt, PrimitiveType> readTypes;
    private final Set<Expr> widened;
    private final int globalCount;

    AnalyzedProgram(Program program, IdentityHashMap<ReadStmt, PrimitiveType> readTypes,
                    Set<Expr> widened, int globalCount) {
        this.program = program;
        this.readTypes = Collections.unmodifiableMap(readTypes);
        this.widened = Collections.unmodifiableSet(widened);
        this.globalCount = globalCount;
    }

    public Program program() { return program; }

    public PrimitiveType readType(ReadStmt read) {
        PrimitiveType t = readTypes.get(read);
        if (t == null) throw new IllegalArgumentException("LIRE statement was not analyzed: line " + read.line());
        return t;
    }

    /**
     * True when {@code e} is an {@code ENTIER} value assigned, passed or returned
     * where a {@code REEL} is declared. Identity based.
     */
    public boolean widensToReal(Expr e) {
        return widened.contains(e);
    }

    /** Number of variables declared at program level. */
    public int globalCount() { return globalCount; }
}
