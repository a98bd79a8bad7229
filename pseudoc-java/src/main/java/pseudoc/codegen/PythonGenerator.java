package pseudoc.codegen;

import pseudoc.ast.Program;
import pseudoc.ast.decl.ArrayDeclaration;
import pseudoc.ast.decl.Declaration;
import pseudoc.ast.decl.FunctionDef;
import pseudoc.ast.decl.VarDecl;
import pseudoc.ast.expr.NumberLiteral;
import pseudoc.ast.stmt.*;
import pseudoc.sema.AnalyzedProgram;
import pseudoc.types.PrimitiveType;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Translates an analyzed program to Python 3 source.
 *
 * <p>Layout: a header comment, the function definitions, the program-level
 * declarations, then the main block at module level. The input is trusted: nothing
 * is re-validated here. Each {@link #generate} call starts from an empty buffer.
 */
public final class PythonGenerator implements Stmt.Visitor<Void>, VarDecl.Visitor<Void> {

    private PythonEmitter out;
    private AnalyzedProgram analyzed;
    private PythonNames names;
    private PythonExpressions exprs;

    public String generate(AnalyzedProgram analyzed) {
        this.analyzed = analyzed;
        this.out = new PythonEmitter();
        Program program = analyzed.program();

        Set<String> functionNames = new LinkedHashSet<>();
        Set<String> variableNames = new LinkedHashSet<>();
        for (VarDecl d : program.declarations()) variableNames.add(d.name());
        for (FunctionDef f : program.functions()) {
            functionNames.add(f.name());
            for (FunctionDef.Param p : f.params()) variableNames.add(p.name());
            for (VarDecl d : f.declarations()) variableNames.add(d.name());
        }
        names = new PythonNames(functionNames, variableNames);
        exprs = new PythonExpressions(names, analyzed);

        out.line("# Generated by pseudoc from algorithm " + program.name());
        out.blank();

        for (FunctionDef f : program.functions()) {
            emitFunction(f);
            out.blank();
        }

        for (VarDecl d : program.declarations()) d.accept(this);
        out.blank();

        for (Stmt s : program.statements()) s.accept(this);

        return out.text();
    }

    // ---------- functions ----------

    private void emitFunction(FunctionDef f) {
        List<String> params = new ArrayList<>();
        for (FunctionDef.Param p : f.params()) {
            params.add(names.variable(p.name()) + ": " + pythonType(p.type()));
        }
        String result = f.isProcedure() ? "None" : pythonType(f.returnType());
        out.line("def " + names.function(f.name()) + "(" + String.join(", ", params) + ") -> " + result + ":");
        out.indent();
        for (VarDecl d : f.declarations()) d.accept(this);
        emitStatements(f.body(), f.declarations().isEmpty());
        out.dedent();
    }

    // ---------- declarations ----------

    @Override
    public Void visitDeclaration(Declaration d) {
        out.line(names.variable(d.name()) + ": " + pythonType(d.type()) + " = " + zeroValue(d.type()));
        return null;
    }

    @Override
    public Void visitArrayDeclaration(ArrayDeclaration d) {
        PrimitiveType t = d.elementType();
        out.line(names.variable(d.name()) + ": list[" + pythonType(t) + "] = ["
                + zeroValue(t) + "] * " + exprs.render(d.size(), PythonExpressions.PREC_MUL + 1));
        return null;
    }

    // ---------- statements ----------

    /** Emits an indented block body; an empty body becomes {@code pass}. */
    private void emitBlock(List<Stmt> body) {
        out.indent();
        emitStatements(body, true);
        out.dedent();
    }

    private void emitStatements(List<Stmt> body, boolean passIfEmpty) {
        if (body.isEmpty() && passIfEmpty) {
            out.line("pass");
            return;
        }
        for (Stmt s : body) s.accept(this);
    }

    @Override
    public Void visitAssign(AssignStmt s) {
        out.line(names.variable(s.target()) + " = " + exprs.value(s.value()));
        return null;
    }

    @Override
    public Void visitArrayAssign(ArrayAssignStmt s) {
        out.line(names.variable(s.target()) + "[" + exprs.render(s.index()) + "] = " + exprs.value(s.value()));
        return null;
    }

    @Override
    public Void visitPrint(PrintStmt s) {
        List<String> args = new ArrayList<>();
        for (var e : s.values()) args.add(exprs.render(e));
        out.line("print(" + String.join(", ", args) + ")");
        return null;
    }

    @Override
    public Void visitRead(ReadStmt s) {
        String read = switch (analyzed.readType(s)) {
            case INT -> "int(input())";
            case FLOAT -> "float(input())";
            case STRING -> "input()";
            case BOOL -> "input().strip().upper() == \"VRAI\"";
            case VOID -> throw new IllegalStateException("LIRE target cannot be VOID");
        };
        out.line(names.variable(s.target()) + " = " + read);
        return null;
    }

    @Override
    public Void visitIf(IfStmt s) {
        emitIf(s, "if");
        return null;
    }

    private void emitIf(IfStmt s, String keyword) {
        out.line(keyword + " " + exprs.render(s.condition()) + ":");
        emitBlock(s.thenBranch());

        List<Stmt> elseB = s.elseBranch();
        if (elseB.isEmpty()) return;
        if (elseB.size() == 1 && elseB.get(0) instanceof IfStmt nested) {
            emitIf(nested, "elif");
            return;
        }
        out.line("else:");
        emitBlock(elseB);
    }

    @Override
    public Void visitWhile(WhileStmt s) {
        out.line("while " + exprs.render(s.condition()) + ":");
        emitBlock(s.body());
        return null;
    }

    @Override
    public Void visitFor(ForStmt s) {
        // inclusive upper bound
        String end;
        if (s.end() instanceof NumberLiteral lit && !lit.isFloat() && lit.value().longValue() < Long.MAX_VALUE) {
            end = Long.toString(lit.value().longValue() + 1);
        } else {
            end = exprs.render(s.end(), PythonExpressions.PREC_ADD) + " + 1";
        }
        out.line("for " + names.variable(s.variable()) + " in range(" + exprs.render(s.start()) + ", " + end + "):");
        emitBlock(s.body());
        return null;
    }

    @Override
    public Void visitReturn(ReturnStmt s) {
        out.line(s.value() == null ? "return" : "return " + exprs.value(s.value()));
        return null;
    }

    @Override
    public Void visitCall(CallStmt s) {
        out.line(exprs.call(s.call()));
        return null;
    }

    // ---------- types ----------

    static String pythonType(PrimitiveType t) {
        return switch (t) {
            case INT -> "int";
            case FLOAT -> "float";
            case STRING -> "str";
            case BOOL -> "bool";
            case VOID -> throw new IllegalArgumentException("VOID has no Python value type");
        };
    }

    static String zeroValue(PrimitiveType t) {
        return switch (t) {
            case INT -> "0";
            case FLOAT -> "0.0";
            case STRING -> "\"\"";
            case BOOL -> "False";
            case VOID -> throw new IllegalArgumentException("No value of type VOID");
        };
    }
}
