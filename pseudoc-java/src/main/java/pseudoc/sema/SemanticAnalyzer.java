package pseudoc.sema;

import pseudoc.ast.Program;
import pseudoc.ast.decl.ArrayDeclaration;
import pseudoc.ast.decl.Declaration;
import pseudoc.ast.decl.FunctionDef;
import pseudoc.ast.decl.VarDecl;
import pseudoc.ast.expr.*;
import pseudoc.ast.stmt.*;
import pseudoc.types.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Name resolution and type checking in one top-to-bottom walk. Stops at the first
 * violation. An instance analyzes a single program.
 */
public final class SemanticAnalyzer {

    private final SymbolTable symbols = new SymbolTable();
    private final Map<String, FuncSymbol> functions = new LinkedHashMap<>();
    private final IdentityHashMap<ReadStmt, PrimitiveType> readTypes = new IdentityHashMap<>();
    private final Set<Expr> widened = Collections.newSetFromMap(new IdentityHashMap<>());

    private final DeclChecker declChecker = new DeclChecker();
    private final StmtChecker stmtChecker = new StmtChecker();
    private final ExprTyper exprTyper = new ExprTyper();

    // null while checking the main block
    private FuncSymbol currentFunction;

    public AnalyzedProgram analyze(Program program) {
        // 1) program-level variables
        for (VarDecl d : program.declarations()) declare(d);

        // 2) predeclare functions so bodies may call each other in any order
        for (FunctionDef f : program.functions()) {
            FuncSymbol existing = functions.get(f.name());
            if (existing != null) {
                throw new DuplicateDeclarationException("Function", f.name(), existing.line(), f.line());
            }
            List<PrimitiveType> ps = new ArrayList<>();
            for (FunctionDef.Param p : f.params()) ps.add(p.type());
            functions.put(f.name(), new FuncSymbol(f.name(), List.copyOf(ps), f.returnType(), f.line()));
        }

        // 3) function bodies
        for (FunctionDef f : program.functions()) checkFunction(f);

        // 4) main block
        for (Stmt s : program.statements()) checkStmt(s);

        return new AnalyzedProgram(program, readTypes, widened, symbols.global().size());
    }

    private void checkFunction(FunctionDef f) {
        currentFunction = functions.get(f.name());

        symbols.push(); // function scope
        for (FunctionDef.Param p : f.params()) {
            symbols.define(new VarSymbol(p.name(), p.type(), f.line()));
        }
        for (VarDecl d : f.declarations()) declare(d);
        for (Stmt s : f.body()) checkStmt(s);
        symbols.pop();

        currentFunction = null;
    }

    private void declare(VarDecl d) {
        d.accept(declChecker);
    }

    private void checkStmt(Stmt s) {
        s.accept(stmtChecker);
    }

    private Type typeOf(Expr e) {
        return e.accept(exprTyper);
    }

    // ---------- name helpers ----------

    private VarSymbol resolveVar(String name, int line) {
        VarSymbol sym = symbols.lookup(name);
        if (sym == null) throw new UndeclaredVariableException(name, line);
        return sym;
    }

    private VarSymbol resolveScalar(String name, int line) {
        VarSymbol sym = resolveVar(name, line);
        if (sym.type() instanceof ArrayType) {
            throw new TypeMismatchException(line, "Array '" + name + "' must be used with an index");
        }
        return sym;
    }

    private ArrayType resolveArray(String name, int line) {
        VarSymbol sym = resolveVar(name, line);
        if (sym.type() instanceof ArrayType at) return at;
        throw new TypeMismatchException(line, "Variable '" + name + "' is not an array");
    }

    private void requireWritable(String name, int line) {
        if (symbols.resolvesToGlobal(name)) throw new GlobalWriteException(name, line);
    }

    private void require(Type expected, Expr e, String ctx) {
        Type t = typeOf(e);
        if (t != expected) {
            throw new TypeMismatchException(e.line(), ctx + " must be of type " + expected + ", but " + t + " found");
        }
    }

    private void requireAssignable(Type dst, Expr value, String target, int line) {
        Type src = typeOf(value);
        if (!TypeUtil.isAssignable(dst, src)) {
            throw new TypeMismatchException(line, "Cannot assign " + src + " to " + target + " of type " + dst);
        }
        noteWidening(dst, src, value);
    }

    // ENTIER value stored into a REEL slot
    private void noteWidening(Type dst, Type src, Expr value) {
        if (dst == PrimitiveType.FLOAT && src == PrimitiveType.INT) widened.add(value);
    }

    private FuncSymbol checkCall(CallExpr c) {
        FuncSymbol fs = functions.get(c.name());
        if (fs == null) throw new UndefinedFunctionException(c.name(), c.line());
        if (fs.paramTypes().size() != c.args().size()) {
            throw new ArityMismatchException(c.name(), fs.paramTypes().size(), c.args().size(), c.line());
        }
        for (int i = 0; i < c.args().size(); i++) {
            Type argT = typeOf(c.args().get(i));
            Type paramT = fs.paramTypes().get(i);
            if (!TypeUtil.isAssignable(paramT, argT)) {
                throw new TypeMismatchException(c.line(), "Argument " + (i + 1) + " of '" + c.name()
                        + "': expected " + paramT + ", but " + argT + " given");
            }
            noteWidening(paramT, argT, c.args().get(i));
        }
        return fs;
    }

    // ---------- declarations ----------

    private final class DeclChecker implements VarDecl.Visitor<Void> {
        @Override
        public Void visitDeclaration(Declaration d) {
            symbols.define(new VarSymbol(d.name(), d.type(), d.line()));
            return null;
        }

        @Override
        public Void visitArrayDeclaration(ArrayDeclaration d) {
            require(PrimitiveType.INT, d.size(), "Size of array '" + d.name() + "'");
            symbols.define(new VarSymbol(d.name(), new ArrayType(d.elementType()), d.line()));
            return null;
        }
    }

    // ---------- statements ----------

    private final class StmtChecker implements Stmt.Visitor<Void> {

        @Override
        public Void visitAssign(AssignStmt s) {
            VarSymbol target = resolveScalar(s.target(), s.line());
            requireWritable(s.target(), s.line());
            requireAssignable(target.type(), s.value(), "'" + s.target() + "'", s.line());
            return null;
        }

        @Override
        public Void visitArrayAssign(ArrayAssignStmt s) {
            ArrayType at = resolveArray(s.target(), s.line());
            requireWritable(s.target(), s.line());
            require(PrimitiveType.INT, s.index(), "Index of array '" + s.target() + "'");
            requireAssignable(at.element(), s.value(), "an element of '" + s.target() + "'", s.line());
            return null;
        }

        @Override
        public Void visitPrint(PrintStmt s) {
            for (Expr e : s.values()) typeOf(e);
            return null;
        }

        @Override
        public Void visitRead(ReadStmt s) {
            VarSymbol target = resolveScalar(s.target(), s.line());
            requireWritable(s.target(), s.line());
            readTypes.put(s, (PrimitiveType) target.type());
            return null;
        }

        @Override
        public Void visitIf(IfStmt s) {
            require(PrimitiveType.BOOL, s.condition(), "Condition of SI");
            for (Stmt st : s.thenBranch()) checkStmt(st);
            for (Stmt st : s.elseBranch()) checkStmt(st);
            return null;
        }

        @Override
        public Void visitWhile(WhileStmt s) {
            require(PrimitiveType.BOOL, s.condition(), "Condition of TANT_QUE");
            for (Stmt st : s.body()) checkStmt(st);
            return null;
        }

        @Override
        public Void visitFor(ForStmt s) {
            VarSymbol var = resolveScalar(s.variable(), s.line());
            if (var.type() != PrimitiveType.INT) {
                throw new TypeMismatchException(s.line(), "Loop variable '" + s.variable()
                        + "' must be of type ENTIER, but " + var.type() + " found");
            }
            requireWritable(s.variable(), s.line());
            require(PrimitiveType.INT, s.start(), "Start value of POUR");
            require(PrimitiveType.INT, s.end(), "End value of POUR");
            for (Stmt st : s.body()) checkStmt(st);
            return null;
        }

        @Override
        public Void visitReturn(ReturnStmt s) {
            if (currentFunction == null) {
                throw new SemanticException(s.line(), "'RETOURNER' outside of a function");
            }
            PrimitiveType expected = currentFunction.returnType();
            if (currentFunction.isProcedure()) {
                if (s.value() != null) {
                    throw new TypeMismatchException(s.line(), "Procedure '" + currentFunction.name() + "' cannot return a value");
                }
                return null;
            }
            if (s.value() == null) {
                throw new TypeMismatchException(s.line(), "Function '" + currentFunction.name()
                        + "' must return a value of type " + expected);
            }
            Type t = typeOf(s.value());
            if (!TypeUtil.isAssignable(expected, t)) {
                throw new TypeMismatchException(s.line(), "Return type mismatch in '" + currentFunction.name()
                        + "': expected " + expected + ", got " + t);
            }
            noteWidening(expected, t, s.value());
            return null;
        }

        @Override
        public Void visitCall(CallStmt s) {
            checkCall(s.call());
            return null;
        }
    }

    // ---------- expressions ----------

    private final class ExprTyper implements Expr.Visitor<Type> {

        @Override
        public Type visitNumber(NumberLiteral e) {
            return e.isFloat() ? PrimitiveType.FLOAT : PrimitiveType.INT;
        }

        @Override
        public Type visitBool(BoolLiteral e) { return PrimitiveType.BOOL; }

        @Override
        public Type visitString(StringLiteral e) { return PrimitiveType.STRING; }

        @Override
        public Type visitVar(VarExpr e) {
            return resolveScalar(e.name(), e.line()).type();
        }

        @Override
        public Type visitArrayAccess(ArrayAccessExpr e) {
            ArrayType at = resolveArray(e.array(), e.line());
            require(PrimitiveType.INT, e.index(), "Index of array '" + e.array() + "'");
            return at.element();
        }

        @Override
        public Type visitUnary(UnaryExpr e) {
            Type a = typeOf(e.operand());
            return switch (e.op()) {
                case NEG -> {
                    if (!a.isNumeric()) {
                        throw new TypeMismatchException(e.line(), "Unary '-' expects ENTIER or REEL, but " + a + " found");
                    }
                    yield a;
                }
                case NOT -> {
                    if (a != PrimitiveType.BOOL) {
                        throw new TypeMismatchException(e.line(), "'NON' expects BOOLEEN, but " + a + " found");
                    }
                    yield PrimitiveType.BOOL;
                }
            };
        }

        @Override
        public Type visitBinary(BinaryExpr b) {
            Type l = typeOf(b.left());
            Type r = typeOf(b.right());
            String op = b.op().symbol();

            return switch (b.op()) {
                case ADD, SUB, MUL, DIV -> {
                    if (b.op() == BinaryExpr.Operator.ADD && l == PrimitiveType.STRING && r == PrimitiveType.STRING) {
                        yield PrimitiveType.STRING;
                    }
                    Type res = TypeUtil.numericResult(l, r);
                    if (res == null) {
                        throw new TypeMismatchException(b.line(), "Operator '" + op + "' expects ENTIER or REEL operands, but got "
                                + l + " and " + r);
                    }
                    yield b.op() == BinaryExpr.Operator.DIV ? PrimitiveType.FLOAT : res;
                }

                case LT, LE, GT, GE, EQ, NE -> {
                    if (l.isNumeric() && r.isNumeric()) yield PrimitiveType.BOOL;
                    if (l == r && (l == PrimitiveType.STRING || l == PrimitiveType.BOOL)) {
                        if (b.op().isEquality()) yield PrimitiveType.BOOL;
                        throw new TypeMismatchException(b.line(), "Operator '" + op + "' is not allowed on " + l
                                + " (only = and ≠)");
                    }
                    throw new TypeMismatchException(b.line(), "Cannot compare " + l + " and " + r + " with '" + op + "'");
                }

                case AND, OR -> {
                    if (l != PrimitiveType.BOOL || r != PrimitiveType.BOOL) {
                        throw new TypeMismatchException(b.line(), "Operator '" + op + "' expects BOOLEEN operands, but got "
                                + l + " and " + r);
                    }
                    yield PrimitiveType.BOOL;
                }
            };
        }

        @Override
        public Type visitCall(CallExpr c) {
            FuncSymbol fs = checkCall(c);
            if (fs.isProcedure()) {
                throw new SemanticException(c.line(), "Procedure '" + c.name() + "' does not return a value");
            }
            return fs.returnType();
        }
    }
}
