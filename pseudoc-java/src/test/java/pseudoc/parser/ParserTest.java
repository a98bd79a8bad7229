package pseudoc.parser;

import pseudoc.ast.Program;
import pseudoc.ast.decl.ArrayDeclaration;
import pseudoc.ast.decl.Declaration;
import pseudoc.ast.decl.FunctionDef;
import pseudoc.ast.expr.*;
import pseudoc.ast.stmt.*;
import pseudoc.lexer.Lexer;
import pseudoc.lexer.TokenType;
import pseudoc.types.PrimitiveType;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ParserTest {

    private static Program parse(String src) {
        var tokens = new Lexer(src).tokenize();
        return new Parser(tokens).parseProgram();
    }

    /** Wraps statements in a minimal program with no declarations. */
    private static List<Stmt> parseBody(String body) {
        return parse("ALGORITHME T\nDEBUT\n" + body + "\nFIN").statements();
    }

    private static Expr parseValue(String expr) {
        var s = (AssignStmt) parseBody("x ← " + expr).get(0);
        return s.value();
    }

    @Test
    void parse_assignment_of_int_literal() {
        var s = (AssignStmt) parseBody("x ← 10").get(0);
        assertEquals("x", s.target());
        var lit = (NumberLiteral) s.value();
        assertEquals(10L, lit.value());
        assertFalse(lit.isFloat());
    }

    @Test
    void parse_float_literal() {
        var lit = (NumberLiteral) parseValue("2.5");
        assertEquals(2.5, lit.value());
        assertTrue(lit.isFloat());
    }

    @Test
    void parse_program_header_and_declarations() {
        var p = parse("""
            ALGORITHME Exemple
            VAR x : ENTIER
            VAR nom : CHAINE
            VAR t : TABLEAU[10] DE REEL
            DEBUT
            FIN
            """);
        assertEquals("Exemple", p.name());
        assertEquals(3, p.declarations().size());
        var x = (Declaration) p.declarations().get(0);
        assertEquals(PrimitiveType.INT, x.type());
        assertEquals(2, x.line());
        assertEquals(PrimitiveType.STRING, ((Declaration) p.declarations().get(1)).type());
        var t = (ArrayDeclaration) p.declarations().get(2);
        assertEquals("t", t.name());
        assertEquals(PrimitiveType.FLOAT, t.elementType());
        assertEquals(10L, ((NumberLiteral) t.size()).value());
        assertTrue(p.statements().isEmpty());
    }

    @Test
    void parse_precedence_mul_over_add() {
        // 1 + 2 * 3 => 1 + (2 * 3)
        var e = (BinaryExpr) parseValue("1 + 2 * 3");
        assertEquals(BinaryExpr.Operator.ADD, e.op());
        assertInstanceOf(NumberLiteral.class, e.left());
        assertEquals(BinaryExpr.Operator.MUL, ((BinaryExpr) e.right()).op());
    }

    @Test
    void parse_subtraction_is_left_associative() {
        // 10 - 3 - 2 => (10 - 3) - 2
        var e = (BinaryExpr) parseValue("10 - 3 - 2");
        assertEquals(BinaryExpr.Operator.SUB, e.op());
        assertEquals(BinaryExpr.Operator.SUB, ((BinaryExpr) e.left()).op());
        assertEquals(2L, ((NumberLiteral) e.right()).value());
    }

    @Test
    void parse_parentheses_override_precedence() {
        var e = (BinaryExpr) parseValue("(1 + 2) * 3");
        assertEquals(BinaryExpr.Operator.MUL, e.op());
        assertEquals(BinaryExpr.Operator.ADD, ((BinaryExpr) e.left()).op());
    }

    @Test
    void parse_logical_precedence() {
        // a OU b ET c => a OU (b ET c)
        var e = (BinaryExpr) parseValue("a OU b ET c");
        assertEquals(BinaryExpr.Operator.OR, e.op());
        assertEquals(BinaryExpr.Operator.AND, ((BinaryExpr) e.right()).op());
    }

    @Test
    void parse_comparison_binds_tighter_than_et() {
        var e = (BinaryExpr) parseValue("x < 3 ET y ≠ 4");
        assertEquals(BinaryExpr.Operator.AND, e.op());
        assertEquals(BinaryExpr.Operator.LT, ((BinaryExpr) e.left()).op());
        assertEquals(BinaryExpr.Operator.NE, ((BinaryExpr) e.right()).op());
    }

    @Test
    void parse_unary_operators() {
        var neg = (UnaryExpr) parseValue("-x");
        assertEquals(UnaryExpr.Operator.NEG, neg.op());
        var not = (UnaryExpr) parseValue("NON VRAI");
        assertEquals(UnaryExpr.Operator.NOT, not.op());
        assertTrue(((BoolLiteral) not.operand()).value());

        // -2 * 3 => (-2) * 3
        var mul = (BinaryExpr) parseValue("-2 * 3");
        assertEquals(BinaryExpr.Operator.MUL, mul.op());
        assertInstanceOf(UnaryExpr.class, mul.left());
    }

    @Test
    void parse_array_access_and_call_in_expression() {
        var e = (BinaryExpr) parseValue("t[i + 1] + f(2, \"a\")");
        var access = (ArrayAccessExpr) e.left();
        assertEquals("t", access.array());
        assertInstanceOf(BinaryExpr.class, access.index());
        var call = (CallExpr) e.right();
        assertEquals("f", call.name());
        assertEquals(2, call.args().size());
        assertEquals("a", ((StringLiteral) call.args().get(1)).text());
    }

    @Test
    void parse_print_read_and_array_assignment() {
        var body = parseBody("""
            ECRIRE("Somme:", x + y)
            LIRE(n)
            t[0] ← 5
            """);
        var print = (PrintStmt) body.get(0);
        assertEquals(2, print.values().size());
        assertEquals("n", ((ReadStmt) body.get(1)).target());
        var aa = (ArrayAssignStmt) body.get(2);
        assertEquals("t", aa.target());
        assertEquals(0L, ((NumberLiteral) aa.index()).value());
    }

    @Test
    void parse_if_without_else_has_empty_else_branch() {
        var s = (IfStmt) parseBody("""
            SI x > 0 ALORS
                ECRIRE("positif")
            FIN_SI
            """).get(0);
        assertEquals(1, s.thenBranch().size());
        assertTrue(s.elseBranch().isEmpty());
    }

    @Test
    void parse_if_else() {
        var s = (IfStmt) parseBody("""
            SI x = 0 ALORS
                y ← 1
            SINON
                y ← 2
                z ← 3
            FIN_SI
            """).get(0);
        assertEquals(BinaryExpr.Operator.EQ, ((BinaryExpr) s.condition()).op());
        assertEquals(2, s.elseBranch().size());
    }

    @Test
    void parse_for_and_while() {
        var body = parseBody("""
            POUR i DE 1 A 5 FAIRE
                ECRIRE(i)
            FIN_POUR
            TANT_QUE i > 0 FAIRE
                i ← i - 1
            FIN_TANT_QUE
            """);
        var f = (ForStmt) body.get(0);
        assertEquals("i", f.variable());
        assertEquals(1L, ((NumberLiteral) f.start()).value());
        assertEquals(5L, ((NumberLiteral) f.end()).value());
        assertEquals(1, f.body().size());
        var w = (WhileStmt) body.get(1);
        assertEquals(1, w.body().size());
        assertEquals(6, w.line());
    }

    @Test
    void parse_function_params_and_return_type() {
        var p = parse("""
            ALGORITHME F
            FONCTION somme(a : ENTIER, b : REEL) : REEL
                VAR total : REEL
                total ← a + b
                RETOURNER total
            FIN_FONCTION
            DEBUT
                ECRIRE(somme(1, 2.0))
            FIN
            """);
        FunctionDef f = p.functions().get(0);
        assertEquals("somme", f.name());
        assertEquals(List.of(new FunctionDef.Param("a", PrimitiveType.INT), new FunctionDef.Param("b", PrimitiveType.FLOAT)),
                f.params());
        assertEquals(PrimitiveType.FLOAT, f.returnType());
        assertFalse(f.isProcedure());
        assertEquals(1, f.declarations().size());
        assertEquals(2, f.body().size());
        assertEquals(2, f.line());
        assertInstanceOf(VarExpr.class, ((ReturnStmt) f.body().get(1)).value());
    }

    @Test
    void parse_procedure_without_return_type() {
        var p = parse("""
            ALGORITHME P
            FONCTION saluer()
                ECRIRE("bonjour")
                RETOURNER
            FIN_FONCTION
            DEBUT
                saluer()
            FIN
            """);
        FunctionDef f = p.functions().get(0);
        assertTrue(f.isProcedure());
        assertEquals(PrimitiveType.VOID, f.returnType());
        assertTrue(f.params().isEmpty());
        assertNull(((ReturnStmt) f.body().get(1)).value());
        var call = (CallStmt) p.statements().get(0);
        assertEquals("saluer", call.call().name());
        assertEquals(7, call.line());
    }

    @Test
    void parse_bare_return_before_keyword_statement() {
        var p = parse("""
            ALGORITHME P
            FONCTION f(x : ENTIER)
                SI x > 0 ALORS
                    RETOURNER
                FIN_SI
                RETOURNER
                ECRIRE(x)
            FIN_FONCTION
            DEBUT
            FIN
            """);
        var body = p.functions().get(0).body();
        assertNull(((ReturnStmt) ((IfStmt) body.get(0)).thenBranch().get(0)).value());
        assertNull(((ReturnStmt) body.get(1)).value());
        assertInstanceOf(PrintStmt.class, body.get(2));
    }

    @Test
    void parse_bare_return_before_identifier_statement() {
        var p = parse("""
            ALGORITHME P
            FONCTION p(n : ENTIER)
                RETOURNER
                n ← 1
                RETOURNER
                q(n)
                RETOURNER
                t[0] ← n
            FIN_FONCTION
            FONCTION f(n : ENTIER) : ENTIER
                RETOURNER f(n - 1)
                RETOURNER
                n ← 2
            FIN_FONCTION
            DEBUT
            FIN
            """);
        var proc = p.functions().get(0).body();
        assertEquals(6, proc.size());
        assertNull(((ReturnStmt) proc.get(0)).value());
        assertInstanceOf(AssignStmt.class, proc.get(1));
        assertNull(((ReturnStmt) proc.get(2)).value());
        assertInstanceOf(CallStmt.class, proc.get(3));
        assertNull(((ReturnStmt) proc.get(4)).value());
        assertInstanceOf(ArrayAssignStmt.class, proc.get(5));

        var fn = p.functions().get(1).body();
        assertEquals(3, fn.size());
        assertInstanceOf(CallExpr.class, ((ReturnStmt) fn.get(0)).value());
        assertNull(((ReturnStmt) fn.get(1)).value());
        assertInstanceOf(AssignStmt.class, fn.get(2));
    }

    @Test
    void parse_error_missing_alors() {
        var ex = assertThrows(ParserException.class, () -> parseBody("SI x > 0\n  y ← 1\nFIN_SI"));
        assertTrue(ex.expected().contains(TokenType.ALORS));
        assertEquals(TokenType.IDENTIFIER, ex.actual().type());
        assertEquals(4, ex.line());
        assertTrue(ex.getMessage().startsWith("Syntax Error (line 4): Expected 'ALORS' after condition"));
        assertTrue(ex.getMessage().contains("got IDENTIFIER 'y'"));
    }

    @Test
    void parse_error_missing_header() {
        var ex = assertThrows(ParserException.class, () -> parse("VAR x : ENTIER\nDEBUT\nFIN"));
        assertEquals(Set.of(TokenType.ALGORITHME), ex.expected());
        assertEquals(1, ex.line());
    }

    @Test
    void parse_error_missing_fin_reports_end_of_input() {
        var ex = assertThrows(ParserException.class, () -> parse("ALGORITHME T\nDEBUT\nx ← 1\n"));
        assertTrue(ex.getMessage().contains("Missing 'FIN'"));
        assertTrue(ex.getMessage().contains("end of input"));
        assertEquals(TokenType.EOF, ex.actual().type());
    }

    @Test
    void parse_error_unclosed_loop() {
        var ex = assertThrows(ParserException.class, () -> parseBody("POUR i DE 1 A 3 FAIRE\nECRIRE(i)"));
        assertEquals(Set.of(TokenType.FIN_POUR), ex.expected());
        assertEquals(TokenType.FIN, ex.actual().type());
        assertTrue(ex.description().startsWith("Missing 'FIN_POUR'"));
    }

    @Test
    void parse_error_chained_comparison() {
        var ex = assertThrows(ParserException.class, () -> parseBody("x ← 1 < 2 < 3"));
        assertEquals(TokenType.LT, ex.actual().type());
    }

    @Test
    void parse_error_declaration_after_function() {
        var ex = assertThrows(ParserException.class, () -> parse("""
            ALGORITHME T
            FONCTION f()
            FIN_FONCTION
            VAR x : ENTIER
            DEBUT
            FIN
            """));
        assertEquals(4, ex.line());
        assertTrue(ex.description().startsWith("Declarations must come before function definitions"));
    }

    @Test
    void parse_error_nested_function() {
        var ex = assertThrows(ParserException.class, () -> parseBody("FONCTION g()\nFIN_FONCTION"));
        assertEquals(TokenType.FONCTION, ex.actual().type());
    }

    @Test
    void parse_error_missing_type() {
        var ex = assertThrows(ParserException.class, () -> parse("ALGORITHME T\nVAR x : ENTIERS\nDEBUT\nFIN"));
        assertTrue(ex.expected().containsAll(List.of(TokenType.ENTIER, TokenType.REEL, TokenType.CHAINE, TokenType.BOOLEEN)));
    }

    @Test
    void parse_error_trailing_input_after_fin() {
        var ex = assertThrows(ParserException.class, () -> parse("ALGORITHME T\nDEBUT\nFIN\nx ← 1"));
        assertEquals(4, ex.line());
        assertEquals(Set.of(TokenType.EOF), ex.expected());
    }

    @Test
    void parse_error_missing_expression() {
        var ex = assertThrows(ParserException.class, () -> parseBody("x ← "));
        assertEquals(TokenType.FIN, ex.actual().type());
        assertTrue(ex.expected().contains(TokenType.INT_LITERAL));
    }
}
