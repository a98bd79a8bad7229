package pseudoc;

import pseudoc.lexer.LexerException;
import pseudoc.parser.ParserException;
import pseudoc.sema.UndeclaredVariableException;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class CompilerTest {

    private static String resource(String name) throws IOException {
        try (InputStream in = CompilerTest.class.getResourceAsStream("/programs/" + name)) {
            assertNotNull(in, "missing test resource " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static String compile(String src) {
        return new Compiler().compile(src);
    }

    @Test
    void compile_somme() throws IOException {
        assertEquals("""
            # Generated by pseudoc from algorithm Somme

            x: int = 0
            y: int = 0

            x = 10
            y = 20
            print("Somme:", x + y)
            """, compile(resource("somme.algo")));
    }

    @Test
    void compile_functions() throws IOException {
        assertEquals("""
            # Generated by pseudoc from algorithm TestFonction

            def carre(n: int) -> int:
                return n * n

            def factorielle(n: int) -> int:
                i: int = 0
                acc: int = 0
                acc = 1
                for i in range(1, n + 1):
                    acc = acc * i
                return acc

            def afficher(message: str, valeur: int) -> None:
                print(message, valeur)

            x: int = 0
            resultat: int = 0

            x = 5
            resultat = carre(x)
            afficher("carre:", resultat)
            afficher("factorielle:", factorielle(x))
            """, compile(resource("fonctions.algo")));
    }

    @Test
    void compile_arrays_and_control_flow() throws IOException {
        String py = compile(resource("tableaux.algo"));
        assertTrue(py.contains("t: list[int] = [0] * 5\n"), py);
        assertTrue(py.contains("""
            for i in range(0, 5):
                t[i] = i * i
            """), py);
        assertTrue(py.contains("""
            while i < 5:
                total = total + t[i]
                i = i + 1
            """), py);
        assertTrue(py.contains("moyenne = total / 5\n"), py);
        assertTrue(py.contains("""
            if moyenne >= 5 and not total == 0:
                print("grande moyenne", moyenne)
            elif moyenne > 1:
                print("moyenne", moyenne)
            else:
                print("petite moyenne")
            """), py);
    }

    @Test
    void compile_is_deterministic() throws IOException {
        String src = resource("tableaux.algo");
        assertEquals(compile(src), compile(src));
    }

    @Test
    void compile_reports_undeclared_variable_at_use_line() {
        var ex = assertThrows(UndeclaredVariableException.class, () -> compile("""
            ALGORITHME Exemple
            VAR x : ENTIER
            DEBUT
                x ← 10
                y ← 20
                ECRIRE("Somme:", x + y)
            FIN
            """));
        assertEquals(CompilationException.Stage.SEMANTIC, ex.stage());
        assertEquals("Semantic Error (line 5): Variable 'y' is used without being declared", ex.getMessage());
    }

    @Test
    void compile_stops_at_first_failing_phase() {
        // lexical error wins over the syntax and semantic errors further down
        var lex = assertThrows(LexerException.class, () -> compile("ALGORITHME T\nDEBUT\nz ← 1\n@\nFIN"));
        assertTrue(lex.getMessage().startsWith("Lexical Error (line 4):"));

        var syntax = assertThrows(ParserException.class, () -> compile("ALGORITHME T\nDEBUT\nz ← \nFIN"));
        assertTrue(syntax.getMessage().startsWith("Syntax Error (line 4):"));
    }
}
