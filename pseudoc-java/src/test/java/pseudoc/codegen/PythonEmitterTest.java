package pseudoc.codegen;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PythonEmitterTest {

    @Test
    void emit_indentation_and_blank_lines() {
        var out = new PythonEmitter();
        out.blank(); // nothing to separate yet
        out.line("def f():");
        out.indent();
        out.line("return 1");
        out.dedent();
        out.blank();
        out.blank();
        out.line("f()");
        out.blank();
        assertEquals("def f():\n    return 1\n\nf()\n", out.text());
    }

    @Test
    void emit_dedent_below_zero_fails() {
        var out = new PythonEmitter();
        assertThrows(IllegalStateException.class, out::dedent);
    }

    @Test
    void emit_empty_buffer() {
        assertEquals("", new PythonEmitter().text());
    }
}
