package pseudoc.codegen;

import java.util.ArrayList;
import java.util.List;

/** Line buffer with an explicit indentation depth. */
public final class PythonEmitter {
    private static final String INDENT = "    ";

    private final List<String> lines = new ArrayList<>();
    private int depth = 0;

    public void line(String text) {
        lines.add(INDENT.repeat(depth) + text);
    }

    public void blank() {
        if (!lines.isEmpty() && !lines.get(lines.size() - 1).isEmpty()) lines.add("");
    }

    public void indent() { depth++; }

    public void dedent() {
        if (depth == 0) throw new IllegalStateException("Indentation depth is already 0");
        depth--;
    }

    /** Every line terminated by a newline, without trailing blank lines. */
    public String text() {
        int end = lines.size();
        while (end > 0 && lines.get(end - 1).isEmpty()) end--;
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < end; i++) sb.append(lines.get(i)).append('\n');
        return sb.toString();
    }
}
