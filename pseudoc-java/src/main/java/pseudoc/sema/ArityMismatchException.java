package pseudoc.sema;

public final class ArityMismatchException extends SemanticException {
    private final int expected;
    private final int actual;

    public ArityMismatchException(String function, int expected, int actual, int line) {
        super(line, "Function '" + function + "' expects " + expected + " argument(s) but " + actual + " given");
        this.expected = expected;
        this.actual = actual;
    }

    public int expected() { return expected; }

    public int actual() { return actual; }
}
