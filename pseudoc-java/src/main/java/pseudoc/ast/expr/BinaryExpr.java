package pseudoc.ast.expr;

public record BinaryExpr(
        Expr left,
        Operator op,
        Expr right,
        int line
) implements Expr {

    public enum Operator {
        ADD("+"), SUB("-"), MUL("*"), DIV("/"),
        EQ("="), NE("≠"), LT("<"), GT(">"), LE("<="), GE(">="),
        AND("ET"), OR("OU");

        private final String symbol;

        Operator(String symbol) { this.symbol = symbol; }

        /** Spelling in the pseudocode, used in diagnostics. */
        public String symbol() { return symbol; }

        public boolean isComparison() {
            return this == EQ || this == NE || this == LT || this == GT || this == LE || this == GE;
        }

        public boolean isEquality() {
            return this == EQ || this == NE;
        }
    }

    @Override
    public <R> R accept(Visitor<R> v) { return v.visitBinary(this); }
}
