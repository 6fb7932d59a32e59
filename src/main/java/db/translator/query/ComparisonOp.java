package db.translator.query;

/**
 * The six comparison operators of the WHERE grammar.
 */
public enum ComparisonOp {
    EQ("="), NE("!="), LT("<"), LTE("<="), GT(">"), GTE(">=");

    private final String symbol;

    ComparisonOp(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() { return symbol; }

    /** Ordering operators only accept numeric literals. */
    public boolean isOrdering() {
        return this == LT || this == LTE || this == GT || this == GTE;
    }

    /** Maps an SQL operator token; "<>" is accepted as an alias of "!=". */
    public static ComparisonOp fromSymbol(String s) {
        return switch (s) {
            case "=" -> EQ;
            case "!=", "<>" -> NE;
            case "<" -> LT;
            case "<=" -> LTE;
            case ">" -> GT;
            case ">=" -> GTE;
            default -> throw new IllegalArgumentException("Unsupported operator: " + s);
        };
    }
}
