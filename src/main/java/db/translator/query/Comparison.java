package db.translator.query;

/**
 * field op literal. IS NULL / IS NOT NULL are EQ / NE against {@link Literal#NULL}.
 */
public record Comparison(String field, ComparisonOp op, Literal value) implements Predicate {

    public Comparison {
        if (field == null || field.isEmpty()) throw new IllegalArgumentException("field must be a non-empty identifier");
        if (op == null) throw new IllegalArgumentException("op must not be null");
        if (value == null) throw new IllegalArgumentException("value must not be null (use Literal.NULL)");
        if (op.isOrdering() && !value.isNumeric()) {
            throw new IllegalArgumentException("Operator " + op.symbol() + " requires a numeric literal, got " + value.kind());
        }
    }

    @Override
    public String toString() {
        if (value.kind() == Literal.Kind.NULL) {
            return field + (op == ComparisonOp.EQ ? " IS NULL" : " IS NOT NULL");
        }
        return field + " " + op.symbol() + " " + value;
    }
}
