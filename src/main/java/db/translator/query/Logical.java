package db.translator.query;

import java.util.List;

/**
 * Logical combination of child predicates. AND / OR need at least two operands, NOT exactly one.
 * Operand order is preserved as written.
 */
public record Logical(Op op, List<Predicate> operands) implements Predicate {
    public enum Op { AND, OR, NOT }

    public Logical {
        if (op == null) throw new IllegalArgumentException("op must not be null");
        if (operands == null) throw new IllegalArgumentException("operands must not be null");
        operands = List.copyOf(operands);
        if (op == Op.NOT && operands.size() != 1) {
            throw new IllegalArgumentException("NOT requires exactly one operand");
        }
        if (op != Op.NOT && operands.size() < 2) {
            throw new IllegalArgumentException(op + " requires at least two operands");
        }
    }

    public static Logical and(Predicate... operands) { return new Logical(Op.AND, List.of(operands)); }
    public static Logical or(Predicate... operands) { return new Logical(Op.OR, List.of(operands)); }
    public static Logical not(Predicate operand) { return new Logical(Op.NOT, List.of(operand)); }

    @Override
    public String toString() {
        if (op == Op.NOT) return "NOT (" + operands.get(0) + ")";
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < operands.size(); i++) {
            if (i > 0) sb.append(' ').append(op).append(' ');
            sb.append(operands.get(i));
        }
        return sb.append(')').toString();
    }
}
