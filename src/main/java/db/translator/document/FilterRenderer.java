package db.translator.document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import db.translator.query.Comparison;
import db.translator.query.ComparisonOp;
import db.translator.query.Logical;
import db.translator.query.Predicate;
import db.translator.query.TranslationInvariantViolation;

/**
 * Renders a predicate tree into the document store's filter form.
 *   a = v           -> {a: v}
 *   a op v          -> {a: {"$op": v}}
 *   AND / OR        -> {"$and": [...]} / {"$or": [...]}
 *   NOT p           -> {"$nor": [p]}
 *   no predicate    -> {}
 * Nesting is kept exactly as in the tree. Output maps and lists are unmodifiable and keep
 * insertion order.
 */
public class FilterRenderer {

    public Map<String, Object> render(Predicate predicate) {
        if (predicate == null) return Collections.emptyMap();
        if (predicate instanceof Comparison c) return renderComparison(c);
        if (predicate instanceof Logical l) return renderLogical(l);
        throw new TranslationInvariantViolation("Unknown predicate node: " + predicate.getClass().getName());
    }

    /**
     * Projection document: {"_id": 0} for SELECT *, otherwise {col: 1, ..., "_id": 0} in SELECT order.
     * An explicitly selected _id stays included.
     */
    public Map<String, Object> renderProjection(List<String> columns) {
        Map<String, Object> projection = new LinkedHashMap<>();
        for (String col : columns) projection.put(col, 1);
        projection.putIfAbsent("_id", 0);
        return Collections.unmodifiableMap(projection);
    }

    private Map<String, Object> renderComparison(Comparison c) {
        Object value = c.value().value();
        Map<String, Object> out = new LinkedHashMap<>();
        if (c.op() == ComparisonOp.EQ) {
            out.put(c.field(), value);
        } else {
            Map<String, Object> operator = new LinkedHashMap<>();
            operator.put(OperatorSymbols.keyFor(c.op()), value);
            out.put(c.field(), Collections.unmodifiableMap(operator));
        }
        return Collections.unmodifiableMap(out);
    }

    private Map<String, Object> renderLogical(Logical l) {
        List<Predicate> operands = l.operands();
        String key = switch (l.op()) {
            case AND -> OperatorSymbols.AND;
            case OR -> OperatorSymbols.OR;
            case NOT -> OperatorSymbols.NOR;
        };
        boolean arityOk = l.op() == Logical.Op.NOT ? operands.size() == 1 : operands.size() >= 2;
        if (!arityOk) {
            throw new TranslationInvariantViolation(l.op() + " node with " + operands.size() + " operand(s)");
        }
        List<Object> rendered = new ArrayList<>(operands.size());
        for (Predicate p : operands) rendered.add(render(p));
        Map<String, Object> out = new LinkedHashMap<>();
        out.put(key, Collections.unmodifiableList(rendered));
        return Collections.unmodifiableMap(out);
    }
}
