package db.translator.document;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import db.translator.query.Comparison;
import db.translator.query.ComparisonOp;
import db.translator.query.Literal;
import db.translator.query.Logical;
import db.translator.query.Predicate;

/**
 * Reads a document filter back into a predicate tree. Inverse of {@link FilterRenderer} for
 * everything it produces; also accepts explicit {"$eq": v}, multi-field maps (implicit AND)
 * and multi-operator field maps such as {a: {"$gt": 1, "$lt": 5}}.
 * Returns null for the empty (match-all) filter.
 */
public class FilterDecoder {

    public Predicate decode(Map<String, ?> filter) {
        if (filter == null) throw new IllegalArgumentException("filter must not be null");
        if (filter.isEmpty()) return null;
        List<Predicate> parts = new ArrayList<>();
        for (Map.Entry<String, ?> e : filter.entrySet()) {
            parts.add(decodeEntry(e.getKey(), e.getValue()));
        }
        return parts.size() == 1 ? parts.get(0) : new Logical(Logical.Op.AND, parts);
    }

    private Predicate decodeEntry(String key, Object value) {
        switch (key) {
            case OperatorSymbols.AND:
                return new Logical(Logical.Op.AND, decodeAll(key, value));
            case OperatorSymbols.OR:
                return new Logical(Logical.Op.OR, decodeAll(key, value));
            case OperatorSymbols.NOR: {
                List<Predicate> operands = decodeAll(key, value);
                Predicate inner = operands.size() == 1 ? operands.get(0) : new Logical(Logical.Op.OR, operands);
                return Logical.not(inner);
            }
            default:
                break;
        }
        if (key.startsWith("$")) throw new IllegalArgumentException("Unsupported top-level operator: " + key);
        if (value instanceof Map<?, ?> ops) return decodeOperators(key, ops);
        return new Comparison(key, ComparisonOp.EQ, Literal.of(value));
    }

    private Predicate decodeOperators(String field, Map<?, ?> ops) {
        if (ops.isEmpty()) throw new IllegalArgumentException("Empty operator document for field '" + field + "'");
        List<Predicate> parts = new ArrayList<>();
        for (Map.Entry<?, ?> e : ops.entrySet()) {
            String opKey = String.valueOf(e.getKey());
            if (!OperatorSymbols.isComparisonKey(opKey)) {
                throw new IllegalArgumentException("Unsupported operator '" + opKey + "' on field '" + field + "'");
            }
            parts.add(new Comparison(field, OperatorSymbols.opFor(opKey), Literal.of(e.getValue())));
        }
        return parts.size() == 1 ? parts.get(0) : new Logical(Logical.Op.AND, parts);
    }

    private List<Predicate> decodeAll(String key, Object value) {
        if (!(value instanceof List<?> list) || list.isEmpty()) {
            throw new IllegalArgumentException(key + " expects a non-empty list of filters");
        }
        List<Predicate> out = new ArrayList<>(list.size());
        for (Object item : list) {
            if (!(item instanceof Map<?, ?> m)) throw new IllegalArgumentException(key + " entries must be documents");
            @SuppressWarnings("unchecked")
            Predicate p = decode((Map<String, ?>) m);
            if (p == null) throw new IllegalArgumentException(key + " entries must not be empty filters");
            out.add(p);
        }
        return out;
    }
}
