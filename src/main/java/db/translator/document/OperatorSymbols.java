package db.translator.document;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

import db.translator.query.ComparisonOp;
import db.translator.query.TranslationInvariantViolation;

/**
 * One-to-one mapping between SQL comparison operators and document-store operator keys,
 * plus the logical wrapper keys.
 */
public final class OperatorSymbols {
    public static final String AND = "$and";
    public static final String OR = "$or";
    public static final String NOR = "$nor";

    private static final Map<ComparisonOp, String> TO_KEY;
    private static final Map<String, ComparisonOp> FROM_KEY;

    static {
        EnumMap<ComparisonOp, String> forward = new EnumMap<>(ComparisonOp.class);
        forward.put(ComparisonOp.EQ, "$eq");
        forward.put(ComparisonOp.NE, "$ne");
        forward.put(ComparisonOp.LT, "$lt");
        forward.put(ComparisonOp.LTE, "$lte");
        forward.put(ComparisonOp.GT, "$gt");
        forward.put(ComparisonOp.GTE, "$gte");
        Map<String, ComparisonOp> reverse = new HashMap<>();
        for (Map.Entry<ComparisonOp, String> e : forward.entrySet()) {
            if (reverse.put(e.getValue(), e.getKey()) != null) {
                throw new TranslationInvariantViolation("Operator key " + e.getValue() + " mapped twice");
            }
        }
        if (forward.size() != ComparisonOp.values().length) {
            throw new TranslationInvariantViolation("Operator table does not cover every comparison operator");
        }
        TO_KEY = Collections.unmodifiableMap(forward);
        FROM_KEY = Collections.unmodifiableMap(reverse);
    }

    private OperatorSymbols() {}

    public static String keyFor(ComparisonOp op) {
        return TO_KEY.get(op);
    }

    /** Inverse of {@link #keyFor}; throws for keys that are not comparison operators. */
    public static ComparisonOp opFor(String key) {
        ComparisonOp op = FROM_KEY.get(key);
        if (op == null) throw new IllegalArgumentException("Unknown comparison operator key: " + key);
        return op;
    }

    public static boolean isComparisonKey(String key) {
        return FROM_KEY.containsKey(key);
    }
}
