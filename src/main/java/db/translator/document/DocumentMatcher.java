package db.translator.document;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.IntPredicate;

/**
 * Compiled document filter, evaluated the way a document store does:
 * {f: null} matches a missing or null field, $ne matches a missing field, ordering operators
 * never match missing, null or incomparable values, and numbers compare numerically across
 * integer and floating-point representations.
 * Compile once, then test many documents; instances are immutable and thread-safe.
 */
public final class DocumentMatcher {

    private interface Node {
        boolean test(Map<String, Object> doc);
    }

    // missing/null values or mismatched types
    private static final int INCOMPARABLE = Integer.MIN_VALUE;

    private final Node root;

    private DocumentMatcher(Node root) {
        this.root = root;
    }

    public static DocumentMatcher compile(Map<String, ?> filter) {
        if (filter == null) throw new IllegalArgumentException("filter must not be null");
        return new DocumentMatcher(compileDocument(filter));
    }

    public boolean test(Map<String, Object> doc) {
        return root.test(doc);
    }

    private static Node compileDocument(Map<String, ?> filter) {
        List<Node> clauses = new ArrayList<>();
        for (Map.Entry<String, ?> e : filter.entrySet()) clauses.add(compileEntry(e.getKey(), e.getValue()));
        if (clauses.size() == 1) return clauses.get(0);
        return doc -> {
            for (Node n : clauses) if (!n.test(doc)) return false;
            return true;
        };
    }

    private static Node compileEntry(String key, Object value) {
        switch (key) {
            case OperatorSymbols.AND: {
                List<Node> children = compileList(key, value);
                return doc -> {
                    for (Node n : children) if (!n.test(doc)) return false;
                    return true;
                };
            }
            case OperatorSymbols.OR: {
                List<Node> children = compileList(key, value);
                return doc -> {
                    for (Node n : children) if (n.test(doc)) return true;
                    return false;
                };
            }
            case OperatorSymbols.NOR: {
                List<Node> children = compileList(key, value);
                return doc -> {
                    for (Node n : children) if (n.test(doc)) return false;
                    return true;
                };
            }
            default:
                break;
        }
        if (key.startsWith("$")) throw new IllegalArgumentException("Unsupported top-level operator: " + key);
        if (value instanceof Map<?, ?> ops) {
            List<Node> checks = new ArrayList<>();
            for (Map.Entry<?, ?> e : ops.entrySet()) {
                checks.add(compileOperator(key, String.valueOf(e.getKey()), e.getValue()));
            }
            return doc -> {
                for (Node n : checks) if (!n.test(doc)) return false;
                return true;
            };
        }
        return doc -> equalsValue(doc.get(key), value);
    }

    private static Node compileOperator(String field, String opKey, Object expected) {
        return switch (OperatorSymbols.opFor(opKey)) {
            case EQ -> doc -> equalsValue(doc.get(field), expected);
            case NE -> doc -> !equalsValue(doc.get(field), expected);
            case LT -> doc -> ordered(doc.get(field), expected, c -> c < 0);
            case LTE -> doc -> ordered(doc.get(field), expected, c -> c <= 0);
            case GT -> doc -> ordered(doc.get(field), expected, c -> c > 0);
            case GTE -> doc -> ordered(doc.get(field), expected, c -> c >= 0);
        };
    }

    private static List<Node> compileList(String key, Object value) {
        if (!(value instanceof List<?> list) || list.isEmpty()) {
            throw new IllegalArgumentException(key + " expects a non-empty list of filters");
        }
        List<Node> out = new ArrayList<>(list.size());
        for (Object item : list) {
            if (!(item instanceof Map<?, ?> m)) throw new IllegalArgumentException(key + " entries must be documents");
            @SuppressWarnings("unchecked")
            Node n = compileDocument((Map<String, ?>) m);
            out.add(n);
        }
        return out;
    }

    static boolean equalsValue(Object actual, Object expected) {
        if (expected == null) return actual == null;
        if (actual instanceof Number a && expected instanceof Number b) return compareNumbers(a, b) == 0;
        return Objects.equals(actual, expected);
    }

    private static boolean ordered(Object actual, Object expected, IntPredicate accept) {
        int c = compare(actual, expected);
        return c != INCOMPARABLE && accept.test(c);
    }

    static int compare(Object actual, Object expected) {
        if (actual == null || expected == null) return INCOMPARABLE;
        if (actual instanceof Number a && expected instanceof Number b) return compareNumbers(a, b);
        if (actual instanceof String a && expected instanceof String b) return Integer.signum(a.compareTo(b));
        return INCOMPARABLE;
    }

    private static int compareNumbers(Number a, Number b) {
        if (isIntegral(a) && isIntegral(b)) return Long.compare(a.longValue(), b.longValue());
        return Double.compare(a.doubleValue(), b.doubleValue());
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte;
    }
}
