package db.translator.query;

/**
 * Tagged literal value. INTEGER holds a Long, FLOAT a Double, STRING a String,
 * BOOLEAN a Boolean and NULL holds null.
 */
public record Literal(Kind kind, Object value) {
    public enum Kind { INTEGER, FLOAT, STRING, BOOLEAN, NULL }

    public static final Literal NULL = new Literal(Kind.NULL, null);
    public static final Literal TRUE = new Literal(Kind.BOOLEAN, Boolean.TRUE);
    public static final Literal FALSE = new Literal(Kind.BOOLEAN, Boolean.FALSE);

    public Literal {
        if (kind == null) throw new IllegalArgumentException("kind must not be null");
        boolean ok = switch (kind) {
            case INTEGER -> value instanceof Long;
            case FLOAT -> value instanceof Double d && !d.isNaN() && !d.isInfinite();
            case STRING -> value instanceof String;
            case BOOLEAN -> value instanceof Boolean;
            case NULL -> value == null;
        };
        if (!ok) {
            throw new IllegalArgumentException("Value " + value + " is not a valid " + kind + " literal");
        }
    }

    public static Literal ofInteger(long v) { return new Literal(Kind.INTEGER, v); }
    public static Literal ofFloat(double v) { return new Literal(Kind.FLOAT, v); }
    public static Literal ofString(String v) { return new Literal(Kind.STRING, v); }
    public static Literal ofBoolean(boolean v) { return v ? TRUE : FALSE; }

    /**
     * Wrap a plain Java value as it appears inside a document filter.
     */
    public static Literal of(Object v) {
        if (v == null) return NULL;
        if (v instanceof Long || v instanceof Integer || v instanceof Short || v instanceof Byte) {
            return ofInteger(((Number) v).longValue());
        }
        if (v instanceof Double || v instanceof Float) return ofFloat(((Number) v).doubleValue());
        if (v instanceof String s) return ofString(s);
        if (v instanceof Boolean b) return ofBoolean(b);
        throw new IllegalArgumentException("Unsupported literal type: " + v.getClass().getSimpleName());
    }

    public boolean isNumeric() {
        return kind == Kind.INTEGER || kind == Kind.FLOAT;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case STRING -> "'" + ((String) value).replace("'", "''") + "'";
            case NULL -> "NULL";
            default -> String.valueOf(value);
        };
    }
}
