package db.translator.query;

/**
 * Malformed or unsupported grammar. Offset is a 0-based index into the
 * original query string, -1 when no position applies.
 */
public class SqlSyntaxException extends QueryTranslationException {
    private final int offset;

    public SqlSyntaxException(String message, int offset) {
        super(offset >= 0 ? message + " (at offset " + offset + ")" : message);
        this.offset = offset;
    }

    public int offset() { return offset; }
}
