package db.translator.query;

/**
 * A construct the lexer/parser recognises but the translator deliberately does not implement
 * (LIKE, IN, joins, ordering, grouping, subqueries ...).
 */
public class UnsupportedFeatureException extends SqlSyntaxException {
    private final String feature;

    public UnsupportedFeatureException(String feature, int offset) {
        super("Unsupported feature: " + feature, offset);
        this.feature = feature;
    }

    public String feature() { return feature; }
}
