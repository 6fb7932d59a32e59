package db.translator.query;

/**
 * Base type for every error raised while turning SQL text into a document query.
 * Terminal for the request: the same input always fails the same way.
 */
public class QueryTranslationException extends IllegalArgumentException {

    public QueryTranslationException(String message) {
        super(message);
    }

    public QueryTranslationException(String message, Throwable cause) {
        super(message, cause);
    }
}
