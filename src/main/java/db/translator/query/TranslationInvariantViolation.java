package db.translator.query;

/**
 * Internal defect: a tree or operator table broke a structural invariant.
 * Never caused by user input, never retryable.
 */
public class TranslationInvariantViolation extends IllegalStateException {

    public TranslationInvariantViolation(String message) {
        super(message);
    }
}
