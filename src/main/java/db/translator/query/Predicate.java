package db.translator.query;

/**
 * Node of a parsed WHERE expression: either a {@link Comparison} leaf or a {@link Logical}
 * combination. Trees are immutable.
 */
public sealed interface Predicate permits Comparison, Logical {
}
