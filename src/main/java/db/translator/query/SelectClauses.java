package db.translator.query;

import java.util.List;

/**
 * Output of {@link ClauseSplitter}: the statement cut into clauses, WHERE text not yet parsed.
 * columns: empty list means SELECT *.
 * whereText: verbatim predicate source, null when there is no WHERE; whereOffset is its
 * position in the original query.
 * limit / offset: null when the clause is absent (0 is a real value).
 */
public record SelectClauses(List<String> columns, String table, String whereText, int whereOffset,
                            Integer limit, Integer offset) {

    public SelectClauses {
        columns = List.copyOf(columns);
    }
}
