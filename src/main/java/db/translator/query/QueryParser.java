package db.translator.query;

/**
 * SQL front end: clause splitting followed by WHERE parsing.
 *   SELECT <cols|*> FROM <table> [WHERE <predicate>] [LIMIT <n>] [OFFSET <n>];
 * Stateless and safe to share between threads.
 */
public class QueryParser {
    private final ClauseSplitter splitter = new ClauseSplitter();
    private final PredicateParser predicateParser = new PredicateParser();

    public Query parse(String sql) {
        SelectClauses clauses = splitter.split(sql);
        Predicate predicate = null;
        if (clauses.whereText() != null) {
            predicate = predicateParser.parse(clauses.whereText(), clauses.whereOffset());
        }
        return new Query(clauses.columns(), clauses.table(), predicate, clauses.limit(), clauses.offset());
    }
}
